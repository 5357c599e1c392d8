package spread.config;

import org.apache.log4j.Logger;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

/**
 * クラスパス上の diffusion.properties を読み込むシングルトン。
 */
public class ConfigLoader {

    public static final String PROP_FILE_NAME = "diffusion.properties";

    // リソース名 -> 読み込み結果（読めなかった場合は null を保持し、再読み込みしない）
    private static final Map<String, ConfigLoader> loaded = new HashMap<>();
    private final Properties prop = new Properties();
    final static Logger logger = Logger.getLogger(ConfigLoader.class);

    /**
     * 読み込み済みのインスタンスを返す。ファイルが読めない場合は null を返す。
     */
    public static ConfigLoader getInstance() {
        return getInstance(PROP_FILE_NAME);
    }

    static synchronized ConfigLoader getInstance(String resource) {
        if (!loaded.containsKey(resource)) {
            ConfigLoader conf = null;
            try {
                conf = new ConfigLoader(resource);
                logger.info("Loaded " + resource + " from the classpath");
            } catch (IOException e) {
                logger.warn("Could not load " + resource + ", falling back to defaults: " + e.getMessage());
            }
            loaded.put(resource, conf);
        }
        return loaded.get(resource);
    }

    protected ConfigLoader(String resource) throws IOException {
        try (InputStream inputStream = getClass().getClassLoader().getResourceAsStream(resource)) {
            if (inputStream == null) {
                throw new FileNotFoundException("property file '" + resource + "' not found in the classpath");
            }
            prop.load(inputStream);
        }
    }

    public String getValue(String key) {
        return prop.getProperty(key);
    }

    /**
     * 読み込んだ設定のコピーを返す。
     */
    public Properties getProperties() {
        Properties copy = new Properties();
        copy.putAll(prop);
        return copy;
    }
}
