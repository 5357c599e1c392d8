package spread.config;

import org.apache.log4j.Logger;

import java.util.Properties;

/**
 * Monte Carlo 拡散シミュレーションの設定を保持する不変クラス。
 * <ul>
 * <li>{@code diffusion.workers}: 並列実行時のワーカースレッド数（既定は利用可能なプロセッサ数）</li>
 * <li>{@code diffusion.seed}: シード省略時に使う乱数シード（既定は 0）</li>
 * </ul>
 */
public final class DiffusionConfig {
    public static final String WORKERS_KEY = "diffusion.workers";
    public static final String SEED_KEY = "diffusion.seed";

    final static Logger logger = Logger.getLogger(DiffusionConfig.class);

    public final int workers; // ワーカースレッド数
    public final long defaultSeed; // 既定の乱数シード

    private DiffusionConfig(int workers, long defaultSeed) {
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be at least 1, but was " + workers);
        }
        this.workers = workers;
        this.defaultSeed = defaultSeed;
    }

    /**
     * 設定ファイルを参照しない既定値。
     */
    public static DiffusionConfig defaults() {
        return new DiffusionConfig(Math.max(1, Runtime.getRuntime().availableProcessors()), 0L);
    }

    /**
     * クラスパス上の diffusion.properties から設定を読み込む。
     * ファイルがなければ既定値を返す。
     */
    public static DiffusionConfig load() {
        ConfigLoader loader = ConfigLoader.getInstance();
        if (loader == null) {
            return defaults();
        }
        return fromProperties(loader.getProperties());
    }

    /**
     * Properties から設定を組み立てる。存在しないキーは既定値を使う。
     *
     * @param props 設定値
     * @return 設定
     */
    public static DiffusionConfig fromProperties(Properties props) {
        DiffusionConfig base = defaults();
        int workers = base.workers;
        long seed = base.defaultSeed;

        String w = trimToNull(props.getProperty(WORKERS_KEY));
        if (w != null) {
            try {
                workers = Integer.parseInt(w);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid " + WORKERS_KEY + ": " + w, e);
            }
        }
        String s = trimToNull(props.getProperty(SEED_KEY));
        if (s != null) {
            try {
                seed = Long.parseLong(s);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid " + SEED_KEY + ": " + s, e);
            }
        }
        DiffusionConfig config = new DiffusionConfig(workers, seed);
        logger.debug("Diffusion config: " + config);
        return config;
    }

    public DiffusionConfig withWorkers(int workers) {
        return new DiffusionConfig(workers, defaultSeed);
    }

    public DiffusionConfig withDefaultSeed(long defaultSeed) {
        return new DiffusionConfig(workers, defaultSeed);
    }

    private static String trimToNull(String v) {
        if (v == null) {
            return null;
        }
        v = v.trim();
        return v.isEmpty() ? null : v;
    }

    @Override
    public String toString() {
        return "DiffusionConfig{workers=" + workers + ", defaultSeed=" + defaultSeed + "}";
    }
}
