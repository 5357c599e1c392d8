package spread.network;

import java.util.Locale;

/** 辺重みの付け方 */
public enum EdgeWeightType {
    CONSTANT, // 全ての辺に同じ重み
    TV, // Trivalency: {0.001, 0.01, 0.1} から一様に選ぶ
    WC; // Weighted Cascade: 1 / 終点の入次数

    /**
     * 大文字小文字を区別せずに名前から変換する。
     *
     * @param name 重みモデル名（"constant", "TV", "wc" など）
     * @return 対応する EdgeWeightType
     */
    public static EdgeWeightType parse(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Edge weight type must be non-null");
        }
        return switch (name.trim().toUpperCase(Locale.ROOT)) {
            case "CONSTANT" -> CONSTANT;
            case "TV" -> TV;
            case "WC" -> WC;
            default -> throw new IllegalArgumentException("Unknown edge weight type: " + name);
        };
    }
}
