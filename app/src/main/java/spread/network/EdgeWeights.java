package spread.network;

import spread.network.GraphSnapshot.IntRange;

import java.util.Random;

/**
 * 辺重みの設定と、次数分布から求める感染閾値のユーティリティクラス。
 */
public final class EdgeWeights {
    private static final double[] TRIVALENCY = { 0.001, 0.01, 0.1 };

    private EdgeWeights() {
    }

    /**
     * 重みモデルに従ってグラフの全辺に重みを設定する。
     *
     * @param g              対象グラフ
     * @param type           重みモデル
     * @param constantWeight CONSTANT 用の重み（それ以外では無視、null 可）
     * @param seed           TV 用の乱数シード
     */
    public static void apply(Graph g, EdgeWeightType type, Double constantWeight, long seed) {
        switch (type) {
            case CONSTANT -> {
                if (constantWeight == null) {
                    throw new IllegalArgumentException("CONSTANT weighting requires a constant weight");
                }
                constant(g, constantWeight);
            }
            case TV -> trivalency(g, seed);
            case WC -> weightedCascade(g);
            default -> throw new IllegalArgumentException("Unknown edge weight type: " + type);
        }
    }

    /**
     * 全ての辺に同じ重みを設定する。
     */
    public static void constant(Graph g, double w) {
        GraphSnapshot s = g.snapshot();
        for (int u = 0; u < s.n; u++) {
            IntRange r = s.outNeighborRange(u);
            for (int i = r.start; i < r.end; i++) {
                int v = s.getOutNeighbor(i);
                if (!s.directed && v < u) {
                    continue;
                }
                g.updateEdgeWeight(u, v, w);
            }
        }
    }

    /**
     * 各辺の重みを {0.001, 0.01, 0.1} から一様に選ぶ。
     * 辺は (u, v) の昇順に処理するので、同じグラフとシードなら同じ結果になる。
     *
     * @param g    対象グラフ
     * @param seed 乱数シード
     */
    public static void trivalency(Graph g, long seed) {
        Random random = new Random(seed);
        GraphSnapshot s = g.snapshot();
        for (int u = 0; u < s.n; u++) {
            IntRange r = s.outNeighborRange(u);
            for (int i = r.start; i < r.end; i++) {
                int v = s.getOutNeighbor(i);
                if (!s.directed && v < u) {
                    continue;
                }
                g.updateEdgeWeight(u, v, TRIVALENCY[random.nextInt(TRIVALENCY.length)]);
            }
        }
    }

    /**
     * 辺 (u, v) に 1 / inDegree(v) を設定する。
     * 無向グラフでは u &lt;= v となる向きの終点 v の次数を使う（重みは両方向で共通）。
     */
    public static void weightedCascade(Graph g) {
        GraphSnapshot s = g.snapshot();
        for (int u = 0; u < s.n; u++) {
            IntRange r = s.outNeighborRange(u);
            for (int i = r.start; i < r.end; i++) {
                int v = s.getOutNeighbor(i);
                if (!s.directed && v < u) {
                    continue;
                }
                g.updateEdgeWeight(u, v, 1.0 / s.inDegree(v));
            }
        }
    }

    public static double epidemicThreshold(Graph g) {
        return epidemicThreshold(g.snapshot());
    }

    /**
     * 次数分布から感染閾値 Σk / (Σk² - Σk) を計算する。
     * 有向グラフでは入次数と出次数の和を次数とする。
     * 自己ループは有向・無向とも次数に 2 を加える。
     *
     * @param s グラフのスナップショット
     * @return 感染閾値
     */
    public static double epidemicThreshold(GraphSnapshot s) {
        double k = 0;
        double k2 = 0;
        for (int u = 0; u < s.n; u++) {
            int d = s.directed ? s.outDegree(u) + s.inDegree(u) : s.outDegree(u);
            if (!s.directed && s.hasArc(u, u)) {
                d++; // 無向の自己ループは次数 2 として数える
            }
            k += d;
            k2 += (double) d * d;
        }
        double denom = k2 - k;
        if (denom <= 0) {
            throw new IllegalArgumentException("Epidemic threshold is undefined for this degree distribution");
        }
        return k / denom;
    }
}
