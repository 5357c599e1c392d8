package spread.network.topology;

import spread.network.Graph;

import java.util.Random;

/**
 * ERモデル（Erdős–Rényi型ランダムグラフ）を生成する。
 * 自己ループは作らず、全ての辺の重みは 1.0 とする。
 */
public class ER {

    /**
     * 確率 p で各ペアに辺を張る ER グラフを生成する。
     * 有向の場合は順序付きペア (i, j) ごと、無向の場合は i &lt; j のペアごとに判定する。
     *
     * @param n        ノード数
     * @param p        エッジ生成確率（0.0〜1.0）
     * @param directed 有向グラフかどうか
     * @param seed     乱数シード
     * @return 生成されたグラフ
     */
    public static Graph generateFromP(int n, double p, boolean directed, long seed) {
        if (n < 0) {
            throw new IllegalArgumentException("ノード数nは0以上である必要があります");
        }
        if (p < 0.0 || p > 1.0) {
            throw new IllegalArgumentException("確率pは0.0〜1.0の範囲で指定してください");
        }

        Random random = new Random(seed);
        Graph g = new Graph(n, directed);

        for (int i = 0; i < n; i++) {
            for (int j = directed ? 0 : i + 1; j < n; j++) {
                if (i == j) {
                    continue;
                }
                if (random.nextDouble() < p) {
                    g.addEdge(i, j);
                }
            }
        }
        return g;
    }
}
