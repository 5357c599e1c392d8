package spread.network;

import org.apache.log4j.Logger;

import java.util.Arrays;

/**
 * {@link Graph} の内容を CSR（Compressed Sparse Row）形式で保持する不変クラス。
 * 生成後は変更されないため、複数のモデル・ワーカースレッドからロックなしで参照できる。
 * 各頂点の隣接頂点は ID の昇順に並ぶ。
 * 無向グラフでは各論理辺が (u, v) と (v, u) の2本のアークとして格納される。
 * 拡散は out-arc だけを辿るので、入力側は次数のみ保持する。
 */
public final class GraphSnapshot {
    final static Logger logger = Logger.getLogger(GraphSnapshot.class);

    public final int n; // 頂点数
    public final int m; // 格納されたアーク数（無向辺の逆向きを含む）
    public final boolean directed; // 有向グラフかどうか
    private final int[] outPtr; // 長さ n+1 の配列（out-neighbors の開始位置）
    private final int[] outIdx; // 長さ m の配列（out-neighbors の頂点ID）
    private final double[] outWeight; // 長さ m の配列（out-arc の重み）
    private final int[] inDeg; // 各頂点の入次数

    private GraphSnapshot(int n, int m, boolean directed, int[] outPtr, int[] outIdx, double[] outWeight,
            int[] inDeg) {
        this.n = n;
        this.m = m;
        this.directed = directed;
        this.outPtr = outPtr;
        this.outIdx = outIdx;
        this.outWeight = outWeight;
        this.inDeg = inDeg;
    }

    /**
     * グラフから CSR スナップショットを構築する。計算量は O(n + m log m)。
     *
     * @param g 元のグラフ
     * @return 構築された GraphSnapshot
     */
    static GraphSnapshot from(Graph g) {
        final int n = g.numNodes();
        int[][] outs = new int[n][];
        int[] outPtr = new int[n + 1];
        int[] inDeg = new int[n];
        for (int u = 0; u < n; u++) {
            outs[u] = g.sortedOutNeighbors(u);
            outPtr[u + 1] = outPtr[u] + outs[u].length;
            inDeg[u] = g.inDegree(u);
        }

        final int arcs = outPtr[n];
        int[] outIdx = new int[arcs];
        double[] outWeight = new double[arcs];
        for (int u = 0; u < n; u++) {
            int pos = outPtr[u];
            for (int v : outs[u]) {
                outIdx[pos] = v;
                outWeight[pos] = g.rawWeight(u, v);
                pos++;
            }
        }

        logger.debug("Built CSR snapshot: n=" + n + ", arcs=" + arcs + ", directed=" + g.isDirected());
        return new GraphSnapshot(n, arcs, g.isDirected(), outPtr, outIdx, outWeight, inDeg);
    }

    /**
     * インデックス i の out-neighbor を取得する。
     *
     * @param i インデックス（0 以上 m 未満）
     * @return 隣接頂点のID
     */
    public int getOutNeighbor(int i) {
        if (i < 0 || i >= m) {
            throw new IndexOutOfBoundsException("Index: " + i + ", Size: " + m);
        }
        return outIdx[i];
    }

    /**
     * インデックス i の out-arc の重みを取得する。
     *
     * @param i インデックス（0 以上 m 未満）
     * @return 辺の重み
     */
    public double getOutWeight(int i) {
        if (i < 0 || i >= m) {
            throw new IndexOutOfBoundsException("Index: " + i + ", Size: " + m);
        }
        return outWeight[i];
    }

    /**
     * 頂点 u の out-neighbors の範囲を取得する。
     * outIdx の [start, end) が u の out-neighbors を表す。
     *
     * @param u 頂点ID（0 以上 n 未満）
     * @return 範囲 [start, end)
     */
    public IntRange outNeighborRange(int u) {
        checkVertex(u);
        return new IntRange(outPtr[u], outPtr[u + 1]);
    }

    /**
     * アーク (u, v) が存在するかを二分探索で判定する。
     */
    public boolean hasArc(int u, int v) {
        checkVertex(u);
        checkVertex(v);
        return Arrays.binarySearch(outIdx, outPtr[u], outPtr[u + 1], v) >= 0;
    }

    public int outDegree(int u) {
        checkVertex(u);
        return outPtr[u + 1] - outPtr[u];
    }

    public int inDegree(int u) {
        checkVertex(u);
        return inDeg[u];
    }

    /**
     * 頂点IDが [0, n) に含まれるか検査する。
     *
     * @param u 頂点ID
     */
    public void checkVertex(int u) {
        if (u < 0 || u >= n) {
            throw new IndexOutOfBoundsException("Vertex: " + u + ", Range: [0, " + n + ")");
        }
    }

    /**
     * 整数の範囲 [start, end) を表すクラス。
     */
    public static final class IntRange {
        /** 開始位置（含む） */
        public final int start;

        /** 終了位置（含まない） */
        public final int end;

        public IntRange(int start, int end) {
            this.start = start;
            this.end = end;
        }
    }
}
