package spread.network;

import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import it.unimi.dsi.fastutil.ints.IntSets;
import it.unimi.dsi.fastutil.longs.Long2DoubleMap;
import it.unimi.dsi.fastutil.longs.Long2DoubleMaps;
import it.unimi.dsi.fastutil.longs.Long2DoubleOpenHashMap;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 重み付きグラフ（有向・無向）を表す可変クラス。
 * 隣接集合と、順序付きペア (u, v) をキーとする辺重みを保持する。
 * 無向グラフでは (u, v) と (v, u) の両方を同じ重みで保持する。
 * <p>
 * 拡散モデルは {@link #snapshot()} で得られる不変な CSR 形式を参照する。
 * このクラス自体はスレッドセーフではない。
 */
public final class Graph {
    private final int n; // 頂点数
    private final boolean directed; // 有向グラフかどうか
    private final IntSet[] out; // out-neighbors
    private final IntSet[] in; // in-neighbors（無向の場合は null）
    private final Long2DoubleOpenHashMap weights; // (u, v) -> 重み
    private int m; // 追加された論理辺の数

    private GraphSnapshot snapshot; // 変更があるまで使い回す

    public Graph(int n) {
        this(n, true);
    }

    public Graph(int n, boolean directed) {
        if (n < 0) {
            throw new IllegalArgumentException("Number of nodes must be non-negative, but was " + n);
        }
        this.n = n;
        this.directed = directed;
        this.out = new IntSet[n];
        this.in = directed ? new IntSet[n] : null;
        for (int u = 0; u < n; u++) {
            out[u] = new IntOpenHashSet();
            if (directed) {
                in[u] = new IntOpenHashSet();
            }
        }
        this.weights = new Long2DoubleOpenHashMap();
    }

    public Graph(int n, int[][] edges) {
        this(n, edges, null, true);
    }

    public Graph(int n, int[][] edges, double[] weights) {
        this(n, edges, weights, true);
    }

    /**
     * 辺リストからグラフを構築する。
     *
     * @param n        頂点数
     * @param edges    {u, v} の配列
     * @param weights  各辺の重み（null または空なら全て 1.0）
     * @param directed 有向グラフかどうか
     */
    public Graph(int n, int[][] edges, double[] weights, boolean directed) {
        this(n, directed);
        addEdges(edges, weights);
    }

    /**
     * 順序付きペア (u, v) を 64bit キーに詰める。上位 32bit が u、下位 32bit が v。
     */
    public static long edgeKey(int u, int v) {
        return ((long) u << 32) | (v & 0xFFFFFFFFL);
    }

    public static int sourceOf(long key) {
        return (int) (key >>> 32);
    }

    public static int targetOf(long key) {
        return (int) key;
    }

    public void addEdge(int u, int v) {
        addEdge(u, v, 1.0);
    }

    /**
     * 辺 (u, v) を追加する。既に存在する場合は重みのみ更新し、辺数は変えない。
     *
     * @param u 始点
     * @param v 終点
     * @param w 重み
     */
    public void addEdge(int u, int v, double w) {
        checkVertex(u);
        checkVertex(v);
        invalidate();

        long key = edgeKey(u, v);
        if (weights.containsKey(key)) {
            weights.put(key, w);
            if (!directed) {
                weights.put(edgeKey(v, u), w);
            }
            return;
        }

        out[u].add(v);
        weights.put(key, w);
        m++;

        if (directed) {
            in[v].add(u);
        } else {
            out[v].add(u);
            weights.put(edgeKey(v, u), w);
        }
    }

    public void addEdges(int[][] edges) {
        addEdges(edges, null);
    }

    /**
     * 辺をまとめて追加する。
     *
     * @param edges   {u, v} の配列
     * @param weights 各辺の重み（null または空なら全て 1.0）
     */
    public void addEdges(int[][] edges, double[] weights) {
        if (edges == null) {
            throw new IllegalArgumentException("Edge list must be non-null");
        }
        boolean weighted = weights != null && weights.length > 0;
        if (weighted && weights.length != edges.length) {
            throw new IllegalArgumentException("Edge list and weight list must have the same length: "
                    + edges.length + " != " + weights.length);
        }
        for (int i = 0; i < edges.length; i++) {
            int[] e = requirePair(edges[i]);
            addEdge(e[0], e[1], weighted ? weights[i] : 1.0);
        }
    }

    /**
     * 既存の辺 (u, v) の重みを更新する。無向グラフでは逆向きも更新する。
     *
     * @throws EdgeNotFoundException 辺が存在しない場合
     */
    public void updateEdgeWeight(int u, int v, double w) {
        checkVertex(u);
        checkVertex(v);
        long key = edgeKey(u, v);
        if (!weights.containsKey(key)) {
            throw new EdgeNotFoundException(u, v);
        }
        invalidate();
        weights.put(key, w);
        if (!directed) {
            weights.put(edgeKey(v, u), w);
        }
    }

    /**
     * 辺 (u, v) を削除する。無向グラフでは逆向きも削除する。
     *
     * @throws EdgeNotFoundException 辺が存在しない場合
     */
    public void removeEdge(int u, int v) {
        checkVertex(u);
        checkVertex(v);
        long key = edgeKey(u, v);
        if (!weights.containsKey(key)) {
            throw new EdgeNotFoundException(u, v);
        }
        invalidate();

        out[u].remove(v);
        if (directed) {
            in[v].remove(u);
        } else {
            out[v].remove(u);
            weights.remove(edgeKey(v, u));
        }
        weights.remove(key);
        m--;
    }

    /**
     * 辺をまとめて削除する。存在しない辺に達した時点で失敗し、それまでの削除は残る。
     */
    public void removeEdges(int[][] edges) {
        if (edges == null) {
            throw new IllegalArgumentException("Edge list must be non-null");
        }
        for (int[] e : edges) {
            requirePair(e);
            removeEdge(e[0], e[1]);
        }
    }

    public boolean hasEdge(int u, int v) {
        checkVertex(u);
        checkVertex(v);
        return weights.containsKey(edgeKey(u, v));
    }

    /**
     * 辺 (u, v) の重みを返す。
     *
     * @throws EdgeNotFoundException 辺が存在しない場合
     */
    public double weight(int u, int v) {
        checkVertex(u);
        checkVertex(v);
        long key = edgeKey(u, v);
        if (!weights.containsKey(key)) {
            throw new EdgeNotFoundException(u, v);
        }
        return weights.get(key);
    }

    /**
     * 頂点 u の out-neighbors（読み取り専用のビュー）。
     */
    public IntSet outNeighbors(int u) {
        checkVertex(u);
        return IntSets.unmodifiable(out[u]);
    }

    /**
     * 頂点 u の in-neighbors（読み取り専用のビュー）。無向グラフでは out-neighbors と同じ。
     */
    public IntSet inNeighbors(int u) {
        checkVertex(u);
        return IntSets.unmodifiable(directed ? in[u] : out[u]);
    }

    public int outDegree(int u) {
        checkVertex(u);
        return out[u].size();
    }

    public int inDegree(int u) {
        checkVertex(u);
        return directed ? in[u].size() : out[u].size();
    }

    public int degree(int u) {
        return outDegree(u);
    }

    public List<IntSet> adjacencyList() {
        List<IntSet> list = new ArrayList<>(n);
        for (int u = 0; u < n; u++) {
            list.add(IntSets.unmodifiable(out[u]));
        }
        return Collections.unmodifiableList(list);
    }

    /**
     * 密な隣接行列を返す（辺がない箇所は 0.0）。確認・出力用。
     */
    public double[][] adjacencyMatrix() {
        double[][] matrix = new double[n][n];
        for (Long2DoubleMap.Entry e : weights.long2DoubleEntrySet()) {
            long key = e.getLongKey();
            matrix[sourceOf(key)][targetOf(key)] = e.getDoubleValue();
        }
        return matrix;
    }

    /**
     * 全ての (u, v) -> 重み の読み取り専用マップ。キーは {@link #edgeKey(int, int)} で詰めたもの。
     */
    public Long2DoubleMap edges() {
        return Long2DoubleMaps.unmodifiable(weights);
    }

    public int numNodes() {
        return n;
    }

    public int numEdges() {
        return m;
    }

    public boolean isDirected() {
        return directed;
    }

    public Graph copy() {
        Graph g = new Graph(n, directed);
        for (int u = 0; u < n; u++) {
            g.out[u].addAll(out[u]);
            if (directed) {
                g.in[u].addAll(in[u]);
            }
        }
        g.weights.putAll(weights);
        g.m = m;
        return g;
    }

    /**
     * 現在の内容の不変な CSR スナップショットを返す。
     * グラフが変更されるまで同じインスタンスを返す。
     */
    public GraphSnapshot snapshot() {
        if (snapshot == null) {
            snapshot = GraphSnapshot.from(this);
        }
        return snapshot;
    }

    int[] sortedOutNeighbors(int u) {
        int[] a = out[u].toIntArray();
        Arrays.sort(a);
        return a;
    }

    double rawWeight(int u, int v) {
        return weights.get(edgeKey(u, v));
    }

    private void invalidate() {
        snapshot = null;
    }

    private void checkVertex(int u) {
        if (u < 0 || u >= n) {
            throw new IndexOutOfBoundsException("Vertex: " + u + ", Range: [0, " + n + ")");
        }
    }

    private static int[] requirePair(int[] e) {
        if (e == null || e.length != 2) {
            throw new IllegalArgumentException("Each edge must be a pair {u, v}");
        }
        return e;
    }

    @Override
    public String toString() {
        return "%s graph with %d nodes and %d edges".formatted(directed ? "Directed" : "Undirected", n, m);
    }
}
