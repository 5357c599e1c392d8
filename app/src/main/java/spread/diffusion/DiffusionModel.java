package spread.diffusion;

import it.unimi.dsi.fastutil.ints.IntSet;
import spread.config.DiffusionConfig;
import spread.network.GraphSnapshot;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.Set;
import java.util.TreeSet;

/**
 * 拡散モデルの基底クラス。
 * 種ノード集合と不変なグラフスナップショットを保持し、Monte Carlo 試行の実行を {@link MonteCarloDriver} に委ねる。
 * サブクラスは1回の試行の規則だけを実装する。
 */
public abstract class DiffusionModel {
    protected final GraphSnapshot graph; // 全試行・全スレッドで共有する読み取り専用グラフ
    private final DiffusionConfig config;
    private final MonteCarloDriver driver;
    private int[] seeds; // 昇順・重複なし

    protected DiffusionModel(Set<Integer> seeds, GraphSnapshot graph, DiffusionConfig config) {
        this.graph = Objects.requireNonNull(graph, "graph");
        this.config = Objects.requireNonNull(config, "config");
        this.driver = new MonteCarloDriver(config.workers);
        setSeeds(seeds);
    }

    /**
     * 種ノード集合を置き換える。実行中の {@link #runMonteCarloDiffusion} には影響しない。
     *
     * @param newSeeds 新しい種ノード集合
     * @throws IndexOutOfBoundsException 範囲外の頂点IDが含まれる場合
     */
    public final void setSeeds(Set<Integer> newSeeds) {
        Objects.requireNonNull(newSeeds, "seeds");
        int[] s = new int[newSeeds.size()];
        int k = 0;
        for (Integer u : newSeeds) {
            if (u == null) {
                throw new IllegalArgumentException("Seed set must not contain null");
            }
            graph.checkVertex(u);
            s[k++] = u;
        }
        Arrays.sort(s);
        this.seeds = s;
    }

    public Set<Integer> getSeeds() {
        Set<Integer> set = new TreeSet<>();
        for (int s : seeds) {
            set.add(s);
        }
        return Collections.unmodifiableSet(set);
    }

    public int numNodes() {
        return graph.n;
    }

    public GraphSnapshot getGraph() {
        return graph;
    }

    public DiffusionConfig getConfig() {
        return config;
    }

    public double runMonteCarloDiffusion(int rounds) {
        return runMonteCarloDiffusion(rounds, config.defaultSeed, false);
    }

    public double runMonteCarloDiffusion(int rounds, long seed) {
        return runMonteCarloDiffusion(rounds, seed, false);
    }

    /**
     * Monte Carlo シミュレーションで活性化ノード数の期待値を推定する。
     * 同じ (rounds, seed) なら逐次・並列のどちらでも同じ値を返す。
     *
     * @param rounds   試行回数（0 以下なら 0.0）
     * @param seed     乱数シード
     * @param parallel 並列実行するかどうか
     * @return 活性化ノード数の平均
     */
    public double runMonteCarloDiffusion(int rounds, long seed, boolean parallel) {
        final int[] s = seeds;
        return driver.run(() -> newTrial(s), rounds, seed, parallel);
    }

    /**
     * 拡散を1回だけ実行し、活性化したノードと各ステップの新規活性化ノードを返す。
     * {@code random} には {@code new Random(seed)} を使うので、
     * {@link MonteCarloDriver#deriveTrialSeeds} のシードを渡すと Monte Carlo 実行の該当試行を再現する。
     *
     * @param seed 乱数シード
     * @return 単発実行の結果
     */
    public DiffusionResult diffusion(long seed) {
        return runOnce(seed, 0);
    }

    /**
     * ステップ数を制限して拡散を1回だけ実行する。
     *
     * @param seed     乱数シード
     * @param maxSteps 最大ステップ数（正の整数。モデル既定の上限より優先する）
     * @return 単発実行の結果
     */
    public DiffusionResult diffusion(long seed, int maxSteps) {
        if (maxSteps <= 0) {
            throw new IllegalArgumentException("maxSteps must be a positive integer, but was " + maxSteps);
        }
        return runOnce(seed, maxSteps);
    }

    private DiffusionResult runOnce(long seed, int maxSteps) {
        DiffusionTrial trial = newTrial(seeds);
        List<IntSet> history = new ArrayList<>();
        trial.run(new Random(seed), maxSteps, history);
        return new DiffusionResult(trial.result(), history);
    }

    /**
     * 1回の試行を表すオブジェクトを生成する。作業用配列はここで確保する。
     *
     * @param seeds この実行で使う種ノード（昇順）
     * @return 試行
     */
    protected abstract DiffusionTrial newTrial(int[] seeds);
}
