package spread.diffusion;

import it.unimi.dsi.fastutil.ints.IntSet;
import spread.config.DiffusionConfig;
import spread.network.EdgeWeights;
import spread.network.Graph;
import spread.network.GraphSnapshot;
import spread.network.GraphSnapshot.IntRange;

import java.util.Arrays;
import java.util.List;
import java.util.Random;
import java.util.Set;

/**
 * SI（Susceptible-Infected）モデル。
 * 各ステップで全ての感染ノードが、感受性の各 out-neighbor を確率 beta で感染させる。
 * 感染したノードは回復せず、以降のステップでも感染を試み続ける。
 */
public class SusceptibleInfectedModel extends DiffusionModel {
    private final double beta; // 感染確率
    private final int maxSteps; // 最大ステップ数

    /**
     * 感染確率にグラフの感染閾値（1 を超える場合は 1）を使う。
     */
    public SusceptibleInfectedModel(Set<Integer> seeds, Graph graph, int maxSteps) {
        this(seeds, graph.snapshot(), defaultBeta(graph.snapshot()), maxSteps, DiffusionConfig.load());
    }

    public SusceptibleInfectedModel(Set<Integer> seeds, Graph graph, double beta, int maxSteps) {
        this(seeds, graph.snapshot(), beta, maxSteps, DiffusionConfig.load());
    }

    /**
     * SusceptibleInfectedModel を構築する。
     *
     * @param seeds    初期感染ノード集合
     * @param graph    グラフのスナップショット
     * @param beta     感染確率（0 以上 1 以下）
     * @param maxSteps 最大ステップ数（正の整数）
     * @param config   実行設定
     */
    public SusceptibleInfectedModel(Set<Integer> seeds, GraphSnapshot graph, double beta, int maxSteps,
            DiffusionConfig config) {
        super(seeds, graph, config);
        if (!(beta >= 0.0 && beta <= 1.0)) {
            throw new IllegalArgumentException("beta must be in [0,1], but was " + beta);
        }
        if (maxSteps <= 0) {
            throw new IllegalArgumentException("maxSteps must be a positive integer, but was " + maxSteps);
        }
        this.beta = beta;
        this.maxSteps = maxSteps;
    }

    /**
     * 感染閾値を感染確率として使えるよう 1 で打ち切る。
     */
    static double defaultBeta(GraphSnapshot graph) {
        return Math.min(1.0, EdgeWeights.epidemicThreshold(graph));
    }

    public double getBeta() {
        return beta;
    }

    public int getMaxSteps() {
        return maxSteps;
    }

    @Override
    protected DiffusionTrial newTrial(int[] seeds) {
        return new InfectionTrial(seeds);
    }

    private final class InfectionTrial extends DiffusionTrial {
        private final int[] seeds;
        private final boolean[] infected;
        private final boolean[] pending; // このステップで新たに感染したノード
        private final int[] infectedList; // 感染ノード（[0, count) が有効）
        private int count;

        InfectionTrial(int[] seeds) {
            this.seeds = seeds;
            this.infected = new boolean[graph.n];
            this.pending = new boolean[graph.n];
            this.infectedList = new int[graph.n];
        }

        @Override
        public int run(Random random, int steps, List<IntSet> history) {
            final int limit = steps > 0 ? steps : maxSteps;
            Arrays.fill(infected, false);
            Arrays.fill(pending, false);
            count = 0;
            for (int s : seeds) {
                infected[s] = true;
                infectedList[count++] = s;
            }
            record(history, infectedList, 0, count);

            for (int step = 0; step < limit && count < graph.n; step++) {
                final int before = count;
                boolean attempted = false;
                for (int k = 0; k < before; k++) {
                    int u = infectedList[k];
                    IntRange r = graph.outNeighborRange(u);
                    for (int i = r.start; i < r.end; i++) {
                        int v = graph.getOutNeighbor(i);
                        if (infected[v]) {
                            continue;
                        }
                        attempted = true;
                        if (random.nextDouble() < beta && !pending[v]) {
                            pending[v] = true;
                            infectedList[count++] = v;
                        }
                    }
                }
                if (!attempted) {
                    break; // 感受性の隣接ノードが残っていない
                }
                for (int k = before; k < count; k++) {
                    int v = infectedList[k];
                    pending[v] = false;
                    infected[v] = true;
                }
                if (count > before) {
                    record(history, infectedList, before, count);
                }
            }
            return count;
        }

        @Override
        public IntSet result() {
            return toSet(infectedList, 0, count);
        }
    }
}
