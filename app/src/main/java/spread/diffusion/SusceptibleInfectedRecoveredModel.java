package spread.diffusion;

import it.unimi.dsi.fastutil.ints.IntSet;
import spread.config.DiffusionConfig;
import spread.network.Graph;
import spread.network.GraphSnapshot;
import spread.network.GraphSnapshot.IntRange;

import java.util.Arrays;
import java.util.List;
import java.util.Random;
import java.util.Set;

/**
 * SIR（Susceptible-Infected-Recovered）モデル。
 * 各ステップで、まず感染ノードが確率 gamma で回復し、
 * 次に残りの感染ノードが感受性の各 out-neighbor を確率 beta で感染させる。
 * 試行の結果は回復したノード数。単発実行の履歴には各ステップで新たに感染したノードを記録する。
 */
public class SusceptibleInfectedRecoveredModel extends DiffusionModel {
    /** ノードの状態 */
    private static final byte S = 0; // Susceptible
    private static final byte I = 1; // Infected
    private static final byte R = 2; // Recovered

    private final double gamma; // 回復確率
    private final double beta; // 感染確率
    private final int maxSteps; // 最大ステップ数（0 以下なら無制限）

    /**
     * 感染確率にグラフの感染閾値（1 を超える場合は 1）を使い、ステップ数は無制限とする。
     */
    public SusceptibleInfectedRecoveredModel(Set<Integer> seeds, Graph graph, double gamma) {
        this(seeds, graph.snapshot(), gamma, SusceptibleInfectedModel.defaultBeta(graph.snapshot()), 0,
                DiffusionConfig.load());
    }

    public SusceptibleInfectedRecoveredModel(Set<Integer> seeds, Graph graph, double gamma, double beta,
            int maxSteps) {
        this(seeds, graph.snapshot(), gamma, beta, maxSteps, DiffusionConfig.load());
    }

    /**
     * SusceptibleInfectedRecoveredModel を構築する。
     *
     * @param seeds    初期感染ノード集合
     * @param graph    グラフのスナップショット
     * @param gamma    回復確率（0 以上 1 以下）
     * @param beta     感染確率（0 以上 1 以下）
     * @param maxSteps 最大ステップ数（0 以下なら無制限。gamma = 0 のときは正の値が必要）
     * @param config   実行設定
     */
    public SusceptibleInfectedRecoveredModel(Set<Integer> seeds, GraphSnapshot graph, double gamma, double beta,
            int maxSteps, DiffusionConfig config) {
        super(seeds, graph, config);
        if (!(gamma >= 0.0 && gamma <= 1.0)) {
            throw new IllegalArgumentException("gamma must be in [0,1], but was " + gamma);
        }
        if (!(beta >= 0.0 && beta <= 1.0)) {
            throw new IllegalArgumentException("beta must be in [0,1], but was " + beta);
        }
        if (gamma == 0.0 && maxSteps <= 0) {
            throw new IllegalArgumentException("maxSteps must be positive when gamma is 0");
        }
        this.gamma = gamma;
        this.beta = beta;
        this.maxSteps = maxSteps;
    }

    public double getGamma() {
        return gamma;
    }

    public double getBeta() {
        return beta;
    }

    public int getMaxSteps() {
        return maxSteps;
    }

    @Override
    protected DiffusionTrial newTrial(int[] seeds) {
        return new EpidemicTrial(seeds);
    }

    private final class EpidemicTrial extends DiffusionTrial {
        private final int[] seeds;
        private final byte[] status;
        private final boolean[] pending; // このステップで新たに感染したノード
        private final int[] recoveredList; // 回復ノード（[0, recovered) が有効）
        private int recovered;
        private int[] current; // 現在の感染ノード
        private int[] next;

        EpidemicTrial(int[] seeds) {
            this.seeds = seeds;
            this.status = new byte[graph.n];
            this.pending = new boolean[graph.n];
            this.recoveredList = new int[graph.n];
            this.current = new int[graph.n];
            this.next = new int[graph.n];
        }

        @Override
        public int run(Random random, int steps, List<IntSet> history) {
            final int limit = steps > 0 ? steps : maxSteps;
            Arrays.fill(status, S);
            Arrays.fill(pending, false);
            int infectedCount = 0;
            for (int s : seeds) {
                status[s] = I;
                current[infectedCount++] = s;
            }
            record(history, current, 0, infectedCount);

            recovered = 0;
            int step = 0;
            while (infectedCount > 0 && (limit <= 0 || step < limit)) {
                // 回復
                int remaining = 0;
                for (int k = 0; k < infectedCount; k++) {
                    int u = current[k];
                    if (random.nextDouble() < gamma) {
                        status[u] = R;
                        recoveredList[recovered++] = u;
                    } else {
                        next[remaining++] = u;
                    }
                }

                // 感染
                int total = remaining;
                for (int k = 0; k < remaining; k++) {
                    int u = next[k];
                    IntRange r = graph.outNeighborRange(u);
                    for (int i = r.start; i < r.end; i++) {
                        int v = graph.getOutNeighbor(i);
                        if (status[v] != S) {
                            continue;
                        }
                        if (random.nextDouble() < beta && !pending[v]) {
                            pending[v] = true;
                            next[total++] = v;
                        }
                    }
                }
                for (int k = remaining; k < total; k++) {
                    int v = next[k];
                    pending[v] = false;
                    status[v] = I;
                }
                if (total > remaining) {
                    record(history, next, remaining, total);
                }

                int[] tmp = current;
                current = next;
                next = tmp;
                infectedCount = total;
                step++;
            }
            return recovered;
        }

        @Override
        public IntSet result() {
            return toSet(recoveredList, 0, recovered);
        }
    }
}
