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
 * 線形閾値（Linear Threshold, LT）モデル。
 * 各ノードの閾値を試行ごとに [thetaL, thetaH) から一様に選び、
 * 活性化済み in-neighbor からの重みの累積が閾値以上になったノードを活性化する。
 */
public class LinearThresholdModel extends DiffusionModel {
    private final double thetaL; // 閾値の下限
    private final double thetaH; // 閾値の上限

    public LinearThresholdModel(Set<Integer> seeds, Graph graph) {
        this(seeds, graph, 0.0, 1.0);
    }

    public LinearThresholdModel(Set<Integer> seeds, Graph graph, double thetaL, double thetaH) {
        this(seeds, graph.snapshot(), thetaL, thetaH, DiffusionConfig.load());
    }

    public LinearThresholdModel(Set<Integer> seeds, Graph graph, double thetaL, double thetaH,
            DiffusionConfig config) {
        this(seeds, graph.snapshot(), thetaL, thetaH, config);
    }

    /**
     * LinearThresholdModel を構築する。
     *
     * @param seeds  種ノード集合
     * @param graph  グラフのスナップショット
     * @param thetaL 閾値の下限（0 以上 1 以下）
     * @param thetaH 閾値の上限（0 以上 1 以下、thetaL 以上）
     * @param config 実行設定
     */
    public LinearThresholdModel(Set<Integer> seeds, GraphSnapshot graph, double thetaL, double thetaH,
            DiffusionConfig config) {
        super(seeds, graph, config);
        if (!(thetaL >= 0.0 && thetaL <= 1.0)) {
            throw new IllegalArgumentException("thetaL must be in [0,1], but was " + thetaL);
        }
        if (!(thetaH >= 0.0 && thetaH <= 1.0)) {
            throw new IllegalArgumentException("thetaH must be in [0,1], but was " + thetaH);
        }
        if (thetaL > thetaH) {
            throw new IllegalArgumentException("thetaL cannot be greater than thetaH");
        }
        this.thetaL = thetaL;
        this.thetaH = thetaH;
    }

    public double getThetaL() {
        return thetaL;
    }

    public double getThetaH() {
        return thetaH;
    }

    @Override
    protected DiffusionTrial newTrial(int[] seeds) {
        return new ThresholdTrial(seeds);
    }

    private final class ThresholdTrial extends DiffusionTrial {
        private final int[] seeds;
        private final double[] threshold; // 各ノードの閾値
        private final double[] influence; // 活性化済み neighbor からの影響の累積
        private final boolean[] activated;
        private final int[] queue;
        private int tail;

        ThresholdTrial(int[] seeds) {
            this.seeds = seeds;
            this.threshold = new double[graph.n];
            this.influence = new double[graph.n];
            this.activated = new boolean[graph.n];
            this.queue = new int[graph.n];
        }

        @Override
        public int run(Random random, int maxSteps, List<IntSet> history) {
            final double span = thetaH - thetaL;
            for (int v = 0; v < threshold.length; v++) {
                threshold[v] = thetaL + random.nextDouble() * span;
            }
            Arrays.fill(influence, 0.0);
            Arrays.fill(activated, false);

            tail = 0;
            for (int s : seeds) {
                activated[s] = true;
                queue[tail++] = s;
            }
            record(history, queue, 0, tail);

            int head = 0;
            for (int step = 0; head < tail && (maxSteps <= 0 || step < maxSteps); step++) {
                final int levelEnd = tail;
                while (head < levelEnd) {
                    int u = queue[head++];
                    IntRange r = graph.outNeighborRange(u);
                    for (int i = r.start; i < r.end; i++) {
                        int v = graph.getOutNeighbor(i);
                        if (activated[v]) {
                            continue;
                        }
                        influence[v] += graph.getOutWeight(i);
                        if (influence[v] >= threshold[v]) {
                            activated[v] = true;
                            queue[tail++] = v;
                        }
                    }
                }
                if (tail > levelEnd) {
                    record(history, queue, levelEnd, tail);
                }
            }
            return tail;
        }

        @Override
        public IntSet result() {
            return toSet(queue, 0, tail);
        }
    }
}
