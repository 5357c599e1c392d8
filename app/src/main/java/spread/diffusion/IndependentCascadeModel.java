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
 * 独立カスケード（Independent Cascade, IC）モデル。
 * 新たに活性化したノード u は、未活性の各 out-neighbor v を確率 w(u, v) で一度だけ活性化しようとする。
 */
public class IndependentCascadeModel extends DiffusionModel {

    public IndependentCascadeModel(Set<Integer> seeds, Graph graph) {
        this(seeds, graph.snapshot(), DiffusionConfig.load());
    }

    public IndependentCascadeModel(Set<Integer> seeds, Graph graph, DiffusionConfig config) {
        this(seeds, graph.snapshot(), config);
    }

    public IndependentCascadeModel(Set<Integer> seeds, GraphSnapshot graph, DiffusionConfig config) {
        super(seeds, graph, config);
    }

    @Override
    protected DiffusionTrial newTrial(int[] seeds) {
        return new CascadeTrial(seeds);
    }

    private final class CascadeTrial extends DiffusionTrial {
        private final int[] seeds;
        private final boolean[] activated; // 各ノードが活性化済みか
        private final int[] queue; // FIFO（各ノードは高々1回しか入らない）
        private int tail;

        CascadeTrial(int[] seeds) {
            this.seeds = seeds;
            this.activated = new boolean[graph.n];
            this.queue = new int[graph.n];
        }

        @Override
        public int run(Random random, int maxSteps, List<IntSet> history) {
            Arrays.fill(activated, false);
            tail = 0;
            for (int s : seeds) {
                activated[s] = true;
                queue[tail++] = s;
            }
            record(history, queue, 0, tail);

            // キューを段ごとに処理する。処理順は単純な FIFO と同じ
            int head = 0;
            for (int step = 0; head < tail && (maxSteps <= 0 || step < maxSteps); step++) {
                final int levelEnd = tail;
                while (head < levelEnd) {
                    int u = queue[head++];
                    IntRange r = graph.outNeighborRange(u);
                    for (int i = r.start; i < r.end; i++) {
                        int v = graph.getOutNeighbor(i);
                        if (!activated[v] && random.nextDouble() < graph.getOutWeight(i)) {
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
