package spread.diffusion;

import org.junit.jupiter.api.Test;
import spread.config.DiffusionConfig;
import spread.network.EdgeWeights;
import spread.network.Graph;
import spread.network.topology.ER;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LinearThresholdModelTest {

    @Test
    void zeroThresholdActivatesAnyInfluencedNode() {
        Graph g = new Graph(2, new int[][] { { 0, 1 } }, new double[] { 0.1 });
        LinearThresholdModel lt = new LinearThresholdModel(Set.of(0), g, 0.0, 0.0);

        assertEquals(2.0, lt.runMonteCarloDiffusion(10));
    }

    @Test
    void rejectsInvalidThresholdRange() {
        Graph g = new Graph(2, new int[][] { { 0, 1 } });

        assertThrows(IllegalArgumentException.class, () -> new LinearThresholdModel(Set.of(0), g, 0.6, 0.3));
        assertThrows(IllegalArgumentException.class, () -> new LinearThresholdModel(Set.of(0), g, -0.1, 0.5));
        assertThrows(IllegalArgumentException.class, () -> new LinearThresholdModel(Set.of(0), g, 0.2, 1.5));
        assertThrows(IllegalArgumentException.class, () -> new LinearThresholdModel(Set.of(0), g, Double.NaN, 0.5));
    }

    @Test
    void defaultsToUnitInterval() {
        LinearThresholdModel lt = new LinearThresholdModel(Set.of(0), new Graph(1));

        assertEquals(0.0, lt.getThetaL());
        assertEquals(1.0, lt.getThetaH());
        assertEquals(1.0, lt.runMonteCarloDiffusion(5));
    }

    @Test
    void influenceAccumulatesAcrossActiveNeighbors() {
        Graph g = new Graph(3, new int[][] { { 0, 2 }, { 1, 2 } }, new double[] { 0.5, 0.5 });

        LinearThresholdModel lt = new LinearThresholdModel(Set.of(0), g, 1.0, 1.0);
        assertEquals(1.0, lt.runMonteCarloDiffusion(10));

        lt.setSeeds(Set.of(0, 1));
        assertEquals(3.0, lt.runMonteCarloDiffusion(10));
    }

    @Test
    void activationCascadesAlongChain() {
        Graph g = new Graph(4, new int[][] { { 0, 1 }, { 1, 2 }, { 2, 3 } });
        LinearThresholdModel lt = new LinearThresholdModel(Set.of(0), g);

        // 重み 1.0 は閾値 [0, 1) を必ず超える
        assertEquals(4.0, lt.runMonteCarloDiffusion(25, 1L, true));
    }

    @Test
    void emptySeedSetAndNonPositiveRounds() {
        Graph g = new Graph(2, new int[][] { { 0, 1 } });
        LinearThresholdModel lt = new LinearThresholdModel(Set.of(), g, 0.0, 0.0);

        assertEquals(0.0, lt.runMonteCarloDiffusion(10));

        lt.setSeeds(Set.of(0));
        assertEquals(0.0, lt.runMonteCarloDiffusion(0));
    }

    @Test
    void parallelRunIsBitIdenticalToSequential() {
        Graph g = ER.generateFromP(250, 0.03, true, 7L);
        EdgeWeights.weightedCascade(g);
        Set<Integer> seeds = Set.of(1, 10, 100, 200);

        double sequential = new LinearThresholdModel(seeds, g, 0.2, 0.8, DiffusionConfig.defaults().withWorkers(1))
                .runMonteCarloDiffusion(800, 42L, false);
        for (int workers : new int[] { 2, 4, 6 }) {
            LinearThresholdModel lt = new LinearThresholdModel(seeds, g, 0.2, 0.8,
                    DiffusionConfig.defaults().withWorkers(workers));
            double parallel = lt.runMonteCarloDiffusion(800, 42L, true);
            assertEquals(Double.doubleToLongBits(sequential), Double.doubleToLongBits(parallel),
                    "workers=" + workers);
        }
        assertTrue(sequential >= seeds.size() && sequential <= g.numNodes());
    }
}
