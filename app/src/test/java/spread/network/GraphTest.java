package spread.network;

import it.unimi.dsi.fastutil.ints.IntSet;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GraphTest {

    @Test
    void constructsWithDefaultWeights() {
        Graph g = new Graph(3, new int[][] { { 0, 1 }, { 1, 2 } });

        assertEquals(3, g.numNodes());
        assertEquals(2, g.numEdges());
        assertTrue(g.isDirected());
        assertEquals(1.0, g.weight(0, 1));
        assertEquals(1.0, g.weight(1, 2));
        assertFalse(g.hasEdge(1, 0));
    }

    @Test
    void rejectsMismatchedWeightList() {
        assertThrows(IllegalArgumentException.class,
                () -> new Graph(3, new int[][] { { 0, 1 }, { 1, 2 } }, new double[] { 0.5 }));

        Graph g = new Graph(3);
        assertThrows(IllegalArgumentException.class,
                () -> g.addEdges(new int[][] { { 0, 1 } }, new double[] { 0.1, 0.2 }));
    }

    @Test
    void emptyWeightListMeansUnitWeights() {
        Graph g = new Graph(2, new int[][] { { 0, 1 } }, new double[0]);
        assertEquals(1.0, g.weight(0, 1));
    }

    @Test
    void addingExistingEdgeOnlyUpdatesWeight() {
        Graph g = new Graph(3, new int[][] { { 0, 1 } }, new double[] { 0.2 });

        g.addEdge(0, 1, 0.7);

        assertEquals(1, g.numEdges());
        assertEquals(1, g.outDegree(0));
        assertEquals(1, g.inDegree(1));
        assertEquals(0.7, g.weight(0, 1));
    }

    @Test
    void addThenRemoveRestoresState() {
        Graph g = new Graph(4, new int[][] { { 0, 1 }, { 2, 3 } });
        int edgesBefore = g.numEdges();
        int degreeBefore = g.outDegree(0);
        int mapSizeBefore = g.edges().size();

        g.addEdge(0, 3, 0.4);
        g.removeEdge(0, 3);

        assertEquals(edgesBefore, g.numEdges());
        assertEquals(degreeBefore, g.outDegree(0));
        assertEquals(mapSizeBefore, g.edges().size());
        assertFalse(g.hasEdge(0, 3));
        assertFalse(g.inNeighbors(3).contains(0));
    }

    @Test
    void removingMissingEdgeFails() {
        Graph g = new Graph(10, new int[][] { { 0, 1 } });

        EdgeNotFoundException e = assertThrows(EdgeNotFoundException.class, () -> g.removeEdge(5, 6));
        assertEquals(5, e.getSource());
        assertEquals(6, e.getTarget());
        assertThrows(EdgeNotFoundException.class, () -> g.updateEdgeWeight(1, 0, 0.3));
        assertThrows(EdgeNotFoundException.class, () -> g.weight(3, 4));
    }

    @Test
    void bulkRemovalKeepsEarlierRemovalsOnFailure() {
        Graph g = new Graph(4, new int[][] { { 0, 1 }, { 1, 2 }, { 2, 3 } });

        assertThrows(EdgeNotFoundException.class,
                () -> g.removeEdges(new int[][] { { 0, 1 }, { 3, 0 }, { 1, 2 } }));

        assertFalse(g.hasEdge(0, 1));
        assertTrue(g.hasEdge(1, 2));
        assertEquals(2, g.numEdges());
    }

    @Test
    void undirectedEdgesAreSymmetric() {
        Graph g = new Graph(4, new int[][] { { 0, 1 }, { 1, 2 }, { 3, 1 } }, new double[] { 0.1, 0.2, 0.3 },
                false);

        assertEquals(3, g.numEdges());
        for (int u = 0; u < 4; u++) {
            for (int v : g.outNeighbors(u)) {
                assertTrue(g.outNeighbors(v).contains(u));
                assertEquals(g.weight(u, v), g.weight(v, u));
            }
            assertEquals(g.outNeighbors(u), g.inNeighbors(u));
        }

        g.updateEdgeWeight(1, 0, 0.9);
        assertEquals(0.9, g.weight(0, 1));

        g.removeEdge(2, 1);
        assertFalse(g.hasEdge(1, 2));
        assertEquals(2, g.numEdges());
    }

    @Test
    void selfLoopHasSingleEntry() {
        Graph g = new Graph(2, false);
        g.addEdge(1, 1, 0.5);

        assertEquals(1, g.numEdges());
        assertEquals(1, g.outDegree(1));
        assertEquals(1, g.edges().size());

        g.removeEdge(1, 1);
        assertEquals(0, g.numEdges());
        assertEquals(0, g.edges().size());
    }

    @Test
    void inNeighborsTrackDirectedArcs() {
        Graph g = new Graph(3, new int[][] { { 0, 2 }, { 1, 2 } });

        assertEquals(2, g.inDegree(2));
        assertEquals(0, g.outDegree(2));
        assertEquals(g.outDegree(0), g.degree(0));
        assertTrue(g.inNeighbors(2).contains(0));
        assertTrue(g.inNeighbors(2).contains(1));
    }

    @Test
    void neighborViewsAreReadOnly() {
        Graph g = new Graph(3, new int[][] { { 0, 1 } });
        IntSet view = g.outNeighbors(0);

        assertThrows(UnsupportedOperationException.class, () -> view.add(2));
        assertThrows(UnsupportedOperationException.class, () -> g.edges().put(Graph.edgeKey(0, 2), 1.0));
        assertThrows(UnsupportedOperationException.class, () -> g.adjacencyList().get(0).remove(1));

        g.addEdge(0, 2);
        assertTrue(view.contains(2));
    }

    @Test
    void rejectsOutOfRangeVertices() {
        Graph g = new Graph(3);

        assertThrows(IndexOutOfBoundsException.class, () -> g.addEdge(0, 3));
        assertThrows(IndexOutOfBoundsException.class, () -> g.addEdge(-1, 0));
        assertThrows(IndexOutOfBoundsException.class, () -> g.outNeighbors(5));
        assertThrows(IndexOutOfBoundsException.class, () -> g.removeEdge(-2, 1));
        assertThrows(IllegalArgumentException.class, () -> new Graph(-1));
    }

    @Test
    void edgeKeysRoundTrip() {
        long key = Graph.edgeKey(123456, 7);
        assertEquals(123456, Graph.sourceOf(key));
        assertEquals(7, Graph.targetOf(key));
        assertTrue(Graph.edgeKey(1, 2) != Graph.edgeKey(2, 1));
    }

    @Test
    void adjacencyMatrixHoldsWeights() {
        Graph g = new Graph(3, new int[][] { { 0, 1 }, { 2, 0 } }, new double[] { 0.25, 0.5 });

        double[][] matrix = g.adjacencyMatrix();

        assertArrayEquals(new double[] { 0.0, 0.25, 0.0 }, matrix[0]);
        assertArrayEquals(new double[] { 0.0, 0.0, 0.0 }, matrix[1]);
        assertArrayEquals(new double[] { 0.5, 0.0, 0.0 }, matrix[2]);
    }

    @Test
    void copyIsIndependent() {
        Graph g = new Graph(3, new int[][] { { 0, 1 } });
        Graph c = g.copy();

        c.addEdge(1, 2);
        c.updateEdgeWeight(0, 1, 0.3);

        assertEquals(1, g.numEdges());
        assertEquals(2, c.numEdges());
        assertEquals(1.0, g.weight(0, 1));
        assertTrue(c.inNeighbors(2).contains(1));
    }

    @Test
    void snapshotIsCachedUntilMutation() {
        Graph g = new Graph(3, new int[][] { { 0, 1 } });
        GraphSnapshot first = g.snapshot();

        assertSame(first, g.snapshot());

        g.addEdge(1, 2);
        GraphSnapshot second = g.snapshot();

        assertNotSame(first, second);
        assertEquals(1, first.m);
        assertEquals(2, second.m);
    }

    @Test
    void describesItself() {
        assertEquals("Directed graph with 3 nodes and 2 edges",
                new Graph(3, new int[][] { { 0, 1 }, { 1, 2 } }).toString());
        assertEquals("Undirected graph with 4 nodes and 1 edges",
                new Graph(4, new int[][] { { 0, 1 } }, null, false).toString());
    }
}
