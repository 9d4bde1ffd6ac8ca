package org.Aayush.astar.search;

import org.Aayush.astar.graph.WeightedGraph;
import org.Aayush.astar.heuristic.EuclideanHeuristicProvider;
import org.Aayush.astar.heuristic.GoalBoundHeuristic;
import org.Aayush.astar.heuristic.ManhattanHeuristicProvider;
import org.Aayush.astar.testutil.GraphFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("A* Search Engine Tests")
class AStarSearchTest {
    private static final double COST_TOLERANCE = 1e-9;

    private final AStarSearch search = new AStarSearch();

    private static GoalBoundHeuristic euclidean(WeightedGraph graph, int goal) {
        return new EuclideanHeuristicProvider(graph).bindGoal(goal);
    }

    @Nested
    @DisplayName("1. Scenarios")
    class ScenarioTests {

        @Test
        @DisplayName("Triangle: two cheap hops beat the direct edge")
        void testTriangle() {
            WeightedGraph graph = GraphFixtures.triangle();

            SearchResult result = search.search(graph, 0, 2, euclidean(graph, 2));

            assertEquals(2.0, result.getPathCost(), COST_TOLERANCE, "Path via node 1 costs 2.0, not 2.5");
            assertTrue(result.isReachable());
            assertEquals(3, result.getNodesExpanded(), "0, 1 and the goal are expanded");
            assertEquals(3, result.getSteps(), "The superseded 2.5 entry is never popped");
            assertEquals(4, result.getPushes(), "start, 1, 2 via direct edge, 2 via node 1");
        }

        @Test
        @DisplayName("Disconnected pair: goal unreachable")
        void testDisconnectedPair() {
            WeightedGraph graph = GraphFixtures.disconnectedPair();

            SearchResult result = search.search(graph, 0, 1, euclidean(graph, 1));

            assertEquals(SearchResult.UNREACHABLE_COST, result.getPathCost());
            assertFalse(result.isReachable());
            assertEquals(1, result.getNodesExpanded(), "Only the start is expanded");
            assertEquals(1, result.getSteps());
        }

        @Test
        @DisplayName("Start equals goal: zero cost, one expansion, one step")
        void testStartEqualsGoal() {
            WeightedGraph graph = GraphFixtures.singleNode();

            SearchResult result = search.search(graph, 0, 0, euclidean(graph, 0));

            assertEquals(0.0, result.getPathCost());
            assertEquals(1, result.getNodesExpanded());
            assertEquals(1, result.getSteps());
        }

        @Test
        @DisplayName("Stale entries count as steps but not as expansions")
        void testStaleEntryAccounting() {
            WeightedGraph graph = WeightedGraph.builder(4)
                    .edge(0, 1, 1.0)
                    .edge(0, 2, 5.0)
                    .edge(1, 2, 1.0)
                    .edge(2, 3, 10.0)
                    .build();

            SearchResult result = search.search(graph, 0, 3, GoalBoundHeuristic.ZERO);

            assertEquals(12.0, result.getPathCost(), COST_TOLERANCE);
            assertEquals(4, result.getNodesExpanded(), "Nodes 0, 1, 2 and goal 3");
            assertEquals(5, result.getSteps(), "The outdated (2, 5.0) entry is popped and discarded");
        }

        @Test
        @DisplayName("Zero-weight edges are allowed")
        void testZeroWeightEdges() {
            WeightedGraph graph = WeightedGraph.builder(3)
                    .edge(0, 1, 0.0)
                    .edge(1, 2, 0.0)
                    .build();

            SearchResult result = search.search(graph, 0, 2, GoalBoundHeuristic.ZERO);

            assertEquals(0.0, result.getPathCost());
        }
    }

    @Nested
    @DisplayName("2. Correctness against reference Dijkstra")
    class CorrectnessTests {

        @ParameterizedTest
        @ValueSource(longs = {1L, 7L, 42L, 2026L, 99_991L})
        @DisplayName("Euclidean A* cost equals reference shortest path on random graphs")
        void testEuclideanMatchesReference(long seed) {
            WeightedGraph graph = GraphFixtures.randomGeometric(200, 400, seed);
            Random random = new Random(seed);

            for (int query = 0; query < 25; query++) {
                int start = random.nextInt(graph.nodeCount());
                int goal = random.nextInt(graph.nodeCount());

                SearchResult result = search.search(graph, start, goal, euclidean(graph, goal));
                double expected = GraphFixtures.referenceDistance(graph, start, goal);

                assertEquals(expected, result.getPathCost(), COST_TOLERANCE,
                        "seed=" + seed + " start=" + start + " goal=" + goal);
            }
        }

        @Test
        @DisplayName("Manhattan A* is optimal on a unit grid")
        void testManhattanOnGrid() {
            WeightedGraph graph = GraphFixtures.grid(12, 9);
            int goal = 8 * 12 + 11;

            SearchResult result = search.search(graph, 0, goal,
                    new ManhattanHeuristicProvider(graph).bindGoal(goal));

            assertEquals(11.0 + 8.0, result.getPathCost(), COST_TOLERANCE);
        }

        @Test
        @DisplayName("Zero heuristic behaves like Dijkstra and expands at least as much as Euclidean")
        void testZeroHeuristicDegeneracy() {
            WeightedGraph graph = GraphFixtures.randomGeometric(300, 600, 11L);
            Random random = new Random(11L);

            for (int query = 0; query < 20; query++) {
                int start = random.nextInt(graph.nodeCount());
                int goal = random.nextInt(graph.nodeCount());

                SearchResult dijkstra = search.search(graph, start, goal, GoalBoundHeuristic.ZERO);
                SearchResult astar = search.search(graph, start, goal, euclidean(graph, goal));

                assertEquals(GraphFixtures.referenceDistance(graph, start, goal), dijkstra.getPathCost(), COST_TOLERANCE);
                assertEquals(dijkstra.getPathCost(), astar.getPathCost(), COST_TOLERANCE);
                assertTrue(dijkstra.getNodesExpanded() >= astar.getNodesExpanded(),
                        "zero heuristic expanded " + dijkstra.getNodesExpanded()
                                + " < euclidean " + astar.getNodesExpanded());
            }
        }
    }

    @Nested
    @DisplayName("3. Determinism and Termination")
    class DeterminismTests {

        @Test
        @DisplayName("Repeated searches yield identical results")
        void testDeterminism() {
            WeightedGraph graph = GraphFixtures.randomGeometric(500, 1_500, 5L);
            GoalBoundHeuristic heuristic = euclidean(graph, 499);

            SearchResult first = search.search(graph, 0, 499, heuristic);
            for (int i = 0; i < 10; i++) {
                assertEquals(first, search.search(graph, 0, 499, heuristic));
            }
        }

        @Test
        @Timeout(5)
        @DisplayName("Cyclic graph with unreachable goal drains the queue within the push bound")
        void testTerminationOnCycles() {
            // Dense component {0..29} plus isolated goal 30.
            WeightedGraph.Builder builder = WeightedGraph.builder(31);
            Random random = new Random(3L);
            for (int u = 0; u < 30; u++) {
                for (int v = u + 1; v < 30; v++) {
                    builder.edge(u, v, 1.0 + random.nextInt(20));
                }
                builder.edge(u, u, 0.5);
            }
            WeightedGraph graph = builder.build();

            SearchResult result = search.search(graph, 0, 30, GoalBoundHeuristic.ZERO);

            assertFalse(result.isReachable());
            assertEquals(30, result.getNodesExpanded(), "Every node of the start component is expanded once");
            assertEquals(result.getPushes(), result.getSteps(), "Every pushed entry is eventually popped");
            assertTrue(result.getPushes() <= graph.arcCount() + 1);
        }
    }

    @Nested
    @DisplayName("4. Input Contract")
    class ContractTests {

        @Test
        @DisplayName("Out-of-range endpoints fail fast with reason codes")
        void testEndpointValidation() {
            WeightedGraph graph = GraphFixtures.triangle();

            SearchContractException badStart = assertThrows(SearchContractException.class,
                    () -> search.search(graph, 3, 2, GoalBoundHeuristic.ZERO));
            assertEquals(AStarSearch.REASON_START_OUT_OF_RANGE, badStart.getReasonCode());

            SearchContractException badGoal = assertThrows(SearchContractException.class,
                    () -> search.search(graph, 0, -1, GoalBoundHeuristic.ZERO));
            assertEquals(AStarSearch.REASON_GOAL_OUT_OF_RANGE, badGoal.getReasonCode());
            assertTrue(badGoal.getMessage().startsWith("[" + AStarSearch.REASON_GOAL_OUT_OF_RANGE + "]"));
        }

        @Test
        @DisplayName("Empty graph, missing graph and missing heuristic are rejected")
        void testMissingInputs() {
            WeightedGraph empty = WeightedGraph.builder(0).build();

            assertEquals(AStarSearch.REASON_GRAPH_EMPTY, assertThrows(SearchContractException.class,
                    () -> search.search(empty, 0, 0, GoalBoundHeuristic.ZERO)).getReasonCode());
            assertEquals(AStarSearch.REASON_GRAPH_REQUIRED, assertThrows(SearchContractException.class,
                    () -> search.search(null, 0, 0, GoalBoundHeuristic.ZERO)).getReasonCode());
            assertEquals(AStarSearch.REASON_HEURISTIC_REQUIRED, assertThrows(SearchContractException.class,
                    () -> search.search(GraphFixtures.triangle(), 0, 2, null)).getReasonCode());
        }

        @Test
        @DisplayName("Negative or NaN heuristic estimates are rejected")
        void testInvalidHeuristic() {
            WeightedGraph graph = GraphFixtures.triangle();

            assertEquals(AStarSearch.REASON_HEURISTIC_INVALID, assertThrows(SearchContractException.class,
                    () -> search.search(graph, 0, 2, node -> -1.0)).getReasonCode());
            assertEquals(AStarSearch.REASON_HEURISTIC_INVALID, assertThrows(SearchContractException.class,
                    () -> search.search(graph, 0, 2, node -> Double.NaN)).getReasonCode());
        }
    }
}
