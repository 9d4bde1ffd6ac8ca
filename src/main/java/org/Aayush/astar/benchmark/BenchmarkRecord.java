package org.Aayush.astar.benchmark;

import lombok.Builder;
import lombok.Value;
import org.Aayush.astar.heuristic.HeuristicType;

/**
 * Per-graph benchmark outcome handed to reporting.
 */
@Value
@Builder
public class BenchmarkRecord {
    String graphName;
    int numNodes;
    int startNode;
    int goalNode;
    HeuristicType heuristicType;
    double avgNodesExpanded;
    double avgSteps;
    double avgTimeNs;
    long totalTimeNs;
    long minTimeNs;
    /** Path cost, or {@link org.Aayush.astar.search.SearchResult#UNREACHABLE_COST}. */
    double pathCost;
}
