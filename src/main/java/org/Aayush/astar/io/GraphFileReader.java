package org.Aayush.astar.io;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import org.Aayush.astar.graph.GraphContractException;
import org.Aayush.astar.graph.GraphInstance;
import org.Aayush.astar.graph.WeightedGraph;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.NoSuchElementException;
import java.util.Scanner;

/**
 * Reads one graph instance from the plain-text graph format.
 * <p>
 * Layout, whitespace separated after the first line:
 * <pre>
 * graph name (whole first line)
 * numNodes
 * x y          (numNodes lines)
 * start goal
 * numEdges
 * u v weight   (numEdges lines, undirected)
 * </pre>
 * A blank name line falls back to the file name without its extension.
 * <p>
 * Start and goal are not range-checked here; the search does that per instance.
 */
public final class GraphFileReader {

    /**
     * Reads a graph file as UTF-8.
     *
     * @throws GraphFormatException if the file is unreadable or malformed.
     */
    public GraphInstance read(Path file) {
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return read(fallbackName(file), reader);
        } catch (IOException ex) {
            throw new GraphFormatException(GraphFormatException.REASON_IO, "cannot read " + file, ex);
        }
    }

    /**
     * Reads graph content from a character stream. The stream is not closed.
     *
     * @param fallbackName name used when the name line is blank.
     * @throws GraphFormatException if the content is malformed.
     */
    public GraphInstance read(String fallbackName, Reader source) throws IOException {
        BufferedReader reader = source instanceof BufferedReader
                ? (BufferedReader) source
                : new BufferedReader(source);

        String nameLine = reader.readLine();
        if (nameLine == null) {
            throw new GraphFormatException(GraphFormatException.REASON_TRUNCATED, "missing graph name line");
        }
        String name = nameLine.isBlank() ? fallbackName : nameLine.strip();

        Scanner tokens = new Scanner(reader);
        tokens.useLocale(Locale.ROOT);

        int nodeCount = nextInt(tokens, "numNodes");
        if (nodeCount < 0) {
            throw new GraphFormatException(
                    GraphFormatException.REASON_NODE_COUNT_NEGATIVE,
                    "numNodes must be non-negative, got " + nodeCount
            );
        }

        // The declared count is untrusted; coordinates grow with the body actually present.
        DoubleArrayList xs = new DoubleArrayList();
        DoubleArrayList ys = new DoubleArrayList();
        for (int node = 0; node < nodeCount; node++) {
            xs.add(nextDouble(tokens, "x of node " + node));
            ys.add(nextDouble(tokens, "y of node " + node));
        }

        try {
            WeightedGraph.Builder builder = WeightedGraph.builder(nodeCount);
            for (int node = 0; node < nodeCount; node++) {
                builder.coordinate(node, xs.getDouble(node), ys.getDouble(node));
            }

            int start = nextInt(tokens, "start node");
            int goal = nextInt(tokens, "goal node");

            int edgeCount = nextInt(tokens, "numEdges");
            if (edgeCount < 0) {
                throw new GraphFormatException(
                        GraphFormatException.REASON_EDGE_COUNT_NEGATIVE,
                        "numEdges must be non-negative, got " + edgeCount
                );
            }
            for (int e = 0; e < edgeCount; e++) {
                int u = nextInt(tokens, "u of edge " + e);
                int v = nextInt(tokens, "v of edge " + e);
                double w = nextDouble(tokens, "weight of edge " + e);
                builder.edge(u, v, w);
            }

            return GraphInstance.builder()
                    .name(name)
                    .graph(builder.build())
                    .startNode(start)
                    .goalNode(goal)
                    .build();
        } catch (GraphContractException ex) {
            throw new GraphFormatException(
                    GraphFormatException.REASON_GRAPH_CONTRACT,
                    "graph '" + name + "' violates graph contract: " + ex.getMessage(),
                    ex
            );
        }
    }

    private static int nextInt(Scanner tokens, String field) {
        String token = nextToken(tokens, field);
        try {
            return Integer.parseInt(token);
        } catch (NumberFormatException ex) {
            throw new GraphFormatException(
                    GraphFormatException.REASON_BAD_NUMBER,
                    field + " must be an integer, got '" + token + "'",
                    ex
            );
        }
    }

    private static double nextDouble(Scanner tokens, String field) {
        String token = nextToken(tokens, field);
        try {
            return Double.parseDouble(token);
        } catch (NumberFormatException ex) {
            throw new GraphFormatException(
                    GraphFormatException.REASON_BAD_NUMBER,
                    field + " must be a number, got '" + token + "'",
                    ex
            );
        }
    }

    private static String nextToken(Scanner tokens, String field) {
        try {
            return tokens.next();
        } catch (NoSuchElementException ex) {
            throw new GraphFormatException(
                    GraphFormatException.REASON_TRUNCATED,
                    "unexpected end of input while reading " + field,
                    ex
            );
        }
    }

    private static String fallbackName(Path file) {
        Path fileName = file.getFileName();
        if (fileName == null) {
            return file.toString();
        }
        String raw = fileName.toString();
        int dot = raw.lastIndexOf('.');
        return dot > 0 ? raw.substring(0, dot) : raw;
    }
}
