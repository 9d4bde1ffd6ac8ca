package org.Aayush.astar.io;

import org.Aayush.astar.graph.GraphInstance;
import org.Aayush.astar.graph.WeightedGraph;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringReader;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Graph File Reader Tests")
class GraphFileReaderTest {

    private final GraphFileReader reader = new GraphFileReader();

    private GraphInstance parse(String content) throws IOException {
        return reader.read("fallback", new StringReader(content));
    }

    @Test
    @DisplayName("Reads the triangle fixture from the classpath")
    void testReadFixture() throws URISyntaxException {
        Path file = Paths.get(getClass().getResource("/graphs/triangle.txt").toURI());

        GraphInstance instance = reader.read(file);

        assertEquals("Triangle Detour", instance.getName());
        assertEquals(0, instance.getStartNode());
        assertEquals(2, instance.getGoalNode());
        WeightedGraph graph = instance.getGraph();
        assertEquals(3, graph.nodeCount());
        assertEquals(3, graph.edgeCount());
        assertEquals(1.0, graph.getNodeX(2));
        assertEquals(1.0, graph.getNodeY(2));
        assertEquals(2, graph.getNodeDegree(0), "Edges are inserted in both directions");
    }

    @Test
    @DisplayName("Tokens may be spread over arbitrary whitespace")
    void testWhitespaceTolerant() throws IOException {
        GraphInstance instance = parse("Loose\n2 0 0\n\n3 4   0 1 1\n0 1 5.0\n");

        assertEquals(2, instance.nodeCount());
        assertEquals(3.0, instance.getGraph().getNodeX(1));
        assertEquals(1, instance.getGraph().edgeCount());
    }

    @Test
    @DisplayName("Blank name line falls back to the file name")
    void testFallbackName(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("unnamed.txt");
        Files.writeString(file, "\n1\n0 0\n0 0\n0\n");

        assertEquals("unnamed", reader.read(file).getName());
    }

    @Test
    @DisplayName("Zero-node graphs parse; skipping them is the scanner's job")
    void testZeroNodes() throws IOException {
        GraphInstance instance = parse("Empty\n0\n0 0\n0\n");
        assertTrue(instance.getGraph().isEmpty());
    }

    @Test
    @DisplayName("Malformed content fails with reason codes")
    void testMalformed() {
        assertEquals(GraphFormatException.REASON_TRUNCATED,
                assertThrows(GraphFormatException.class, () -> parse("")).reasonCode());
        assertEquals(GraphFormatException.REASON_TRUNCATED,
                assertThrows(GraphFormatException.class, () -> parse("Short\n2\n0 0\n")).reasonCode());
        assertEquals(GraphFormatException.REASON_BAD_NUMBER,
                assertThrows(GraphFormatException.class, () -> parse("Bad\ntwo\n")).reasonCode());
        assertEquals(GraphFormatException.REASON_NODE_COUNT_NEGATIVE,
                assertThrows(GraphFormatException.class, () -> parse("Neg\n-1\n")).reasonCode());
        assertEquals(GraphFormatException.REASON_EDGE_COUNT_NEGATIVE,
                assertThrows(GraphFormatException.class, () -> parse("Neg\n1\n0 0\n0 0\n-2\n")).reasonCode());
    }

    @Test
    @DisplayName("Oversized node count with a short body fails as truncated")
    void testOversizedNodeCount() {
        GraphFormatException ex = assertThrows(GraphFormatException.class,
                () -> parse("Huge\n2000000000\n0 0\n"));
        assertEquals(GraphFormatException.REASON_TRUNCATED, ex.reasonCode());
        assertTrue(ex.getMessage().contains("x of node 1"), ex.getMessage());
    }

    @Test
    @DisplayName("Graph contract violations are wrapped")
    void testContractViolation() {
        GraphFormatException negative = assertThrows(GraphFormatException.class,
                () -> parse("Neg weight\n2\n0 0\n1 0\n0 1\n1\n0 1 -3\n"));
        assertEquals(GraphFormatException.REASON_GRAPH_CONTRACT, negative.reasonCode());
        assertNotNull(negative.getCause());

        GraphFormatException outOfRange = assertThrows(GraphFormatException.class,
                () -> parse("Bad edge\n2\n0 0\n1 0\n0 1\n1\n0 5 1\n"));
        assertEquals(GraphFormatException.REASON_GRAPH_CONTRACT, outOfRange.reasonCode());
    }

    @Test
    @DisplayName("Missing file fails with an IO reason code")
    void testMissingFile(@TempDir Path dir) {
        assertEquals(GraphFormatException.REASON_IO, assertThrows(GraphFormatException.class,
                () -> reader.read(dir.resolve("nope.txt"))).reasonCode());
    }
}
