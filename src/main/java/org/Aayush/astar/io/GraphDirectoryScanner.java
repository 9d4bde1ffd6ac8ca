package org.Aayush.astar.io;

import org.Aayush.astar.graph.GraphInstance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Discovers and loads every {@code *.txt} graph file directly inside a folder.
 * <p>
 * Files are loaded in file-name order. A file that cannot be parsed, or that declares no
 * nodes, is logged and skipped so one bad input does not hide the rest.
 */
public final class GraphDirectoryScanner {
    public static final String GRAPH_FILE_EXTENSION = ".txt";

    private static final Logger log = LoggerFactory.getLogger(GraphDirectoryScanner.class);

    private final GraphFileReader reader;

    public GraphDirectoryScanner() {
        this(new GraphFileReader());
    }

    public GraphDirectoryScanner(GraphFileReader reader) {
        this.reader = Objects.requireNonNull(reader, "reader");
    }

    /**
     * @param directory folder to scan, not recursive.
     * @return loaded instances with at least one node.
     * @throws GraphFormatException if the folder is missing or cannot be listed.
     */
    public List<GraphInstance> scan(Path directory) {
        Objects.requireNonNull(directory, "directory");
        if (!Files.isDirectory(directory)) {
            throw new GraphFormatException(
                    GraphFormatException.REASON_DIRECTORY_MISSING,
                    "graph folder not found: " + directory
            );
        }

        List<Path> files;
        try (Stream<Path> entries = Files.list(directory)) {
            files = entries
                    .filter(Files::isRegularFile)
                    .filter(GraphDirectoryScanner::isGraphFile)
                    .sorted(Comparator.comparing(path -> path.getFileName().toString()))
                    .collect(Collectors.toList());
        } catch (IOException ex) {
            throw new GraphFormatException(GraphFormatException.REASON_IO, "cannot list " + directory, ex);
        }

        List<GraphInstance> graphs = new ArrayList<>(files.size());
        for (Path file : files) {
            GraphInstance instance;
            try {
                instance = reader.read(file);
            } catch (GraphFormatException ex) {
                log.warn("Skipping graph file {}: {}", file, ex.getMessage());
                continue;
            }
            if (instance.nodeCount() <= 0) {
                log.warn("Skipping graph file {}: graph has no nodes", file);
                continue;
            }
            log.debug("Loaded graph '{}' from {}: {}", instance.getName(), file, instance.getGraph());
            graphs.add(instance);
        }
        return graphs;
    }

    private static boolean isGraphFile(Path path) {
        Path fileName = path.getFileName();
        return fileName != null
                && fileName.toString().toLowerCase(Locale.ROOT).endsWith(GRAPH_FILE_EXTENSION);
    }
}
