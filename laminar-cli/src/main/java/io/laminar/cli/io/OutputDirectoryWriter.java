package io.laminar.cli.io;

import io.laminar.core.pipeline.SheetResult;
import io.laminar.core.pipeline.SheetResultSink;
import io.laminar.serialization.ProcessSerializer;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/// Writes the artifacts of each processed sheet into one directory.
///
/// For a sheet named `Orders` two files are written:
/// - `Orders_process.json`: the canonical process document
/// - `Orders_flowchart.mmd`: the Mermaid diagram
///
/// Characters that are not allowed in file names are replaced by `_`. Two sheets whose
/// names map to the same file stem, such as `A/B` and `A_B`, get distinct files: the later
/// one is suffixed `_2`, `_3` and so on. Stems are compared ignoring case. Files left by
/// earlier runs are overwritten.
///
/// @implNote Thread-safe. Writes are serialized, so concurrent sheets never interleave
/// within the directory. One writer covers one run; stems are assigned per instance.
public class OutputDirectoryWriter implements SheetResultSink {

    private static final Logger logger = Logger.getLogger(OutputDirectoryWriter.class.getName());

    static final String PROCESS_SUFFIX = "_process.json";
    static final String DIAGRAM_SUFFIX = "_flowchart.mmd";

    private final Path directory;
    private final Map<String, String> stems = new HashMap<>();
    private final Set<String> usedStems = new HashSet<>();

    /// Creates a writer.
    ///
    /// @param directory target directory, created on first write, not null
    public OutputDirectoryWriter(Path directory) {
        this.directory = directory;
    }

    public Path getDirectory() {
        return directory;
    }

    @Override
    public synchronized void accept(SheetResult result) throws IOException {
        Files.createDirectories(directory);

        Path json = processFile(result.sheetName());
        Files.writeString(
                json, ProcessSerializer.toJson(result.document()), StandardCharsets.UTF_8);

        Path diagram = diagramFile(result.sheetName());
        Files.writeString(diagram, result.diagram(), StandardCharsets.UTF_8);

        logger.info("Sheet '" + result.sheetName() + "': wrote " + json + " and " + diagram);
    }

    /// Returns the path of the process document written for a sheet.
    public Path processFile(String sheetName) {
        return directory.resolve(stemOf(sheetName) + PROCESS_SUFFIX);
    }

    /// Returns the path of the diagram written for a sheet.
    public Path diagramFile(String sheetName) {
        return directory.resolve(stemOf(sheetName) + DIAGRAM_SUFFIX);
    }

    private synchronized String stemOf(String sheetName) {
        return stems.computeIfAbsent(
                sheetName,
                name -> {
                    String base = fileStem(name);
                    String candidate = base;
                    int suffix = 2;
                    while (!usedStems.add(candidate.toLowerCase(Locale.ROOT))) {
                        candidate = base + "_" + suffix++;
                    }
                    if (!candidate.equals(base)) {
                        logger.warning(
                                "Sheet '" + name + "' clashes with another file name; using "
                                        + candidate);
                    }
                    return candidate;
                });
    }

    /// Replaces path separators, control characters and characters reserved on common
    /// file systems.
    static String fileStem(String sheetName) {
        String stem = sheetName.trim().replaceAll("[\\\\/:*?\"<>|\\p{Cntrl}]", "_");
        return stem.isEmpty() || stem.chars().allMatch(ch -> ch == '.') ? "sheet" : stem;
    }
}
