package com.example.reviewharvester.io;

import com.example.reviewharvester.model.CollectionLog;
import com.example.reviewharvester.model.TargetRecord;
import com.example.reviewharvester.model.TargetResult;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * One pretty-printed JSON file per target under the output directory, grouped by grid
 * when the target has one, plus the run log. Files are written to a temp name and moved
 * into place so a crash never leaves a half-written result behind.
 */
public class JsonResultStore {
    private static final Logger log = LoggerFactory.getLogger(JsonResultStore.class);
    private static final Gson G = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    public static final String RUN_LOG_FILE = "collection-log.json";

    private final Path outputDir;

    public JsonResultStore(Path outputDir) {
        this.outputDir = outputDir;
    }

    public Path outputDir() {
        return outputDir;
    }

    public Path pathFor(TargetRecord target) {
        return pathFor(target.getId(), target.getGrid());
    }

    Path pathFor(String targetId, String grid) {
        Path dir = grid == null || grid.isBlank() ? outputDir : outputDir.resolve(safeName(grid));
        return dir.resolve(safeName(targetId) + ".json");
    }

    public boolean exists(TargetRecord target) {
        return Files.isRegularFile(pathFor(target));
    }

    /** Stored result for a target; empty when missing or unreadable. */
    public Optional<TargetResult> read(TargetRecord target) {
        Path file = pathFor(target);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            TargetResult result = G.fromJson(reader, TargetResult.class);
            if (result == null || result.getStatus() == null || !target.getId().equals(result.getTargetId())) {
                log.warn("Ignoring unrecognized result file {}", file);
                return Optional.empty();
            }
            return Optional.of(result);
        } catch (IOException | JsonParseException e) {
            log.warn("Ignoring unreadable result file {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    public Path write(TargetResult result) throws IOException {
        Path file = pathFor(result.getTargetId(), result.getGrid());
        writeAtomically(file, result);
        log.debug("Wrote {}", file);
        return file;
    }

    public Path writeRunLog(CollectionLog runLog) throws IOException {
        Path file = outputDir.resolve(RUN_LOG_FILE);
        writeAtomically(file, runLog);
        return file;
    }

    private void writeAtomically(Path file, Object value) throws IOException {
        Files.createDirectories(file.getParent());
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        try (Writer w = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
            G.toJson(value, w);
        }
        try {
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    /** Keep ids usable as file names on every platform. */
    static String safeName(String raw) {
        String cleaned = raw.trim().replaceAll("[\\\\/:*?\"<>|\\s]+", "_");
        return cleaned.isEmpty() ? "_" : cleaned;
    }
}
