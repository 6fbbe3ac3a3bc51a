package com.example.reviewharvester.io;

import com.example.reviewharvester.model.TargetRecord;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the target list produced by place discovery: a JSON array of objects with
 * {@code place_id}, {@code name}, {@code address}, {@code rating}, {@code user_ratings_total}.
 */
public class TargetFileReader {
    private static final Logger log = LoggerFactory.getLogger(TargetFileReader.class);
    private static final Pattern GRID_FILE = Pattern.compile("restaurants_(.+?)\\.json");
    private static final Gson G = new Gson();

    public List<TargetRecord> read(Path file) throws IOException {
        List<TargetRecord> raw;
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            raw = G.fromJson(reader, new TypeToken<List<TargetRecord>>() { }.getType());
        } catch (JsonParseException e) {
            throw new IOException("Invalid target file " + file + ": " + e.getMessage(), e);
        }
        if (raw == null) {
            return List.of();
        }

        String fileGrid = gridFromFileName(file);
        List<TargetRecord> out = new ArrayList<>();
        for (TargetRecord t : raw) {
            if (t == null || t.getId() == null || t.getId().isBlank()) {
                log.warn("Skipping target without a place id: {}", t);
                continue;
            }
            out.add(t.getGrid() == null && fileGrid != null ? t.withGrid(fileGrid) : t);
        }
        log.info("Read {} targets from {}", out.size(), file);
        return out;
    }

    static String gridFromFileName(Path file) {
        Matcher m = GRID_FILE.matcher(file.getFileName().toString());
        return m.matches() ? m.group(1) : null;
    }
}
