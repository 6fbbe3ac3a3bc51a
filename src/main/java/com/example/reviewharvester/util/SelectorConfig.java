package com.example.reviewharvester.util;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Loads the site profile (selectors, labels, URL template) from resources/config/.
 *
 * Example:
 *   SelectorConfig cfg = SelectorConfig.load("google_maps_selectors.json");
 *   String panel = cfg.require("reviewsPanel");
 */
public class SelectorConfig {

    private final JsonObject selectors;

    public SelectorConfig(JsonObject selectors) {
        this.selectors = Objects.requireNonNull(selectors, "selectors");
    }

    public static SelectorConfig load(String fileName) throws IOException {
        String path = "/config/" + fileName;
        InputStream in = SelectorConfig.class.getResourceAsStream(path);
        if (in == null) {
            throw new IllegalArgumentException("Could not find selector config file: " + path);
        }
        try (InputStreamReader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            return new SelectorConfig(JsonParser.parseReader(reader).getAsJsonObject());
        }
    }

    /**
     * Get a string value from the loaded JSON.
     * @param key JSON key
     * @return the value or null if missing
     */
    public String getString(String key) {
        if (selectors.has(key) && !selectors.get(key).isJsonNull()) {
            return selectors.get(key).getAsString();
        }
        return null;
    }

    public String getString(String key, String fallback) {
        String value = getString(key);
        return value != null ? value : fallback;
    }

    /** Like {@link #getString(String)} but a missing key is a broken profile. */
    public String require(String key) {
        String value = getString(key);
        if (value == null || value.isBlank()) {
            throw new IllegalStateException("Selector config is missing '" + key + "'");
        }
        return value;
    }

    /** A string array value; a plain string is treated as a one-element list. */
    public List<String> getStrings(String key) {
        List<String> out = new ArrayList<>();
        if (!selectors.has(key)) return out;
        JsonElement el = selectors.get(key);
        if (el.isJsonArray()) {
            JsonArray arr = el.getAsJsonArray();
            for (JsonElement item : arr) {
                out.add(item.getAsString());
            }
        } else if (!el.isJsonNull()) {
            out.add(el.getAsString());
        }
        return out;
    }

    @Override
    public String toString() {
        return Objects.toString(selectors);
    }
}
