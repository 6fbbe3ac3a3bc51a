package com.example.reviewharvester.scraper;

import com.example.reviewharvester.model.SortOrder;
import com.example.reviewharvester.model.TargetRecord;
import com.example.reviewharvester.util.SelectorConfig;

import java.io.IOException;
import java.io.InputStream;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Site-specific knowledge: selectors from resources/config and the in-page scripts
 * from resources/scripts, plus the argument maps those scripts expect.
 */
public class SiteProfile {

    public static final String DEFAULT_PROFILE = "google_maps_selectors.json";

    static final String BLOCK_PROBE_SCRIPT = "return document.querySelector(arguments[0]) !== null;";

    private final SelectorConfig cfg;
    private final String openReviewsScript;
    private final String sortScript;
    private final String scrollScript;
    private final String expandScript;
    private final String extractScript;
    private final Map<String, Object> reviewArgs;

    public SiteProfile(SelectorConfig cfg) throws IOException {
        this.cfg = cfg;
        this.openReviewsScript = loadScript("open_reviews.js");
        this.sortScript = loadScript("sort.js");
        this.scrollScript = loadScript("scroll.js");
        this.expandScript = loadScript("expand.js");
        this.extractScript = loadScript("extract.js");
        this.reviewArgs = buildReviewArgs(cfg);
    }

    public static SiteProfile load() throws IOException {
        return new SiteProfile(SelectorConfig.load(DEFAULT_PROFILE));
    }

    static String loadScript(String name) throws IOException {
        String path = "/scripts/" + name;
        try (InputStream in = SiteProfile.class.getResourceAsStream(path)) {
            if (in == null) {
                throw new IllegalArgumentException("Could not find script: " + path);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private static Map<String, Object> buildReviewArgs(SelectorConfig cfg) {
        Map<String, Object> args = new HashMap<>();
        for (String key : List.of("reviewNode", "reviewIdAttribute", "expandButton", "originalButton",
                "authorName", "authorLink", "rating", "date", "textContainer", "textSpan")) {
            args.put(key, cfg.require(key));
        }
        args.put("expandLabels", cfg.getStrings("expandLabels"));
        args.put("originalLabels", cfg.getStrings("originalLabels"));
        return Map.copyOf(args);
    }

    /** Canonical detail-page URL for a target. */
    public String placeUrl(TargetRecord target) {
        String template = cfg.require("placeUrlTemplate");
        return template.replace("{id}", URLEncoder.encode(target.getId(), StandardCharsets.UTF_8));
    }

    public String loadedMarker() {
        return cfg.require("loadedMarker");
    }

    public String reviewsPanel() {
        return cfg.require("reviewsPanel");
    }

    public String sortMenuItem() {
        return cfg.require("sortMenuItem");
    }

    public String blockedSelector() {
        return cfg.getString("blockedSelector");
    }

    public List<String> blockedUrlMarkers() {
        return cfg.getStrings("blockedUrlMarkers");
    }

    public String openReviewsScript() { return openReviewsScript; }
    public String sortScript() { return sortScript; }
    public String scrollScript() { return scrollScript; }
    public String expandScript() { return expandScript; }
    public String extractScript() { return extractScript; }

    public Map<String, Object> openReviewsArgs() {
        return Map.of(
                "tabLabels", cfg.getStrings("reviewsTabLabels"),
                "zeroLabels", cfg.getStrings("zeroReviewsLabels"),
                "mainContainer", cfg.getString("mainContainer", "body"));
    }

    public Map<String, Object> sortOpenArgs() {
        return Map.of("mode", "open", "sortButton", cfg.require("sortButton"));
    }

    public Map<String, Object> sortSelectArgs(SortOrder order) {
        return Map.of(
                "mode", "select",
                "menuItem", cfg.require("sortMenuItem"),
                "labels", cfg.getStrings(order.labelKey()));
    }

    public Map<String, Object> scrollArgs(int pages) {
        return Map.of("panel", reviewsPanel(), "pages", pages);
    }

    public Map<String, Object> reviewArgs() {
        return reviewArgs;
    }
}
