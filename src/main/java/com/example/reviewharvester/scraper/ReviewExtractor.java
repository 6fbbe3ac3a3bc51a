package com.example.reviewharvester.scraper;

import com.example.reviewharvester.browser.BrowserSession;
import com.example.reviewharvester.model.ReviewRecord;
import com.example.reviewharvester.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps the loaded review nodes to {@link ReviewRecord}s. Each batch first clicks every
 * "More" / "See original" control in one script call, then reads all nodes in a second.
 */
public class ReviewExtractor {
    private static final Logger log = LoggerFactory.getLogger(ReviewExtractor.class);

    // "별표 4개", "4 stars", "Rated 4.0 out of 5"
    private static final Pattern RATING = Pattern.compile(
            "별표\\s*(\\d+(?:[.,]\\d+)?)\\s*개|(\\d+(?:[.,]\\d+)?)\\s*(?:stars?|out of)",
            Pattern.CASE_INSENSITIVE);

    private final SiteProfile profile;
    private final Retrier retrier;
    private final Sleeper sleeper;
    private final Duration settle;

    public ReviewExtractor(SiteProfile profile, Retrier retrier, Sleeper sleeper, Duration settle) {
        this.profile = profile;
        this.retrier = retrier;
        this.sleeper = sleeper;
        this.settle = settle;
    }

    /**
     * Expand and read every loaded node. Nodes without text, or still showing an
     * unexpanded "More" control, are left for a later batch.
     */
    public List<ReviewRecord> extractBatch(BrowserSession session) throws HarvestException {
        Object clicked = retrier.call("expand reviews",
                () -> session.evaluate(profile.expandScript(), profile.reviewArgs()));
        if (clicked instanceof Number && ((Number) clicked).intValue() > 0) {
            // let the expanded text render before reading it
            sleeper.sleep(settle);
        }
        Object raw = retrier.call("extract reviews", () -> {
            Object result = session.evaluate(profile.extractScript(), profile.reviewArgs());
            if (!(result instanceof List)) {
                throw new ScriptExecutionException("Extraction returned " + result + " instead of a list");
            }
            return result;
        });
        return toRecords((List<?>) raw);
    }

    static List<ReviewRecord> toRecords(List<?> nodes) {
        List<ReviewRecord> out = new ArrayList<>();
        int skipped = 0;
        for (Object node : nodes) {
            if (!(node instanceof Map)) {
                skipped++;
                continue;
            }
            ReviewRecord r = toRecord((Map<?, ?>) node);
            if (r == null) {
                skipped++;
            } else {
                out.add(r);
            }
        }
        if (skipped > 0) {
            log.trace("Skipped {} review nodes without complete text", skipped);
        }
        return out;
    }

    static ReviewRecord toRecord(Map<?, ?> node) {
        String body = string(node.get("text"));
        if (body == null || body.isBlank() || Boolean.TRUE.equals(node.get("truncated"))) {
            return null;
        }
        String authorName = string(node.get("author"));
        String authorId = string(node.get("authorId"));
        String dateText = string(node.get("date"));
        String fingerprint = Fingerprints.of(authorId != null ? authorId : authorName, dateText, body);
        return new ReviewRecord(
                fingerprint,
                string(node.get("reviewId")),
                authorName,
                parseRating(string(node.get("ratingLabel"))),
                dateText,
                body.trim(),
                string(node.get("language")));
    }

    /** Star rating from an aria-label; null when absent or outside 1..5. */
    static Integer parseRating(String label) {
        if (label == null) return null;
        Matcher m = RATING.matcher(label);
        if (!m.find()) return null;
        String digits = m.group(1) != null ? m.group(1) : m.group(2);
        try {
            int value = (int) Math.round(Double.parseDouble(digits.replace(',', '.')));
            return value >= 1 && value <= 5 ? value : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String string(Object value) {
        return value == null ? null : value.toString();
    }
}
