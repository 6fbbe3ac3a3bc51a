package com.example.reviewharvester.model;

import java.util.Objects;

/**
 * One extracted review. Immutable; identity is the fingerprint, never the DOM position.
 */
public final class ReviewRecord {
    private final String fingerprint;
    private final String reviewId;
    private final String author;
    private final Integer rating;
    private final String dateText;
    private final String body;
    private final String language;

    public ReviewRecord(String fingerprint, String reviewId, String author, Integer rating,
                        String dateText, String body, String language) {
        this.fingerprint = Objects.requireNonNull(fingerprint, "fingerprint");
        this.reviewId = reviewId;
        this.author = author;
        this.rating = rating;
        this.dateText = dateText;
        this.body = body;
        this.language = language;
    }

    public String getFingerprint() { return fingerprint; }
    public String getReviewId() { return reviewId; }
    public String getAuthor() { return author; }
    public Integer getRating() { return rating; }
    public String getDateText() { return dateText; }
    public String getBody() { return body; }
    public String getLanguage() { return language; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ReviewRecord)) return false;
        return fingerprint.equals(((ReviewRecord) o).fingerprint);
    }

    @Override
    public int hashCode() {
        return fingerprint.hashCode();
    }
}
