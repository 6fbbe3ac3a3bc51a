package com.example.reviewharvester.model;

import com.google.gson.annotations.SerializedName;

import java.util.Locale;

/** Review ordering requested from the reviews panel. */
public enum SortOrder {
    @SerializedName("newest")
    NEWEST("sortNewestLabels"),
    @SerializedName("relevant")
    RELEVANT("sortRelevantLabels");

    private final String labelKey;

    SortOrder(String labelKey) {
        this.labelKey = labelKey;
    }

    /** Key of the menu-item labels in the site profile. */
    public String labelKey() {
        return labelKey;
    }

    public static SortOrder parse(String raw) {
        switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "newest":
            case "recent":
                return NEWEST;
            case "relevant":
            case "relevance":
                return RELEVANT;
            default:
                throw new IllegalArgumentException("Unknown sort order: " + raw);
        }
    }
}
