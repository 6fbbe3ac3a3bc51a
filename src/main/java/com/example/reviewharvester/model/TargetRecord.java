package com.example.reviewharvester.model;

import com.google.gson.annotations.SerializedName;

import java.util.Objects;

/**
 * Identity of one place to harvest, as supplied by the discovery step.
 * Read-only to the harvester.
 */
public final class TargetRecord {
    @SerializedName(value = "place_id", alternate = {"id"})
    private final String id;
    private final String name;
    private final String address;
    private final Double rating;
    @SerializedName(value = "user_ratings_total", alternate = {"knownReviewCount"})
    private final Integer knownReviewCount;
    @SerializedName(value = "phone_number", alternate = {"phoneNumber"})
    private final String phoneNumber;
    private final String grid;

    public TargetRecord(String id, String name, String address, Double rating,
                        Integer knownReviewCount, String phoneNumber, String grid) {
        this.id = id;
        this.name = name;
        this.address = address;
        this.rating = rating;
        this.knownReviewCount = knownReviewCount;
        this.phoneNumber = phoneNumber;
        this.grid = grid;
    }

    public static TargetRecord of(String id, String name) {
        return new TargetRecord(id, name, null, null, null, null, null);
    }

    public String getId() { return id; }
    public String getName() { return name; }
    public String getAddress() { return address; }
    public Double getRating() { return rating; }
    public Integer getKnownReviewCount() { return knownReviewCount; }
    public String getPhoneNumber() { return phoneNumber; }
    public String getGrid() { return grid; }

    /** Copy carrying the given grid, used when the grid comes from the input file name. */
    public TargetRecord withGrid(String grid) {
        return new TargetRecord(id, name, address, rating, knownReviewCount, phoneNumber, grid);
    }

    /** Human-readable label for logs. */
    public String label() {
        return name != null && !name.isBlank() ? name : id;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TargetRecord)) return false;
        return Objects.equals(id, ((TargetRecord) o).id);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(id);
    }

    @Override
    public String toString() {
        return "TargetRecord{" + id + ", " + name + "}";
    }
}
