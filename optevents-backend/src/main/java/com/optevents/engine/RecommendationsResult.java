package com.optevents.engine;

import com.optevents.model.RecommendationRow;

import java.util.List;

public final class RecommendationsResult {
    public static final String NO_RECOMMENDATIONS = "No recommendation results found for given input";

    private final List<RecommendationRow> items;
    private final String status;

    private RecommendationsResult(List<RecommendationRow> items, String status) {
        this.items = items;
        this.status = status;
    }

    public static RecommendationsResult of(List<RecommendationRow> items) {
        return new RecommendationsResult(items, null);
    }

    public static RecommendationsResult empty(String status) {
        return new RecommendationsResult(List.of(), status);
    }

    public List<RecommendationRow> getItems() {
        return items;
    }

    public String getStatus() {
        return status;
    }

    public int getTotal() {
        return items.size();
    }
}
