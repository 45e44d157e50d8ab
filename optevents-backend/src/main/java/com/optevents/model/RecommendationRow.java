package com.optevents.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A recommendation event enriched with the ignored-blocker context of the optimization run
 * that produced it.
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RecommendationRow {
    private final Instant timestamp;
    private final Map<String, Object> eventAttributes;
    private final Map<String, Object> blockersAttributes = new LinkedHashMap<>();
    private final List<String> blockers = new ArrayList<>();

    public RecommendationRow(EventRow event) {
        this.timestamp = event.getTimestamp();
        this.eventAttributes = event.getEventAttributes();
    }

    /**
     * Adds a blocker id unless an identical one is already present.
     *
     * @param blockerId blocker id
     */
    public void addBlocker(String blockerId) {
        if (!blockers.contains(blockerId)) {
            blockers.add(blockerId);
        }
    }

    public boolean isBlockersPresent() {
        return !blockers.isEmpty();
    }
}
