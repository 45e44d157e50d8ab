package com.optevents.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One event returned by an events query: its timestamp and flattened attribute bag.
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class EventRow {
    public static final String OPTIMIZER_ID = "optimize.optimization.optimizer_id";
    public static final String OPTIMIZATION_NUM = "optimize.optimization.num";
    public static final String EVENT_TYPE = "appd.event.type";

    private final Instant timestamp;
    private final Map<String, Object> eventAttributes;

    public EventRow(Instant timestamp, Map<String, Object> eventAttributes) {
        this.timestamp = timestamp;
        this.eventAttributes = eventAttributes == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(eventAttributes));
    }

    public Object attribute(String name) {
        return eventAttributes.get(name);
    }
}
