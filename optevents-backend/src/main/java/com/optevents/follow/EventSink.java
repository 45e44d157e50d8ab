package com.optevents.follow;

import com.optevents.model.EventRow;

import java.util.List;

/**
 * Receives each non-empty batch of newly arrived events.
 */
@FunctionalInterface
public interface EventSink {
    void accept(List<EventRow> batch);
}
