package com.optevents.engine;

import com.optevents.client.DataSet;
import com.optevents.model.EventRow;

import java.util.List;

/**
 * Outcome of an events request.
 *
 * <p>{@code status} is set when nothing was returned, and says why. {@code lastCursor} is the
 * final page's table, used to continue in follow mode.
 */
public final class EventsResult {
    public static final String NO_ENTITIES = "No optimization entities found matching the given criteria";
    public static final String NO_EVENTS = "No event results found for given input";

    private final List<EventRow> items;
    private final DataSet lastCursor;
    private final String status;

    private EventsResult(List<EventRow> items, DataSet lastCursor, String status) {
        this.items = items;
        this.lastCursor = lastCursor;
        this.status = status;
    }

    public static EventsResult of(List<EventRow> items, DataSet lastCursor) {
        return new EventsResult(items, lastCursor, null);
    }

    public static EventsResult empty(String status) {
        return new EventsResult(List.of(), null, status);
    }

    public List<EventRow> getItems() {
        return items;
    }

    public DataSet getLastCursor() {
        return lastCursor;
    }

    public String getStatus() {
        return status;
    }

    public int getTotal() {
        return items.size();
    }
}
