package com.optevents.engine;

import com.optevents.client.DataSet;
import com.optevents.client.QueryError;
import com.optevents.client.QueryResponse;
import com.optevents.client.RemoteQueryException;
import com.optevents.client.ScriptedQueryClient;
import com.optevents.model.EventRow;
import com.optevents.model.QueryDocument;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static com.optevents.client.TestPages.emptyResponse;
import static com.optevents.client.TestPages.eventRow;
import static com.optevents.client.TestPages.eventsResponse;
import static com.optevents.client.TestPages.links;
import static com.optevents.client.TestPages.response;
import static com.optevents.client.TestPages.table;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Paginator Tests")
class PaginatorTest {

    private static final QueryDocument QUERY = new QueryDocument("events", "FETCH events(x)");
    private static final Instant T0 = Instant.parse("2024-03-01T00:00:00Z");

    private ScriptedQueryClient client;
    private Paginator paginator;

    @BeforeEach
    void setUp() {
        client = new ScriptedQueryClient();
        paginator = new Paginator(client, new ResultExtractor());
    }

    private static DataSet page(int n, boolean hasNext) {
        List<Object> first = eventRow(T0.plusSeconds(n * 10L), "page", n, "slot", "a");
        List<Object> second = eventRow(T0.plusSeconds(n * 10L + 1), "page", n, "slot", "b");
        return table("events-" + n,
                hasNext ? links("next", "/next/" + n, "follow", "/follow/" + n) : links("follow", "/follow/" + n),
                first, second);
    }

    @Test
    @DisplayName("Should concatenate N pages in order using exactly N round trips")
    void testExecuteEvents_AllPages() {
        client.onExecute(eventsResponse(page(1, true)))
                .onContinue("next", eventsResponse(page(2, true)))
                .onContinue("next", eventsResponse(page(3, false)));

        Paginator.PageSet<EventRow> result = paginator.executeEvents(QUERY, true);

        assertEquals(3, result.getRoundTrips());
        assertEquals(6, result.getRows().size());
        List<Object> order = new ArrayList<>();
        for (EventRow row : result.getRows()) {
            order.add(row.attribute("page") + "" + row.attribute("slot"));
        }
        assertEquals(List.of("1a", "1b", "2a", "2b", "3a", "3b"), order);
        assertEquals("events-3", result.getLastCursor().getName());
        assertEquals(List.of("execute:events", "continue:next:/next/1", "continue:next:/next/2"), client.getCalls());
    }

    @Test
    @DisplayName("Should read only the first page when pagination is off")
    void testExecuteEvents_PaginationSkipped() {
        client.onExecute(eventsResponse(page(1, true)));

        Paginator.PageSet<EventRow> result = paginator.executeEvents(QUERY, false);

        assertEquals(1, result.getRoundTrips());
        assertEquals(2, result.getRows().size());
        assertEquals(0, client.countCalls("continue"));
        assertTrue(result.getLastCursor().hasLink(DataSet.NEXT));
    }

    @Test
    @DisplayName("Should treat a missing first main dataset as no results")
    void testExecuteEvents_NoMain() {
        client.onExecute(emptyResponse());

        Paginator.PageSet<EventRow> result = paginator.executeEvents(QUERY, true);

        assertTrue(result.isEmpty());
        assertNull(result.getLastCursor());
    }

    @Test
    @DisplayName("Should treat a first main dataset without rows as no results")
    void testExecuteEvents_NoRows() {
        client.onExecute(response(DataSet.builder().name("main").build()));

        Paginator.PageSet<EventRow> result = paginator.executeEvents(QUERY, true);

        assertTrue(result.isEmpty());
        assertNull(result.getLastCursor());
    }

    @Test
    @DisplayName("Should stop at a continuation without main data and keep earlier rows")
    void testExecuteEvents_ContinuationWithoutMain() {
        client.onExecute(eventsResponse(page(1, true)))
                .onContinue("next", emptyResponse());

        Paginator.PageSet<EventRow> result = paginator.executeEvents(QUERY, true);

        assertEquals(2, result.getRows().size());
        assertEquals(2, result.getRoundTrips());
    }

    @Test
    @DisplayName("Should fail with the page number when a continuation page has no rows")
    void testExecuteEvents_ContinuationWithoutRows() {
        client.onExecute(eventsResponse(page(1, true)))
                .onContinue("next", response(DataSet.builder().name("main").build()));

        DataShapeException ex = assertThrows(DataShapeException.class, () -> paginator.executeEvents(QUERY, true));
        assertTrue(ex.getMessage().contains("page 2"));
    }

    @Test
    @DisplayName("Should fail when the first cell is not a nested table")
    void testExecuteEvents_NotNested() {
        List<List<Object>> rows = new ArrayList<>();
        rows.add(new ArrayList<>(List.of("oops")));
        client.onExecute(response(DataSet.builder().name("main").data(rows).build()));

        DataShapeException ex = assertThrows(DataShapeException.class, () -> paginator.executeEvents(QUERY, true));
        assertTrue(ex.getMessage().contains("page 1"));
        assertTrue(ex.getMessage().contains("String"));
    }

    @Test
    @DisplayName("Should wrap continuation failures with the page number")
    void testExecuteEvents_RemoteFailure() {
        client.onExecute(eventsResponse(page(1, true)))
                .onContinue("next", () -> {
                    throw new RemoteQueryException("connection reset");
                });

        RemoteQueryException ex = assertThrows(RemoteQueryException.class, () -> paginator.executeEvents(QUERY, true));
        assertTrue(ex.getMessage().contains("page 2"));
        assertTrue(ex.getMessage().contains("connection reset"));
    }

    @Test
    @DisplayName("Should keep going when the response reports partial errors")
    void testExecuteEvents_PartialErrors() {
        QueryResponse partial = eventsResponse(page(1, false));
        partial.getErrors().add(new QueryError("Partial result", "one shard timed out"));
        client.onExecute(partial);

        Paginator.PageSet<EventRow> result = paginator.executeEvents(QUERY, true);

        assertEquals(2, result.getRows().size());
    }
}
