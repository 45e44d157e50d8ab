package com.optevents.engine;

import com.optevents.client.DataSet;
import com.optevents.client.QueryClient;
import com.optevents.client.QueryError;
import com.optevents.client.QueryResponse;
import com.optevents.client.RemoteQueryException;
import com.optevents.model.EventRow;
import com.optevents.model.QueryDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Walks the {@code next} links of a query until the last page.
 *
 * <p>Fetching is sequential: one round trip at a time, and every round trip continues from the
 * page returned by the previous one.
 */
@Component
public class Paginator {
    private static final Logger log = LoggerFactory.getLogger(Paginator.class);

    private final QueryClient queryClient;
    private final ResultExtractor resultExtractor;

    /**
     * Reads the rows of one page.
     *
     * @param <T> row type
     */
    @FunctionalInterface
    public interface PageReader<T> {
        /**
         * @param main main dataset of the response
         * @param page 1-based page number
         * @return rows and the dataset whose links continue the query
         */
        Page<T> read(DataSet main, int page);
    }

    /**
     * Rows of one page plus the dataset carrying its continuation links.
     */
    public static final class Page<T> {
        private final List<T> rows;
        private final DataSet cursor;

        public Page(List<T> rows, DataSet cursor) {
            this.rows = rows;
            this.cursor = cursor;
        }

        public static <T> Page<T> empty() {
            return new Page<>(List.of(), null);
        }

        public List<T> getRows() {
            return rows;
        }

        public DataSet getCursor() {
            return cursor;
        }
    }

    /**
     * Aggregated result of a paginated query.
     */
    public static final class PageSet<T> {
        private final List<T> rows;
        private final DataSet lastCursor;
        private final int roundTrips;

        PageSet(List<T> rows, DataSet lastCursor, int roundTrips) {
            this.rows = rows;
            this.lastCursor = lastCursor;
            this.roundTrips = roundTrips;
        }

        public List<T> getRows() {
            return rows;
        }

        /**
         * Dataset of the last page read, or {@code null} when the query returned nothing.
         */
        public DataSet getLastCursor() {
            return lastCursor;
        }

        public int getRoundTrips() {
            return roundTrips;
        }

        public boolean isEmpty() {
            return rows.isEmpty();
        }
    }

    public Paginator(QueryClient queryClient, ResultExtractor resultExtractor) {
        this.queryClient = queryClient;
        this.resultExtractor = resultExtractor;
    }

    /**
     * Executes an events-shaped query and reads its pages.
     *
     * @param query query
     * @param followNext whether to walk {@code next} links; {@code false} keeps only the first page
     * @return rows of all pages read
     */
    public PageSet<EventRow> executeEvents(QueryDocument query, boolean followNext) {
        String label = query.getLabel();
        return execute(query, (main, page) -> readEventPage(main, label, "page " + page, page == 1), followNext);
    }

    /**
     * Executes a query and reads its pages with the given reader.
     */
    public <T> PageSet<T> execute(QueryDocument query, PageReader<T> reader, boolean followNext) {
        QueryResponse first;
        try {
            first = queryClient.executeQuery(query);
        } catch (RemoteQueryException e) {
            throw new RemoteQueryException(query.getLabel() + " query failed: " + e.getMessage(), e);
        }
        return paginate(first, query.getLabel(), reader, followNext);
    }

    /**
     * Reads the first page and then every {@code next} page.
     *
     * @param first response of the initial execute call
     * @param label query label for logs and errors
     * @param reader page reader
     * @param followNext whether to walk {@code next} links
     * @return aggregated rows in page order
     */
    public <T> PageSet<T> paginate(QueryResponse first, String label, PageReader<T> reader, boolean followNext) {
        logPartialErrors(first, label, "Execution");

        DataSet main = first == null ? null : first.getMain();
        if (main == null) {
            return new PageSet<>(List.of(), null, 1);
        }

        Page<T> current = reader.read(main, 1);
        List<T> rows = new ArrayList<>(current.getRows());
        DataSet cursor = current.getCursor();
        int roundTrips = 1;

        boolean more = followNext && cursor != null && cursor.hasLink(DataSet.NEXT);
        for (int page = 2; more; page++) {
            QueryResponse resp;
            try {
                resp = queryClient.continueQuery(cursor, DataSet.NEXT);
            } catch (RemoteQueryException e) {
                throw new RemoteQueryException("page " + page + " of " + label + " query failed: " + e.getMessage(), e);
            }
            roundTrips++;
            logPartialErrors(resp, label, "Continuation (page " + page + ")");

            DataSet nextMain = resp == null ? null : resp.getMain();
            if (nextMain == null) {
                log.error("Continuation of {} query (page {}) has no main data. Returned data may not be complete!", label, page);
                break;
            }

            current = reader.read(nextMain, page);
            rows.addAll(current.getRows());
            cursor = current.getCursor();
            more = cursor != null && cursor.hasLink(DataSet.NEXT);
        }

        log.debug("Read {} rows of {} query in {} round trips", rows.size(), label, roundTrips);
        return new PageSet<>(rows, cursor, roundTrips);
    }

    /**
     * Reads an events page: the main dataset's first cell holds the events table.
     *
     * @param main main dataset
     * @param label query label
     * @param position position for messages, e.g. {@code page 3} or {@code follow}
     * @param emptyAllowed whether a main dataset without rows means "no results" rather than an error
     * @return extracted rows and the events table as cursor
     */
    public Page<EventRow> readEventPage(DataSet main, String label, String position, boolean emptyAllowed) {
        if (main.rowCount() < 1) {
            if (emptyAllowed) {
                return Page.empty();
            }
            throw new DataShapeException(String.format("%s %s main dataset %s has no rows", label, position, main.getName()));
        }

        List<Object> firstRow = main.getData().get(0);
        if (firstRow == null || firstRow.isEmpty()) {
            throw new DataShapeException(String.format("%s %s main dataset %s first row has no columns",
                    label, position, main.getName()));
        }

        Object cell = firstRow.get(0);
        if (!(cell instanceof DataSet table)) {
            throw new DataShapeException(String.format(
                    "%s %s main dataset %s first row first column (type %s) could not be converted to a dataset",
                    label, position, main.getName(), ResultExtractor.typeName(cell)));
        }

        return new Page<>(resultExtractor.extract(table, label + " " + position), table);
    }

    /**
     * Logs errors reported next to otherwise usable data. Never fails.
     */
    public void logPartialErrors(QueryResponse resp, String label, String phase) {
        if (resp == null || !resp.hasErrors()) {
            return;
        }
        log.warn("{} of {} query encountered errors. Returned data may not be complete!", phase, label);
        for (QueryError e : resp.getErrors()) {
            log.warn("{}: {}", e.getTitle(), e.getDetail());
        }
    }
}
