package com.optevents.engine;

import com.optevents.model.EventRow;
import com.optevents.model.FilterCriteria;
import com.optevents.model.QueryDocument;
import com.optevents.query.FilterCompiler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Runs event log queries: scope resolution, query rendering and pagination.
 */
@Slf4j
@Service
public class EventsService {
    private final FilterCompiler filterCompiler;
    private final EntityResolver entityResolver;
    private final Paginator paginator;

    public EventsService(FilterCompiler filterCompiler, EntityResolver entityResolver, Paginator paginator) {
        this.filterCompiler = filterCompiler;
        this.entityResolver = entityResolver;
        this.paginator = paginator;
    }

    /**
     * Fetches events matching the criteria.
     *
     * <p>All pages are read unless a result cap is set, or unless the caller is going to follow:
     * the follow link of the first page already covers the rest.
     *
     * @param criteria criteria
     * @param follow whether the caller will follow the result
     * @return events, or an empty result with a status
     */
    public EventsResult listEvents(FilterCriteria criteria, boolean follow) {
        filterCompiler.validate(criteria);

        Optional<String> filter = entityResolver.resolveFilter(criteria);
        if (filter.isEmpty()) {
            return EventsResult.empty(EventsResult.NO_ENTITIES);
        }

        QueryDocument query = filterCompiler.eventsQuery(criteria, filter.get());
        boolean paginate = !criteria.isCapped() && !follow;
        Paginator.PageSet<EventRow> pages = paginator.executeEvents(query, paginate);
        if (pages.getLastCursor() == null) {
            return EventsResult.empty(EventsResult.NO_EVENTS);
        }

        log.info("Events query returned {} rows in {} round trips (follow={})",
                pages.getRows().size(), pages.getRoundTrips(), follow);
        return EventsResult.of(pages.getRows(), pages.getLastCursor());
    }
}
