package com.optevents.engine;

import com.optevents.model.EventRow;
import com.optevents.model.FilterCriteria;
import com.optevents.model.RecommendationRow;
import com.optevents.query.FilterCompiler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Runs recommendation queries and joins in the blocker context of each recommendation.
 */
@Slf4j
@Service
public class RecommendationsService {
    private final FilterCompiler filterCompiler;
    private final EntityResolver entityResolver;
    private final Paginator paginator;
    private final BlockerJoiner blockerJoiner;

    public RecommendationsService(
            FilterCompiler filterCompiler,
            EntityResolver entityResolver,
            Paginator paginator,
            BlockerJoiner blockerJoiner
    ) {
        this.filterCompiler = filterCompiler;
        this.entityResolver = entityResolver;
        this.paginator = paginator;
        this.blockerJoiner = blockerJoiner;
    }

    public RecommendationsResult listRecommendations(FilterCriteria criteria) {
        filterCompiler.validate(criteria);

        Optional<String> filter = entityResolver.resolveFilter(criteria);
        if (filter.isEmpty()) {
            return RecommendationsResult.empty(EventsResult.NO_ENTITIES);
        }

        Paginator.PageSet<EventRow> pages = paginator.executeEvents(
                filterCompiler.recommendationsQuery(criteria, filter.get()), !criteria.isCapped());
        if (pages.getLastCursor() == null) {
            return RecommendationsResult.empty(RecommendationsResult.NO_RECOMMENDATIONS);
        }
        if (pages.isEmpty()) {
            return RecommendationsResult.of(List.of());
        }

        List<RecommendationRow> joined = blockerJoiner.join(pages.getRows(), criteria, filter.get());
        log.info("Recommendations query returned {} rows in {} round trips", joined.size(), pages.getRoundTrips());
        return RecommendationsResult.of(joined);
    }
}
