package com.optevents.engine;

import com.optevents.model.EventRow;
import com.optevents.model.FilterCriteria;
import com.optevents.model.RecommendationRow;
import com.optevents.query.FilterCompiler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges the ignored-blocker attributes of optimization-started events into recommendations.
 *
 * <p>Both sides are matched on {@code <optimizer_id>-<optimization_num>}. The lookup is built per
 * call and dropped afterwards.
 */
@Component
public class BlockerJoiner {
    private static final Logger log = LoggerFactory.getLogger(BlockerJoiner.class);

    static final String IGNORED_BLOCKERS_PREFIX = "optimize.ignored_blockers";
    private static final String PRINCIPAL = "principal";

    private final FilterCompiler filterCompiler;
    private final Paginator paginator;

    public BlockerJoiner(FilterCompiler filterCompiler, Paginator paginator) {
        this.filterCompiler = filterCompiler;
        this.paginator = paginator;
    }

    /**
     * Queries optimization-started events with the recommendation filter and joins them in.
     *
     * @param recommendations recommendation events
     * @param criteria criteria of the recommendation query
     * @param filter predicate of the recommendation query
     * @return recommendations with blocker context, in input order
     */
    public List<RecommendationRow> join(List<EventRow> recommendations, FilterCriteria criteria, String filter) {
        Paginator.PageSet<EventRow> started = paginator.executeEvents(
                filterCompiler.optimizationStartedQuery(criteria, filter), true);
        if (started.isEmpty()) {
            log.warn("No optimization_started events found for the requested recommendations");
        }
        return merge(recommendations, buildLookup(started.getRows()));
    }

    /**
     * Groups the ignored-blocker attributes of each started event by composite key.
     *
     * @param startedEvents optimization-started events
     * @return lookup from composite key to blocker attributes
     */
    public Map<String, Map<String, Object>> buildLookup(List<EventRow> startedEvents) {
        Map<String, Map<String, Object>> lookup = new HashMap<>();
        for (int i = 0; i < startedEvents.size(); i++) {
            EventRow row = startedEvents.get(i);
            Map<String, Object> blockers = new LinkedHashMap<>();
            for (Map.Entry<String, Object> attr : row.getEventAttributes().entrySet()) {
                if (attr.getKey().startsWith(IGNORED_BLOCKERS_PREFIX)) {
                    blockers.put(attr.getKey(), attr.getValue());
                }
            }
            lookup.put(compositeKey(row, "optimization_started", i), blockers);
        }
        return lookup;
    }

    /**
     * Attaches blocker attributes and ids to each recommendation.
     *
     * @param recommendations recommendation events
     * @param lookup lookup from {@link #buildLookup(List)}
     * @return joined rows
     */
    public List<RecommendationRow> merge(List<EventRow> recommendations, Map<String, Map<String, Object>> lookup) {
        List<RecommendationRow> out = new ArrayList<>(recommendations.size());
        for (int i = 0; i < recommendations.size(); i++) {
            EventRow event = recommendations.get(i);
            String key = compositeKey(event, "recommendations", i);
            RecommendationRow row = new RecommendationRow(event);

            Map<String, Object> blockers = lookup.get(key);
            if (blockers == null) {
                log.warn("No optimization_started event found for recommendation with optimizer_id: {} and num: {}",
                        event.attribute(EventRow.OPTIMIZER_ID), event.attribute(EventRow.OPTIMIZATION_NUM));
            } else {
                for (Map.Entry<String, Object> attr : blockers.entrySet()) {
                    row.getBlockersAttributes().put(attr.getKey(), attr.getValue());
                    String blockerId = blockerId(attr.getKey());
                    if (blockerId != null) {
                        row.addBlocker(blockerId);
                    }
                }
            }
            out.add(row);
        }
        return out;
    }

    /**
     * Composite join key {@code <optimizer_id>-<optimization_num>} of an event.
     *
     * @throws DataShapeException if either attribute is missing or not a string
     */
    public static String compositeKey(EventRow row, String dataset, int index) {
        return requireString(row, EventRow.OPTIMIZER_ID, dataset, index)
                + "-" + requireString(row, EventRow.OPTIMIZATION_NUM, dataset, index);
    }

    /**
     * Blocker id of an attribute name: its second-to-last segment. Attribute names containing
     * {@code principal} and names with three segments or fewer carry no id.
     *
     * @param attribute attribute name, e.g. {@code optimize.ignored_blockers.cpu-limit.reason}
     * @return blocker id, or {@code null}
     */
    static String blockerId(String attribute) {
        if (attribute.contains(PRINCIPAL)) {
            return null;
        }
        String[] parts = attribute.split("\\.", -1);
        if (parts.length <= 3) {
            return null;
        }
        return parts[parts.length - 2];
    }

    private static String requireString(EventRow row, String attribute, String dataset, int index) {
        Object value = row.attribute(attribute);
        if (!(value instanceof String s)) {
            throw new DataShapeException(String.format("%s row %d attribute %s (type %s) is missing or not a string",
                    dataset, index, attribute, ResultExtractor.typeName(value)));
        }
        return s;
    }
}
