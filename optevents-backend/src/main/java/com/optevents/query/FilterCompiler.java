package com.optevents.query;

import com.optevents.model.EventRow;
import com.optevents.model.FilterCriteria;
import com.optevents.model.QueryDocument;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns {@link FilterCriteria} into query documents.
 *
 * <p>Rendering is deterministic: the same criteria always produce the same text.
 */
@Component
public class FilterCompiler {
    public static final int MAX_COUNT = 1000;

    private static final String CLUSTER_ATTRIBUTE = "k8s.cluster.id";
    private static final String NAMESPACE_ATTRIBUTE = "\"k8s.namespace.name\"";
    private static final String WORKLOAD_ATTRIBUTE = "\"k8s.workload.name\"";
    private static final String QUOTED_CLUSTER_ATTRIBUTE = "\"k8s.cluster.id\"";
    private static final String AND = " && ";

    /**
     * Checks the result cap. Must run before any query is sent.
     *
     * @param criteria criteria
     * @throws IllegalArgumentException if the cap is above {@value #MAX_COUNT} or below 1
     */
    public void validate(FilterCriteria criteria) {
        Integer count = criteria.getCount();
        if (count == null) {
            return;
        }
        if (count > MAX_COUNT) {
            throw new IllegalArgumentException("counts higher than " + MAX_COUNT + " are not supported");
        }
        if (count < 1) {
            throw new IllegalArgumentException("count must be at least 1");
        }
    }

    /**
     * Builds the predicate shared by the events, recommendations and optimization-started queries.
     *
     * @param criteria criteria
     * @param resolvedOptimizerIds optimizer ids from the entity lookup, or {@code null} when no
     *                             lookup was made
     * @return predicate, empty when nothing filters
     */
    public String compileFilter(FilterCriteria criteria, List<String> resolvedOptimizerIds) {
        List<String> clauses = new ArrayList<>(2);
        if (!isBlank(criteria.getClusterId())) {
            clauses.add(equalsClause(CLUSTER_ATTRIBUTE, criteria.getClusterId()));
        }
        if (criteria.hasOptimizerId()) {
            clauses.add(equalsClause(EventRow.OPTIMIZER_ID, criteria.getOptimizerId()));
        } else if (resolvedOptimizerIds != null) {
            clauses.add(inClause(EventRow.OPTIMIZER_ID, resolvedOptimizerIds));
        }
        return String.join(AND, clauses);
    }

    /**
     * Event names to fetch, qualified with the solution prefix, in caller order.
     *
     * @param criteria criteria
     * @return qualified names
     */
    public List<String> qualifiedEvents(FilterCriteria criteria) {
        List<String> names = new ArrayList<>();
        if (criteria.getEvents() == null || criteria.getEvents().isEmpty()) {
            names.addAll(EventTypes.DEFAULT_EVENTS);
        } else {
            names.addAll(criteria.getEvents());
        }
        if (criteria.isIncludeProgress()) {
            names.addAll(EventTypes.PROGRESS_EVENTS);
        }

        List<String> qualified = new ArrayList<>(names.size());
        for (String name : names) {
            qualified.add(EventTypes.qualify(criteria.getSolutionName(), name.trim()));
        }
        return qualified;
    }

    public QueryDocument eventsQuery(FilterCriteria criteria, String filter) {
        validate(criteria);
        return new QueryDocument("events", QueryTemplates.events(
                criteria.getSince(), criteria.getUntil(), qualifiedEvents(criteria), filter, criteria.getCount()));
    }

    public QueryDocument recommendationsQuery(FilterCriteria criteria, String filter) {
        validate(criteria);
        String solution = criteria.getSolutionName();
        List<String> events = new ArrayList<>(3);
        if (criteria.isIncludeInvalidated()) {
            events.add(EventTypes.qualify(solution, EventTypes.RECOMMENDATION_IDENTIFIED));
            events.add(EventTypes.qualify(solution, EventTypes.RECOMMENDATION_INVALIDATED));
        }
        events.add(EventTypes.qualify(solution, EventTypes.RECOMMENDATION_VERIFIED));
        return new QueryDocument("recommendations", QueryTemplates.events(
                criteria.getSince(), criteria.getUntil(), events, filter, criteria.getCount()));
    }

    /**
     * Optimization-started events over the same window and filter, never capped.
     */
    public QueryDocument optimizationStartedQuery(FilterCriteria criteria, String filter) {
        List<String> events = List.of(EventTypes.qualify(criteria.getSolutionName(), EventTypes.OPTIMIZATION_STARTED));
        return new QueryDocument("optimization_started", QueryTemplates.events(
                criteria.getSince(), criteria.getUntil(), events, filter, null));
    }

    /**
     * Entity lookup for the optimizers matching namespace, workload and cluster.
     *
     * @param criteria criteria with at least a namespace or a workload name
     * @return query
     * @throws IllegalArgumentException if neither namespace nor workload name is set
     */
    public QueryDocument entityLookupQuery(FilterCriteria criteria) {
        List<String> clauses = new ArrayList<>(3);
        if (!isBlank(criteria.getNamespace())) {
            clauses.add(equalsClause(NAMESPACE_ATTRIBUTE, criteria.getNamespace()));
        }
        if (!isBlank(criteria.getWorkloadName())) {
            clauses.add(equalsClause(WORKLOAD_ATTRIBUTE, criteria.getWorkloadName()));
        }
        if (clauses.isEmpty()) {
            throw new IllegalArgumentException(
                    "optimizations query must at least filter on namespace or workload name, otherwise it can be skipped");
        }
        if (!isBlank(criteria.getClusterId())) {
            clauses.add(equalsClause(QUOTED_CLUSTER_ATTRIBUTE, criteria.getClusterId()));
        }
        return new QueryDocument("optimization", QueryTemplates.entityAttribute(
                criteria.getSince(),
                criteria.getUntil(),
                EventRow.OPTIMIZER_ID,
                EventTypes.qualify(criteria.getSolutionName(), EventTypes.OPTIMIZATION_ENTITY),
                String.join(AND, clauses)));
    }

    static String equalsClause(String attribute, String value) {
        return "attributes(" + attribute + ") = " + quote(value);
    }

    static String inClause(String attribute, List<String> values) {
        List<String> quoted = new ArrayList<>(values.size());
        for (String v : values) {
            quoted.add(quote(v));
        }
        return "attributes(" + attribute + ") IN [" + String.join(", ", quoted) + "]";
    }

    /**
     * Double-quotes a value, escaping backslashes, quotes and control characters.
     */
    static String quote(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 2).append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"':
                    sb.append("\\\"");
                    break;
                case '\\':
                    sb.append("\\\\");
                    break;
                case '\n':
                    sb.append("\\n");
                    break;
                case '\r':
                    sb.append("\\r");
                    break;
                case '\t':
                    sb.append("\\t");
                    break;
                default:
                    sb.append(c);
                    break;
            }
        }
        return sb.append('"').toString();
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
