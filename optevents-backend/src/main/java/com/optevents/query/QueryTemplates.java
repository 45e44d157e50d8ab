package com.optevents.query;

import java.util.List;

/**
 * Query text templates.
 *
 * <p>Each method is a pure function of its arguments. Optional clauses (SINCE, UNTIL, the
 * predicate block, LIMITS) are omitted when their value is {@code null} or blank.
 */
public final class QueryTemplates {
    private static final String EVENT_SEPARATOR = ",\n\t\t";

    private QueryTemplates() {
    }

    /**
     * Events query; used for the event log, recommendation and optimization-started queries.
     *
     * @param since window start, passed through verbatim
     * @param until window end, passed through verbatim
     * @param qualifiedEvents event names already prefixed with their solution, in order
     * @param filter predicate joined with {@code &&}
     * @param limit result cap, or {@code null}
     * @return query text
     */
    public static String events(String since, String until, List<String> qualifiedEvents, String filter, Integer limit) {
        StringBuilder sb = new StringBuilder("\n");
        appendWindow(sb, since, until);
        sb.append("FETCH events(\n\t\t")
                .append(String.join(EVENT_SEPARATOR, qualifiedEvents))
                .append("\n\t)\n\t");
        if (!isBlank(filter)) {
            sb.append('[').append(filter).append("]\n\t");
        }
        sb.append("{attributes, timestamp}\n");
        if (limit != null) {
            sb.append("LIMITS events.count(").append(limit).append(")\n");
        }
        sb.append("ORDER events.asc()\n");
        return sb.toString();
    }

    /**
     * Entity lookup returning one attribute per matching entity.
     *
     * @param since window start
     * @param until window end
     * @param attribute attribute to fetch
     * @param qualifiedEntityType entity type prefixed with its solution
     * @param filter predicate joined with {@code &&}
     * @return query text
     */
    public static String entityAttribute(String since, String until, String attribute, String qualifiedEntityType, String filter) {
        StringBuilder sb = new StringBuilder("\n");
        appendWindow(sb, since, until);
        sb.append("FETCH attributes(").append(attribute).append(")\n")
                .append("FROM entities(").append(qualifiedEntityType).append(")[")
                .append(filter == null ? "" : filter)
                .append("]\n");
        return sb.toString();
    }

    private static void appendWindow(StringBuilder sb, String since, String until) {
        if (!isBlank(since)) {
            sb.append("SINCE ").append(since).append('\n');
        }
        if (!isBlank(until)) {
            sb.append("UNTIL ").append(until).append('\n');
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
