package com.optevents.query;

import java.util.List;

/**
 * Logical names of the optimizer lifecycle events.
 */
public final class EventTypes {

    public static final List<String> DEFAULT_EVENTS = List.of(
            "optimization_baselined",
            "optimization_started",
            "optimization_ended",
            "stage_started",
            "stage_ended",
            "experiment_started",
            "experiment_ended",
            "experiment_deployment_started",
            "experiment_deployment_completed",
            "experiment_measurement_started",
            "experiment_measurement_completed",
            "experiment_described",
            "recommendation_identified",
            "recommendation_verified",
            "recommendation_invalidated"
    );

    public static final List<String> PROGRESS_EVENTS = List.of(
            "optimization_progress",
            "stage_progress",
            "experiment_progress"
    );

    public static final String OPTIMIZATION_STARTED = "optimization_started";
    public static final String RECOMMENDATION_IDENTIFIED = "recommendation_identified";
    public static final String RECOMMENDATION_INVALIDATED = "recommendation_invalidated";
    public static final String RECOMMENDATION_VERIFIED = "recommendation_verified";

    /** Entity type holding one row per optimizer. */
    public static final String OPTIMIZATION_ENTITY = "optimization";

    private EventTypes() {
    }

    /**
     * Prefixes an event or entity name with its solution, e.g. {@code optimize:stage_started}.
     *
     * @param solutionName solution name
     * @param name logical name
     * @return qualified name
     */
    public static String qualify(String solutionName, String name) {
        return solutionName + ":" + name;
    }
}
