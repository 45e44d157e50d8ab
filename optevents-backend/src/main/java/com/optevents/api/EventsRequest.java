package com.optevents.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.optevents.model.FilterCriteria;
import jakarta.validation.constraints.Min;
import lombok.Data;

import java.util.List;

/**
 * Request payload for retrieving optimizer lifecycle events.
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class EventsRequest {
    private String clusterId;
    private String namespace;
    private String workloadName;
    private String optimizerId;

    private List<String> events;
    private boolean includeProgress;

    private String since;
    private String until;
    private Integer count;

    private boolean follow;

    @Min(value = 1, message = "follow_interval_sec must be positive")
    private Integer followIntervalSec;

    /** Overrides the solution prefix of event names; meant for developers. */
    private String solutionName;

    /**
     * Checks the combinations that cannot be used together and converts to criteria.
     *
     * @param defaultSolutionName solution name used when none is given
     * @return criteria
     * @throws IllegalArgumentException on conflicting options
     */
    public FilterCriteria toCriteria(String defaultSolutionName) {
        RequestChecks.checkScope(optimizerId, clusterId, namespace, workloadName);
        if (includeProgress && events != null && !events.isEmpty()) {
            throw new IllegalArgumentException("include_progress cannot be combined with events");
        }
        if (follow && count != null) {
            throw new IllegalArgumentException("follow cannot be combined with count");
        }
        RequestChecks.checkCount(count);

        return FilterCriteria.builder()
                .clusterId(clusterId)
                .namespace(namespace)
                .workloadName(workloadName)
                .optimizerId(optimizerId)
                .since(since)
                .until(until)
                .count(count)
                .events(events)
                .includeProgress(includeProgress)
                .solutionName(RequestChecks.solutionOrDefault(solutionName, defaultSolutionName))
                .build();
    }
}
