package com.optevents.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.optevents.model.FilterCriteria;
import lombok.Data;

/**
 * Request payload for retrieving recommendations.
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RecommendationsRequest {
    private String clusterId;
    private String namespace;
    private String workloadName;
    private String optimizerId;

    private boolean includeInvalidated;

    private String since = "-52w";
    private String until;
    private Integer count = 1;

    private String solutionName;

    public FilterCriteria toCriteria(String defaultSolutionName) {
        RequestChecks.checkScope(optimizerId, clusterId, namespace, workloadName);
        RequestChecks.checkCount(count);

        return FilterCriteria.builder()
                .clusterId(clusterId)
                .namespace(namespace)
                .workloadName(workloadName)
                .optimizerId(optimizerId)
                .since(since)
                .until(until)
                .count(count)
                .includeInvalidated(includeInvalidated)
                .solutionName(RequestChecks.solutionOrDefault(solutionName, defaultSolutionName))
                .build();
    }
}
