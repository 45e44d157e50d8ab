package com.optevents.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Filter criteria for event, recommendation and entity queries.
 *
 * <p>Every field is optional. {@code optimizerId} is an alternative to the
 * cluster/namespace/workload scoping; when it is set the others are not used to build
 * the optimizer predicate.
 */
@Data
@Builder(toBuilder = true)
public class FilterCriteria {
    public static final String DEFAULT_SOLUTION_NAME = "optimize";

    private String clusterId;
    private String namespace;
    private String workloadName;
    private String optimizerId;
    private String since;
    private String until;

    /** Result cap; {@code null} paginates to exhaustion. */
    private Integer count;

    /** Logical event names; {@code null} or empty selects the default list. */
    private List<String> events;
    private boolean includeProgress;
    private boolean includeInvalidated;

    @Builder.Default
    private String solutionName = DEFAULT_SOLUTION_NAME;

    public boolean hasOptimizerId() {
        return optimizerId != null && !optimizerId.isBlank();
    }

    public boolean hasEntityScope() {
        return (namespace != null && !namespace.isBlank())
                || (workloadName != null && !workloadName.isBlank());
    }

    public boolean isCapped() {
        return count != null;
    }
}
