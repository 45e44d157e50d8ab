package com.optevents.api;

import com.optevents.query.FilterCompiler;

/**
 * Option checks shared by the request payloads.
 */
final class RequestChecks {

    private RequestChecks() {
    }

    static void checkScope(String optimizerId, String clusterId, String namespace, String workloadName) {
        if (isBlank(optimizerId)) {
            return;
        }
        if (!isBlank(clusterId)) {
            throw new IllegalArgumentException("optimizer_id cannot be combined with cluster_id");
        }
        if (!isBlank(namespace)) {
            throw new IllegalArgumentException("optimizer_id cannot be combined with namespace");
        }
        if (!isBlank(workloadName)) {
            throw new IllegalArgumentException("optimizer_id cannot be combined with workload_name");
        }
    }

    static void checkCount(Integer count) {
        if (count == null) {
            return;
        }
        if (count > FilterCompiler.MAX_COUNT) {
            throw new IllegalArgumentException("counts higher than " + FilterCompiler.MAX_COUNT + " are not supported");
        }
        if (count < 1) {
            throw new IllegalArgumentException("count must be at least 1");
        }
    }

    static String solutionOrDefault(String solutionName, String defaultSolutionName) {
        return isBlank(solutionName) ? defaultSolutionName : solutionName.trim();
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
