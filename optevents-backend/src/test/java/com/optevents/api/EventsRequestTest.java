package com.optevents.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.optevents.model.FilterCriteria;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Request payload Tests")
class EventsRequestTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    @DisplayName("Should read snake case fields and build criteria")
    void testToCriteria() throws Exception {
        EventsRequest request = objectMapper.readValue(
                "{\"namespace\": \"payments\", \"workload_name\": \"api\", \"include_progress\": true, \"since\": \"-7d\"}",
                EventsRequest.class);

        FilterCriteria criteria = request.toCriteria("optimize");

        assertEquals("payments", criteria.getNamespace());
        assertEquals("api", criteria.getWorkloadName());
        assertTrue(criteria.isIncludeProgress());
        assertEquals("-7d", criteria.getSince());
        assertEquals("optimize", criteria.getSolutionName());
        assertFalse(criteria.isCapped());
    }

    @Test
    @DisplayName("Should prefer an explicit solution name")
    void testToCriteria_SolutionName() {
        EventsRequest request = new EventsRequest();
        request.setSolutionName(" optimize-dev ");

        assertEquals("optimize-dev", request.toCriteria("optimize").getSolutionName());
    }

    @Test
    @DisplayName("Should reject include_progress combined with events")
    void testToCriteria_ProgressWithEvents() {
        EventsRequest request = new EventsRequest();
        request.setIncludeProgress(true);
        request.setEvents(List.of("stage_started"));

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> request.toCriteria("optimize"));
        assertEquals("include_progress cannot be combined with events", ex.getMessage());
    }

    @ParameterizedTest
    @ValueSource(strings = {"cluster_id", "namespace", "workload_name"})
    @DisplayName("Should reject optimizer id combined with entity scoping")
    void testToCriteria_OptimizerIdConflicts(String field) throws Exception {
        EventsRequest request = objectMapper.readValue(
                "{\"optimizer_id\": \"x\", \"" + field + "\": \"y\"}", EventsRequest.class);

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> request.toCriteria("optimize"));
        assertEquals("optimizer_id cannot be combined with " + field, ex.getMessage());
    }

    @Test
    @DisplayName("Should default recommendations to the last year and a single result")
    void testRecommendationsDefaults() {
        FilterCriteria criteria = new RecommendationsRequest().toCriteria("optimize");

        assertEquals("-52w", criteria.getSince());
        assertEquals(1, criteria.getCount());
        assertFalse(criteria.isIncludeInvalidated());
    }

    @ParameterizedTest
    @ValueSource(ints = {0, -3, 1001})
    @DisplayName("Should reject counts outside 1..1000")
    void testRecommendations_BadCount(int count) {
        RecommendationsRequest request = new RecommendationsRequest();
        request.setCount(count);

        assertThrows(IllegalArgumentException.class, () -> request.toCriteria("optimize"));
    }
}
