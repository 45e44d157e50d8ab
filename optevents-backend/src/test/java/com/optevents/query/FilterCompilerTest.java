package com.optevents.query;

import com.optevents.model.FilterCriteria;
import com.optevents.model.QueryDocument;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FilterCompiler Tests")
class FilterCompilerTest {

    private final FilterCompiler compiler = new FilterCompiler();

    // ============================================================================
    // Predicates
    // ============================================================================

    @Test
    @DisplayName("Should join cluster and optimizer clauses with &&")
    void testCompileFilter_ClusterAndOptimizer() {
        FilterCriteria criteria = FilterCriteria.builder()
                .clusterId("c-1")
                .optimizerId("ns-wl-abc")
                .build();

        assertEquals("attributes(k8s.cluster.id) = \"c-1\" && attributes(optimize.optimization.optimizer_id) = \"ns-wl-abc\"",
                compiler.compileFilter(criteria, null));
    }

    @Test
    @DisplayName("Should use IN membership for resolved optimizer ids")
    void testCompileFilter_ResolvedIds() {
        FilterCriteria criteria = FilterCriteria.builder().namespace("payments").build();

        assertEquals("attributes(optimize.optimization.optimizer_id) IN [\"payments-api-111\", \"payments-db-222\"]",
                compiler.compileFilter(criteria, List.of("payments-api-111", "payments-db-222")));
    }

    @Test
    @DisplayName("Should ignore resolved ids when an optimizer id is given")
    void testCompileFilter_OptimizerIdWins() {
        FilterCriteria criteria = FilterCriteria.builder().optimizerId("x").namespace("payments").build();

        assertEquals("attributes(optimize.optimization.optimizer_id) = \"x\"",
                compiler.compileFilter(criteria, List.of("ignored")));
    }

    @Test
    @DisplayName("Should produce an empty filter when nothing scopes the query")
    void testCompileFilter_Empty() {
        assertEquals("", compiler.compileFilter(FilterCriteria.builder().build(), null));
    }

    @Test
    @DisplayName("Should escape quotes and backslashes in values")
    void testQuote() {
        assertEquals("\"a\\\"b\\\\c\"", FilterCompiler.quote("a\"b\\c"));
    }

    @Test
    @DisplayName("Should escape control characters in values")
    void testQuote_ControlCharacters() {
        assertEquals("\"line1\\nline2\\r\\tend\"", FilterCompiler.quote("line1\nline2\r\tend"));
    }

    // ============================================================================
    // Rendering
    // ============================================================================

    @Test
    @DisplayName("Should render the events query with every optional clause")
    void testEventsQuery_Full() {
        FilterCriteria criteria = FilterCriteria.builder()
                .since("-7d")
                .until("2023-07-31")
                .events(List.of("stage_started", "stage_ended"))
                .count(5)
                .build();

        QueryDocument doc = compiler.eventsQuery(criteria, "attributes(k8s.cluster.id) = \"c1\"");

        String expected = "\n"
                + "SINCE -7d\n"
                + "UNTIL 2023-07-31\n"
                + "FETCH events(\n"
                + "\t\toptimize:stage_started,\n"
                + "\t\toptimize:stage_ended\n"
                + "\t)\n"
                + "\t[attributes(k8s.cluster.id) = \"c1\"]\n"
                + "\t{attributes, timestamp}\n"
                + "LIMITS events.count(5)\n"
                + "ORDER events.asc()\n";
        assertEquals(expected, doc.getText());
        assertEquals("events", doc.getLabel());
    }

    @Test
    @DisplayName("Should omit absent clauses")
    void testEventsQuery_Minimal() {
        FilterCriteria criteria = FilterCriteria.builder()
                .events(List.of("optimization_started"))
                .solutionName("dev")
                .build();

        String expected = "\n"
                + "FETCH events(\n"
                + "\t\tdev:optimization_started\n"
                + "\t)\n"
                + "\t{attributes, timestamp}\n"
                + "ORDER events.asc()\n";
        assertEquals(expected, compiler.eventsQuery(criteria, "").getText());
    }

    @Test
    @DisplayName("Should render identical text for identical criteria")
    void testEventsQuery_Deterministic() {
        FilterCriteria a = FilterCriteria.builder().since("-1h").clusterId("c").includeProgress(true).build();
        FilterCriteria b = a.toBuilder().build();

        QueryDocument first = compiler.eventsQuery(a, compiler.compileFilter(a, null));
        QueryDocument second = compiler.eventsQuery(b, compiler.compileFilter(b, null));

        assertEquals(first.getText(), second.getText());
        assertEquals(first, second);
    }

    @Test
    @DisplayName("Should use the default event order and append progress events")
    void testQualifiedEvents_DefaultsWithProgress() {
        List<String> events = compiler.qualifiedEvents(FilterCriteria.builder().includeProgress(true).build());

        assertEquals(EventTypes.DEFAULT_EVENTS.size() + EventTypes.PROGRESS_EVENTS.size(), events.size());
        assertEquals("optimize:optimization_baselined", events.get(0));
        assertEquals("optimize:recommendation_invalidated", events.get(EventTypes.DEFAULT_EVENTS.size() - 1));
        assertEquals("optimize:experiment_progress", events.get(events.size() - 1));
    }

    @Test
    @DisplayName("Should keep the caller's event order")
    void testQualifiedEvents_CallerOrder() {
        List<String> events = compiler.qualifiedEvents(FilterCriteria.builder()
                .events(List.of("stage_ended", "experiment_started", "stage_started"))
                .build());

        assertEquals(List.of("optimize:stage_ended", "optimize:experiment_started", "optimize:stage_started"), events);
    }

    @Test
    @DisplayName("Should fetch only verified recommendations by default")
    void testRecommendationsQuery_VerifiedOnly() {
        FilterCriteria criteria = FilterCriteria.builder().since("-52w").count(1).build();

        String expected = "\n"
                + "SINCE -52w\n"
                + "FETCH events(\n"
                + "\t\toptimize:recommendation_verified\n"
                + "\t)\n"
                + "\t{attributes, timestamp}\n"
                + "LIMITS events.count(1)\n"
                + "ORDER events.asc()\n";
        assertEquals(expected, compiler.recommendationsQuery(criteria, "").getText());
    }

    @Test
    @DisplayName("Should include identified and invalidated recommendations on request")
    void testRecommendationsQuery_IncludeInvalidated() {
        FilterCriteria criteria = FilterCriteria.builder().includeInvalidated(true).build();

        String text = compiler.recommendationsQuery(criteria, "").getText();
        assertTrue(text.contains("FETCH events(\n"
                + "\t\toptimize:recommendation_identified,\n"
                + "\t\toptimize:recommendation_invalidated,\n"
                + "\t\toptimize:recommendation_verified\n"
                + "\t)"));
    }

    @Test
    @DisplayName("Should never cap the optimization started query")
    void testOptimizationStartedQuery() {
        FilterCriteria criteria = FilterCriteria.builder().since("-52w").count(1).build();

        String expected = "\n"
                + "SINCE -52w\n"
                + "FETCH events(\n"
                + "\t\toptimize:optimization_started\n"
                + "\t)\n"
                + "\t[attributes(optimize.optimization.optimizer_id) = \"a\"]\n"
                + "\t{attributes, timestamp}\n"
                + "ORDER events.asc()\n";
        assertEquals(expected, compiler.optimizationStartedQuery(criteria,
                "attributes(optimize.optimization.optimizer_id) = \"a\"").getText());
    }

    @Test
    @DisplayName("Should render the entity lookup with namespace, workload and cluster")
    void testEntityLookupQuery() {
        FilterCriteria criteria = FilterCriteria.builder()
                .since("-7d")
                .namespace("payments")
                .workloadName("api")
                .clusterId("c1")
                .build();

        String expected = "\n"
                + "SINCE -7d\n"
                + "FETCH attributes(optimize.optimization.optimizer_id)\n"
                + "FROM entities(optimize:optimization)[attributes(\"k8s.namespace.name\") = \"payments\""
                + " && attributes(\"k8s.workload.name\") = \"api\""
                + " && attributes(\"k8s.cluster.id\") = \"c1\"]\n";
        assertEquals(expected, compiler.entityLookupQuery(criteria).getText());
    }

    @Test
    @DisplayName("Should reject an entity lookup without namespace or workload")
    void testEntityLookupQuery_NoScope() {
        FilterCriteria criteria = FilterCriteria.builder().clusterId("c1").build();

        assertThrows(IllegalArgumentException.class, () -> compiler.entityLookupQuery(criteria));
    }

    // ============================================================================
    // Result cap
    // ============================================================================

    @ParameterizedTest
    @ValueSource(ints = {1001, 5000, Integer.MAX_VALUE})
    @DisplayName("Should reject counts above 1000")
    void testValidate_CountTooHigh(int count) {
        FilterCriteria criteria = FilterCriteria.builder().count(count).build();

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> compiler.validate(criteria));
        assertTrue(ex.getMessage().contains("higher than 1000"));
        assertThrows(IllegalArgumentException.class, () -> compiler.eventsQuery(criteria, ""));
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 500, 1000})
    @DisplayName("Should accept counts up to 1000")
    void testValidate_CountAccepted(int count) {
        assertDoesNotThrow(() -> compiler.validate(FilterCriteria.builder().count(count).build()));
    }

    @Test
    @DisplayName("Should reject non-positive counts")
    void testValidate_CountZero() {
        assertThrows(IllegalArgumentException.class, () -> compiler.validate(FilterCriteria.builder().count(0).build()));
    }
}
