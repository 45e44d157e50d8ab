package com.optevents.controller;

import com.optevents.api.EventsRequest;
import com.optevents.api.EventsResponse;
import com.optevents.api.ErrorResponse;
import com.optevents.api.FollowEventsResponse;
import com.optevents.api.FollowStatusResponse;
import com.optevents.api.RecommendationsRequest;
import com.optevents.api.RecommendationsResponse;
import com.optevents.engine.EventsResult;
import com.optevents.engine.EventsService;
import com.optevents.engine.RecommendationsResult;
import com.optevents.engine.RecommendationsService;
import com.optevents.follow.FollowManager;
import com.optevents.follow.FollowSession;
import com.optevents.model.EventRow;
import com.optevents.model.FilterCriteria;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/v1")
public class OptEventsController {

    private static final Logger log = LoggerFactory.getLogger(OptEventsController.class);

    private final EventsService eventsService;
    private final RecommendationsService recommendationsService;
    private final FollowManager followManager;

    @Value("${optevents.solution-name:" + FilterCriteria.DEFAULT_SOLUTION_NAME + "}")
    private String solutionName = FilterCriteria.DEFAULT_SOLUTION_NAME;

    public OptEventsController(
            EventsService eventsService,
            RecommendationsService recommendationsService,
            FollowManager followManager
    ) {
        this.eventsService = eventsService;
        this.recommendationsService = recommendationsService;
        this.followManager = followManager;
    }

    /**
     * Retrieve event logs for an optimization or workload.
     *
     * POST /v1/events
     *
     * <p>With {@code follow} set, the response also carries a {@code follow_id}; new events are
     * then read from {@code /v1/follows/{follow_id}/events}.
     *
     * @param request filters
     * @return events and total
     */
    @PostMapping("/events")
    public ResponseEntity<EventsResponse> listEvents(@Valid @RequestBody EventsRequest request) {
        FilterCriteria criteria = request.toCriteria(solutionName);
        EventsResult result = eventsService.listEvents(criteria, request.isFollow());

        String followId = null;
        if (request.isFollow() && result.getLastCursor() != null) {
            followId = followManager.startFollow(result.getLastCursor(), request.getFollowIntervalSec());
        }
        log.info("Events request served: total={}, follow_id={}, trace_id={}", result.getTotal(), followId, MDC.get("trace_id"));

        return ResponseEntity.ok(EventsResponse.builder()
                .items(result.getItems())
                .total(result.getTotal())
                .status(result.getStatus())
                .followId(followId)
                .build());
    }

    /**
     * Retrieve recommendations with their ignored blockers.
     *
     * POST /v1/recommendations
     */
    @PostMapping("/recommendations")
    public ResponseEntity<RecommendationsResponse> listRecommendations(@Valid @RequestBody RecommendationsRequest request) {
        RecommendationsResult result = recommendationsService.listRecommendations(request.toCriteria(solutionName));
        return ResponseEntity.ok(RecommendationsResponse.builder()
                .items(result.getItems())
                .total(result.getTotal())
                .status(result.getStatus())
                .build());
    }

    @GetMapping("/follows")
    public ResponseEntity<?> listFollows() {
        return ResponseEntity.ok(Map.of("follows", followManager.listFollowIds()));
    }

    @GetMapping("/follows/{follow_id}")
    public ResponseEntity<FollowStatusResponse> getFollowStatus(@PathVariable("follow_id") String followId) {
        return ResponseEntity.ok(toStatus(followManager.getSession(followId)));
    }

    /**
     * Drain the batches emitted since the previous call. A follow that failed answers 409 once
     * nothing is left to drain, and is forgotten.
     *
     * GET /v1/follows/{follow_id}/events
     */
    @GetMapping("/follows/{follow_id}/events")
    public ResponseEntity<?> drainFollow(@PathVariable("follow_id") String followId) {
        FollowSession session = followManager.getSession(followId);
        List<List<EventRow>> drained = session.drain();

        if (drained.isEmpty() && session.isFailed()) {
            followManager.evictFailed(followId);
            return ResponseEntity.status(409).body(ErrorResponse.builder()
                    .code("FOLLOW_STOPPED")
                    .message("Follow stopped: " + session.getReason())
                    .traceId(MDC.get("trace_id"))
                    .build());
        }

        List<EventsResponse> batches = new ArrayList<>(drained.size());
        for (List<EventRow> batch : drained) {
            batches.add(EventsResponse.builder().items(batch).total(batch.size()).build());
        }
        return ResponseEntity.ok(FollowEventsResponse.builder()
                .followId(followId)
                .status(session.getStatus().name())
                .batches(batches)
                .build());
    }

    @DeleteMapping("/follows/{follow_id}")
    public ResponseEntity<FollowStatusResponse> stopFollow(@PathVariable("follow_id") String followId) {
        return ResponseEntity.ok(toStatus(followManager.stopFollow(followId)));
    }

    private static FollowStatusResponse toStatus(FollowSession session) {
        return FollowStatusResponse.builder()
                .followId(session.getFollowId())
                .status(session.getStatus().name())
                .reason(session.getReason() == null ? "" : session.getReason())
                .startedAt(session.getStartedAt())
                .build();
    }
}
