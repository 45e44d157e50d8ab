package com.optevents.follow;

import com.optevents.client.DataSet;
import com.optevents.client.QueryClient;
import com.optevents.engine.Paginator;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Owns the running follows.
 *
 * <p>Each follow runs its loop on its own thread; polls run on a shared pool. Followers are
 * cancelled on {@link #stopFollow(String)} and when the application shuts down.
 */
@Component
public class FollowManager {
    private static final Logger log = LoggerFactory.getLogger(FollowManager.class);

    private final QueryClient queryClient;
    private final Paginator paginator;
    private final Duration defaultInterval;
    private final int maxPendingBatches;
    private final PollDelay pollDelay;

    private final ExecutorService loopExecutor = Executors.newCachedThreadPool();
    private final ExecutorService pollExecutor = Executors.newCachedThreadPool();
    private final Map<String, FollowSession> sessions = new ConcurrentHashMap<>();

    @Autowired
    public FollowManager(
            QueryClient queryClient,
            Paginator paginator,
            @Value("${optevents.follow.interval-sec:60}") long defaultIntervalSec,
            @Value("${optevents.follow.max-pending-batches:1000}") int maxPendingBatches
    ) {
        this(queryClient, paginator, Duration.ofSeconds(defaultIntervalSec), maxPendingBatches, PollDelay.LATCH);
    }

    FollowManager(QueryClient queryClient, Paginator paginator, Duration defaultInterval, int maxPendingBatches, PollDelay pollDelay) {
        this.queryClient = queryClient;
        this.paginator = paginator;
        this.defaultInterval = defaultInterval;
        this.maxPendingBatches = maxPendingBatches;
        this.pollDelay = pollDelay;
    }

    /**
     * Starts following from the last delivered page.
     *
     * @param start table of the last page already delivered
     * @param intervalSec poll interval in seconds, or {@code null} for the configured default
     * @return follow id
     */
    public String startFollow(DataSet start, Integer intervalSec) {
        if (start == null) {
            throw new IllegalArgumentException("nothing to follow: the query returned no page");
        }
        if (intervalSec != null && intervalSec <= 0) {
            throw new IllegalArgumentException("follow interval must be positive");
        }
        Duration interval = intervalSec != null ? Duration.ofSeconds(intervalSec) : defaultInterval;

        String followId = UUID.randomUUID().toString();
        FollowSession session = new FollowSession(followId, maxPendingBatches);
        EventFollower follower = new EventFollower(
                followId, queryClient, paginator, pollExecutor, interval, pollDelay, session);

        session.attach(follower);
        sessions.put(followId, session);
        Future<?> loop = loopExecutor.submit(() -> runLoop(session, follower, start));
        session.attachLoop(loop);
        log.info("Started follow: follow_id={}, interval={}", followId, interval);
        return followId;
    }

    private void runLoop(FollowSession session, EventFollower follower, DataSet start) {
        try {
            follower.run(start);
            session.markStopped("cancelled", false);
        } catch (RuntimeException | Error e) {
            log.error("Follow stopped on error: follow_id={}", session.getFollowId(), e);
            session.markStopped(e.getMessage() == null || e.getMessage().isBlank()
                    ? e.getClass().getSimpleName()
                    : e.getMessage(), true);
            if (e instanceof Error error) {
                throw error;
            }
        }
    }

    public FollowSession getSession(String followId) {
        FollowSession session = followId == null ? null : sessions.get(followId);
        if (session == null) {
            throw new FollowNotFoundException(followId);
        }
        return session;
    }

    /**
     * Delivers the cancellation signal and forgets the follow.
     *
     * @param followId follow id
     * @return the stopped session
     */
    public FollowSession stopFollow(String followId) {
        FollowSession session = sessions.remove(followId);
        if (session == null) {
            throw new FollowNotFoundException(followId);
        }
        session.cancel();
        log.info("Stopped follow: follow_id={}", followId);
        return session;
    }

    /**
     * Forgets a follow that stopped on an error. Running follows are kept.
     *
     * @param followId follow id
     * @return whether the follow was removed
     */
    public boolean evictFailed(String followId) {
        FollowSession session = sessions.get(followId);
        if (session == null || !session.isFailed()) {
            return false;
        }
        boolean removed = sessions.remove(followId, session);
        if (removed) {
            log.info("Evicted failed follow: follow_id={}, reason={}", followId, session.getReason());
        }
        return removed;
    }

    public List<String> listFollowIds() {
        return sessions.keySet().stream().sorted().toList();
    }

    @PreDestroy
    public void cleanup() {
        sessions.values().forEach(FollowSession::cancel);
        sessions.clear();
        loopExecutor.shutdown();
        pollExecutor.shutdownNow();
    }
}
