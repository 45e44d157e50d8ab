package com.optevents.follow;

import com.optevents.model.EventRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.OffsetDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.Future;

/**
 * A running (or finished) follow: the follower, its loop task and the batches not yet drained.
 */
public class FollowSession implements EventSink {
    private static final Logger log = LoggerFactory.getLogger(FollowSession.class);

    public enum Status {
        RUNNING,
        STOPPED
    }

    private final String followId;
    private final int maxPendingBatches;
    private final OffsetDateTime startedAt = OffsetDateTime.now();
    private final Deque<List<EventRow>> pending = new ArrayDeque<>();

    private volatile EventFollower follower;
    private volatile Future<?> loop;
    private volatile Status status = Status.RUNNING;
    private volatile String reason;
    private volatile boolean failed;

    public FollowSession(String followId, int maxPendingBatches) {
        this.followId = followId;
        this.maxPendingBatches = maxPendingBatches;
    }

    @Override
    public synchronized void accept(List<EventRow> batch) {
        if (pending.size() >= maxPendingBatches) {
            pending.removeFirst();
            log.warn("Dropping oldest undrained follow batch: follow_id={}, max_pending_batches={}", followId, maxPendingBatches);
        }
        pending.addLast(List.copyOf(batch));
    }

    /**
     * Removes and returns every batch emitted since the last drain, oldest first.
     *
     * @return batches
     */
    public synchronized List<List<EventRow>> drain() {
        List<List<EventRow>> out = new ArrayList<>(pending);
        pending.clear();
        return out;
    }

    void attach(EventFollower follower) {
        this.follower = follower;
    }

    void attachLoop(Future<?> loop) {
        this.loop = loop;
    }

    /**
     * Loop task of this follow; done once the follower has returned or failed.
     */
    public Future<?> getLoop() {
        return loop;
    }

    void markStopped(String reason, boolean failed) {
        this.reason = reason;
        this.failed = failed;
        this.status = Status.STOPPED;
    }

    void cancel() {
        EventFollower f = follower;
        if (f != null) {
            f.cancel();
        }
        if (status == Status.RUNNING) {
            markStopped("cancelled", false);
        }
    }

    public String getFollowId() {
        return followId;
    }

    public OffsetDateTime getStartedAt() {
        return startedAt;
    }

    public Status getStatus() {
        return status;
    }

    public String getReason() {
        return reason;
    }

    public boolean isFailed() {
        return failed;
    }
}
