package com.optevents.follow;

import com.optevents.client.DataSet;
import com.optevents.client.QueryClient;
import com.optevents.client.QueryResponse;
import com.optevents.client.RemoteQueryException;
import com.optevents.engine.DataShapeException;
import com.optevents.engine.Paginator;
import com.optevents.model.EventRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Tails an events query through its {@code follow} link.
 *
 * <p>{@link #run(DataSet)} blocks the calling thread. Each poll runs as a background task on the
 * poll executor and hands its result to the mailbox; the calling thread takes from the mailbox
 * and only then dispatches the next poll, so at most one poll is in flight. A poll that returns
 * rows is followed immediately by the next one; a poll that returns nothing waits for the
 * interval first. {@link #cancel()} posts to the same mailbox and ends the loop without error;
 * a poll already running is not aborted, its result is just never read.
 */
public class EventFollower {
    private static final Logger log = LoggerFactory.getLogger(EventFollower.class);

    private static final String LABEL = "events";
    private static final String POSITION = "follow";

    private final String followId;
    private final QueryClient queryClient;
    private final Paginator paginator;
    private final Executor pollExecutor;
    private final Duration interval;
    private final PollDelay pollDelay;
    private final EventSink sink;

    private final BlockingQueue<Signal> mailbox = new LinkedBlockingQueue<>();
    private final CountDownLatch cancelled = new CountDownLatch(1);

    public EventFollower(
            String followId,
            QueryClient queryClient,
            Paginator paginator,
            Executor pollExecutor,
            Duration interval,
            PollDelay pollDelay,
            EventSink sink
    ) {
        this.followId = Objects.requireNonNull(followId, "followId");
        this.queryClient = Objects.requireNonNull(queryClient, "queryClient");
        this.paginator = Objects.requireNonNull(paginator, "paginator");
        this.pollExecutor = Objects.requireNonNull(pollExecutor, "pollExecutor");
        this.interval = Objects.requireNonNull(interval, "interval");
        this.pollDelay = Objects.requireNonNull(pollDelay, "pollDelay");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    /**
     * Polls until cancelled.
     *
     * @param start table of the last page already delivered
     * @throws RemoteQueryException if a poll fails
     * @throws DataShapeException if a poll returns data of the wrong shape
     * @throws IllegalStateException if a poll is interrupted without a cancel
     */
    public void run(DataSet start) {
        Objects.requireNonNull(start, "start");
        mailbox.add(Signal.result(PollResult.ready(start)));
        log.info("Following events: follow_id={}, interval={}", followId, interval);

        while (true) {
            Signal signal;
            try {
                signal = mailbox.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.info("Follow interrupted: follow_id={}", followId);
                return;
            }

            if (signal.cancel) {
                log.info("Follow cancelled: follow_id={}", followId);
                return;
            }

            PollResult result = signal.result;
            if (result.error instanceof Error error) {
                throw error;
            }
            if (result.error != null) {
                throw (RuntimeException) result.error;
            }
            pollExecutor.execute(() -> pollInBackground(result));
        }
    }

    /**
     * Requests the loop to stop. Safe to call from any thread, more than once.
     */
    public void cancel() {
        if (cancelled.getCount() == 0) {
            return;
        }
        cancelled.countDown();
        mailbox.add(Signal.CANCEL);
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    public String getFollowId() {
        return followId;
    }

    private void pollInBackground(PollResult previous) {
        PollResult next;
        try {
            if (previous.cursorExhausted) {
                pollDelay.await(interval, cancelled);
            }
            if (isCancelled()) {
                return;
            }
            next = poll(previous.cursor);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (isCancelled()) {
                return;
            }
            next = PollResult.failed(new IllegalStateException("follow poll of " + LABEL + " query was interrupted", e));
        } catch (RuntimeException | Error e) {
            next = PollResult.failed(e);
        }
        mailbox.add(Signal.result(next));
    }

    private PollResult poll(DataSet cursor) {
        if (!cursor.hasLink(DataSet.FOLLOW)) {
            throw new DataShapeException(String.format("%s dataset %s has no follow link", POSITION, cursor.getName()));
        }

        QueryResponse resp;
        try {
            resp = queryClient.continueQuery(cursor, DataSet.FOLLOW);
        } catch (RemoteQueryException e) {
            throw new RemoteQueryException("follow of " + LABEL + " query failed: " + e.getMessage(), e);
        }
        paginator.logPartialErrors(resp, LABEL, "Following");

        DataSet main = resp == null ? null : resp.getMain();
        if (main == null) {
            throw new DataShapeException("follow of " + LABEL + " query returned no main dataset");
        }

        Paginator.Page<EventRow> page = paginator.readEventPage(main, LABEL, POSITION, false);
        List<EventRow> rows = page.getRows();
        if (rows.isEmpty()) {
            return PollResult.exhausted(page.getCursor());
        }

        log.debug("Follow delivered {} new events: follow_id={}", rows.size(), followId);
        sink.accept(rows);
        return PollResult.ready(page.getCursor());
    }

    private static final class PollResult {
        private final DataSet cursor;
        private final boolean cursorExhausted;
        private final Throwable error;

        private PollResult(DataSet cursor, boolean cursorExhausted, Throwable error) {
            this.cursor = cursor;
            this.cursorExhausted = cursorExhausted;
            this.error = error;
        }

        static PollResult ready(DataSet cursor) {
            return new PollResult(cursor, false, null);
        }

        static PollResult exhausted(DataSet cursor) {
            return new PollResult(cursor, true, null);
        }

        static PollResult failed(Throwable error) {
            return new PollResult(null, false, error);
        }
    }

    private static final class Signal {
        static final Signal CANCEL = new Signal(true, null);

        private final boolean cancel;
        private final PollResult result;

        private Signal(boolean cancel, PollResult result) {
            this.cancel = cancel;
            this.result = result;
        }

        static Signal result(PollResult result) {
            return new Signal(false, result);
        }
    }
}
