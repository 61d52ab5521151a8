package com.optiondesk.broker;

import com.optiondesk.domain.enums.PendingOutcome;
import com.optiondesk.domain.enums.RequestCategory;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;

/** One in-flight request owned by the {@link RequestCorrelator}. */
public class PendingRequest {

    private final int id;
    private final RequestCategory category;
    private final Instant createdAt;
    private final RequestHandler handler;
    private final CompletableFuture<PendingOutcome> completion = new CompletableFuture<>();
    private volatile ScheduledFuture<?> timeoutTask;

    PendingRequest(int id, RequestCategory category, Instant createdAt, RequestHandler handler) {
        this.id = id;
        this.category = category;
        this.createdAt = createdAt;
        this.handler = handler;
    }

    public int getId() {
        return id;
    }

    public RequestCategory getCategory() {
        return category;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    RequestHandler getHandler() {
        return handler;
    }

    /** Completes exactly once, with COMPLETED or TIMED_OUT. */
    public CompletableFuture<PendingOutcome> getCompletion() {
        return completion;
    }

    void setTimeoutTask(ScheduledFuture<?> timeoutTask) {
        this.timeoutTask = timeoutTask;
    }

    void cancelTimeout() {
        ScheduledFuture<?> task = timeoutTask;
        if (task != null) {
            task.cancel(false);
        }
    }
}
