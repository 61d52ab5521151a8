package com.optiondesk.broker;

import com.optiondesk.exception.GatewayException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Blocking waits on gateway futures for the synchronous service API. Runtime failures of the
 * future are rethrown as-is so callers see the original {@code BaseException}.
 */
public final class FutureAwaits {

    private FutureAwaits() {}

    /**
     * Waits up to {@code ceiling}; on timeout returns {@code onTimeout.get()} instead. The future
     * itself is left running.
     */
    public static <T> T await(CompletableFuture<T> future, Duration ceiling, Supplier<T> onTimeout) {
        try {
            return future.get(ceiling.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            return onTimeout.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GatewayException("Interrupted while waiting for the gateway", e);
        } catch (ExecutionException e) {
            throw unwrap(e.getCause());
        }
    }

    /** Strips the CompletionException wrapper dependent stages add around a failure. */
    public static Throwable unwrapCompletion(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }

    static RuntimeException unwrap(Throwable cause) {
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return new GatewayException("Gateway request failed: " + cause.getMessage(), cause);
    }
}
