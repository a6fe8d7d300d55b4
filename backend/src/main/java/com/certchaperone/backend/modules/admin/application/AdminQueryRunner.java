package com.certchaperone.backend.modules.admin.application;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

import com.certchaperone.backend.global.config.ExecutionConfig;
import com.certchaperone.backend.global.error.ErrorCode;
import com.certchaperone.backend.global.error.ProblemException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Component;

/**
 * Runs admin reads on the bounded query pool and waits for them no longer than the request's
 * deadline. Work still outstanding at the deadline is cancelled.
 */
@Component
public class AdminQueryRunner {

    private static final Logger log = LoggerFactory.getLogger(AdminQueryRunner.class);

    private final TaskExecutor executor;
    private final Clock clock;

    public AdminQueryRunner(@Qualifier(ExecutionConfig.ADMIN_QUERY_EXECUTOR) TaskExecutor executor, Clock clock) {
        this.executor = executor;
        this.clock = clock;
    }

    /**
     * Queues the task on the query pool. Cancelling the returned future with {@code cancel(true)}
     * keeps a queued task from starting and interrupts one that is already running.
     */
    public <T> Future<T> submit(Supplier<T> task) {
        FutureTask<T> future = new FutureTask<>(task::get);
        executor.execute(future);
        return future;
    }

    /**
     * Blocks until every future completes or the deadline passes. Outstanding work is cancelled
     * before this method throws.
     *
     * @throws ProblemException {@link ErrorCode#DEADLINE_EXCEEDED} when the deadline passes first
     */
    public void awaitAll(List<? extends Future<?>> futures, AdminRequestContext context) {
        try {
            for (Future<?> future : futures) {
                Duration remaining = context.remaining(clock);
                if (remaining.isZero()) {
                    throw new TimeoutException();
                }
                future.get(remaining.toNanos(), TimeUnit.NANOSECONDS);
            }
        } catch (TimeoutException ex) {
            long outstanding = futures.stream().filter(future -> !future.isDone()).count();
            cancelAll(futures);
            log.warn("Deadline exceeded with {} concurrent queries outstanding", outstanding);
            throw new ProblemException(ErrorCode.DEADLINE_EXCEEDED, "Request deadline exceeded");
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            cancelAll(futures);
            throw new ProblemException(ErrorCode.INTERNAL_ERROR, "Request interrupted", null, ex);
        } catch (ExecutionException ex) {
            cancelAll(futures);
            throw rethrow(ex.getCause());
        }
    }

    /**
     * Returns the value of a future that {@link #awaitAll} has already seen complete.
     */
    public <T> T join(Future<T> future) {
        try {
            return future.get();
        } catch (ExecutionException ex) {
            throw rethrow(ex.getCause());
        } catch (CancellationException ex) {
            throw new ProblemException(ErrorCode.DEADLINE_EXCEEDED, "Request deadline exceeded");
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new ProblemException(ErrorCode.INTERNAL_ERROR, "Request interrupted", null, ex);
        }
    }

    private static void cancelAll(List<? extends Future<?>> futures) {
        futures.forEach(future -> future.cancel(true));
    }

    private RuntimeException rethrow(Throwable cause) {
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        return new ProblemException(ErrorCode.INTERNAL_ERROR, "Internal server error", null, cause);
    }
}
