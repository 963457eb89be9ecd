package io.swarmmesh.runtime;

import io.swarmmesh.error.SessionNotFoundException;
import io.swarmmesh.util.NamedThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * The single thread that writes a session's state. The periodic health loop and every mutation requested
 * by a caller run here, one after the other.
 */
final class SessionWorker {
    private static final Logger LOG = LoggerFactory.getLogger(SessionWorker.class);

    private final String sessionId;
    private final ScheduledExecutorService executor;
    private volatile Thread thread;
    private volatile ScheduledFuture<?> loop;

    SessionWorker(String sessionId) {
        this.sessionId = sessionId;
        NamedThreadFactory factory = new NamedThreadFactory("swarm-session-" + shortId(sessionId));
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = factory.newThread(r);
            thread = t;
            return t;
        });
    }

    void start(long intervalMs, Runnable cycle) {
        loop = executor.scheduleWithFixedDelay(cycle, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    boolean onWorkerThread() {
        return Thread.currentThread() == thread;
    }

    /**
     * Runs {@code task} on the worker and waits for it. Called from the worker itself it runs inline.
     */
    <T> T call(Callable<T> task) {
        if (onWorkerThread()) {
            return invoke(task);
        }
        Future<T> future;
        try {
            future = executor.submit(task);
        } catch (RejectedExecutionException e) {
            throw new SessionNotFoundException(sessionId);
        }
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new IllegalStateException("interrupted while waiting on session " + sessionId, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw new IllegalStateException("session " + sessionId + " task failed", cause);
        }
    }

    private static <T> T invoke(Callable<T> task) {
        try {
            return task.call();
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }

    void cancelLoop() {
        ScheduledFuture<?> current = loop;
        if (current != null) {
            current.cancel(false);
        }
    }

    void stop() {
        cancelLoop();
        executor.shutdown();
        if (onWorkerThread()) {
            return;
        }
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                LOG.warn("session {} worker did not stop in time, interrupting", sessionId);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }

    private static String shortId(String sessionId) {
        return sessionId.length() <= 12 ? sessionId : sessionId.substring(0, 12);
    }
}
