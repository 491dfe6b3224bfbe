package org.tsticker.manager.internal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tsticker.manager.api.RemoteFailureException;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Issues remote calls strictly one after the other on a single worker thread, each under the rate limiter.
 */
public class RemoteCallExecutor implements AutoCloseable {

    private final static Logger logger = LoggerFactory.getLogger(RemoteCallExecutor.class);

    private final RateLimiter rateLimiter;
    private final int readRetries;
    private final ExecutorService executorService;

    public RemoteCallExecutor(final RateLimiter rateLimiter, final int readRetries) {
        this.rateLimiter = rateLimiter;
        this.readRetries = readRetries;
        this.executorService = Executors.newSingleThreadExecutor(r -> {
            final var thread = new Thread(r, "remote-call");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Runs a mutating call exactly once.
     */
    public <T> T execute(
            final String description, final RateLimiter.RemoteCall<T> call
    ) throws RemoteFailureException {
        logger.debug("Enqueuing remote call {}", description);
        final var future = executorService.submit(() -> rateLimiter.call(call));
        try {
            return future.get();
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new RemoteFailureException("Interrupted while waiting for " + description, e);
        } catch (ExecutionException e) {
            final var cause = e.getCause();
            if (cause instanceof RemoteFailureException remoteFailure) {
                throw remoteFailure;
            }
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new RemoteFailureException(description + " failed: " + cause.getMessage(), cause);
        }
    }

    /**
     * Runs an idempotent read, repeating it after a remote failure at most {@code readRetries} times.
     */
    public <T> T executeRead(
            final String description, final RateLimiter.RemoteCall<T> call
    ) throws RemoteFailureException {
        var attempt = 0;
        while (true) {
            try {
                return execute(description, call);
            } catch (RemoteFailureException e) {
                if (attempt >= readRetries || Thread.currentThread().isInterrupted()) {
                    throw e;
                }
                attempt++;
                logger.warn("{} failed, retrying ({}/{}): {}", description, attempt, readRetries, e.getMessage());
            }
        }
    }

    @Override
    public void close() {
        executorService.shutdown();
        try {
            if (!executorService.awaitTermination(1, TimeUnit.MINUTES)) {
                logger.warn("Remote calls still running after shutdown, interrupting");
                executorService.shutdownNow();
            }
        } catch (InterruptedException e) {
            executorService.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
