package org.tsticker.manager.internal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tsticker.manager.api.RemoteFailureException;

import java.time.Duration;
import java.util.concurrent.Semaphore;

/**
 * Caps the number of remote calls in flight and keeps each slot idle for a minimum interval after its call
 * finished, so at most {@code maxConcurrent} calls are started per interval.
 */
public class RateLimiter {

    private final static Logger logger = LoggerFactory.getLogger(RateLimiter.class);

    private final Semaphore semaphore;
    private final Duration minInterval;
    private final Sleeper sleeper;

    public RateLimiter(final int maxConcurrent, final Duration minInterval) {
        this(maxConcurrent, minInterval, d -> Thread.sleep(d.toMillis()));
    }

    public RateLimiter(final int maxConcurrent, final Duration minInterval, final Sleeper sleeper) {
        if (maxConcurrent < 1) {
            throw new IllegalArgumentException("maxConcurrent must be positive");
        }
        this.semaphore = new Semaphore(maxConcurrent, true);
        this.minInterval = minInterval;
        this.sleeper = sleeper;
    }

    public Permit acquire() throws RemoteFailureException {
        try {
            semaphore.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RemoteFailureException("Interrupted while waiting for a request slot", e);
        }
        return new Permit();
    }

    public <T> T call(final RemoteCall<T> call) throws RemoteFailureException {
        try (var ignored = acquire()) {
            return call.call();
        }
    }

    public int availablePermits() {
        return semaphore.availablePermits();
    }

    public final class Permit implements AutoCloseable {

        private boolean released;

        private Permit() {
        }

        /**
         * Holds the slot for the minimum interval, then returns it.
         */
        @Override
        public void close() {
            if (released) {
                return;
            }
            released = true;
            try {
                if (!minInterval.isZero()) {
                    sleeper.sleep(minInterval);
                }
            } catch (InterruptedException e) {
                logger.debug("Interrupted while holding request slot");
                Thread.currentThread().interrupt();
            } finally {
                semaphore.release();
            }
        }
    }

    @FunctionalInterface
    public interface RemoteCall<T> {

        T call() throws RemoteFailureException;
    }

    @FunctionalInterface
    public interface Sleeper {

        void sleep(Duration duration) throws InterruptedException;
    }
}
