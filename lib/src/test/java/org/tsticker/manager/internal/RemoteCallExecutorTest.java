package org.tsticker.manager.internal;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.tsticker.manager.api.RemoteFailureException;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RemoteCallExecutorTest {

    private final RemoteCallExecutor executor = new RemoteCallExecutor(new RateLimiter(20, Duration.ZERO), 1);

    @AfterEach
    void tearDown() {
        executor.close();
    }

    @Test
    void runsCallsOnWorkerThread() throws Exception {
        final var caller = Thread.currentThread();
        final var worker = executor.execute("thread", Thread::currentThread);

        assertNotEquals(caller, worker);
        assertEquals(worker, executor.execute("thread", Thread::currentThread));
    }

    @Test
    void mutatingCallIsNotRepeated() {
        final var attempts = new AtomicInteger();

        final var e = assertThrows(RemoteFailureException.class, () -> executor.execute("delete", () -> {
            attempts.incrementAndGet();
            throw new RemoteFailureException("rejected");
        }));

        assertEquals("rejected", e.getMessage());
        assertEquals(1, attempts.get());
    }

    @Test
    void readIsRetriedOnce() throws Exception {
        final var attempts = new AtomicInteger();

        final var result = executor.executeRead("get", () -> {
            if (attempts.incrementAndGet() == 1) {
                throw new RemoteFailureException("timeout");
            }
            return "collection";
        });

        assertEquals("collection", result);
        assertEquals(2, attempts.get());
    }

    @Test
    void readFailsAfterRetries() {
        final var attempts = new AtomicInteger();

        assertThrows(RemoteFailureException.class, () -> executor.executeRead("get", () -> {
            attempts.incrementAndGet();
            throw new RemoteFailureException("timeout");
        }));
        assertEquals(2, attempts.get());
    }

    @Test
    void runtimeExceptionsPropagate() {
        assertThrows(IllegalStateException.class, () -> executor.execute("broken", () -> {
            throw new IllegalStateException("bug");
        }));
    }
}
