package com.rtmbot.common.infra;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RetryRunnerTest {

    private final List<Long> sleeps = new ArrayList<>();

    private RetryRunner runner(int attempts, long retryAfter) {
        return new RetryRunner(new RetryRunner.Config(attempts, 100, 1000),
                null, err -> retryAfter, sleeps::add);
    }

    @Test
    void execute_successFirstTime_noSleep() throws Exception {
        assertEquals("ok", runner(3, -1).execute(() -> "ok", "op"));
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void execute_transientThenSuccess_retriesWithBackoff() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        String result = runner(5, -1).execute(() -> {
            if (calls.incrementAndGet() < 3) {
                throw new IOException("connection reset");
            }
            return "done";
        }, "op");

        assertEquals("done", result);
        assertEquals(3, calls.get());
        assertEquals(List.of(100L, 200L), sleeps);
    }

    @Test
    void execute_nonTransient_throwsImmediately() {
        AtomicInteger calls = new AtomicInteger();
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> runner(5, -1).execute(() -> {
            calls.incrementAndGet();
            throw new IllegalStateException("bug");
        }, "op"));

        assertEquals("bug", e.getMessage());
        assertEquals(1, calls.get());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void execute_exhaustsAttempts_throwsLast() {
        AtomicInteger calls = new AtomicInteger();
        assertThrows(IOException.class, () -> runner(3, -1).execute(() -> {
            calls.incrementAndGet();
            throw new IOException("timeout");
        }, "op"));
        assertEquals(3, calls.get());
        assertEquals(2, sleeps.size());
    }

    @Test
    void delayFor_honoursRetryAfterHint() {
        assertEquals(500, runner(3, 500).delayFor(new IOException("429"), 1));
        assertEquals(100, runner(3, 10).delayFor(new IOException("429"), 1));
        assertEquals(1000, runner(3, 5000).delayFor(new IOException("429"), 1));
    }

    @Test
    void delayFor_exponentialCappedAtMax() {
        RetryRunner runner = runner(10, -1);
        assertEquals(100, runner.delayFor(new IOException(), 1));
        assertEquals(400, runner.delayFor(new IOException(), 3));
        assertEquals(1000, runner.delayFor(new IOException(), 8));
    }
}
