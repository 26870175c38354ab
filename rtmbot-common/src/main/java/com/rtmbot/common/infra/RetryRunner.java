package com.rtmbot.common.infra;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.Callable;
import java.util.function.BiPredicate;
import java.util.function.ToLongFunction;

/**
 * Retry executor with exponential backoff and server-provided retry hints.
 * <p>
 * Used around Web API calls and the connection handshake so that rate limits
 * and short network outages do not take the bot down.
 */
@Slf4j
public final class RetryRunner {

    /**
     * Retry configuration.
     *
     * @param attempts   maximum number of attempts (>= 1)
     * @param minDelayMs minimum delay between retries in ms
     * @param maxDelayMs maximum delay between retries in ms
     */
    public record Config(int attempts, long minDelayMs, long maxDelayMs) {

        public static final Config DEFAULT = new Config(5, 1000, 60_000);

        public Config {
            attempts = Math.max(1, attempts);
            minDelayMs = Math.max(0, minDelayMs);
            maxDelayMs = Math.max(minDelayMs, maxDelayMs);
        }
    }

    /**
     * Sleeps between attempts; replaced in tests.
     */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    private final Config config;
    private final BiPredicate<Throwable, Integer> shouldRetry;
    private final ToLongFunction<Throwable> retryAfterMs;
    private final Sleeper sleeper;

    public RetryRunner(Config config,
            BiPredicate<Throwable, Integer> shouldRetry,
            ToLongFunction<Throwable> retryAfterMs,
            Sleeper sleeper) {
        this.config = config != null ? config : Config.DEFAULT;
        this.shouldRetry = shouldRetry != null ? shouldRetry : (err, attempt) -> Failures.isTransient(err);
        this.retryAfterMs = retryAfterMs != null ? retryAfterMs : err -> -1;
        this.sleeper = sleeper != null ? sleeper : Thread::sleep;
    }

    public RetryRunner(Config config) {
        this(config, null, null, null);
    }

    /**
     * Execute the callable, retrying failures that {@code shouldRetry} accepts.
     *
     * @param fn    the operation to retry
     * @param label label for logging
     * @return the result of the first successful call
     * @throws Exception the last failure if all attempts fail or it is not retryable
     */
    public <T> T execute(Callable<T> fn, String label) throws Exception {
        for (int attempt = 1;; attempt++) {
            try {
                return fn.call();
            } catch (InterruptedException e) {
                throw e;
            } catch (Exception err) {
                if (attempt >= config.attempts() || !shouldRetry.test(err, attempt)) {
                    throw err;
                }
                long delay = delayFor(err, attempt);
                log.warn("{} failed (attempt {}/{}), retrying in {}ms: {}",
                        label, attempt, config.attempts(), delay, Failures.messageChain(err));
                sleeper.sleep(delay);
            }
        }
    }

    long delayFor(Throwable err, int attempt) {
        long hinted = retryAfterMs.applyAsLong(err);
        long base = hinted > 0
                ? Math.max(hinted, config.minDelayMs())
                : config.minDelayMs() * (1L << Math.min(attempt - 1, 20));
        return Math.min(base, config.maxDelayMs());
    }
}
