package com.sretoolbox.support;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Random;
import java.util.function.Supplier;

/**
 * Bounded exponential backoff with +/-20% jitter.
 * Only the given exception type is retried; anything else propagates on the first throw.
 */
@Slf4j
public class Backoff {

    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    private final int maxAttempts;
    private final long baseMs;
    private final long maxDelayMs;
    private final Sleeper sleeper;
    private final Random rand = new Random();

    public Backoff(int maxAttempts, Duration base, Duration maxDelay) {
        this(maxAttempts, base, maxDelay, Thread::sleep);
    }

    public Backoff(int maxAttempts, Duration base, Duration maxDelay, Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        this.maxAttempts = maxAttempts;
        this.baseMs = base.toMillis();
        this.maxDelayMs = maxDelay.toMillis();
        this.sleeper = sleeper;
    }

    public static Backoff none() {
        return new Backoff(1, Duration.ZERO, Duration.ZERO);
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /** Delay before retry number {@code attempt} (0-based), jitter excluded. */
    public long baseDelayMillis(int attempt) {
        return Math.min(maxDelayMs, (long) (baseMs * Math.pow(2, attempt)));
    }

    public <T, E extends RuntimeException> T call(String what, Class<E> retryOn, Supplier<T> action) {
        RuntimeException last = null;
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            try {
                return action.get();
            } catch (RuntimeException e) {
                if (!retryOn.isInstance(e)) {
                    throw e;
                }
                last = e;
                if (attempt + 1 >= maxAttempts) {
                    break;
                }
                long delay = (long) (baseDelayMillis(attempt) * (0.8 + rand.nextDouble() * 0.4));
                log.warn("{} failed (attempt {}/{}), retrying in {} ms: {}", what, attempt + 1, maxAttempts, delay,
                        e.getMessage());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }
        throw last;
    }

    public <E extends RuntimeException> void run(String what, Class<E> retryOn, Runnable action) {
        call(what, retryOn, () -> {
            action.run();
            return null;
        });
    }
}
