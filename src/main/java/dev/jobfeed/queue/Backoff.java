package dev.jobfeed.queue;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with symmetric jitter: {@code min(base * 2^retry, cap) * (1 ± jitterRatio)}.
 */
public final class Backoff {

    private Backoff() {
    }

    public static Duration expJitter(int retryCount, long baseMillis, long capMillis, double jitterRatio) {
        double exp = baseMillis * Math.pow(2, Math.max(0, retryCount));
        long capped = (long) Math.min(exp, capMillis);
        double jitter = 1.0 + (ThreadLocalRandom.current().nextDouble() * 2 - 1) * jitterRatio;
        return Duration.ofMillis(Math.max(0, (long) (capped * jitter)));
    }

    public static Duration expJitter(int retryCount, Duration base, Duration cap, double jitterRatio) {
        return expJitter(retryCount, base.toMillis(), cap.toMillis(), jitterRatio);
    }
}
