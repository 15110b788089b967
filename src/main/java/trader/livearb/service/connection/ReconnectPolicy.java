package trader.livearb.service.connection;

import lombok.Value;

import java.time.Duration;

/**
 * Exponential backoff: {@code delay(n) = min(baseDelay * 2^n, maxDelay)} for at most
 * {@code maxAttempts} reconnects in a row.
 */
@Value
public class ReconnectPolicy {
    Duration baseDelay;
    Duration maxDelay;
    int maxAttempts;

    public ReconnectPolicy(Duration baseDelay, Duration maxDelay, int maxAttempts) {
        if (baseDelay.isNegative() || baseDelay.isZero()) {
            throw new IllegalArgumentException("baseDelay must be positive: " + baseDelay);
        }
        if (maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("maxDelay " + maxDelay + " is below baseDelay " + baseDelay);
        }
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("maxAttempts must not be negative: " + maxAttempts);
        }
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
        this.maxAttempts = maxAttempts;
    }

    public boolean canRetry(int attemptsSoFar) {
        return attemptsSoFar < maxAttempts;
    }

    public Duration delayFor(int attemptsSoFar) {
        long max = maxDelay.toMillis();
        long delay = baseDelay.toMillis();
        for (int i = 0; i < attemptsSoFar && delay < max; i++) {
            delay *= 2;
        }
        return Duration.ofMillis(Math.min(delay, max));
    }
}
