package com.auditq.internal;

import com.auditq.config.AuditQProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff: attempt {@code n} (0-based retry count) waits {@code 2^n * baseDelay}, capped at
 * {@code maxDelay}. Once {@code retryCount} reaches {@code maxRetries} the job fails for good.
 */
@Component
public class RetryPolicy {

    private final Duration baseDelay;
    private final Duration maxDelay;
    private final double jitterRatio;
    private final DoubleSupplier random;

    @Autowired
    public RetryPolicy(AuditQProperties properties) {
        this(properties.getRetry().getBaseDelay(), properties.getRetry().getMaxDelay(),
                properties.getRetry().getJitterRatio(), () -> ThreadLocalRandom.current().nextDouble());
    }

    RetryPolicy(Duration baseDelay, Duration maxDelay, double jitterRatio, DoubleSupplier random) {
        if (baseDelay == null || baseDelay.isNegative()) {
            throw new IllegalArgumentException("auditq.retry.base-delay must be >= 0");
        }
        if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("auditq.retry.max-delay must be >= base-delay");
        }
        if (jitterRatio < 0.0 || jitterRatio >= 1.0) {
            throw new IllegalArgumentException("auditq.retry.jitter-ratio must be in [0, 1)");
        }
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
        this.jitterRatio = jitterRatio;
        this.random = random;
    }

    public static RetryPolicy withoutJitter(Duration baseDelay, Duration maxDelay) {
        return new RetryPolicy(baseDelay, maxDelay, 0.0, () -> 0.5);
    }

    public RetryDecision decide(int retryCount, int maxRetries) {
        if (retryCount < 0) {
            throw new IllegalArgumentException("retryCount must be >= 0");
        }
        if (retryCount >= maxRetries) {
            return RetryDecision.fail();
        }
        return RetryDecision.retry(applyJitter(backoff(retryCount)));
    }

    Duration backoff(int retryCount) {
        if (retryCount >= Long.SIZE - 2) {
            return maxDelay;
        }
        try {
            Duration delay = baseDelay.multipliedBy(1L << retryCount);
            return delay.compareTo(maxDelay) > 0 ? maxDelay : delay;
        } catch (ArithmeticException overflow) {
            return maxDelay;
        }
    }

    private Duration applyJitter(Duration delay) {
        if (jitterRatio == 0.0) {
            return delay;
        }
        double factor = 1.0 - jitterRatio + (2.0 * jitterRatio * random.getAsDouble());
        return Duration.ofMillis(Math.round(delay.toMillis() * factor));
    }

    public sealed interface RetryDecision permits RetryDecision.Retry, RetryDecision.Fail {

        static RetryDecision retry(Duration delay) {
            return new Retry(delay);
        }

        static RetryDecision fail() {
            return Fail.INSTANCE;
        }

        record Retry(Duration delay) implements RetryDecision {
        }

        final class Fail implements RetryDecision {
            private static final Fail INSTANCE = new Fail();

            private Fail() {
            }

            @Override
            public String toString() {
                return "Fail";
            }
        }
    }
}
