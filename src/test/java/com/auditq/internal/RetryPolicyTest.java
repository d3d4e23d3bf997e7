package com.auditq.internal;

import com.auditq.config.AuditQProperties;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryPolicyTest {

    private final RetryPolicy policy = RetryPolicy.withoutJitter(Duration.ofMinutes(5), Duration.ofHours(24));

    @Test
    void shouldDoubleDelayWithEachRetry() {
        assertThat(delayFor(0, 3)).isEqualTo(Duration.ofMinutes(5));
        assertThat(delayFor(1, 3)).isEqualTo(Duration.ofMinutes(10));
        assertThat(delayFor(2, 3)).isEqualTo(Duration.ofMinutes(20));
    }

    @Test
    void shouldFailOnceRetriesAreExhausted() {
        assertThat(policy.decide(3, 3)).isInstanceOf(RetryPolicy.RetryDecision.Fail.class);
        assertThat(policy.decide(5, 3)).isInstanceOf(RetryPolicy.RetryDecision.Fail.class);
    }

    @Test
    void shouldFailImmediatelyWhenNoRetriesAllowed() {
        assertThat(policy.decide(0, 0)).isSameAs(RetryPolicy.RetryDecision.fail());
    }

    @Test
    void shouldCapDelayAtMaximum() {
        assertThat(policy.backoff(9)).isEqualTo(Duration.ofHours(24));
        assertThat(policy.backoff(200)).isEqualTo(Duration.ofHours(24));
        assertThat(delayFor(40, 100)).isEqualTo(Duration.ofHours(24));
    }

    @Test
    void shouldApplyJitterWithinRatio() {
        RetryPolicy low = new RetryPolicy(Duration.ofMinutes(10), Duration.ofHours(1), 0.2, () -> 0.0);
        RetryPolicy high = new RetryPolicy(Duration.ofMinutes(10), Duration.ofHours(1), 0.2, () -> 1.0);

        assertThat(((RetryPolicy.RetryDecision.Retry) low.decide(0, 3)).delay()).isEqualTo(Duration.ofMinutes(8));
        assertThat(((RetryPolicy.RetryDecision.Retry) high.decide(0, 3)).delay()).isEqualTo(Duration.ofMinutes(12));
    }

    @Test
    void shouldUseConfiguredDelays() {
        AuditQProperties properties = new AuditQProperties();
        properties.getRetry().setBaseDelay(Duration.ofSeconds(30));
        RetryPolicy configured = new RetryPolicy(properties);

        assertThat(((RetryPolicy.RetryDecision.Retry) configured.decide(2, 3)).delay())
                .isEqualTo(Duration.ofMinutes(2));
    }

    @Test
    void shouldRejectInvalidConfiguration() {
        assertThatThrownBy(() -> new RetryPolicy(Duration.ofMinutes(5), Duration.ofMinutes(1), 0.0, () -> 0.5))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RetryPolicy(Duration.ofMinutes(5), Duration.ofHours(1), 1.5, () -> 0.5))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> policy.decide(-1, 3)).isInstanceOf(IllegalArgumentException.class);
    }

    private Duration delayFor(int retryCount, int maxRetries) {
        RetryPolicy.RetryDecision decision = policy.decide(retryCount, maxRetries);
        assertThat(decision).isInstanceOf(RetryPolicy.RetryDecision.Retry.class);
        return ((RetryPolicy.RetryDecision.Retry) decision).delay();
    }
}
