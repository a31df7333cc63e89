package com.sunny.conduit.job.core.strategy.retry;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    @Test
    void nextDelay_shouldGrowExponentiallyUntilAttemptsAreExhausted() {
        RetryPolicy policy = RetryPolicy.exponential(3, 100L);

        assertEquals(100L, policy.nextDelay(1));
        assertEquals(200L, policy.nextDelay(2));
        assertEquals(-1L, policy.nextDelay(3));
        assertFalse(policy.canRetry(3));
    }

    @Test
    void nextDelay_shouldBeCappedByMaxBackoff() {
        RetryPolicy policy = new RetryPolicy(20, 1_000L, 5_000L, BackoffStrategy.EXPONENTIAL);

        assertEquals(5_000L, policy.nextDelay(10));
    }

    @Test
    void exponential_shouldNotOverflowOnLargeAttempts() {
        assertEquals(Long.MAX_VALUE, BackoffStrategy.EXPONENTIAL.calculateDelay(80, 1_000L));
        assertEquals(0L, BackoffStrategy.EXPONENTIAL.calculateDelay(5, 0L));
    }

    @Test
    void of_shouldResolveConfiguredNames() {
        assertSame(BackoffStrategy.LINEAR, BackoffStrategy.of("linear"));
        assertSame(BackoffStrategy.EXPONENTIAL, BackoffStrategy.of(null));
        assertSame(BackoffStrategy.EXPONENTIAL_JITTER, BackoffStrategy.of("exponential-jitter"));
        assertThrows(IllegalArgumentException.class, () -> BackoffStrategy.of("random"));
    }

    @Test
    void withAttempts_shouldKeepStrategyAndCap() {
        RetryPolicy base = new RetryPolicy(3, 1_000L, 2_000L, BackoffStrategy.LINEAR);
        RetryPolicy derived = base.withAttempts(5, 700L);

        assertEquals(5, derived.maxAttempts());
        assertEquals(1_400L, derived.nextDelay(2));
        assertEquals(2_000L, derived.nextDelay(4));
    }
}
