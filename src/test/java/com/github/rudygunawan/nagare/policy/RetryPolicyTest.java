package com.github.rudygunawan.nagare.policy;

import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    @Test
    void testLinearDelays() {
        RetryPolicy policy = RetryPolicy.linear(3, 1, TimeUnit.SECONDS);

        assertEquals(3, policy.retries());
        assertEquals(4, policy.maxAttempts());
        assertEquals(1000, policy.delayAfterAttempt(0));
        assertEquals(1000, policy.delayAfterAttempt(2));
        assertFalse(policy.isExponential());
    }

    @Test
    void testExponentialDelays() {
        RetryPolicy policy = RetryPolicy.exponential(3, 1000, TimeUnit.MILLISECONDS);

        assertEquals(1000, policy.delayAfterAttempt(0));
        assertEquals(2000, policy.delayAfterAttempt(1));
        assertEquals(4000, policy.delayAfterAttempt(2));
        assertEquals(Long.MAX_VALUE, policy.delayAfterAttempt(200));
    }

    @Test
    void testNone() {
        RetryPolicy none = RetryPolicy.none();

        assertEquals(0, none.retries());
        assertEquals(1, none.maxAttempts());
        assertEquals(RetryPolicy.of(0, 0, TimeUnit.MILLISECONDS, false), none);
    }

    @Test
    void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.linear(-1, 1, TimeUnit.SECONDS));
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.exponential(1, -1, TimeUnit.SECONDS));
    }
}
