package kds.domain.queue;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for ExponentialBackoffRetryPolicy
 * @since 14/10/2026
 */
class ExponentialBackoffRetryPolicyTest {

    @Test
    @DisplayName("Delay should double per attempt up to the cap")
    void shouldDoubleUpToCap() {
        // Given
        RetryPolicy policy = new ExponentialBackoffRetryPolicy(30_000, 300_000, false);

        // When & Then
        assertThat(policy.computeDelayMs(1)).isEqualTo(30_000);
        assertThat(policy.computeDelayMs(2)).isEqualTo(60_000);
        assertThat(policy.computeDelayMs(3)).isEqualTo(120_000);
        assertThat(policy.computeDelayMs(4)).isEqualTo(240_000);
        assertThat(policy.computeDelayMs(5)).isEqualTo(300_000);
        assertThat(policy.computeDelayMs(60)).isEqualTo(300_000);
    }

    @Test
    @DisplayName("Non-positive attempts and zero base should mean no delay")
    void shouldReturnZeroForDegenerateInput() {
        assertThat(new ExponentialBackoffRetryPolicy(1000, 2000, false).computeDelayMs(0)).isZero();
        assertThat(new ExponentialBackoffRetryPolicy(0, 0, true).computeDelayMs(3)).isZero();
    }

    @Test
    @DisplayName("Jittered delay should stay within half and one and a half of the plain delay, capped")
    void jitterShouldStayInRange() {
        // Given
        RetryPolicy policy = new ExponentialBackoffRetryPolicy(1000, 10_000, true);

        // When & Then
        for (int i = 0; i < 200; i++) {
            assertThat(policy.computeDelayMs(2)).isBetween(1000L, 3000L);
            assertThat(policy.computeDelayMs(10)).isBetween(5000L, 10_000L);
        }
    }

    @Test
    @DisplayName("Should reject invalid bounds")
    void shouldRejectInvalidBounds() {
        assertThatThrownBy(() -> new ExponentialBackoffRetryPolicy(-1, 10, false))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ExponentialBackoffRetryPolicy(100, 10, false))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
