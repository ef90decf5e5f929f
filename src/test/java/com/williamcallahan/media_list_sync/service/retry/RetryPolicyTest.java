package com.williamcallahan.media_list_sync.service.retry;

import com.williamcallahan.media_list_sync.exception.HttpStatusException;
import com.williamcallahan.media_list_sync.exception.NetworkException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryPolicyTest {

    @Test
    void isRetryable_matchesConfiguredStatusCodes() {
        RetryPolicy policy = RetryPolicy.of(3, Set.of(503));

        assertThat(policy.isRetryable(new HttpStatusException("unavailable", 503))).isTrue();
        assertThat(policy.isRetryable(new HttpStatusException("not found", 404))).isFalse();
        assertThat(policy.isRetryable(new IllegalStateException("bug"))).isFalse();
    }

    @Test
    void of_doesNotRetryNetworkErrors() {
        RetryPolicy policy = RetryPolicy.of(3, Set.of(503));

        assertThat(policy.isRetryable(new NetworkException("reset", "ECONNRESET", null))).isFalse();
        assertThat(policy.retryableNetworkCodes()).isEmpty();
    }

    @Test
    void standard_coversTransientStatusesAndTransportCodes() {
        RetryPolicy policy = RetryPolicy.standard();

        assertThat(policy.maxAttempts()).isEqualTo(4);
        assertThat(policy.retryableStatusCodes()).containsExactlyInAnyOrder(408, 429, 500, 502, 503, 504);
        assertThat(policy.isRetryable(new NetworkException("reset", "ECONNRESET", null))).isTrue();
        assertThat(policy.isRetryable(new NetworkException("unknown", NetworkException.GENERIC_CODE, null))).isFalse();
        assertThat(policy.initialBackoff()).isEqualTo(Duration.ofSeconds(1));
        assertThat(policy.maxBackoff()).isEqualTo(Duration.ofSeconds(30));
        assertThat(policy.jitter()).isEqualTo(0.1);
    }

    @Test
    void withBackoff_keepsClassification() {
        RetryPolicy policy = RetryPolicy.standard().withBackoff(Duration.ofMillis(5), Duration.ofMillis(20));

        assertThat(policy.initialBackoff()).isEqualTo(Duration.ofMillis(5));
        assertThat(policy.maxBackoff()).isEqualTo(Duration.ofMillis(20));
        assertThat(policy.retryableStatusCodes()).isEqualTo(RetryPolicy.TRANSIENT_STATUS_CODES);
    }

    @Test
    void constructor_rejectsInvalidValues() {
        assertThatThrownBy(() -> RetryPolicy.of(0, Set.of(503)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RetryPolicy(2, Set.of(), Set.of(), null, null, 1.5))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
