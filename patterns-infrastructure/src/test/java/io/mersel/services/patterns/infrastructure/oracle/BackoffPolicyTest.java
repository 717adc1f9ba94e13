package io.mersel.services.patterns.infrastructure.oracle;

import io.mersel.services.patterns.infrastructure.config.OracleProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("BackoffPolicy")
class BackoffPolicyTest {

    @Test
    @DisplayName("Varsayılan özelliklerle 500 → 1000 → 2000 ms")
    void defaults_doubling() {
        BackoffPolicy policy = BackoffPolicy.from(new OracleProperties());

        assertThat(policy.maxRetries()).isEqualTo(3);
        assertThat(policy.delayBeforeRetry(1)).isEqualTo(500);
        assertThat(policy.delayBeforeRetry(2)).isEqualTo(1000);
        assertThat(policy.delayBeforeRetry(3)).isEqualTo(2000);
    }

    @Test
    @DisplayName("Bekleme üst sınırı aşmaz")
    void cappedAtMax() {
        var policy = new BackoffPolicy(10, 500, 2.0, 3000);

        assertThat(policy.delayBeforeRetry(4)).isEqualTo(3000);
        assertThat(policy.delayBeforeRetry(9)).isEqualTo(3000);
    }
}
