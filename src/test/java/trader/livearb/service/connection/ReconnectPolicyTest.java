package trader.livearb.service.connection;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ReconnectPolicy")
class ReconnectPolicyTest {

    private final ReconnectPolicy policy =
            new ReconnectPolicy(Duration.ofMillis(3000), Duration.ofMillis(30000), 5);

    @ParameterizedTest(name = "after {0} attempts the delay is {1} ms")
    @CsvSource({"0, 3000", "1, 6000", "2, 12000", "3, 24000", "4, 30000", "10, 30000", "60, 30000"})
    void doublesUpToTheCap(int attempts, long expectedMillis) {
        assertThat(policy.delayFor(attempts)).isEqualTo(Duration.ofMillis(expectedMillis));
    }

    @Test
    @DisplayName("allows exactly maxAttempts retries")
    void retryBudget() {
        assertThat(policy.canRetry(0)).isTrue();
        assertThat(policy.canRetry(4)).isTrue();
        assertThat(policy.canRetry(5)).isFalse();
    }

    @Test
    @DisplayName("rejects a max delay below the base delay")
    void rejectsInvertedDelays() {
        assertThatThrownBy(() -> new ReconnectPolicy(Duration.ofSeconds(5), Duration.ofSeconds(1), 3))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
