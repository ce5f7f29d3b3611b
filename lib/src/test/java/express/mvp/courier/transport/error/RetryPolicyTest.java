package express.mvp.courier.transport.error;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link RetryPolicy}. */
@DisplayName("RetryPolicy")
class RetryPolicyTest {

    @Nested
    @DisplayName("Backoff schedule")
    class ScheduleTests {

        @Test
        @DisplayName("exponentialBackoff() doubles up to the cap")
        void exponentialBackoff_doublesUpToCap() {
            RetryPolicy policy =
                    RetryPolicy.exponentialBackoff(Duration.ofMillis(10), Duration.ofMillis(70));

            assertEquals(10, policy.delayMillis(1));
            assertEquals(20, policy.delayMillis(2));
            assertEquals(40, policy.delayMillis(3));
            assertEquals(70, policy.delayMillis(4));
            assertEquals(70, policy.delayMillis(30));
            assertEquals(70, policy.delayMillis(Integer.MAX_VALUE));
        }

        @Test
        @DisplayName("acceptDefault() starts small and caps at one second")
        void acceptDefault_isBounded() {
            RetryPolicy policy = RetryPolicy.acceptDefault();

            assertEquals(10, policy.getInitialDelayMillis());
            assertEquals(1000, policy.getMaxDelayMillis());
            assertEquals(640, policy.delayMillis(7));
            assertEquals(1000, policy.delayMillis(8));
            assertEquals(1000, policy.delayMillis(100));
        }

        @Test
        @DisplayName("Equal initial delay and cap give a fixed delay")
        void equalBounds_areFixed() {
            RetryPolicy policy =
                    RetryPolicy.exponentialBackoff(Duration.ofMillis(50), Duration.ofMillis(50));

            assertEquals(50, policy.delayMillis(1));
            assertEquals(50, policy.delayMillis(10));
        }

        @Test
        @DisplayName("Failure counts below one use the initial delay")
        void zeroFailures_useInitialDelay() {
            RetryPolicy policy =
                    RetryPolicy.exponentialBackoff(Duration.ofMillis(5), Duration.ofMillis(50));

            assertEquals(5, policy.delayMillis(0));
        }
    }

    @Test
    @DisplayName("Rejects a cap below the initial delay")
    void capBelowInitial_isRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> RetryPolicy.exponentialBackoff(Duration.ofMillis(100), Duration.ofMillis(10)));
    }

    @Test
    @DisplayName("Rejects negative delays")
    void negativeDelay_isRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> RetryPolicy.exponentialBackoff(Duration.ofMillis(-1), Duration.ofMillis(10)));
    }
}
