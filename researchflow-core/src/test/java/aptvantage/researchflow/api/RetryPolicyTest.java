package aptvantage.researchflow.api;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.parallel.Execution;
import org.junit.jupiter.api.parallel.ExecutionMode;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Execution(ExecutionMode.CONCURRENT)
class RetryPolicyTest {

    /**
     * Default is 3 attempts, 1 second base delay, 0.5 randomization
     */
    @Test
    public void defaultSettings() {

        // given a default policy
        RetryPolicy subject = RetryPolicy.defaults();

        // then it allows 3 attempts
        assertEquals(3, subject.maxAttempts());

        // and the base delay is 1 second
        assertEquals(Duration.of(1, ChronoUnit.SECONDS), subject.baseDelay());

        // and the randomization factor is 0.5
        assertEquals(0.5, subject.randomizationFactor());
    }

    @Test
    public void delaysDoubleWithoutJitter() {

        // given a policy without randomization
        RetryPolicy subject = RetryPolicy.defaults()
                .baseDelay(Duration.of(1, ChronoUnit.SECONDS))
                .randomizationFactor(0);

        // then each delay doubles the previous one
        assertEquals(Duration.ofSeconds(1), subject.delayAfter(1));
        assertEquals(Duration.ofSeconds(2), subject.delayAfter(2));
        assertEquals(Duration.ofSeconds(4), subject.delayAfter(3));
    }

    @Test
    public void jitterStaysWithinTheRandomizationBand() {

        // given the default policy
        RetryPolicy subject = RetryPolicy.defaults();

        // then the delay after the second attempt is 2s +/- 50%
        for (int i = 0; i < 50; i++) {
            long millis = subject.delayAfter(2).toMillis();
            assertTrue(millis >= 1000 && millis <= 3000, "delay was " + millis);
        }
    }

    @Test
    public void hasAttemptsAfterRespectsTheCeiling() {
        RetryPolicy subject = RetryPolicy.defaults().maxAttempts(2);

        assertTrue(subject.hasAttemptsAfter(1));
        assertFalse(subject.hasAttemptsAfter(2));
    }

    @Test
    public void invalidSettingsAreRejected() {
        RetryPolicy subject = RetryPolicy.defaults();

        IllegalArgumentException nullDelay = assertThrows(IllegalArgumentException.class,
                () -> subject.baseDelay(null));
        assertEquals("baseDelay must not be null", nullDelay.getMessage());

        assertThrows(IllegalArgumentException.class, () -> subject.maxAttempts(0));
        assertThrows(IllegalArgumentException.class, () -> subject.randomizationFactor(1.0));
        assertThrows(IllegalArgumentException.class, () -> subject.baseDelay(Duration.ZERO));
    }
}
