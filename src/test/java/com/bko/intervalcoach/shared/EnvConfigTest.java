package com.bko.intervalcoach.shared;

import io.github.cdimascio.dotenv.Dotenv;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class EnvConfigTest {

    @Test
    void readsDotenvKeysInEnvironmentNaming() {
        Dotenv dotenv = mock(Dotenv.class);
        when(dotenv.get("INTERVALS_API_KEY")).thenReturn("  secret  ");
        when(dotenv.get("COACH_FITNESS_LONG_CONSTANT")).thenReturn("28");
        when(dotenv.get("COACH_ORACLE_ENABLED")).thenReturn("false");

        EnvConfig config = new EnvConfig(dotenv);

        assertEquals("secret", config.get("intervals.api_key"));
        assertEquals(28, config.getInt("coach.fitness.long_constant", 42));
        assertFalse(config.getBoolean("coach.oracle.enabled", true));
    }

    @Test
    void rejectsMalformedIntegers() {
        Dotenv dotenv = mock(Dotenv.class);
        when(dotenv.get("COACH_SELECTION_MAX_MINUTES")).thenReturn("ninety");

        EnvConfig config = new EnvConfig(dotenv);

        assertThrows(IllegalArgumentException.class, () -> config.getInt("coach.selection.max_minutes", 90));
    }

    @Test
    void fallsBackToDefaultsForMissingValues() {
        EnvConfig config = new EnvConfig(mock(Dotenv.class));

        assertEquals(42, config.getInt("intervalcoach.test.unset_value", 42));
        assertTrue(config.getBoolean("intervalcoach.test.unset_flag", true));
        assertNull(config.get("intervalcoach.test.unset_text"));
    }
}
