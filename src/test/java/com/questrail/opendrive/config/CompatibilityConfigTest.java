package com.questrail.opendrive.config;

import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class CompatibilityConfigTest
{
    @Test
    void strictEnablesNothing()
    {
        CompatibilityConfig strict = CompatibilityConfig.strict();
        assertTrue(strict.isStrict());
        for (Workaround w : Workaround.values()) {
            assertFalse(strict.isEnabled(w));
        }
    }

    @Test
    void umbrellaFlagEnablesEveryWorkaround()
    {
        CompatibilityConfig config = CompatibilityConfig.fromFlags(List.of(Workaround.SUMO_UMBRELLA_FLAG));
        assertEquals(EnumSet.allOf(Workaround.class), EnumSet.copyOf(config.enabled()));
        assertEquals(CompatibilityConfig.sumo(), config);
    }

    @Test
    void individualFlagsAreIndependent()
    {
        CompatibilityConfig config = CompatibilityConfig.fromFlags(List.of("workaround-sumo-issue-10301"));
        assertTrue(config.isEnabled(Workaround.SUMO_ISSUE_10301));
        assertFalse(config.isEnabled(Workaround.SUMO_ROADMARK_MISSING_COLOR));
        assertFalse(config.isStrict());
    }

    @Test
    void unknownFlagIsRejected()
    {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> CompatibilityConfig.fromFlags(List.of("workaround-everything")));
        assertTrue(e.getMessage().contains("workaround-everything"));
    }

    @Test
    void builderTogglesWorkarounds()
    {
        CompatibilityConfig config = CompatibilityConfig.builder()
                .enableAll()
                .withWorkaround(Workaround.SUMO_ISSUE_10301, false)
                .build();
        assertEquals(CompatibilityConfig.of(Workaround.SUMO_ROADMARK_MISSING_COLOR), config);
    }
}
