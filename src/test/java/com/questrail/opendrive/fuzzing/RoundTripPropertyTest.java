package com.questrail.opendrive.fuzzing;

import com.questrail.opendrive.config.CompatibilityConfig;
import com.questrail.opendrive.config.Workaround;
import com.questrail.opendrive.model.Document;
import com.questrail.opendrive.model.road.Road;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RoundTripPropertyTest
 * -----------------------------------------------------------------------------
 * Property tests over seeded arbitrary documents:
 *
 * <ul>
 *   <li>read(write(d)) equals d under a fixed compatibility configuration</li>
 *   <li>write(read(write(d))) is byte-identical to write(d)</li>
 *   <li>adjacent reference-line segments meet within 1e-6</li>
 * </ul>
 */
final class RoundTripPropertyTest
{
    private static final int DOCUMENTS = 200;

    @Test
    void strictRoundTripIsLosslessAndIdempotent()
    {
        Optional<RoundTripHarness.RoundTripResult> failure =
                new RoundTripHarness(CompatibilityConfig.strict()).findCounterexample(0L, DOCUMENTS);
        assertTrue(failure.isEmpty(), () -> failure.orElseThrow().toString());
    }

    @Test
    void sumoRoundTripIsLosslessAndIdempotent()
    {
        Optional<RoundTripHarness.RoundTripResult> failure =
                new RoundTripHarness(CompatibilityConfig.sumo()).findCounterexample(10_000L, DOCUMENTS);
        assertTrue(failure.isEmpty(), () -> failure.orElseThrow().toString());
    }

    @Test
    void eachWorkaroundAloneRoundTrips()
    {
        for (Workaround workaround : Workaround.values()) {
            Optional<RoundTripHarness.RoundTripResult> failure =
                    new RoundTripHarness(CompatibilityConfig.of(workaround)).findCounterexample(20_000L, 50);
            assertTrue(failure.isEmpty(), () -> workaround + ": " + failure.orElseThrow());
        }
    }

    @Test
    void configurationsProduceIdenticalOutputForCompleteDocuments()
    {
        RoundTripHarness strict = new RoundTripHarness(CompatibilityConfig.strict());
        RoundTripHarness sumo = new RoundTripHarness(CompatibilityConfig.sumo());
        ArbitraryDocuments documents = new ArbitraryDocuments(42L);
        for (int i = 0; i < 50; i++) {
            Document document = documents.next();
            assertEquals(strict.check(document).firstOutput(), sumo.check(document).firstOutput());
        }
    }

    @Test
    void generatedReferenceLinesAreContinuous()
    {
        ArbitraryDocuments documents = new ArbitraryDocuments(7L);
        for (int i = 0; i < DOCUMENTS; i++) {
            for (Road road : documents.next().roads()) {
                assertTrue(road.planView().continuityDefects(1e-6).isEmpty(), road::id);
            }
        }
    }

    @Test
    void sameSeedYieldsSameDocument()
    {
        assertEquals(new ArbitraryDocuments(99L).next(), new ArbitraryDocuments(99L).next());
    }
}
