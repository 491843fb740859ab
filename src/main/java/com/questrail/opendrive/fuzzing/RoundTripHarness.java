package com.questrail.opendrive.fuzzing;

import com.questrail.opendrive.OpenDriveCodec;
import com.questrail.opendrive.config.CompatibilityConfig;
import com.questrail.opendrive.model.Document;
import com.questrail.opendrive.observability.NullDiagnosticSink;

import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;

/**
 * RoundTripHarness
 * ----------------
 *
 * Runs write → read → write for a document under one fixed
 * {@link CompatibilityConfig} and reports whether
 * <ul>
 *   <li>the re-read document equals the original (lossless), and</li>
 *   <li>the second write is byte-identical to the first (idempotent).</li>
 * </ul>
 *
 * Read and write failures propagate unchanged; they are never a "failed" result.
 */
public final class RoundTripHarness
{
    private final OpenDriveCodec codec;

    public RoundTripHarness(CompatibilityConfig compatibility) {
        this.codec = OpenDriveCodec.builder()
                .withCompatibility(Objects.requireNonNull(compatibility, "compatibility"))
                .withDiagnosticSink(NullDiagnosticSink.INSTANCE)
                .build();
    }

    public RoundTripResult check(Document document) {
        byte[] first = codec.serialize(document);
        Document reread = codec.parse(first);
        byte[] second = codec.serialize(reread);
        return new RoundTripResult(document, reread,
                new String(first, StandardCharsets.UTF_8),
                new String(second, StandardCharsets.UTF_8));
    }

    /**
     * Checks {@code count} documents generated from consecutive seeds starting at
     * {@code firstSeed}.
     *
     * @return the first result that is not lossless or not idempotent
     */
    public Optional<RoundTripResult> findCounterexample(long firstSeed, int count) {
        for (long seed = firstSeed; seed < firstSeed + count; seed++) {
            RoundTripResult result = check(new ArbitraryDocuments(seed).next());
            if (!result.passed()) {
                return Optional.of(result.withSeed(seed));
            }
        }
        return Optional.empty();
    }

    public record RoundTripResult(
            Document original,
            Document reread,
            String firstOutput,
            String secondOutput,
            Optional<Long> seed
    ) {
        public RoundTripResult {
            Objects.requireNonNull(original, "original");
            Objects.requireNonNull(reread, "reread");
            Objects.requireNonNull(firstOutput, "firstOutput");
            Objects.requireNonNull(secondOutput, "secondOutput");
            Objects.requireNonNull(seed, "seed");
        }

        RoundTripResult(Document original, Document reread, String firstOutput, String secondOutput) {
            this(original, reread, firstOutput, secondOutput, Optional.empty());
        }

        RoundTripResult withSeed(long seed) {
            return new RoundTripResult(original, reread, firstOutput, secondOutput, Optional.of(seed));
        }

        public boolean lossless() {
            return original.equals(reread);
        }

        public boolean idempotent() {
            return firstOutput.equals(secondOutput);
        }

        public boolean passed() {
            return lossless() && idempotent();
        }

        @Override
        public String toString() {
            return "RoundTripResult[seed=" + seed.map(String::valueOf).orElse("n/a")
                    + ", lossless=" + lossless() + ", idempotent=" + idempotent() + "]\n" + firstOutput;
        }
    }
}
