package com.questrail.opendrive.config;

import java.util.Optional;

/**
 * Workaround
 * -----------------------------------------------------------------------------
 * Named deviations from strict standard conformance, each compensating for a
 * known defect of a specific third-party tool.
 *
 * <p>Every workaround is off unless explicitly enabled through a
 * {@link CompatibilityConfig}. Each constant documents the one field it affects,
 * the conformant behaviour it overrides, and the defect it compensates for.</p>
 */
public enum Workaround
{
    /**
     * <strong>Field:</strong> {@code pRange} of {@code <paramPoly3>}.
     * <p><strong>Conformant behaviour:</strong> {@code pRange} is required; a
     * missing attribute fails the read with {@code MISSING_REQUIRED_FIELD}.</p>
     * <p><strong>With workaround:</strong> a missing {@code pRange} is read as
     * {@code normalized}.</p>
     * <p><strong>Defect:</strong> SUMO's netconvert (issue 10301) writes
     * {@code paramPoly3} records without {@code pRange}; its own reader assumes
     * the normalized range.</p>
     */
    SUMO_ISSUE_10301("workaround-sumo-issue-10301"),

    /**
     * <strong>Field:</strong> {@code color} of {@code <roadMark>}.
     * <p><strong>Conformant behaviour:</strong> {@code color} is required; a
     * missing attribute fails the read with {@code MISSING_REQUIRED_FIELD}.</p>
     * <p><strong>With workaround:</strong> a missing color is read as
     * {@code standard}. Output always carries the color attribute, so documents
     * passed on to SUMO never rely on a default.</p>
     * <p><strong>Defect:</strong> SUMO exports road marks without a color and
     * mis-defaults the color of road marks that arrive without one.</p>
     */
    SUMO_ROADMARK_MISSING_COLOR("workaround-sumo-roadmark-missing-color");

    /** Flag name enabling every SUMO workaround at once. */
    public static final String SUMO_UMBRELLA_FLAG = "workaround-sumo";

    private final String flag;

    Workaround(String flag) {
        this.flag = flag;
    }

    /**
     * @return the feature flag name of this workaround
     */
    public String flag() {
        return flag;
    }

    public static Optional<Workaround> fromFlag(String flag) {
        for (Workaround w : values()) {
            if (w.flag.equals(flag)) {
                return Optional.of(w);
            }
        }
        return Optional.empty();
    }
}
