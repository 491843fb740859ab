package com.questrail.opendrive.config;

import java.util.Collection;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * The set of {@link Workaround}s enabled for one reader or writer.
 *
 * <p>This is a plain value passed to each codec instance; there is no
 * process-wide default. Codecs with different configurations can coexist.</p>
 */
public record CompatibilityConfig(Set<Workaround> enabled)
{
    private static final CompatibilityConfig STRICT = new CompatibilityConfig(Set.of());

    public CompatibilityConfig {
        Objects.requireNonNull(enabled, "enabled");
        enabled = enabled.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(enabled));
    }

    /**
     * @return strict standard conformance, no workaround enabled
     */
    public static CompatibilityConfig strict() {
        return STRICT;
    }

    /**
     * @return every SUMO workaround, equivalent to the {@code workaround-sumo} flag
     */
    public static CompatibilityConfig sumo() {
        return new CompatibilityConfig(EnumSet.allOf(Workaround.class));
    }

    public static CompatibilityConfig of(Workaround... workarounds) {
        Builder builder = builder();
        for (Workaround w : workarounds) {
            builder.enable(w);
        }
        return builder.build();
    }

    /**
     * Builds a configuration from feature flag names, e.g.
     * {@code workaround-sumo-issue-10301} or the umbrella {@code workaround-sumo}.
     *
     * @throws IllegalArgumentException on an unknown flag name
     */
    public static CompatibilityConfig fromFlags(Collection<String> flags) {
        Builder builder = builder();
        for (String flag : flags) {
            if (Workaround.SUMO_UMBRELLA_FLAG.equals(flag)) {
                builder.enableAll();
                continue;
            }
            Workaround w = Workaround.fromFlag(flag)
                    .orElseThrow(() -> new IllegalArgumentException("unknown workaround flag: " + flag));
            builder.enable(w);
        }
        return builder.build();
    }

    public boolean isEnabled(Workaround workaround) {
        return enabled.contains(workaround);
    }

    public boolean isStrict() {
        return enabled.isEmpty();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final EnumSet<Workaround> enabled = EnumSet.noneOf(Workaround.class);

        public Builder enable(Workaround workaround) {
            enabled.add(Objects.requireNonNull(workaround, "workaround"));
            return this;
        }

        public Builder enableAll() {
            enabled.addAll(EnumSet.allOf(Workaround.class));
            return this;
        }

        public Builder withWorkaround(Workaround workaround, boolean on) {
            if (on) {
                enabled.add(workaround);
            } else {
                enabled.remove(workaround);
            }
            return this;
        }

        public CompatibilityConfig build() {
            return new CompatibilityConfig(enabled);
        }
    }
}
