package com.questrail.opendrive.model.signal;

import com.questrail.opendrive.model.AdditionalData;
import com.questrail.opendrive.model.Orientation;
import com.questrail.opendrive.units.Angle;
import com.questrail.opendrive.units.Length;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Signal
 * -----------------------------------------------------------------------------
 * A {@code <signal>} placed on a road at reference-line coordinates
 * {@code (s, t)} and height {@code zOffset} above the road surface.
 *
 * <p>{@code type} and {@code subtype} are country-specific catalogue codes and are
 * kept as text. {@code value} and {@code unit} describe the signalled quantity
 * (for example a speed limit) and are only meaningful together. {@code position}
 * is set only when the signal is mounted somewhere other than {@code (s, t)}.</p>
 */
public record Signal(
        String id,
        Length s,
        Length t,
        Length zOffset,
        boolean dynamic,
        Orientation orientation,
        String type,
        String subtype,
        Optional<String> name,
        Optional<String> country,
        Optional<String> countryRevision,
        Optional<Double> value,
        Optional<String> unit,
        Optional<Length> height,
        Optional<Length> width,
        Optional<String> text,
        Optional<Angle> hOffset,
        Optional<Angle> pitch,
        Optional<Angle> roll,
        List<LaneValidity> validities,
        List<SignalDependency> dependencies,
        List<SignalElementReference> references,
        Optional<SignalPosition> position,
        AdditionalData additionalData
) {
    public Signal {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(s, "s");
        Objects.requireNonNull(t, "t");
        Objects.requireNonNull(zOffset, "zOffset");
        Objects.requireNonNull(orientation, "orientation");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(subtype, "subtype");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(country, "country");
        Objects.requireNonNull(countryRevision, "countryRevision");
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(unit, "unit");
        Objects.requireNonNull(height, "height");
        Objects.requireNonNull(width, "width");
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(hOffset, "hOffset");
        Objects.requireNonNull(pitch, "pitch");
        Objects.requireNonNull(roll, "roll");
        Objects.requireNonNull(position, "position");
        Objects.requireNonNull(additionalData, "additionalData");
        validities = List.copyOf(validities);
        dependencies = List.copyOf(dependencies);
        references = List.copyOf(references);
    }

    public static Builder builder(String id, double s, double t) {
        return new Builder(id, s, t);
    }

    public static final class Builder {
        private final String id;
        private final Length s;
        private final Length t;
        private Length zOffset = Length.ZERO;
        private boolean dynamic;
        private Orientation orientation = Orientation.PLUS;
        private String type = "-1";
        private String subtype = "-1";
        private String name;
        private String country;
        private String countryRevision;
        private Double value;
        private String unit;
        private Length height;
        private Length width;
        private String text;
        private Angle hOffset;
        private Angle pitch;
        private Angle roll;
        private final List<LaneValidity> validities = new ArrayList<>();
        private final List<SignalDependency> dependencies = new ArrayList<>();
        private final List<SignalElementReference> references = new ArrayList<>();
        private SignalPosition position;
        private AdditionalData additionalData = AdditionalData.EMPTY;

        private Builder(String id, double s, double t) {
            this.id = id;
            this.s = Length.of(s);
            this.t = Length.of(t);
        }

        public Builder withZOffset(Length zOffset) {
            this.zOffset = zOffset;
            return this;
        }

        public Builder withDynamic(boolean dynamic) {
            this.dynamic = dynamic;
            return this;
        }

        public Builder withOrientation(Orientation orientation) {
            this.orientation = orientation;
            return this;
        }

        public Builder withType(String type, String subtype) {
            this.type = type;
            this.subtype = subtype;
            return this;
        }

        public Builder withName(String name) {
            this.name = name;
            return this;
        }

        public Builder withCountry(String country, String countryRevision) {
            this.country = country;
            this.countryRevision = countryRevision;
            return this;
        }

        public Builder withValue(double value, String unit) {
            this.value = value;
            this.unit = unit;
            return this;
        }

        public Builder withSize(Length height, Length width) {
            this.height = height;
            this.width = width;
            return this;
        }

        public Builder withText(String text) {
            this.text = text;
            return this;
        }

        public Builder withRotation(Angle hOffset, Angle pitch, Angle roll) {
            this.hOffset = hOffset;
            this.pitch = pitch;
            this.roll = roll;
            return this;
        }

        public Builder addValidity(LaneValidity validity) {
            validities.add(validity);
            return this;
        }

        public Builder addDependency(SignalDependency dependency) {
            dependencies.add(dependency);
            return this;
        }

        public Builder addReference(SignalElementReference reference) {
            references.add(reference);
            return this;
        }

        public Builder withPosition(SignalPosition position) {
            this.position = position;
            return this;
        }

        public Builder withAdditionalData(AdditionalData additionalData) {
            this.additionalData = additionalData;
            return this;
        }

        public Signal build() {
            return new Signal(id, s, t, zOffset, dynamic, orientation, type, subtype,
                    Optional.ofNullable(name), Optional.ofNullable(country), Optional.ofNullable(countryRevision),
                    Optional.ofNullable(value), Optional.ofNullable(unit),
                    Optional.ofNullable(height), Optional.ofNullable(width), Optional.ofNullable(text),
                    Optional.ofNullable(hOffset), Optional.ofNullable(pitch), Optional.ofNullable(roll),
                    validities, dependencies, references, Optional.ofNullable(position), additionalData);
        }
    }
}
