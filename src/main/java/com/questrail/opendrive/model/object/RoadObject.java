package com.questrail.opendrive.model.object;

import com.questrail.opendrive.model.AdditionalData;
import com.questrail.opendrive.model.Orientation;
import com.questrail.opendrive.model.signal.LaneValidity;
import com.questrail.opendrive.units.Angle;
import com.questrail.opendrive.units.Length;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * An {@code <object>} on a road: anything that influences the road or its users
 * without being a signal (poles, barriers, crosswalks, buildings and so on).
 *
 * <p>{@code dynamic} defaults to {@code false} ({@code "no"}). The shape is
 * either the bounding box or cylinder given by the size attributes or the
 * {@code outline}/{@code outlines}; an empty {@code outlines} list stands for an
 * absent {@code <outlines>} element.</p>
 */
public record RoadObject(
        String id,
        Length s,
        Length t,
        Length zOffset,
        Optional<ObjectType> type,
        Optional<String> subtype,
        Optional<String> name,
        boolean dynamic,
        Optional<Orientation> orientation,
        Optional<Angle> hdg,
        Optional<Angle> pitch,
        Optional<Angle> roll,
        Optional<Length> height,
        Optional<Length> length,
        Optional<Length> width,
        Optional<Length> radius,
        Optional<Length> validLength,
        Optional<Boolean> perpToRoad,
        List<ObjectRepeat> repeats,
        Optional<Outline> outline,
        List<Outline> outlines,
        List<ObjectMaterial> materials,
        List<LaneValidity> validities,
        Optional<ParkingSpace> parkingSpace,
        List<ObjectMarking> markings,
        List<ObjectBorder> borders,
        Optional<ObjectSurface> surface,
        AdditionalData additionalData
) {
    public RoadObject {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(s, "s");
        Objects.requireNonNull(t, "t");
        Objects.requireNonNull(zOffset, "zOffset");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(subtype, "subtype");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(orientation, "orientation");
        Objects.requireNonNull(hdg, "hdg");
        Objects.requireNonNull(pitch, "pitch");
        Objects.requireNonNull(roll, "roll");
        Objects.requireNonNull(height, "height");
        Objects.requireNonNull(length, "length");
        Objects.requireNonNull(width, "width");
        Objects.requireNonNull(radius, "radius");
        Objects.requireNonNull(validLength, "validLength");
        Objects.requireNonNull(perpToRoad, "perpToRoad");
        Objects.requireNonNull(outline, "outline");
        Objects.requireNonNull(parkingSpace, "parkingSpace");
        Objects.requireNonNull(surface, "surface");
        Objects.requireNonNull(additionalData, "additionalData");
        repeats = List.copyOf(repeats);
        outlines = List.copyOf(outlines);
        materials = List.copyOf(materials);
        validities = List.copyOf(validities);
        markings = List.copyOf(markings);
        borders = List.copyOf(borders);
    }

    public static Builder builder(String id, double s, double t) {
        return new Builder(id, s, t);
    }

    public static final class Builder {
        private final String id;
        private final Length s;
        private final Length t;
        private Length zOffset = Length.ZERO;
        private ObjectType type;
        private String subtype;
        private String name;
        private boolean dynamic;
        private Orientation orientation;
        private Angle hdg;
        private Angle pitch;
        private Angle roll;
        private Length height;
        private Length length;
        private Length width;
        private Length radius;
        private Length validLength;
        private Boolean perpToRoad;
        private final List<ObjectRepeat> repeats = new ArrayList<>();
        private Outline outline;
        private final List<Outline> outlines = new ArrayList<>();
        private final List<ObjectMaterial> materials = new ArrayList<>();
        private final List<LaneValidity> validities = new ArrayList<>();
        private ParkingSpace parkingSpace;
        private final List<ObjectMarking> markings = new ArrayList<>();
        private final List<ObjectBorder> borders = new ArrayList<>();
        private ObjectSurface surface;
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

        public Builder withType(ObjectType type, String subtype) {
            this.type = type;
            this.subtype = subtype;
            return this;
        }

        public Builder withName(String name) {
            this.name = name;
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

        public Builder withRotation(Angle hdg, Angle pitch, Angle roll) {
            this.hdg = hdg;
            this.pitch = pitch;
            this.roll = roll;
            return this;
        }

        public Builder withBox(Length length, Length width, Length height) {
            this.length = length;
            this.width = width;
            this.height = height;
            return this;
        }

        public Builder withRadius(Length radius) {
            this.radius = radius;
            return this;
        }

        public Builder withValidLength(Length validLength) {
            this.validLength = validLength;
            return this;
        }

        public Builder withPerpToRoad(boolean perpToRoad) {
            this.perpToRoad = perpToRoad;
            return this;
        }

        public Builder addRepeat(ObjectRepeat repeat) {
            repeats.add(repeat);
            return this;
        }

        /**
         * Sets the single {@code <outline>} child.
         */
        public Builder withOutline(Outline outline) {
            this.outline = outline;
            return this;
        }

        /**
         * Adds to the {@code <outlines>} group.
         */
        public Builder addOutline(Outline outline) {
            outlines.add(outline);
            return this;
        }

        public Builder addMaterial(ObjectMaterial material) {
            materials.add(material);
            return this;
        }

        public Builder withParkingSpace(ParkingSpace parkingSpace) {
            this.parkingSpace = parkingSpace;
            return this;
        }

        public Builder addMarking(ObjectMarking marking) {
            markings.add(marking);
            return this;
        }

        public Builder addBorder(ObjectBorder border) {
            borders.add(border);
            return this;
        }

        public Builder withSurface(ObjectSurface surface) {
            this.surface = surface;
            return this;
        }

        public Builder addValidity(LaneValidity validity) {
            validities.add(validity);
            return this;
        }

        public Builder withAdditionalData(AdditionalData additionalData) {
            this.additionalData = additionalData;
            return this;
        }

        public RoadObject build() {
            return new RoadObject(id, s, t, zOffset, Optional.ofNullable(type), Optional.ofNullable(subtype),
                    Optional.ofNullable(name), dynamic, Optional.ofNullable(orientation),
                    Optional.ofNullable(hdg), Optional.ofNullable(pitch), Optional.ofNullable(roll),
                    Optional.ofNullable(height), Optional.ofNullable(length), Optional.ofNullable(width),
                    Optional.ofNullable(radius), Optional.ofNullable(validLength), Optional.ofNullable(perpToRoad),
                    repeats, Optional.ofNullable(outline), outlines, materials, validities,
                    Optional.ofNullable(parkingSpace), markings, borders, Optional.ofNullable(surface),
                    additionalData);
        }
    }
}
