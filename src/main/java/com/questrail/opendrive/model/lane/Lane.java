package com.questrail.opendrive.model.lane;

import com.questrail.opendrive.model.AdditionalData;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Lane
 * -----------------------------------------------------------------------------
 * One {@code <lane>} of a lane section.
 *
 * <p>The id encodes both side and adjacency: positive ids lie left of the center
 * lane, negative ids right of it, and the magnitude grows outwards. The side a
 * lane belongs to is fixed by the list of {@link LaneSection} that holds it; id
 * consistency is checked by the structural validator.</p>
 *
 * <p>{@code level} defaults to {@code false} and is omitted from output when so.</p>
 */
public record Lane(
        int id,
        LaneType type,
        boolean level,
        Optional<LaneLink> link,
        List<LaneBoundary> boundaries,
        List<RoadMark> roadMarks,
        List<LaneMaterial> materials,
        List<LaneSpeed> speeds,
        List<LaneAccess> accesses,
        List<LaneHeight> heights,
        List<LaneRule> rules,
        AdditionalData additionalData
) {
    public Lane {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(link, "link");
        Objects.requireNonNull(additionalData, "additionalData");
        boundaries = List.copyOf(boundaries);
        roadMarks = List.copyOf(roadMarks);
        materials = List.copyOf(materials);
        speeds = List.copyOf(speeds);
        accesses = List.copyOf(accesses);
        heights = List.copyOf(heights);
        rules = List.copyOf(rules);
    }

    public static Builder builder(int id, LaneType type) {
        return new Builder(id, type);
    }

    public static final class Builder {
        private final int id;
        private final LaneType type;
        private boolean level;
        private LaneLink link;
        private final List<LaneBoundary> boundaries = new ArrayList<>();
        private final List<RoadMark> roadMarks = new ArrayList<>();
        private final List<LaneMaterial> materials = new ArrayList<>();
        private final List<LaneSpeed> speeds = new ArrayList<>();
        private final List<LaneAccess> accesses = new ArrayList<>();
        private final List<LaneHeight> heights = new ArrayList<>();
        private final List<LaneRule> rules = new ArrayList<>();
        private AdditionalData additionalData = AdditionalData.EMPTY;

        private Builder(int id, LaneType type) {
            this.id = id;
            this.type = type;
        }

        public Builder withLevel(boolean level) {
            this.level = level;
            return this;
        }

        public Builder withLink(LaneLink link) {
            this.link = link;
            return this;
        }

        public Builder addBoundary(LaneBoundary boundary) {
            boundaries.add(boundary);
            return this;
        }

        public Builder addRoadMark(RoadMark roadMark) {
            roadMarks.add(roadMark);
            return this;
        }

        public Builder addMaterial(LaneMaterial material) {
            materials.add(material);
            return this;
        }

        public Builder addSpeed(LaneSpeed speed) {
            speeds.add(speed);
            return this;
        }

        public Builder addAccess(LaneAccess access) {
            accesses.add(access);
            return this;
        }

        public Builder addHeight(LaneHeight height) {
            heights.add(height);
            return this;
        }

        public Builder addRule(LaneRule rule) {
            rules.add(rule);
            return this;
        }

        public Builder withAdditionalData(AdditionalData additionalData) {
            this.additionalData = additionalData;
            return this;
        }

        public Lane build() {
            return new Lane(id, type, level, Optional.ofNullable(link), boundaries, roadMarks,
                    materials, speeds, accesses, heights, rules, additionalData);
        }
    }
}
