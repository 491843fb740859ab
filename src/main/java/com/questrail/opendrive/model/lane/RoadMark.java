package com.questrail.opendrive.model.lane;

import com.questrail.opendrive.units.Length;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * RoadMark
 * -----------------------------------------------------------------------------
 * {@code <roadMark>}: the marking on the outer edge of a lane from
 * {@code sOffset} onwards.
 *
 * <p>{@code color} is a required attribute of the schema. Some exporters leave it
 * out; reading such documents is only possible with the
 * {@code workaround-sumo-roadmark-missing-color} compatibility flag, which
 * substitutes {@link RoadMarkColor#STANDARD}. The writer always emits the
 * color.</p>
 *
 * <p>Defaults: {@code laneChange} is {@link LaneChange#BOTH}, {@code material} is
 * {@value #DEFAULT_MATERIAL}. Both are omitted from output when they hold their
 * default.</p>
 *
 * <p>The shape is the plain {@code type}, refined either by a repeating
 * {@code detail} pattern or by {@code explicit} lines; {@code sways} add a
 * lateral displacement along the mark.</p>
 */
public record RoadMark(
        Length sOffset,
        RoadMarkType type,
        RoadMarkColor color,
        Optional<RoadMarkWeight> weight,
        Optional<Length> width,
        Optional<Length> height,
        LaneChange laneChange,
        String material,
        List<RoadMarkSway> sways,
        Optional<RoadMarkTypeDetail> detail,
        Optional<RoadMarkExplicit> explicit
) {
    public static final LaneChange DEFAULT_LANE_CHANGE = LaneChange.BOTH;
    public static final String DEFAULT_MATERIAL = "standard";

    public RoadMark {
        Objects.requireNonNull(sOffset, "sOffset");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(color, "color");
        Objects.requireNonNull(weight, "weight");
        Objects.requireNonNull(width, "width");
        Objects.requireNonNull(height, "height");
        Objects.requireNonNull(laneChange, "laneChange");
        Objects.requireNonNull(material, "material");
        Objects.requireNonNull(detail, "detail");
        Objects.requireNonNull(explicit, "explicit");
        sways = List.copyOf(sways);
    }

    public static RoadMark simple(double sOffset, RoadMarkType type, RoadMarkColor color) {
        return new RoadMark(Length.of(sOffset), type, color, Optional.empty(), Optional.empty(),
                Optional.empty(), DEFAULT_LANE_CHANGE, DEFAULT_MATERIAL, List.of(), Optional.empty(), Optional.empty());
    }
}
