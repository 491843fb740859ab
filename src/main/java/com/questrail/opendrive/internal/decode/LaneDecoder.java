package com.questrail.opendrive.internal.decode;

import com.questrail.opendrive.api.ErrorKind;
import com.questrail.opendrive.config.Workaround;
import com.questrail.opendrive.model.lane.AccessRestriction;
import com.questrail.opendrive.model.lane.AccessRule;
import com.questrail.opendrive.model.lane.Lane;
import com.questrail.opendrive.model.lane.LaneAccess;
import com.questrail.opendrive.model.lane.LaneBorder;
import com.questrail.opendrive.model.lane.LaneChange;
import com.questrail.opendrive.model.lane.LaneHeight;
import com.questrail.opendrive.model.lane.LaneLink;
import com.questrail.opendrive.model.lane.LaneMaterial;
import com.questrail.opendrive.model.lane.LaneOffset;
import com.questrail.opendrive.model.lane.LaneRule;
import com.questrail.opendrive.model.lane.LaneSection;
import com.questrail.opendrive.model.lane.LaneSpeed;
import com.questrail.opendrive.model.lane.LaneType;
import com.questrail.opendrive.model.lane.LaneWidth;
import com.questrail.opendrive.model.lane.Lanes;
import com.questrail.opendrive.model.lane.RoadMark;
import com.questrail.opendrive.model.lane.RoadMarkColor;
import com.questrail.opendrive.model.lane.RoadMarkExplicit;
import com.questrail.opendrive.model.lane.RoadMarkExplicitLine;
import com.questrail.opendrive.model.lane.RoadMarkLine;
import com.questrail.opendrive.model.lane.RoadMarkRule;
import com.questrail.opendrive.model.lane.RoadMarkSway;
import com.questrail.opendrive.model.lane.RoadMarkType;
import com.questrail.opendrive.model.lane.RoadMarkTypeDetail;
import com.questrail.opendrive.model.lane.RoadMarkWeight;
import com.questrail.opendrive.units.Length;
import com.questrail.opendrive.units.Speed;
import com.questrail.opendrive.units.SpeedUnit;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Decodes {@code <lanes>} and everything below it.
 *
 * <p>The {@link Workaround#SUMO_ROADMARK_MISSING_COLOR} decision point lives in
 * {@link #decodeRoadMark(ElementReader)}.</p>
 */
final class LaneDecoder
{
    private static final class SectionParts
    {
        List<Lane> left;
        List<Lane> center;
        List<Lane> right;
        final AdditionalDataCollector additional = new AdditionalDataCollector();
    }

    Lanes decodeLanes(ElementReader element) {
        List<LaneOffset> offsets = new ArrayList<>();
        List<LaneSection> sections = new ArrayList<>();
        element.forEachChild(child -> {
            switch (child.name()) {
                case "laneOffset" -> offsets.add(
                        new LaneOffset(child.requiredNonNegativeLength("s"), child.polynomial("")));
                case "laneSection" -> sections.add(decodeSection(child));
                default -> child.skipUnknown();
            }
        });
        if (sections.isEmpty()) {
            throw element.missingChild("laneSection");
        }
        return new Lanes(offsets, sections);
    }

    LaneSection decodeSection(ElementReader element) {
        Length s = element.requiredNonNegativeLength("s");
        boolean singleSide = element.optionalBoolean("singleSide", false);

        SectionParts parts = new SectionParts();
        element.forEachChild(child -> {
            switch (child.name()) {
                case "left" -> {
                    element.requireAbsent(parts.left, "left");
                    parts.left = decodeSide(child);
                }
                case "center" -> {
                    element.requireAbsent(parts.center, "center");
                    parts.center = decodeSide(child);
                    if (parts.center.isEmpty()) {
                        throw child.missingChild("lane");
                    }
                    if (parts.center.size() > 1) {
                        throw child.error(ErrorKind.STRUCTURAL_VIOLATION, "lane", null,
                                "center must contain exactly one lane");
                    }
                }
                case "right" -> {
                    element.requireAbsent(parts.right, "right");
                    parts.right = decodeSide(child);
                }
                default -> parts.additional.acceptOrSkip(child);
            }
        });
        if (parts.center == null) {
            throw element.missingChild("center");
        }
        return new LaneSection(s, singleSide,
                parts.left == null ? List.of() : parts.left,
                parts.center.get(0),
                parts.right == null ? List.of() : parts.right,
                parts.additional.build());
    }

    private List<Lane> decodeSide(ElementReader element) {
        List<Lane> lanes = new ArrayList<>();
        element.forEachChild(child -> {
            if (child.name().equals("lane")) {
                lanes.add(decodeLane(child));
            } else {
                child.skipUnknown();
            }
        });
        return lanes;
    }

    Lane decodeLane(ElementReader element) {
        int id = element.requiredInt("id");
        LaneType type = element.requiredEnum("type", LaneType.class);
        boolean level = element.optionalBoolean("level", false);

        Lane.Builder lane = Lane.builder(id, type).withLevel(level);
        List<LaneLink> link = new ArrayList<>(1);
        AdditionalDataCollector additional = new AdditionalDataCollector();
        element.forEachChild(child -> {
            switch (child.name()) {
                case "link" -> {
                    element.requireAbsent(link.isEmpty() ? null : link, "link");
                    link.add(decodeLaneLink(child));
                }
                case "width" -> lane.addBoundary(
                        new LaneWidth(child.requiredNonNegativeLength("sOffset"), child.polynomial("")));
                case "border" -> lane.addBoundary(
                        new LaneBorder(child.requiredNonNegativeLength("sOffset"), child.polynomial("")));
                case "roadMark" -> lane.addRoadMark(decodeRoadMark(child));
                case "material" -> lane.addMaterial(decodeMaterial(child));
                case "speed" -> lane.addSpeed(decodeSpeed(child));
                case "access" -> lane.addAccess(decodeAccess(child));
                case "height" -> lane.addHeight(decodeHeight(child));
                case "rule" -> lane.addRule(
                        new LaneRule(child.requiredNonNegativeLength("sOffset"), child.requiredText("value")));
                default -> additional.acceptOrSkip(child);
            }
        });
        link.stream().findFirst().ifPresent(lane::withLink);
        return lane.withAdditionalData(additional.build()).build();
    }

    private static LaneLink decodeLaneLink(ElementReader element) {
        List<Integer> predecessors = new ArrayList<>();
        List<Integer> successors = new ArrayList<>();
        element.forEachChild(child -> {
            switch (child.name()) {
                case "predecessor" -> predecessors.add(child.requiredInt("id"));
                case "successor" -> successors.add(child.requiredInt("id"));
                default -> child.skipUnknown();
            }
        });
        return new LaneLink(predecessors, successors);
    }

    RoadMark decodeRoadMark(ElementReader element) {
        Length sOffset = element.requiredNonNegativeLength("sOffset");
        RoadMarkType type = element.requiredEnum("type", RoadMarkType.class);
        RoadMarkColor color = element.optionalEnum("color", RoadMarkColor.class)
                .orElseGet(() -> missingColor(element));
        Optional<RoadMarkWeight> weight = element.optionalEnum("weight", RoadMarkWeight.class);
        Optional<Length> width = element.optionalLength("width");
        Optional<Length> height = element.optionalLength("height");
        LaneChange laneChange = element.optionalEnum("laneChange", LaneChange.class, RoadMark.DEFAULT_LANE_CHANGE);
        String material = element.optionalText("material").orElse(RoadMark.DEFAULT_MATERIAL);

        List<RoadMarkSway> sways = new ArrayList<>();
        List<RoadMarkTypeDetail> detail = new ArrayList<>(1);
        List<RoadMarkExplicit> explicit = new ArrayList<>(1);
        element.forEachChild(child -> {
            switch (child.name()) {
                case "sway" -> sways.add(new RoadMarkSway(child.requiredNonNegativeLength("ds"),
                        child.polynomial("")));
                case "type" -> {
                    element.requireAbsent(detail.isEmpty() ? null : detail, "type");
                    detail.add(decodeTypeDetail(child));
                }
                case "explicit" -> {
                    element.requireAbsent(explicit.isEmpty() ? null : explicit, "explicit");
                    explicit.add(decodeExplicit(child));
                }
                default -> child.skipUnknown();
            }
        });
        return new RoadMark(sOffset, type, color, weight, width, height, laneChange, material, sways,
                detail.stream().findFirst(), explicit.stream().findFirst());
    }

    private static RoadMarkExplicit decodeExplicit(ElementReader element) {
        List<RoadMarkExplicitLine> lines = new ArrayList<>();
        AdditionalDataCollector additional = new AdditionalDataCollector();
        element.forEachChild(child -> {
            if (child.name().equals("line")) {
                lines.add(new RoadMarkExplicitLine(
                        child.requiredLength("length"),
                        child.requiredLength("tOffset"),
                        child.requiredNonNegativeLength("sOffset"),
                        child.optionalEnum("rule", RoadMarkRule.class),
                        child.optionalLength("width")));
            } else {
                additional.acceptOrSkip(child);
            }
        });
        if (lines.isEmpty()) {
            throw element.missingChild("line");
        }
        return new RoadMarkExplicit(lines, additional.build());
    }

    private static RoadMarkColor missingColor(ElementReader element) {
        ReadContext context = element.context();
        if (!context.isEnabled(Workaround.SUMO_ROADMARK_MISSING_COLOR)) {
            throw element.missing("color");
        }
        context.workaroundApplied(Workaround.SUMO_ROADMARK_MISSING_COLOR, element,
                "missing color read as " + RoadMarkColor.STANDARD.xmlValue());
        return RoadMarkColor.STANDARD;
    }

    private static RoadMarkTypeDetail decodeTypeDetail(ElementReader element) {
        String name = element.requiredText("name");
        Length width = element.requiredLength("width");
        List<RoadMarkLine> lines = new ArrayList<>();
        element.forEachChild(child -> {
            if (child.name().equals("line")) {
                lines.add(new RoadMarkLine(
                        child.requiredLength("length"),
                        child.requiredLength("space"),
                        child.requiredLength("tOffset"),
                        child.requiredNonNegativeLength("sOffset"),
                        child.optionalEnum("rule", RoadMarkRule.class),
                        child.optionalLength("width"),
                        child.optionalEnum("color", RoadMarkColor.class)));
            } else {
                child.skipUnknown();
            }
        });
        if (lines.isEmpty()) {
            throw element.missingChild("line");
        }
        return new RoadMarkTypeDetail(name, width, lines);
    }

    private static LaneMaterial decodeMaterial(ElementReader element) {
        return new LaneMaterial(
                element.requiredNonNegativeLength("sOffset"),
                element.requiredFinite("friction"),
                element.optionalDouble("roughness"),
                element.optionalText("surface"));
    }

    private static LaneSpeed decodeSpeed(ElementReader element) {
        Length sOffset = element.requiredNonNegativeLength("sOffset");
        double max = element.requiredFinite("max");
        SpeedUnit unit = element.optionalEnum("unit", SpeedUnit.class, LaneSpeed.DEFAULT_UNIT);
        return new LaneSpeed(sOffset, Speed.of(max, unit));
    }

    private static LaneAccess decodeAccess(ElementReader element) {
        return new LaneAccess(
                element.requiredNonNegativeLength("sOffset"),
                element.requiredEnum("restriction", AccessRestriction.class),
                element.optionalEnum("rule", AccessRule.class));
    }

    private static LaneHeight decodeHeight(ElementReader element) {
        return new LaneHeight(
                element.requiredNonNegativeLength("sOffset"),
                element.optionalLength("inner", Length.ZERO),
                element.optionalLength("outer", Length.ZERO));
    }
}
