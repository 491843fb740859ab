package com.questrail.opendrive.fuzzing;

import com.questrail.opendrive.OpenDriveVersion;
import com.questrail.opendrive.api.XmlEnum;
import com.questrail.opendrive.geometry.Arc;
import com.questrail.opendrive.geometry.CubicPolynomial;
import com.questrail.opendrive.geometry.Geometry;
import com.questrail.opendrive.geometry.GeometryShape;
import com.questrail.opendrive.geometry.Line;
import com.questrail.opendrive.geometry.ParamPoly3;
import com.questrail.opendrive.geometry.ParamPoly3Range;
import com.questrail.opendrive.geometry.Poly3;
import com.questrail.opendrive.geometry.Pose;
import com.questrail.opendrive.geometry.Spiral;
import com.questrail.opendrive.model.AdditionalData;
import com.questrail.opendrive.model.ContactPoint;
import com.questrail.opendrive.model.DataQuality;
import com.questrail.opendrive.model.DataQualityError;
import com.questrail.opendrive.model.Document;
import com.questrail.opendrive.model.ElementDir;
import com.questrail.opendrive.model.Header;
import com.questrail.opendrive.model.HeaderOffset;
import com.questrail.opendrive.model.Include;
import com.questrail.opendrive.model.OpaqueElement;
import com.questrail.opendrive.model.Orientation;
import com.questrail.opendrive.model.PostProcessing;
import com.questrail.opendrive.model.RawData;
import com.questrail.opendrive.model.RawDataSource;
import com.questrail.opendrive.model.UserData;
import com.questrail.opendrive.model.junction.Connection;
import com.questrail.opendrive.model.junction.ConnectionLink;
import com.questrail.opendrive.model.junction.ConnectionType;
import com.questrail.opendrive.model.junction.Junction;
import com.questrail.opendrive.model.junction.JunctionController;
import com.questrail.opendrive.model.junction.JunctionGroup;
import com.questrail.opendrive.model.junction.JunctionGroupType;
import com.questrail.opendrive.model.junction.JunctionLaneLink;
import com.questrail.opendrive.model.junction.JunctionPriority;
import com.questrail.opendrive.model.junction.JunctionSurface;
import com.questrail.opendrive.model.junction.JunctionType;
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
import com.questrail.opendrive.model.object.BorderType;
import com.questrail.opendrive.model.object.Bridge;
import com.questrail.opendrive.model.object.BridgeType;
import com.questrail.opendrive.model.object.ObjectBorder;
import com.questrail.opendrive.model.object.ObjectMarking;
import com.questrail.opendrive.model.object.ObjectMaterial;
import com.questrail.opendrive.model.object.ObjectReference;
import com.questrail.opendrive.model.object.ObjectRepeat;
import com.questrail.opendrive.model.object.ObjectSurface;
import com.questrail.opendrive.model.object.ObjectType;
import com.questrail.opendrive.model.object.Outline;
import com.questrail.opendrive.model.object.OutlineCorner;
import com.questrail.opendrive.model.object.OutlineFillType;
import com.questrail.opendrive.model.object.ParkingAccess;
import com.questrail.opendrive.model.object.ParkingSpace;
import com.questrail.opendrive.model.object.RoadObject;
import com.questrail.opendrive.model.object.RoadObjects;
import com.questrail.opendrive.model.object.SideType;
import com.questrail.opendrive.model.object.Tunnel;
import com.questrail.opendrive.model.object.TunnelType;
import com.questrail.opendrive.model.road.CrgMode;
import com.questrail.opendrive.model.road.CrgOrientation;
import com.questrail.opendrive.model.road.CrgPurpose;
import com.questrail.opendrive.model.road.Elevation;
import com.questrail.opendrive.model.road.ElevationProfile;
import com.questrail.opendrive.model.road.LateralProfile;
import com.questrail.opendrive.model.road.LateralShape;
import com.questrail.opendrive.model.road.LinkElementType;
import com.questrail.opendrive.model.road.MaxSpeed;
import com.questrail.opendrive.model.road.PlanView;
import com.questrail.opendrive.model.road.Road;
import com.questrail.opendrive.model.road.RoadCrg;
import com.questrail.opendrive.model.road.RoadLink;
import com.questrail.opendrive.model.road.RoadLinkTarget;
import com.questrail.opendrive.model.road.RoadSpeed;
import com.questrail.opendrive.model.road.RoadSurface;
import com.questrail.opendrive.model.road.RoadType;
import com.questrail.opendrive.model.road.RoadTypeEntry;
import com.questrail.opendrive.model.road.Superelevation;
import com.questrail.opendrive.model.road.TrafficRule;
import com.questrail.opendrive.model.signal.Control;
import com.questrail.opendrive.model.signal.Controller;
import com.questrail.opendrive.model.signal.LaneValidity;
import com.questrail.opendrive.model.signal.ReferencedElementType;
import com.questrail.opendrive.model.signal.Signal;
import com.questrail.opendrive.model.signal.SignalDependency;
import com.questrail.opendrive.model.signal.SignalElementReference;
import com.questrail.opendrive.model.signal.SignalPosition;
import com.questrail.opendrive.model.signal.SignalReference;
import com.questrail.opendrive.model.signal.Signals;
import com.questrail.opendrive.units.Angle;
import com.questrail.opendrive.units.Curvature;
import com.questrail.opendrive.units.Length;
import com.questrail.opendrive.units.Speed;
import com.questrail.opendrive.units.SpeedUnit;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.function.Supplier;

/**
 * ArbitraryDocuments
 * ------------------
 *
 * Seeded generator of well-formed {@link Document}s.
 *
 * <p>Every generated document satisfies the structural invariants the reader and
 * writer enforce: the reference line is contiguous from {@code s = 0} to the road
 * length, lane sections start at 0 and are ordered, lane ids are unique and
 * correctly signed per side, and per-lane offsets are ordered. All other fields
 * are drawn freely, including every optional field and every enumeration
 * constant.</p>
 *
 * <p>Free-text fields mix plain words with whitespace (tab, line feed and
 * carriage return included), markup characters, {@code ]]>}, non-ASCII text and
 * the empty string. Ids stay numeric, and no string holds a code point XML 1.0
 * cannot carry.</p>
 *
 * <p>The same seed always yields the same sequence of documents.</p>
 */
public final class ArbitraryDocuments
{
    private static final String ALPHABET = "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";
    private static final String[] AWKWARD = {
            " ", "  ", "\t", "\n", "\r", "\r\n", "&", "<", ">", "\"", "'", "&amp;", "]]>", "<![CDATA[",
            "\u00e9", "Stra\u00dfe", "\u6771\u4eac", "\uD83D\uDE97", "\u00a0"
    };

    private final Random random;
    private int nextId;

    public ArbitraryDocuments(long seed) {
        this(new Random(seed));
    }

    public ArbitraryDocuments(Random random) {
        this.random = random;
    }

    public Document next() {
        nextId = 1;
        List<Road> roads = listOf(1, 3, this::road);
        List<Controller> controllers = listOf(0, 2, this::controller);
        List<Junction> junctions = listOf(0, 2, this::junction);
        List<JunctionGroup> groups = listOf(0, 2, this::junctionGroup);
        return new Document(header(), roads, controllers, junctions, groups, additionalData());
    }

    // ---------------------------------------------------------------------
    // Header
    // ---------------------------------------------------------------------

    private Header header() {
        return new Header(
                OpenDriveVersion.STANDARD_REV_MAJOR,
                random.nextInt(OpenDriveVersion.STANDARD_REV_MINOR + 1),
                maybe(this::text),
                maybe(() -> "1." + random.nextInt(10)),
                maybe(() -> "2023-0" + (1 + random.nextInt(9)) + "-1" + random.nextInt(10)),
                maybe(this::anyLength),
                maybe(this::anyLength),
                maybe(this::anyLength),
                maybe(this::anyLength),
                maybe(this::text),
                maybe(() -> random.nextBoolean()
                        ? "+proj=tmerc +lat_0=" + random.nextInt(90) + " +lon_0=" + random.nextInt(180) + " +ellps=WGS84"
                        : text()),
                maybe(() -> new HeaderOffset(anyLength(), anyLength(), anyLength(), anyAngle())),
                additionalData());
    }

    // ---------------------------------------------------------------------
    // Roads
    // ---------------------------------------------------------------------

    private Road road() {
        PlanView planView = planView();
        double length = planView.length();
        Road.Builder road = Road.builder(id(), planView, lanes(length))
                .withLength(Length.of(length))
                .withRule(pick(TrafficRule.class))
                .withAdditionalData(additionalData());
        maybe(this::text).ifPresent(road::withName);
        maybe(this::id).ifPresent(road::withJunction);
        maybe(this::roadLink).ifPresent(road::withLink);
        double s = 0.0;
        for (int i = random.nextInt(3); i > 0; i--) {
            road.addType(new RoadTypeEntry(Length.of(s), pick(RoadType.class), maybe(() -> "DE"),
                    maybe(this::roadSpeed)));
            s += nonNegative();
        }
        maybe(() -> new ElevationProfile(listOf(0, 3,
                () -> new Elevation(nonNegativeLength(), polynomial())))).ifPresent(road::withElevationProfile);
        maybe(() -> new LateralProfile(
                listOf(0, 2, () -> new Superelevation(nonNegativeLength(), polynomial())),
                listOf(0, 2, () -> new LateralShape(nonNegativeLength(), anyLength(), polynomial()))))
                .ifPresent(road::withLateralProfile);
        maybe(() -> new RoadObjects(listOf(0, 3, this::roadObject), listOf(0, 2, this::objectReference),
                listOf(0, 1, this::tunnel), listOf(0, 1, this::bridge))).ifPresent(road::withObjects);
        maybe(() -> new Signals(listOf(0, 3, this::signal), listOf(0, 2, this::signalReference)))
                .ifPresent(road::withSignals);
        maybe(() -> new RoadSurface(listOf(0, 2, this::roadCrg))).ifPresent(road::withSurface);
        return road.build();
    }

    private RoadCrg roadCrg() {
        return new RoadCrg(text(), nonNegativeLength(), nonNegativeLength(), pick(CrgOrientation.class),
                pick(CrgMode.class), maybe(() -> pick(CrgPurpose.class)), maybe(this::anyLength),
                maybe(this::anyLength), maybe(this::anyLength), maybe(random::nextDouble), maybe(this::anyAngle));
    }

    private PlanView planView() {
        List<Geometry> geometries = new ArrayList<>();
        Pose pose = new Pose(anyDouble(), anyDouble(), anyDouble() / 10.0);
        double s = 0.0;
        for (int i = 1 + random.nextInt(4); i > 0; i--) {
            Geometry geometry = Geometry.startingAt(s, pose, 1.0 + random.nextDouble() * 99.0, shape());
            if (random.nextInt(5) == 0) {
                geometry = geometry.withAdditionalData(additionalData());
            }
            geometries.add(geometry);
            s = geometry.end();
            pose = geometry.endPose();
        }
        return new PlanView(geometries);
    }

    private GeometryShape shape() {
        return switch (random.nextInt(5)) {
            case 0 -> new Line();
            case 1 -> new Arc(curvature());
            case 2 -> new Spiral(curvature(), curvature());
            case 3 -> new Poly3(new CubicPolynomial(0.0, small(), small() / 10.0, small() / 100.0));
            default -> new ParamPoly3(
                    new CubicPolynomial(0.0, 1.0 + random.nextDouble(), small(), small() / 10.0),
                    new CubicPolynomial(0.0, small(), small(), small() / 10.0),
                    pick(ParamPoly3Range.class));
        };
    }

    private RoadLink roadLink() {
        return new RoadLink(maybe(this::roadLinkTarget), maybe(this::roadLinkTarget));
    }

    private RoadLinkTarget roadLinkTarget() {
        return new RoadLinkTarget(id(), maybe(() -> pick(LinkElementType.class)), maybe(() -> pick(ContactPoint.class)),
                maybe(() -> pick(ElementDir.class)), maybe(this::nonNegativeLength));
    }

    private RoadSpeed roadSpeed() {
        MaxSpeed max = switch (random.nextInt(4)) {
            case 0 -> MaxSpeed.noLimit();
            case 1 -> MaxSpeed.undefined();
            default -> MaxSpeed.of(nonNegative());
        };
        return new RoadSpeed(max, pick(SpeedUnit.class));
    }

    // ---------------------------------------------------------------------
    // Lanes
    // ---------------------------------------------------------------------

    private Lanes lanes(double roadLength) {
        List<LaneOffset> offsets = listOf(0, 2, () -> new LaneOffset(nonNegativeLength(), polynomial()));
        List<LaneSection> sections = new ArrayList<>();
        double s = 0.0;
        for (int i = 1 + random.nextInt(3); i > 0; i--) {
            sections.add(laneSection(s));
            s += random.nextDouble() * roadLength / 3.0;
        }
        return new Lanes(offsets, sections);
    }

    private LaneSection laneSection(double s) {
        List<Lane> left = new ArrayList<>();
        for (int id = random.nextInt(3); id > 0; id--) {
            left.add(lane(id));
        }
        List<Lane> right = new ArrayList<>();
        for (int id = -1, n = random.nextInt(3); id >= -n; id--) {
            right.add(lane(id));
        }
        return new LaneSection(Length.of(s), random.nextBoolean(), left, lane(0), right,
                random.nextInt(4) == 0 ? additionalData() : AdditionalData.EMPTY);
    }

    private Lane lane(int id) {
        Lane.Builder lane = Lane.builder(id, pick(LaneType.class)).withLevel(random.nextBoolean());
        maybe(() -> new LaneLink(listOf(0, 2, this::laneId), listOf(0, 2, this::laneId))).ifPresent(lane::withLink);
        if (id != 0) {
            double sOffset = 0.0;
            for (int i = random.nextInt(3); i > 0; i--) {
                lane.addBoundary(random.nextBoolean()
                        ? new LaneWidth(Length.of(sOffset), polynomial())
                        : new LaneBorder(Length.of(sOffset), polynomial()));
                sOffset += nonNegative();
            }
        }
        double markOffset = 0.0;
        for (int i = random.nextInt(3); i > 0; i--) {
            lane.addRoadMark(roadMark(markOffset));
            markOffset += nonNegative();
        }
        for (int i = random.nextInt(2); i > 0; i--) {
            lane.addMaterial(new LaneMaterial(nonNegativeLength(), random.nextDouble(), maybe(random::nextDouble),
                    maybe(this::text)));
        }
        for (int i = random.nextInt(2); i > 0; i--) {
            lane.addSpeed(new LaneSpeed(nonNegativeLength(), Speed.of(nonNegative(), pick(SpeedUnit.class))));
        }
        for (int i = random.nextInt(2); i > 0; i--) {
            lane.addAccess(new LaneAccess(nonNegativeLength(), pick(AccessRestriction.class),
                    maybe(() -> pick(AccessRule.class))));
        }
        for (int i = random.nextInt(2); i > 0; i--) {
            lane.addHeight(new LaneHeight(nonNegativeLength(),
                    random.nextBoolean() ? Length.ZERO : anyLength(),
                    random.nextBoolean() ? Length.ZERO : anyLength()));
        }
        for (int i = random.nextInt(2); i > 0; i--) {
            lane.addRule(new LaneRule(nonNegativeLength(), text()));
        }
        if (random.nextInt(5) == 0) {
            lane.withAdditionalData(additionalData());
        }
        return lane.build();
    }

    private RoadMark roadMark(double sOffset) {
        return new RoadMark(
                Length.of(sOffset),
                pick(RoadMarkType.class),
                pick(RoadMarkColor.class),
                maybe(() -> pick(RoadMarkWeight.class)),
                maybe(this::nonNegativeLength),
                maybe(this::nonNegativeLength),
                pick(LaneChange.class),
                random.nextBoolean() ? RoadMark.DEFAULT_MATERIAL : word(),
                listOf(0, 2, () -> new RoadMarkSway(nonNegativeLength(), polynomial())),
                maybe(this::typeDetail),
                maybe(this::explicit));
    }

    private RoadMarkExplicit explicit() {
        return new RoadMarkExplicit(listOf(1, 3, () -> new RoadMarkExplicitLine(
                nonNegativeLength(),
                anyLength(),
                nonNegativeLength(),
                maybe(() -> pick(RoadMarkRule.class)),
                maybe(this::nonNegativeLength))),
                random.nextInt(4) == 0 ? additionalData() : AdditionalData.EMPTY);
    }

    private RoadMarkTypeDetail typeDetail() {
        return new RoadMarkTypeDetail(text(), nonNegativeLength(), listOf(1, 3, () -> new RoadMarkLine(
                nonNegativeLength(),
                nonNegativeLength(),
                anyLength(),
                nonNegativeLength(),
                maybe(() -> pick(RoadMarkRule.class)),
                maybe(this::nonNegativeLength),
                maybe(() -> pick(RoadMarkColor.class)))));
    }

    // ---------------------------------------------------------------------
    // Objects and signals
    // ---------------------------------------------------------------------

    private RoadObject roadObject() {
        RoadObject.Builder object = RoadObject.builder(id(), nonNegative(), anyDouble())
                .withZOffset(anyLength())
                .withDynamic(random.nextBoolean());
        if (random.nextBoolean()) {
            object.withType(pick(ObjectType.class), random.nextBoolean() ? text() : null);
        }
        maybe(this::text).ifPresent(object::withName);
        maybe(() -> pick(Orientation.class)).ifPresent(object::withOrientation);
        if (random.nextBoolean()) {
            object.withRotation(anyAngle(), anyAngle(), anyAngle());
        }
        if (random.nextBoolean()) {
            object.withBox(nonNegativeLength(), nonNegativeLength(), nonNegativeLength());
        }
        maybe(this::nonNegativeLength).ifPresent(object::withRadius);
        maybe(this::nonNegativeLength).ifPresent(object::withValidLength);
        maybe(random::nextBoolean).ifPresent(object::withPerpToRoad);
        listOf(0, 2, this::repeat).forEach(object::addRepeat);
        maybe(this::outline).ifPresent(object::withOutline);
        listOf(0, 2, this::outline).forEach(object::addOutline);
        listOf(0, 2, () -> new ObjectMaterial(maybe(this::text), maybe(random::nextDouble), maybe(random::nextDouble)))
                .forEach(object::addMaterial);
        listOf(0, 2, this::validity).forEach(object::addValidity);
        maybe(() -> new ParkingSpace(pick(ParkingAccess.class), maybe(this::text))).ifPresent(object::withParkingSpace);
        listOf(0, 2, this::marking).forEach(object::addMarking);
        listOf(0, 2, this::border).forEach(object::addBorder);
        maybe(() -> new ObjectSurface(maybe(() -> new ObjectSurface.Crg(maybe(this::text), maybe(random::nextBoolean),
                maybe(random::nextDouble))))).ifPresent(object::withSurface);
        if (random.nextInt(4) == 0) {
            object.withAdditionalData(additionalData());
        }
        return object.build();
    }

    private ObjectRepeat repeat() {
        return new ObjectRepeat(nonNegativeLength(), nonNegativeLength(), nonNegativeLength(), anyLength(),
                anyLength(), nonNegativeLength(), nonNegativeLength(), maybe(this::anyLength), maybe(this::anyLength),
                maybe(this::nonNegativeLength), maybe(this::nonNegativeLength), maybe(this::nonNegativeLength),
                maybe(this::nonNegativeLength), maybe(this::nonNegativeLength), maybe(this::nonNegativeLength));
    }

    private Outline outline() {
        return new Outline(maybe(() -> random.nextInt(100)), maybe(() -> pick(OutlineFillType.class)),
                maybe(random::nextBoolean), maybe(random::nextBoolean), maybe(() -> pick(LaneType.class)),
                listOf(1, 4, this::corner), random.nextInt(4) == 0 ? additionalData() : AdditionalData.EMPTY);
    }

    private OutlineCorner corner() {
        if (random.nextBoolean()) {
            return new OutlineCorner.Road(nonNegativeLength(), anyLength(), anyLength(), nonNegativeLength(),
                    maybe(() -> random.nextInt(100)));
        }
        return new OutlineCorner.Local(anyLength(), anyLength(), anyLength(), nonNegativeLength(),
                maybe(() -> random.nextInt(100)));
    }

    private ObjectMarking marking() {
        return new ObjectMarking(pick(RoadMarkColor.class), nonNegativeLength(), nonNegativeLength(), anyLength(),
                anyLength(), maybe(() -> pick(SideType.class)), maybe(() -> pick(RoadMarkWeight.class)),
                maybe(this::nonNegativeLength), maybe(this::anyLength), listOf(0, 3, () -> random.nextInt(100)));
    }

    private ObjectBorder border() {
        return new ObjectBorder(pick(BorderType.class), nonNegativeLength(), random.nextInt(100),
                maybe(random::nextBoolean), listOf(0, 3, () -> random.nextInt(100)));
    }

    private ObjectReference objectReference() {
        return new ObjectReference(id(), nonNegativeLength(), anyLength(), maybe(this::anyLength),
                maybe(this::nonNegativeLength), pick(Orientation.class), listOf(0, 2, this::validity));
    }

    private Tunnel tunnel() {
        return new Tunnel(id(), nonNegativeLength(), nonNegativeLength(), maybe(this::text), pick(TunnelType.class),
                maybe(random::nextDouble), maybe(random::nextDouble), listOf(0, 2, this::validity));
    }

    private Bridge bridge() {
        return new Bridge(id(), nonNegativeLength(), nonNegativeLength(), maybe(this::text), pick(BridgeType.class),
                listOf(0, 2, this::validity));
    }

    private Signal signal() {
        Signal.Builder signal = Signal.builder(id(), nonNegative(), anyDouble())
                .withZOffset(anyLength())
                .withDynamic(random.nextBoolean())
                .withOrientation(pick(Orientation.class))
                .withType(random.nextBoolean() ? "-1" : String.valueOf(100 + random.nextInt(900)),
                        random.nextBoolean() ? "-1" : String.valueOf(random.nextInt(100)));
        maybe(this::text).ifPresent(signal::withName);
        if (random.nextBoolean()) {
            signal.withCountry("DE", random.nextBoolean() ? "2017" : null);
        }
        if (random.nextBoolean()) {
            signal.withValue(nonNegative(), random.nextBoolean() ? "km/h" : null);
        }
        if (random.nextBoolean()) {
            signal.withSize(nonNegativeLength(), nonNegativeLength());
        }
        maybe(this::text).ifPresent(signal::withText);
        if (random.nextBoolean()) {
            signal.withRotation(anyAngle(), anyAngle(), anyAngle());
        }
        listOf(0, 2, this::validity).forEach(signal::addValidity);
        listOf(0, 2, () -> new SignalDependency(id(), maybe(this::text))).forEach(signal::addDependency);
        listOf(0, 2, () -> new SignalElementReference(pick(ReferencedElementType.class), id(), maybe(this::text)))
                .forEach(signal::addReference);
        maybe(this::signalPosition).ifPresent(signal::withPosition);
        if (random.nextInt(4) == 0) {
            signal.withAdditionalData(additionalData());
        }
        return signal.build();
    }

    private SignalPosition signalPosition() {
        if (random.nextBoolean()) {
            return new SignalPosition.Road(id(), nonNegativeLength(), anyLength(), anyLength(), anyAngle(),
                    maybe(this::anyAngle), maybe(this::anyAngle));
        }
        return new SignalPosition.Inertial(anyLength(), anyLength(), anyLength(), anyAngle(),
                maybe(this::anyAngle), maybe(this::anyAngle));
    }

    private SignalReference signalReference() {
        return new SignalReference(id(), nonNegativeLength(), anyLength(), pick(Orientation.class),
                listOf(0, 2, this::validity));
    }

    private LaneValidity validity() {
        return new LaneValidity(laneId(), laneId());
    }

    private Controller controller() {
        return new Controller(id(), maybe(this::text), maybe(() -> random.nextInt(10)),
                listOf(0, 3, () -> new Control(id(), maybe(this::text))));
    }

    // ---------------------------------------------------------------------
    // Junctions
    // ---------------------------------------------------------------------

    private Junction junction() {
        return new Junction(
                id(),
                maybe(this::text),
                pick(JunctionType.class),
                maybe(this::id),
                maybe(() -> pick(Orientation.class)),
                maybe(this::nonNegativeLength),
                maybe(this::nonNegativeLength),
                listOf(1, 3, this::connection),
                listOf(0, 2, () -> new JunctionPriority(maybe(this::id), maybe(this::id))),
                listOf(0, 2, () -> new JunctionController(id(), maybe(this::text), maybe(() -> random.nextInt(10)))),
                maybe(() -> new JunctionSurface(listOf(0, 2, () -> new JunctionSurface.Crg(text(), CrgMode.GLOBAL,
                        maybe(() -> pick(CrgPurpose.class)), maybe(this::anyLength), maybe(random::nextDouble))))),
                additionalData());
    }

    private JunctionGroup junctionGroup() {
        return new JunctionGroup(id(), maybe(this::text), pick(JunctionGroupType.class), listOf(1, 3, this::id),
                additionalData());
    }

    private Connection connection() {
        return new Connection(
                id(),
                maybe(this::id),
                maybe(this::id),
                maybe(this::id),
                maybe(() -> pick(ContactPoint.class)),
                pick(ConnectionType.class),
                maybe(this::connectionLink),
                maybe(this::connectionLink),
                listOf(0, 3, () -> new JunctionLaneLink(laneId(), laneId())));
    }

    private ConnectionLink connectionLink() {
        return new ConnectionLink(id(), pick(LinkElementType.class), nonNegativeLength(), pick(ElementDir.class));
    }

    // ---------------------------------------------------------------------
    // Extension content
    // ---------------------------------------------------------------------

    private AdditionalData additionalData() {
        if (random.nextInt(3) != 0) {
            return AdditionalData.EMPTY;
        }
        return new AdditionalData(
                listOf(0, 2, () -> new Include(text() + ".xodr")),
                listOf(0, 2, () -> new UserData(text(), maybe(this::text), listOf(0, 2, () -> opaque(2)))),
                maybe(this::dataQuality));
    }

    private DataQuality dataQuality() {
        return new DataQuality(
                maybe(() -> new DataQualityError(anyLength(), anyLength(), anyLength(), anyLength())),
                maybe(() -> new RawData(text(), pick(RawDataSource.class), maybe(this::text),
                        pick(PostProcessing.class), maybe(this::text))));
    }

    private OpaqueElement opaque(int depth) {
        Map<String, String> attributes = new LinkedHashMap<>();
        for (int i = random.nextInt(3); i > 0; i--) {
            attributes.put("attr" + i, text());
        }
        List<OpaqueElement> children = depth == 0 ? List.of() : listOf(0, 2, () -> opaque(depth - 1));
        return new OpaqueElement("vendor" + random.nextInt(5), attributes, children,
                random.nextBoolean() ? text() : "");
    }

    // ---------------------------------------------------------------------
    // Primitives
    // ---------------------------------------------------------------------

    private String id() {
        return String.valueOf(nextId++);
    }

    private String word() {
        StringBuilder word = new StringBuilder();
        for (int i = 1 + random.nextInt(8); i > 0; i--) {
            word.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return word.toString();
    }

    /**
     * Free text: words interleaved with fragments that need escaping or
     * survive XML parsing only when written carefully. One call in eight
     * yields the empty string.
     */
    private String text() {
        if (random.nextInt(8) == 0) {
            return "";
        }
        StringBuilder text = new StringBuilder();
        for (int i = 1 + random.nextInt(5); i > 0; i--) {
            text.append(random.nextBoolean() ? word() : AWKWARD[random.nextInt(AWKWARD.length)]);
        }
        return text.toString();
    }

    private int laneId() {
        return random.nextInt(7) - 3;
    }

    private double anyDouble() {
        return (random.nextDouble() - 0.5) * 2000.0;
    }

    private double nonNegative() {
        return random.nextDouble() * 100.0;
    }

    private double small() {
        return (random.nextDouble() - 0.5) * 0.02;
    }

    private Length anyLength() {
        return Length.of(anyDouble());
    }

    private Length nonNegativeLength() {
        return Length.of(nonNegative());
    }

    private Angle anyAngle() {
        return Angle.ofRadians((random.nextDouble() - 0.5) * 2.0 * Math.PI);
    }

    private Curvature curvature() {
        return Curvature.of(small());
    }

    private CubicPolynomial polynomial() {
        return new CubicPolynomial(anyDouble() / 100.0, small(), small(), small());
    }

    private <E extends Enum<E> & XmlEnum> E pick(Class<E> type) {
        E[] values = type.getEnumConstants();
        return values[random.nextInt(values.length)];
    }

    private <T> Optional<T> maybe(Supplier<T> supplier) {
        return random.nextBoolean() ? Optional.of(supplier.get()) : Optional.empty();
    }

    private <T> List<T> listOf(int min, int max, Supplier<T> supplier) {
        int size = min + random.nextInt(max - min + 1);
        List<T> values = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            values.add(supplier.get());
        }
        return values;
    }
}
