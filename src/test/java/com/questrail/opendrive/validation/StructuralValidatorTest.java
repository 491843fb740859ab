package com.questrail.opendrive.validation;

import com.questrail.opendrive.TestDocuments;
import com.questrail.opendrive.api.ErrorKind;
import com.questrail.opendrive.geometry.Geometry;
import com.questrail.opendrive.geometry.Line;
import com.questrail.opendrive.model.AdditionalData;
import com.questrail.opendrive.model.Document;
import com.questrail.opendrive.model.Header;
import com.questrail.opendrive.model.junction.JunctionGroup;
import com.questrail.opendrive.model.junction.JunctionGroupType;
import com.questrail.opendrive.model.lane.LaneSection;
import com.questrail.opendrive.model.lane.Lanes;
import com.questrail.opendrive.model.object.RoadObjects;
import com.questrail.opendrive.model.object.Tunnel;
import com.questrail.opendrive.model.object.TunnelType;
import com.questrail.opendrive.model.road.PlanView;
import com.questrail.opendrive.model.road.Road;
import com.questrail.opendrive.model.signal.Signal;
import com.questrail.opendrive.model.signal.SignalDependency;
import com.questrail.opendrive.model.signal.Signals;
import com.questrail.opendrive.units.Length;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

final class StructuralValidatorTest
{
    private final StructuralValidator validator = new StructuralValidator();

    @Test
    void wellFormedRoadHasNoViolations()
    {
        assertTrue(validator.check(TestDocuments.singleRoad(TestDocuments.straightRoad("1", 10.0))).isEmpty());
    }

    @Test
    void gapInReferenceLine()
    {
        PlanView gappy = PlanView.of(
                Geometry.of(0.0, 0.0, 0.0, 0.0, 10.0, new Line()),
                Geometry.of(11.0, 11.0, 0.0, 0.0, 10.0, new Line()));
        Road road = Road.builder("1", gappy, TestDocuments.straightRoad("x", 1.0).lanes()).build();

        Violation v = validator.firstViolation(road).orElseThrow();
        assertEquals(ErrorKind.STRUCTURAL_VIOLATION, v.kind());
        assertEquals("s", v.field());
        assertTrue(v.message().startsWith("gap in reference line"), v.message());
    }

    @Test
    void overlapInReferenceLine()
    {
        PlanView overlapping = PlanView.of(
                Geometry.of(0.0, 0.0, 0.0, 0.0, 10.0, new Line()),
                Geometry.of(9.0, 9.0, 0.0, 0.0, 10.0, new Line()));
        Road road = Road.builder("1", overlapping, TestDocuments.straightRoad("x", 1.0).lanes()).build();
        assertTrue(validator.firstViolation(road).orElseThrow().message().startsWith("overlap"));
    }

    @Test
    void toleratesRoundingNoise()
    {
        PlanView noisy = PlanView.of(
                Geometry.of(0.0, 0.0, 0.0, 0.0, 0.1 + 0.2, new Line()),
                Geometry.of(0.3, 0.3, 0.0, 0.0, 1000.0, new Line()));
        Road road = Road.builder("1", noisy, TestDocuments.straightRoad("x", 1.0).lanes())
                .withLength(Length.of(1000.3000001))
                .build();
        assertTrue(validator.check(road).isEmpty(), () -> validator.check(road).toString());
    }

    @Test
    void roadLengthMustMatchReferenceLine()
    {
        Road road = Road.builder("1", TestDocuments.straight(10.0), TestDocuments.straightRoad("x", 1.0).lanes())
                .withLength(Length.of(12.0))
                .build();
        Violation v = validator.firstViolation(road).orElseThrow();
        assertEquals(ErrorKind.STRUCTURAL_VIOLATION, v.kind());
        assertEquals("length", v.field());
    }

    @Test
    void duplicateLaneIdReportedBeforeSideMismatch()
    {
        Lanes lanes = TestDocuments.singleSection(List.of(),
                List.of(TestDocuments.drivingLane(1), TestDocuments.drivingLane(1)));
        Road road = Road.builder("1", TestDocuments.straight(10.0), lanes).build();

        List<Violation> violations = validator.check(road);
        assertEquals("duplicate lane id 1 on right side", violations.get(0).message());
        assertTrue(violations.stream().anyMatch(v -> v.message().contains("does not belong on the right side")));
    }

    @Test
    void laneSectionsMustNotGoBackwards()
    {
        LaneSection first = TestDocuments.singleSection(List.of(), List.of(TestDocuments.drivingLane(-1)))
                .laneSections().get(0);
        LaneSection later = new LaneSection(Length.of(6.0), false, List.of(), TestDocuments.centerLane(),
                List.of(), AdditionalData.EMPTY);
        LaneSection earlier = new LaneSection(Length.of(4.0), false, List.of(), TestDocuments.centerLane(),
                List.of(), AdditionalData.EMPTY);
        Road road = Road.builder("1", TestDocuments.straight(10.0), Lanes.of(first, later, earlier)).build();

        Violation v = validator.firstViolation(road).orElseThrow();
        assertEquals("lanes/laneSection[2]", v.element().substring(v.element().indexOf("lanes/")));
    }

    @Test
    void malformedIdsAreUnresolvedReferences()
    {
        Road road = Road.builder("main road", TestDocuments.straight(1.0),
                TestDocuments.straightRoad("x", 1.0).lanes()).build();
        Violation v = validator.firstViolation(road).orElseThrow();
        assertEquals(ErrorKind.UNRESOLVED_REFERENCE, v.kind());
        assertEquals("id", v.field());
    }

    @Test
    void unsupportedRevisionIsReported()
    {
        Header future = new Header(1, 8, Header.current().name(), Header.current().version(),
                Header.current().date(), Header.current().north(), Header.current().south(),
                Header.current().east(), Header.current().west(), Header.current().vendor(),
                Header.current().geoReference(), Header.current().offset(), AdditionalData.EMPTY);
        Document document = Document.of(future, List.of(TestDocuments.straightRoad("1", 1.0)));
        assertEquals(ErrorKind.UNSUPPORTED_VERSION, validator.check(document).get(0).kind());
    }

    @Test
    void malformedSignalDependencyIsReported()
    {
        Signal signal = Signal.builder("20", 1.0, -3.0)
                .addDependency(new SignalDependency("", Optional.empty()))
                .build();
        Road road = Road.builder("1", TestDocuments.straight(10.0), TestDocuments.straightRoad("x", 1.0).lanes())
                .withSignals(new Signals(List.of(signal), List.of()))
                .build();

        Violation v = validator.firstViolation(road).orElseThrow();
        assertEquals(ErrorKind.UNRESOLVED_REFERENCE, v.kind());
        assertEquals("road[1]/signals/signal[20]/dependency", v.element());
        assertEquals("id", v.field());
    }

    @Test
    void malformedTunnelIdIsReported()
    {
        Tunnel tunnel = new Tunnel("north bore", Length.of(1.0), Length.of(5.0), Optional.empty(),
                TunnelType.STANDARD, Optional.empty(), Optional.empty(), List.of());
        Road road = Road.builder("1", TestDocuments.straight(10.0), TestDocuments.straightRoad("x", 1.0).lanes())
                .withObjects(new RoadObjects(List.of(), List.of(), List.of(tunnel), List.of()))
                .build();

        Violation v = validator.firstViolation(road).orElseThrow();
        assertEquals("road[1]/objects/tunnel", v.element());
    }

    @Test
    void malformedJunctionGroupMemberIsReported()
    {
        JunctionGroup group = new JunctionGroup("7", Optional.empty(), JunctionGroupType.ROUNDABOUT,
                List.of("100", "1 01"), AdditionalData.EMPTY);
        Document document = TestDocuments.singleRoad(TestDocuments.straightRoad("1", 10.0))
                .withJunctionGroups(List.of(group));

        List<Violation> violations = validator.check(document);
        assertEquals(1, violations.size());
        assertEquals("junctionGroup[7]/junctionReference", violations.get(0).element());
        assertEquals("junction", violations.get(0).field());
    }
}
