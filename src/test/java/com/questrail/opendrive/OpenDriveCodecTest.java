package com.questrail.opendrive;

import com.questrail.opendrive.api.ErrorKind;
import com.questrail.opendrive.api.OpenDriveReadException;
import com.questrail.opendrive.config.CompatibilityConfig;
import com.questrail.opendrive.config.Workaround;
import com.questrail.opendrive.geometry.ParamPoly3;
import com.questrail.opendrive.geometry.ParamPoly3Range;
import com.questrail.opendrive.geometry.Pose;
import com.questrail.opendrive.model.AdditionalData;
import com.questrail.opendrive.model.Document;
import com.questrail.opendrive.model.Header;
import com.questrail.opendrive.model.OpaqueElement;
import com.questrail.opendrive.model.UserData;
import com.questrail.opendrive.model.junction.Junction;
import com.questrail.opendrive.model.lane.Lane;
import com.questrail.opendrive.model.lane.LaneSection;
import com.questrail.opendrive.model.lane.RoadMarkColor;
import com.questrail.opendrive.model.road.Road;
import com.questrail.opendrive.model.signal.Signal;
import com.questrail.opendrive.model.signal.Signals;
import com.questrail.opendrive.observability.ReadDiagnostic;
import com.questrail.opendrive.observability.RecordingDiagnosticSink;
import com.questrail.opendrive.units.SpeedUnit;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * OpenDriveCodecTest
 * -----------------------------------------------------------------------------
 * End-to-end tests through the public {@link OpenDriveCodec} facade, using the
 * documents under {@code src/test/resources/fixtures}.
 */
final class OpenDriveCodecTest
{
    private static OpenDriveCodec codec(CompatibilityConfig config, RecordingDiagnosticSink sink)
    {
        return OpenDriveCodec.builder()
                .withCompatibility(config)
                .withDiagnosticSink(sink)
                .build();
    }

    @Test
    void readsCompleteNetwork()
    {
        Document document = OpenDriveCodec.strict().parse(Fixtures.bytes("two-lane-road.xodr"));

        assertEquals("two-lane-road", document.header().name().orElseThrow());
        assertEquals("+proj=utm +zone=32 +ellps=WGS84 +datum=WGS84 +units=m +no_defs",
                document.header().geoReference().orElseThrow());
        assertEquals(-354000.0, document.header().offset().orElseThrow().x().meters(), 0.0);

        Road main = document.findRoad("1").orElseThrow();
        assertEquals("Main Street", main.name().orElseThrow());
        assertTrue(main.junction().isEmpty());
        assertEquals(SpeedUnit.KILOMETERS_PER_HOUR, main.types().get(0).speed().orElseThrow().unit());
        assertTrue(main.planView().continuityDefects(1e-6).isEmpty());

        LaneSection section = main.lanes().laneSections().get(0);
        assertEquals(1, section.left().size());
        assertEquals(2, section.right().size());
        Lane center = section.center();
        assertEquals(RoadMarkColor.WHITE, center.roadMarks().get(0).color());
        assertEquals("dashed", center.roadMarks().get(0).detail().orElseThrow().name());

        Road connector = document.findRoad("2").orElseThrow();
        assertEquals("100", connector.junction().orElseThrow());
        assertEquals(List.of(connector), document.roadsInJunction("100"));

        Junction junction = document.findJunction("100").orElseThrow();
        assertEquals("2", junction.connections().get(0).connectingRoad().orElseThrow());
        assertTrue(document.findController("30").isPresent());
        assertTrue(document.findSignal("20").isPresent());
    }

    @Test
    void evaluatesLineSegment()
    {
        Document document = OpenDriveCodec.strict().parse(Fixtures.bytes("two-lane-road.xodr"));
        Pose pose = document.findRoad("1").orElseThrow().planView().geometries().get(0).evaluate(5.0);
        assertEquals(5.0, pose.x(), 1e-12);
        assertEquals(0.0, pose.y(), 1e-12);
        assertEquals(0.0, pose.heading(), 1e-12);
    }

    @Test
    void serializedNetworkReadsBackEqualAndIsIdempotent()
    {
        OpenDriveCodec codec = OpenDriveCodec.strict();
        Document original = codec.parse(Fixtures.bytes("two-lane-road.xodr"));

        byte[] first = codec.serialize(original);
        Document reread = codec.parse(first);
        assertEquals(original, reread);
        assertArrayEquals(first, codec.serialize(reread));
    }

    @Test
    void missingRangeFailsInStrictMode()
    {
        OpenDriveReadException e = assertThrows(OpenDriveReadException.class,
                () -> OpenDriveCodec.strict().parse(Fixtures.bytes("param-poly3-without-range.xodr")));
        assertEquals(ErrorKind.MISSING_REQUIRED_FIELD, e.kind());
        assertEquals("pRange", e.field().orElseThrow());
        assertEquals("OpenDRIVE/road/planView/geometry/paramPoly3", e.element().orElseThrow());
    }

    @Test
    void missingRangeIsNormalizedWithWorkaround()
    {
        RecordingDiagnosticSink sink = new RecordingDiagnosticSink();
        OpenDriveCodec codec = codec(CompatibilityConfig.of(Workaround.SUMO_ISSUE_10301), sink);

        Document document = codec.parse(Fixtures.bytes("param-poly3-without-range.xodr"));
        ParamPoly3 shape = (ParamPoly3) document.roads().get(0).planView().geometries().get(0).shape();
        assertEquals(ParamPoly3Range.NORMALIZED, shape.pRange());
        assertTrue(sink.hasDiagnostic(ReadDiagnostic.Kind.WORKAROUND_APPLIED, Workaround.SUMO_ISSUE_10301.flag()));

        assertTrue(codec.serializeToString(document).contains("pRange=\"normalized\""));
    }

    @Test
    void rangeToggleDoesNotAffectOtherElements()
    {
        byte[] xml = Fixtures.bytes("two-lane-road.xodr");
        OpenDriveCodec strict = OpenDriveCodec.strict();
        OpenDriveCodec lenient = codec(CompatibilityConfig.of(Workaround.SUMO_ISSUE_10301), new RecordingDiagnosticSink());

        Document a = strict.parse(xml);
        Document b = lenient.parse(xml);
        assertEquals(a, b);
        assertArrayEquals(strict.serialize(a), lenient.serialize(b));
    }

    @Test
    void referenceLineGapFails()
    {
        OpenDriveReadException e = assertThrows(OpenDriveReadException.class,
                () -> OpenDriveCodec.strict().parse(Fixtures.bytes("reference-line-gap.xodr")));
        assertEquals(ErrorKind.STRUCTURAL_VIOLATION, e.kind());
    }

    @Test
    void duplicateLaneIdFails()
    {
        OpenDriveReadException e = assertThrows(OpenDriveReadException.class,
                () -> OpenDriveCodec.strict().parse(Fixtures.bytes("duplicate-lane-id.xodr")));
        assertEquals(ErrorKind.STRUCTURAL_VIOLATION, e.kind());
        assertTrue(e.getMessage().contains("duplicate lane id 1 on right side"), e.getMessage());
    }

    @Test
    void missingRoadMarkColorFailsInStrictMode()
    {
        OpenDriveReadException e = assertThrows(OpenDriveReadException.class,
                () -> OpenDriveCodec.strict().parse(Fixtures.bytes("road-mark-without-color.xodr")));
        assertEquals(ErrorKind.MISSING_REQUIRED_FIELD, e.kind());
        assertEquals("color", e.field().orElseThrow());
    }

    @Test
    void missingRoadMarkColorIsAlwaysEmittedWithWorkaround()
    {
        RecordingDiagnosticSink sink = new RecordingDiagnosticSink();
        OpenDriveCodec codec = codec(CompatibilityConfig.of(Workaround.SUMO_ROADMARK_MISSING_COLOR), sink);

        Document document = codec.parse(Fixtures.bytes("road-mark-without-color.xodr"));
        assertEquals(RoadMarkColor.STANDARD,
                document.roads().get(0).lanes().laneSections().get(0).center().roadMarks().get(0).color());
        assertTrue(sink.hasDiagnostic(ReadDiagnostic.Kind.WORKAROUND_APPLIED,
                Workaround.SUMO_ROADMARK_MISSING_COLOR.flag()));

        String xml = codec.serializeToString(document);
        assertTrue(xml.contains("<roadMark color=\"standard\" sOffset=\"0.0\" type=\"solid\"/>"), xml);
        assertEquals(document, OpenDriveCodec.strict().parse(xml));
    }

    @Test
    void unknownContentIsReportedAndSkipped()
    {
        RecordingDiagnosticSink sink = new RecordingDiagnosticSink();
        Document document = codec(CompatibilityConfig.strict(), sink).parse(Fixtures.bytes("unknown-content.xodr"));

        assertTrue(sink.hasDiagnostic(ReadDiagnostic.Kind.UNKNOWN_ATTRIBUTE, "generator"));
        assertTrue(sink.hasDiagnostic(ReadDiagnostic.Kind.UNKNOWN_ATTRIBUTE, "surfaceQuality"));
        assertTrue(sink.hasDiagnostic(ReadDiagnostic.Kind.UNKNOWN_ELEMENT, "railroad"));
        assertFalse(sink.hasDiagnostic(ReadDiagnostic.Kind.UNKNOWN_ELEMENT, "switch"));

        ReadDiagnostic railroad = sink.ofKind(ReadDiagnostic.Kind.UNKNOWN_ELEMENT).get(0);
        assertEquals("OpenDRIVE/road/railroad", railroad.element());
        assertTrue(railroad.line() > 0);

        assertEquals("signals.xodr", document.additionalData().includes().get(0).file());
    }

    @Test
    void userDataIsPreservedVerbatim()
    {
        OpenDriveCodec codec = codec(CompatibilityConfig.strict(), new RecordingDiagnosticSink());
        Document document = codec.parse(Fixtures.bytes("unknown-content.xodr"));

        UserData userData = document.roads().get(0).additionalData().userData().get(0);
        assertEquals("vectorScene", userData.code());
        assertEquals("42", userData.value().orElseThrow());
        OpaqueElement lane = userData.content().get(0);
        assertEquals("vectorLane", lane.name());
        assertEquals(Map.of("sOffset", "0.0", "laneId", "-1"), lane.attributes());
        assertEquals("forward", lane.children().get(0).text());

        Document reread = codec.parse(codec.serialize(document));
        assertEquals(document, reread);
    }

    @Test
    void indentIsConfigurable()
    {
        Document document = TestDocuments.singleRoad(TestDocuments.straightRoad("1", 10.0));
        String xml = OpenDriveCodec.builder().withIndent("    ").build().serializeToString(document);
        assertTrue(xml.contains("\n    <road "), xml);
        assertEquals(document, OpenDriveCodec.strict().parse(xml));
    }

    @Test
    void defaultConfigurationIsStrict()
    {
        assertTrue(OpenDriveCodec.strict().compatibility().isStrict());
        assertTrue(OpenDriveCodec.builder().build().compatibility().isStrict());
    }

    @Test
    void attributeWhitespaceSurvivesRoundTrip()
    {
        UserData userData = UserData.of("note", "line one\nline two\r\n\tindented");
        Signal signal = Signal.builder("20", 5.0, -4.0).withText("STOP\tAHEAD\rSLOW").build();
        Road road = Road.builder("1", TestDocuments.straight(10.0),
                        TestDocuments.singleSection(List.of(), List.of(TestDocuments.drivingLane(-1))))
                .withName("\tMain\nStreet\r")
                .withSignals(new Signals(List.of(signal), List.of()))
                .withAdditionalData(AdditionalData.of(List.of(), List.of(userData)))
                .build();
        Document document = TestDocuments.singleRoad(road);

        OpenDriveCodec codec = OpenDriveCodec.strict();
        String xml = codec.serializeToString(document);
        assertTrue(xml.contains("name=\"&#9;Main&#10;Street&#13;\""), xml);

        Document reread = codec.parse(xml);
        Road rereadRoad = reread.roads().get(0);
        assertEquals("\tMain\nStreet\r", rereadRoad.name().orElseThrow());
        assertEquals("line one\nline two\r\n\tindented",
                rereadRoad.additionalData().userData().get(0).value().orElseThrow());
        assertEquals("STOP\tAHEAD\rSLOW",
                rereadRoad.signals().orElseThrow().signals().get(0).text().orElseThrow());
        assertEquals(document, reread);
    }

    @Test
    void cdataTerminatorInGeoReferenceSurvivesRoundTrip()
    {
        Header header = Header.current().withGeoReference("+proj=a]]>b +units=m");
        Document document = Document.of(header, List.of(TestDocuments.straightRoad("1", 10.0)));

        OpenDriveCodec codec = OpenDriveCodec.strict();
        byte[] xml = codec.serialize(document);
        Document reread = codec.parse(xml);
        assertEquals("+proj=a]]>b +units=m", reread.header().geoReference().orElseThrow());
        assertEquals(document, reread);
        assertArrayEquals(xml, codec.serialize(reread));
    }

    @Test
    void surroundingWhitespaceIsDroppedFromTextContent()
    {
        Header header = Header.current().withGeoReference("  +proj=utm +zone=32\n");
        assertEquals("+proj=utm +zone=32", header.geoReference().orElseThrow());

        OpaqueElement note = new OpaqueElement("note", Map.of(), List.of(), "\n    padded text\n  ");
        assertEquals("padded text", note.text());

        UserData userData = new UserData("vendorNotes", Optional.empty(), List.of(note));
        Road road = Road.builder("1", TestDocuments.straight(10.0),
                        TestDocuments.singleSection(List.of(), List.of(TestDocuments.drivingLane(-1))))
                .withAdditionalData(AdditionalData.of(List.of(), List.of(userData)))
                .build();
        Document document = Document.of(header, List.of(road));

        OpenDriveCodec codec = OpenDriveCodec.strict();
        Document reread = codec.parse(codec.serialize(document));
        assertEquals(document, reread);
        assertEquals("padded text",
                reread.roads().get(0).additionalData().userData().get(0).content().get(0).text());
    }
}
