package com.questrail.opendrive.internal.decode;

import com.questrail.opendrive.Fixtures;
import com.questrail.opendrive.api.ErrorKind;
import com.questrail.opendrive.api.OpenDriveReadException;
import com.questrail.opendrive.config.CompatibilityConfig;
import com.questrail.opendrive.geometry.Line;
import com.questrail.opendrive.model.Document;
import com.questrail.opendrive.model.lane.Lane;
import com.questrail.opendrive.model.lane.LaneType;
import com.questrail.opendrive.model.lane.RoadMarkColor;
import com.questrail.opendrive.model.road.Road;
import com.questrail.opendrive.observability.ReadDiagnostic;
import com.questrail.opendrive.observability.RecordingDiagnosticSink;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * OpenDriveDocumentDecoderTest
 * -----------------------------------------------------------------------------
 * Unit tests for {@link OpenDriveDocumentDecoder}.
 *
 * <p>Each failure test starts from a minimal valid document and damages exactly
 * one fragment of it, then checks the reported {@link ErrorKind}, the element
 * path and the offending field.</p>
 */
final class OpenDriveDocumentDecoderTest
{
    private static final String HEADER = "<header revMajor=\"1\" revMinor=\"7\"/>";
    private static final String ROAD = "<road id=\"1\" length=\"10\" junction=\"-1\">";
    private static final String GEOMETRY = "<geometry s=\"0.0\" x=\"0.0\" y=\"0.0\" hdg=\"0.0\" length=\"10.0\">";
    private static final String SHAPE = "<line/>";
    private static final String ROAD_MARK = "<roadMark sOffset=\"0.0\" type=\"solid\" color=\"standard\"/>";

    private static final String MINIMAL =
            "<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n"
                    + "<OpenDRIVE>\n"
                    + "  " + HEADER + "\n"
                    + "  " + ROAD + "\n"
                    + "    <planView>" + GEOMETRY + SHAPE + "</geometry></planView>\n"
                    + "    <lanes><laneSection s=\"0.0\"><center><lane id=\"0\" type=\"none\">"
                    + ROAD_MARK
                    + "</lane></center></laneSection></lanes>\n"
                    + "  </road>\n"
                    + "</OpenDRIVE>\n";

    private final RecordingDiagnosticSink sink = new RecordingDiagnosticSink();
    private final OpenDriveDocumentDecoder decoder =
            new OpenDriveDocumentDecoder(CompatibilityConfig.strict(), sink);

    private Document decode(String xml)
    {
        return decoder.decode(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)));
    }

    private static String damage(String fragment, String replacement)
    {
        assertEquals(MINIMAL.indexOf(fragment), MINIMAL.lastIndexOf(fragment), "fragment must be unique");
        assertTrue(MINIMAL.contains(fragment), fragment);
        return MINIMAL.replace(fragment, replacement);
    }

    private OpenDriveReadException failure(String xml)
    {
        return assertThrows(OpenDriveReadException.class, () -> decode(xml));
    }

    @Test
    void decodesMinimalDocument()
    {
        Document document = decode(MINIMAL);

        assertEquals(1, document.header().revMajor());
        assertEquals(7, document.header().revMinor());
        Road road = document.roads().get(0);
        assertEquals("1", road.id());
        assertTrue(road.junction().isEmpty());
        assertEquals(10.0, road.length().meters(), 0.0);
        assertInstanceOf(Line.class, road.planView().geometries().get(0).shape());

        Lane center = road.lanes().laneSections().get(0).center();
        assertEquals(0, center.id());
        assertEquals(LaneType.NONE, center.type());
        assertEquals(RoadMarkColor.STANDARD, center.roadMarks().get(0).color());
        assertTrue(road.lanes().laneSections().get(0).right().isEmpty());
        assertTrue(sink.getAll().isEmpty());
    }

    @Test
    void junctionMembershipIsKept()
    {
        Road road = decode(damage(ROAD, "<road id=\"1\" length=\"10\" junction=\"100\">")).roads().get(0);
        assertEquals("100", road.junction().orElseThrow());
    }

    @Test
    void truncatedDocumentIsMalformedXml()
    {
        String truncated = MINIMAL.substring(0, MINIMAL.indexOf("</OpenDRIVE>"));
        assertEquals(ErrorKind.MALFORMED_XML, failure(truncated).kind());
    }

    @Test
    void mismatchedTagIsMalformedXml()
    {
        assertEquals(ErrorKind.MALFORMED_XML, failure(damage("</planView>", "</planview>")).kind());
    }

    @Test
    void missingHeadingIsReportedWithPath()
    {
        OpenDriveReadException e = failure(damage(GEOMETRY, GEOMETRY.replace(" hdg=\"0.0\"", "")));
        assertEquals(ErrorKind.MISSING_REQUIRED_FIELD, e.kind());
        assertEquals("OpenDRIVE/road/planView/geometry", e.element().orElseThrow());
        assertEquals("hdg", e.field().orElseThrow());
        assertTrue(e.line() > 0);
    }

    @Test
    void missingHeaderElement()
    {
        OpenDriveReadException e = failure(damage(HEADER, ""));
        assertEquals(ErrorKind.MISSING_REQUIRED_FIELD, e.kind());
        assertEquals("header", e.field().orElseThrow());
    }

    @Test
    void missingShape()
    {
        OpenDriveReadException e = failure(damage(SHAPE, ""));
        assertEquals(ErrorKind.MISSING_REQUIRED_FIELD, e.kind());
    }

    @Test
    void unknownRoadMarkType()
    {
        OpenDriveReadException e = failure(damage(ROAD_MARK, ROAD_MARK.replace("solid", "wavy")));
        assertEquals(ErrorKind.INVALID_ENUM_VALUE, e.kind());
        assertEquals("type", e.field().orElseThrow());
        assertEquals("wavy", e.rawText().orElseThrow());
    }

    @Test
    void numberWithUnitSuffix()
    {
        OpenDriveReadException e = failure(damage(GEOMETRY, GEOMETRY.replace("x=\"0.0\"", "x=\"1.0m\"")));
        assertEquals(ErrorKind.MALFORMED_NUMBER, e.kind());
        assertEquals("x", e.field().orElseThrow());
        assertEquals("1.0m", e.rawText().orElseThrow());
    }

    @Test
    void nonIntegerLaneId()
    {
        OpenDriveReadException e = failure(damage("<lane id=\"0\"", "<lane id=\"0.5\""));
        assertEquals(ErrorKind.MALFORMED_NUMBER, e.kind());
    }

    @Test
    void negativeGeometryLength()
    {
        OpenDriveReadException e = failure(damage(GEOMETRY, GEOMETRY.replace("length=\"10.0\"", "length=\"-1.0\"")));
        assertEquals(ErrorKind.VALUE_OUT_OF_DOMAIN, e.kind());
        assertEquals("length", e.field().orElseThrow());
    }

    @Test
    void infiniteHeading()
    {
        OpenDriveReadException e = failure(damage(GEOMETRY, GEOMETRY.replace("hdg=\"0.0\"", "hdg=\"INF\"")));
        assertEquals(ErrorKind.VALUE_OUT_OF_DOMAIN, e.kind());
    }

    @Test
    void malformedRoadId()
    {
        OpenDriveReadException e = failure(damage(ROAD, ROAD.replace("id=\"1\"", "id=\"road 1\"")));
        assertEquals(ErrorKind.UNRESOLVED_REFERENCE, e.kind());
        assertEquals("id", e.field().orElseThrow());
    }

    @Test
    void laterRevisionIsUnsupported()
    {
        OpenDriveReadException e = failure(damage(HEADER, HEADER.replace("revMinor=\"7\"", "revMinor=\"8\"")));
        assertEquals(ErrorKind.UNSUPPORTED_VERSION, e.kind());
    }

    @Test
    void earlierRevisionIsAccepted()
    {
        Document document = decode(damage(HEADER, HEADER.replace("revMinor=\"7\"", "revMinor=\"4\"")));
        assertEquals(4, document.header().revMinor());
    }

    @Test
    void wrongDocumentElement()
    {
        String xml = MINIMAL.replace("<OpenDRIVE>", "<OpenSCENARIO>").replace("</OpenDRIVE>", "</OpenSCENARIO>");
        assertEquals(ErrorKind.STRUCTURAL_VIOLATION, failure(xml).kind());
    }

    @Test
    void geometryWithTwoShapes()
    {
        OpenDriveReadException e = failure(damage(SHAPE, SHAPE + "<arc curvature=\"0.1\"/>"));
        assertEquals(ErrorKind.STRUCTURAL_VIOLATION, e.kind());
    }

    @Test
    void duplicateHeader()
    {
        assertEquals(ErrorKind.STRUCTURAL_VIOLATION, failure(damage(HEADER, HEADER + HEADER)).kind());
    }

    @Test
    void gapInReferenceLineFailsTheRoad()
    {
        OpenDriveReadException e = failure(Fixtures.text("reference-line-gap.xodr"));
        assertEquals(ErrorKind.STRUCTURAL_VIOLATION, e.kind());
        assertTrue(e.getMessage().contains("gap in reference line"), e.getMessage());
    }

    @Test
    void duplicateLaneIdFailsTheRoad()
    {
        OpenDriveReadException e = failure(Fixtures.text("duplicate-lane-id.xodr"));
        assertEquals(ErrorKind.STRUCTURAL_VIOLATION, e.kind());
        assertTrue(e.getMessage().contains("duplicate lane id 1"), e.getMessage());
    }

    @Test
    void unknownAttributeIsReportedNotFatal()
    {
        decode(damage(ROAD, ROAD.replace(">", " surfaceQuality=\"good\">")));
        assertTrue(sink.hasDiagnostic(ReadDiagnostic.Kind.UNKNOWN_ATTRIBUTE, "surfaceQuality"));
    }
}
