package com.questrail.opendrive.internal.encode;

import com.questrail.opendrive.TestDocuments;
import com.questrail.opendrive.api.ErrorKind;
import com.questrail.opendrive.api.OpenDriveWriteException;
import com.questrail.opendrive.geometry.Geometry;
import com.questrail.opendrive.geometry.Line;
import com.questrail.opendrive.model.Document;
import com.questrail.opendrive.model.Header;
import com.questrail.opendrive.model.lane.Lane;
import com.questrail.opendrive.model.lane.LaneType;
import com.questrail.opendrive.model.road.PlanView;
import com.questrail.opendrive.model.road.Road;
import com.questrail.opendrive.model.road.TrafficRule;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * OpenDriveDocumentEncoderTest
 * -----------------------------------------------------------------------------
 * Unit tests for {@link OpenDriveDocumentEncoder}: attribute order, default
 * omission and failure on structurally invalid models.
 */
final class OpenDriveDocumentEncoderTest
{
    private final OpenDriveDocumentEncoder encoder = new OpenDriveDocumentEncoder();

    private String encode(Document document)
    {
        return new String(encoder.encode(document), StandardCharsets.UTF_8);
    }

    @Test
    void writesXmlDeclarationAndRoot()
    {
        String xml = encode(TestDocuments.singleRoad(TestDocuments.straightRoad("1", 10.0)));
        assertTrue(xml.startsWith("<?xml version=\"1.0\" encoding=\"UTF-8\"?>"), xml);
        assertTrue(xml.contains("<OpenDRIVE>"), xml);
        assertTrue(xml.contains("<header revMajor=\"1\" revMinor=\"7\"/>"), xml);
    }

    @Test
    void attributesAreAlphabeticalAndJunctionSentinelIsWritten()
    {
        String xml = encode(TestDocuments.singleRoad(TestDocuments.straightRoad("1", 10.0)));
        assertTrue(xml.contains("<road id=\"1\" junction=\"-1\" length=\"10.0\">"), xml);
        assertTrue(xml.contains("<geometry hdg=\"0.0\" length=\"10.0\" s=\"0.0\" x=\"0.0\" y=\"0.0\">"), xml);
    }

    @Test
    void defaultsAreOmitted()
    {
        String xml = encode(TestDocuments.singleRoad(TestDocuments.straightRoad("1", 10.0)));
        assertFalse(xml.contains("rule="), xml);
        assertFalse(xml.contains("singleSide"), xml);
        assertFalse(xml.contains("level"), xml);
        assertFalse(xml.contains("laneChange"), xml);
        assertFalse(xml.contains("material"), xml);
        assertFalse(xml.contains("<left"), xml);
        assertTrue(xml.contains("<laneSection s=\"0.0\">"), xml);
        assertTrue(xml.contains("<lane id=\"-1\" type=\"driving\">"), xml);
    }

    @Test
    void nonDefaultValuesAreWritten()
    {
        Road road = Road.builder("1", TestDocuments.straight(10.0),
                        TestDocuments.singleSection(List.of(),
                                List.of(Lane.builder(-1, LaneType.SIDEWALK).withLevel(true).build())))
                .withRule(TrafficRule.LHT)
                .withJunction("7")
                .withName("High Street")
                .build();
        String xml = encode(TestDocuments.singleRoad(road));
        assertTrue(xml.contains("<road id=\"1\" junction=\"7\" length=\"10.0\" name=\"High Street\" rule=\"LHT\">"), xml);
        assertTrue(xml.contains("<lane id=\"-1\" level=\"true\" type=\"sidewalk\"/>"), xml);
    }

    @Test
    void roadMarkColorIsAlwaysWritten()
    {
        String xml = encode(TestDocuments.singleRoad(TestDocuments.straightRoad("1", 10.0)));
        assertTrue(xml.contains("<roadMark color=\"standard\" sOffset=\"0.0\" type=\"solid\"/>"), xml);
    }

    @Test
    void geoReferenceIsWrittenAsCdata()
    {
        Document document = TestDocuments.singleRoad(TestDocuments.straightRoad("1", 1.0))
                .withHeader(Header.current().withGeoReference("+proj=tmerc +lat_0=0 <datum>"));
        String xml = encode(document);
        assertTrue(xml.contains("<geoReference><![CDATA[+proj=tmerc +lat_0=0 <datum>]]></geoReference>"), xml);
    }

    @Test
    void invalidModelIsRejectedBeforeWriting()
    {
        PlanView gappy = PlanView.of(
                Geometry.of(0.0, 0.0, 0.0, 0.0, 10.0, new Line()),
                Geometry.of(12.0, 12.0, 0.0, 0.0, 10.0, new Line()));
        Road road = Road.builder("1", gappy, TestDocuments.straightRoad("x", 1.0).lanes()).build();

        OpenDriveWriteException e = assertThrows(OpenDriveWriteException.class,
                () -> encoder.encode(TestDocuments.singleRoad(road)));
        assertEquals(ErrorKind.STRUCTURAL_VIOLATION, e.kind());
        assertEquals("s", e.field().orElseThrow());
    }

    @Test
    void outputIsDeterministic()
    {
        Document document = TestDocuments.singleRoad(TestDocuments.straightRoad("1", 10.0));
        assertArrayEquals(encoder.encode(document), new OpenDriveDocumentEncoder().encode(document));
    }

    @Test
    void indentIsConfigurable()
    {
        String xml = new String(new OpenDriveDocumentEncoder("\t").encode(
                TestDocuments.singleRoad(TestDocuments.straightRoad("1", 10.0))), StandardCharsets.UTF_8);
        assertTrue(xml.contains("\n\t<road "), xml);
        assertTrue(xml.contains("\n\t\t<planView>"), xml);
        assertThrows(IllegalArgumentException.class, () -> new OpenDriveDocumentEncoder("--"));
    }
}
