package com.questrail.opendrive.codec.impl;

import com.questrail.opendrive.Fixtures;
import com.questrail.opendrive.OpenDriveCodec;
import com.questrail.opendrive.TestDocuments;
import com.questrail.opendrive.api.ErrorKind;
import com.questrail.opendrive.api.OpenDriveWriteException;
import com.questrail.opendrive.codec.OpenDriveReader;
import com.questrail.opendrive.codec.OpenDriveWriter;
import com.questrail.opendrive.config.CompatibilityConfig;
import com.questrail.opendrive.model.Document;
import com.questrail.opendrive.model.road.Road;
import com.questrail.opendrive.observability.RecordingDiagnosticSink;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link DefaultOpenDriveWriter} paired with {@link DefaultOpenDriveReader}.
 */
final class DefaultOpenDriveWriterTest
{
    private final OpenDriveWriter writer = new DefaultOpenDriveWriter();
    private final RecordingDiagnosticSink sink = new RecordingDiagnosticSink();
    private final OpenDriveReader reader = new DefaultOpenDriveReader(CompatibilityConfig.strict(), sink);

    @Test
    void streamAndArrayOutputMatch()
    {
        Document document = TestDocuments.singleRoad(TestDocuments.straightRoad("1", 25.0));
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        writer.write(document, out);
        assertArrayEquals(writer.write(document), out.toByteArray());
    }

    @Test
    void readerInvertsWriter()
    {
        Document document = TestDocuments.singleRoad(TestDocuments.straightRoad("1", 25.0));
        Document reread = reader.read(new ByteArrayInputStream(writer.write(document)));
        assertEquals(document, reread);
        assertTrue(sink.getAll().isEmpty());
    }

    @Test
    void unrepresentableCharacterFailsBeforeAnyOutput()
    {
        Road road = TestDocuments.straightRoad("1", 25.0);
        Road named = Road.builder(road.id(), road.planView(), road.lanes()).withName("exit\u0001ramp").build();
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        OpenDriveWriteException e = assertThrows(OpenDriveWriteException.class,
                () -> writer.write(TestDocuments.singleRoad(named), out));
        assertEquals(ErrorKind.WRITE_FAILURE, e.kind());
        assertEquals("OpenDRIVE/road", e.element().orElseThrow());
        assertEquals("name", e.field().orElseThrow());
        assertTrue(e.getMessage().contains("U+0001"), e.getMessage());
        assertEquals(0, out.size());
    }

    @Test
    void outputDoesNotDependOnReaderConfiguration()
    {
        Document document = OpenDriveCodec.strict().parse(Fixtures.bytes("two-lane-road.xodr"));
        byte[] strict = OpenDriveCodec.strict().serialize(document);
        byte[] relaxed = OpenDriveCodec.builder()
                .withCompatibility(CompatibilityConfig.builder().enableAll().build())
                .build()
                .serialize(document);

        assertArrayEquals(strict, relaxed);
        assertArrayEquals(strict, writer.write(document));
    }
}
