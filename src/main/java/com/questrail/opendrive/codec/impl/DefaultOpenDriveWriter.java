package com.questrail.opendrive.codec.impl;

import com.questrail.opendrive.codec.OpenDriveWriter;
import com.questrail.opendrive.internal.encode.OpenDriveDocumentEncoder;
import com.questrail.opendrive.model.Document;

import java.io.OutputStream;

/**
 * DefaultOpenDriveWriter
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link OpenDriveWriter}.
 *
 * <p>This is the mechanical inverse of {@link DefaultOpenDriveReader}. None of
 * the current compatibility workarounds change writer output: road-mark color
 * and {@code pRange} are written in every configuration.</p>
 */
public final class DefaultOpenDriveWriter implements OpenDriveWriter
{
    private final OpenDriveDocumentEncoder encoder;

    public DefaultOpenDriveWriter()
    {
        this(OpenDriveDocumentEncoder.DEFAULT_INDENT);
    }

    public DefaultOpenDriveWriter(String indent)
    {
        this.encoder = new OpenDriveDocumentEncoder(indent);
    }

    @Override
    public byte[] write(Document document)
    {
        return encoder.encode(document);
    }

    @Override
    public void write(Document document, OutputStream output)
    {
        encoder.encode(document, output);
    }
}
