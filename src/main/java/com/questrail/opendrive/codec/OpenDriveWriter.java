package com.questrail.opendrive.codec;

import com.questrail.opendrive.api.OpenDriveWriteException;
import com.questrail.opendrive.model.Document;

import java.io.OutputStream;

/**
 * OpenDriveWriter
 * -----------------------------------------------------------------------------
 * Outbound boundary from a {@link Document} to OpenDRIVE XML.
 *
 * <p>Output is deterministic. Writing a document read by an
 * {@link OpenDriveReader} with the same configuration reproduces that document
 * when read again.</p>
 */
public interface OpenDriveWriter
{
    /**
     * @throws OpenDriveWriteException if the document is structurally invalid or
     *         holds a string XML 1.0 cannot represent
     */
    byte[] write(Document document);

    /**
     * Writes to {@code output}, which is flushed but not closed.
     *
     * @throws OpenDriveWriteException if the document is structurally invalid or
     *         the stream fails
     */
    void write(Document document, OutputStream output);
}
