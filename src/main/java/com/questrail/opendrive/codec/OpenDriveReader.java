package com.questrail.opendrive.codec;

import com.questrail.opendrive.api.OpenDriveReadException;
import com.questrail.opendrive.model.Document;

import java.io.InputStream;

/**
 * OpenDriveReader
 * -----------------------------------------------------------------------------
 * Inbound boundary between raw OpenDRIVE XML and a validated {@link Document}.
 *
 * <p>The reader is responsible for:</p>
 * <ul>
 *   <li>Well-formedness of the XML input</li>
 *   <li>Typed conversion of every attribute the schema defines</li>
 *   <li>Per-element structural invariants</li>
 *   <li>Applying the compatibility workarounds it was configured with</li>
 * </ul>
 *
 * <p>The reader is <strong>not</strong> responsible for:</p>
 * <ul>
 *   <li>Resolving references across the document</li>
 *   <li>Opening, buffering or closing files</li>
 * </ul>
 *
 * <p>A read either returns a complete document or throws; there is no partial
 * result.</p>
 */
public interface OpenDriveReader
{
    /**
     * Reads one complete document. The stream is consumed but not closed.
     *
     * @throws OpenDriveReadException if the document is malformed, incomplete,
     *         of an unsupported revision or structurally invalid
     */
    Document read(InputStream input);
}
