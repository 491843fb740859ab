package com.questrail.opendrive.codec.impl;

import com.questrail.opendrive.codec.OpenDriveReader;
import com.questrail.opendrive.config.CompatibilityConfig;
import com.questrail.opendrive.internal.decode.OpenDriveDocumentDecoder;
import com.questrail.opendrive.model.Document;
import com.questrail.opendrive.observability.DiagnosticSink;

import java.io.InputStream;
import java.util.Objects;

/**
 * DefaultOpenDriveReader
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link OpenDriveReader}.
 *
 * <p>Unknown elements and attributes, and every applied workaround, are
 * reported to the configured {@link DiagnosticSink}; they never fail a read.</p>
 */
public final class DefaultOpenDriveReader implements OpenDriveReader
{
    private final OpenDriveDocumentDecoder decoder;

    public DefaultOpenDriveReader(CompatibilityConfig compatibility, DiagnosticSink sink)
    {
        this.decoder = new OpenDriveDocumentDecoder(
                Objects.requireNonNull(compatibility, "compatibility"),
                Objects.requireNonNull(sink, "sink"));
    }

    @Override
    public Document read(InputStream input)
    {
        return decoder.decode(input);
    }
}
