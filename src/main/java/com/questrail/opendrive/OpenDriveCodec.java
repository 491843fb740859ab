package com.questrail.opendrive;

import com.questrail.opendrive.api.OpenDriveReadException;
import com.questrail.opendrive.api.OpenDriveWriteException;
import com.questrail.opendrive.codec.OpenDriveReader;
import com.questrail.opendrive.codec.OpenDriveWriter;
import com.questrail.opendrive.codec.impl.DefaultOpenDriveReader;
import com.questrail.opendrive.codec.impl.DefaultOpenDriveWriter;
import com.questrail.opendrive.config.CompatibilityConfig;
import com.questrail.opendrive.internal.encode.OpenDriveDocumentEncoder;
import com.questrail.opendrive.model.Document;
import com.questrail.opendrive.observability.DiagnosticSink;
import com.questrail.opendrive.observability.Slf4jDiagnosticSink;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * OpenDriveCodec
 * -----------------------------------------------------------------------------
 * Entry point for reading and writing ASAM OpenDRIVE documents.
 *
 * <p>A codec instance pairs one {@link OpenDriveReader} and one
 * {@link OpenDriveWriter} built from the same {@link CompatibilityConfig}. The
 * configuration is fixed at construction; codecs with different configurations
 * can be used side by side.</p>
 *
 * <pre>{@code
 * OpenDriveCodec codec = OpenDriveCodec.builder()
 *         .withCompatibility(CompatibilityConfig.sumo())
 *         .build();
 * Document document = codec.parse(input);
 * byte[] xml = codec.serialize(document);
 * }</pre>
 *
 * <p>Instances hold no per-call state and may be shared between threads.</p>
 */
public final class OpenDriveCodec
{
    private final CompatibilityConfig compatibility;
    private final OpenDriveReader reader;
    private final OpenDriveWriter writer;

    private OpenDriveCodec(Builder builder)
    {
        this.compatibility = builder.compatibility;
        this.reader = new DefaultOpenDriveReader(builder.compatibility, builder.sink);
        this.writer = new DefaultOpenDriveWriter(builder.indent);
    }

    /**
     * A codec with strict standard conformance that logs diagnostics through SLF4J.
     */
    public static OpenDriveCodec strict() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public CompatibilityConfig compatibility() {
        return compatibility;
    }

    /**
     * @throws OpenDriveReadException on any document defect
     */
    public Document parse(InputStream input) {
        return reader.read(Objects.requireNonNull(input, "input"));
    }

    public Document parse(byte[] xml) {
        return parse(new ByteArrayInputStream(Objects.requireNonNull(xml, "xml")));
    }

    public Document parse(String xml) {
        return parse(Objects.requireNonNull(xml, "xml").getBytes(StandardCharsets.UTF_8));
    }

    /**
     * @return the UTF-8 encoded document
     * @throws OpenDriveWriteException if the document violates a structural invariant
     */
    public byte[] serialize(Document document) {
        return writer.write(Objects.requireNonNull(document, "document"));
    }

    public void serialize(Document document, OutputStream output) {
        writer.write(Objects.requireNonNull(document, "document"), Objects.requireNonNull(output, "output"));
    }

    public String serializeToString(Document document) {
        return new String(serialize(document), StandardCharsets.UTF_8);
    }

    public static final class Builder {
        private CompatibilityConfig compatibility = CompatibilityConfig.strict();
        private DiagnosticSink sink = new Slf4jDiagnosticSink();
        private String indent = OpenDriveDocumentEncoder.DEFAULT_INDENT;

        public Builder withCompatibility(CompatibilityConfig compatibility) {
            this.compatibility = Objects.requireNonNull(compatibility, "compatibility");
            return this;
        }

        public Builder withDiagnosticSink(DiagnosticSink sink) {
            this.sink = Objects.requireNonNull(sink, "sink");
            return this;
        }

        /**
         * @param indent whitespace written once per nesting level; empty for no indentation
         */
        public Builder withIndent(String indent) {
            this.indent = Objects.requireNonNull(indent, "indent");
            return this;
        }

        public OpenDriveCodec build() {
            return new OpenDriveCodec(this);
        }
    }
}
