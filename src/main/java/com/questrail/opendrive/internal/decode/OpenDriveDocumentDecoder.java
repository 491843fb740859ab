package com.questrail.opendrive.internal.decode;

import com.questrail.opendrive.OpenDriveVersion;
import com.questrail.opendrive.api.ErrorKind;
import com.questrail.opendrive.api.OpenDriveReadException;
import com.questrail.opendrive.config.CompatibilityConfig;
import com.questrail.opendrive.model.Document;
import com.questrail.opendrive.model.Header;
import com.questrail.opendrive.model.HeaderOffset;
import com.questrail.opendrive.model.junction.Junction;
import com.questrail.opendrive.model.junction.JunctionGroup;
import com.questrail.opendrive.model.road.Road;
import com.questrail.opendrive.model.signal.Controller;
import com.questrail.opendrive.observability.DiagnosticSink;
import com.questrail.opendrive.units.Length;
import com.questrail.opendrive.validation.StructuralValidator;

import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * OpenDriveDocumentDecoder
 * -----------------------------------------------------------------------------
 * Translates an XML token stream into a {@link Document}.
 *
 * <p>This class represents the inbound semantic boundary:</p>
 *
 * <pre>
 *   InputStream
 *       → XMLStreamReader      (well-formedness, tokenization)
 *           → ElementReader    (typed attribute access, unknown-content handling)
 *               → per-element decoders
 *                   → Document
 * </pre>
 *
 * <p>The stream is consumed in a single forward pass. The header revision is
 * checked as soon as the header has been read, so documents of an unsupported
 * revision fail before any road is decoded. Any failure aborts the whole read;
 * no partial document is returned.</p>
 *
 * <p>Instances are immutable and may be shared; each call to
 * {@link #decode(InputStream)} owns its own parsing state.</p>
 */
public final class OpenDriveDocumentDecoder
{
    private static final String ROOT = "OpenDRIVE";

    private final CompatibilityConfig compatibility;
    private final DiagnosticSink sink;
    private final StructuralValidator validator = new StructuralValidator();
    private final XMLInputFactory inputFactory = SecureXmlInputFactory.create();

    private final RoadDecoder roadDecoder = new RoadDecoder();
    private final JunctionDecoder junctionDecoder = new JunctionDecoder();
    private final SignalDecoder signalDecoder = new SignalDecoder();

    public OpenDriveDocumentDecoder(CompatibilityConfig compatibility, DiagnosticSink sink) {
        this.compatibility = Objects.requireNonNull(compatibility, "compatibility");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    private static final class DocumentParts
    {
        Header header;
        final List<Road> roads = new ArrayList<>();
        final List<Controller> controllers = new ArrayList<>();
        final List<Junction> junctions = new ArrayList<>();
        final List<JunctionGroup> junctionGroups = new ArrayList<>();
        final AdditionalDataCollector additional = new AdditionalDataCollector();
    }

    /**
     * @throws OpenDriveReadException on any document defect
     */
    public Document decode(InputStream input) {
        Objects.requireNonNull(input, "input");
        ReadContext context = new ReadContext(compatibility, sink, validator);
        XMLStreamReader xml;
        try {
            xml = inputFactory.createXMLStreamReader(input);
        } catch (XMLStreamException e) {
            throw new OpenDriveReadException(ErrorKind.MALFORMED_XML, e.getMessage(), null, null, null, -1, -1, e);
        }
        Document document;
        try {
            ElementReader root = ElementReader.openRoot(xml, context);
            document = decodeRoot(root);
            ElementReader.drain(xml);
        } catch (RuntimeException e) {
            try {
                xml.close();
            } catch (XMLStreamException closeFailure) {
                e.addSuppressed(closeFailure);
            }
            throw e;
        }
        try {
            xml.close();
        } catch (XMLStreamException e) {
            throw new OpenDriveReadException(ErrorKind.MALFORMED_XML, e.getMessage(), null, null, null, -1, -1, e);
        }
        return document;
    }

    private Document decodeRoot(ElementReader root) {
        if (!ROOT.equals(root.name())) {
            throw root.error(ErrorKind.STRUCTURAL_VIOLATION, null, root.name(),
                    "document element must be " + ROOT);
        }
        DocumentParts parts = new DocumentParts();
        root.forEachChild(child -> {
            switch (child.name()) {
                case "header" -> {
                    root.requireAbsent(parts.header, "header");
                    parts.header = decodeHeader(child);
                }
                case "road" -> parts.roads.add(roadDecoder.decodeRoad(child));
                case "controller" -> parts.controllers.add(signalDecoder.decodeController(child));
                case "junction" -> parts.junctions.add(junctionDecoder.decodeJunction(child));
                case "junctionGroup" -> parts.junctionGroups.add(junctionDecoder.decodeJunctionGroup(child));
                default -> parts.additional.acceptOrSkip(child);
            }
        });
        if (parts.header == null) {
            throw root.missingChild("header");
        }
        if (parts.roads.isEmpty()) {
            throw root.missingChild("road");
        }
        return new Document(parts.header, parts.roads, parts.controllers, parts.junctions,
                parts.junctionGroups, parts.additional.build());
    }

    private Header decodeHeader(ElementReader element) {
        int revMajor = element.requiredInt("revMajor");
        int revMinor = element.requiredInt("revMinor");
        if (!OpenDriveVersion.isSupported(revMajor, revMinor)) {
            throw element.error(ErrorKind.UNSUPPORTED_VERSION, "revMinor", revMajor + "." + revMinor,
                    "this codec implements OpenDRIVE " + OpenDriveVersion.STANDARD_VERSION
                            + " and earlier 1.x revisions");
        }
        Optional<String> name = element.optionalText("name");
        Optional<String> version = element.optionalText("version");
        Optional<String> date = element.optionalText("date");
        Optional<Length> north = element.optionalLength("north");
        Optional<Length> south = element.optionalLength("south");
        Optional<Length> east = element.optionalLength("east");
        Optional<Length> west = element.optionalLength("west");
        Optional<String> vendor = element.optionalText("vendor");

        List<String> geoReference = new ArrayList<>(1);
        List<HeaderOffset> offset = new ArrayList<>(1);
        AdditionalDataCollector additional = new AdditionalDataCollector();
        element.forEachChild(child -> {
            switch (child.name()) {
                case "geoReference" -> {
                    element.requireAbsent(geoReference.isEmpty() ? null : geoReference, "geoReference");
                    geoReference.add(child.readText());
                }
                case "offset" -> {
                    element.requireAbsent(offset.isEmpty() ? null : offset, "offset");
                    offset.add(new HeaderOffset(
                            child.requiredLength("x"),
                            child.requiredLength("y"),
                            child.requiredLength("z"),
                            child.requiredAngle("hdg")));
                }
                default -> additional.acceptOrSkip(child);
            }
        });
        return new Header(revMajor, revMinor, name, version, date, north, south, east, west, vendor,
                geoReference.stream().findFirst(), offset.stream().findFirst(), additional.build());
    }
}
