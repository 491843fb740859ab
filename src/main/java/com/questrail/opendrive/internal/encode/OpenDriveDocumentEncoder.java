package com.questrail.opendrive.internal.encode;

import com.questrail.opendrive.api.OpenDriveWriteException;
import com.questrail.opendrive.model.Document;
import com.questrail.opendrive.model.Header;
import com.questrail.opendrive.model.HeaderOffset;
import com.questrail.opendrive.validation.StructuralValidator;
import com.questrail.opendrive.validation.Violation;

import java.io.ByteArrayOutputStream;
import java.io.OutputStream;
import java.util.List;
import java.util.Objects;

/**
 * OpenDriveDocumentEncoder
 * -----------------------------------------------------------------------------
 * Converts a {@link Document} into OpenDRIVE XML.
 *
 * <p>This class represents the outbound semantic boundary:</p>
 *
 * <pre>
 *   Document
 *       → per-element encoders  (schema order, default omission)
 *           → XmlNode tree
 *               → XmlNodeSerializer → bytes
 * </pre>
 *
 * <h2>Output contract</h2>
 * <ul>
 *   <li>Elements follow the schema sequence order; attributes follow the
 *       schema's alphabetical attribute order.</li>
 *   <li>An optional attribute equal to its documented default is omitted;
 *       every other present field is written.</li>
 *   <li>Output is a pure function of the document: the same document always
 *       yields the same bytes.</li>
 * </ul>
 *
 * <p>The document is checked by {@link StructuralValidator} first. A violation
 * is reported as an {@link OpenDriveWriteException} and nothing is written.</p>
 */
public final class OpenDriveDocumentEncoder
{
    public static final String DEFAULT_INDENT = "  ";

    private final StructuralValidator validator = new StructuralValidator();
    private final RoadEncoder roadEncoder = new RoadEncoder();
    private final SignalEncoder signalEncoder = new SignalEncoder();
    private final JunctionEncoder junctionEncoder = new JunctionEncoder();
    private final XmlNodeSerializer serializer;

    public OpenDriveDocumentEncoder() {
        this(DEFAULT_INDENT);
    }

    public OpenDriveDocumentEncoder(String indent) {
        Objects.requireNonNull(indent, "indent");
        if (!indent.isBlank()) {
            throw new IllegalArgumentException("indent must be whitespace only");
        }
        this.serializer = new XmlNodeSerializer(indent);
    }

    /**
     * @throws OpenDriveWriteException if the document violates a structural invariant
     *         or the XML writer fails
     */
    public byte[] encode(Document document) {
        ByteArrayOutputStream output = new ByteArrayOutputStream();
        encode(document, output);
        return output.toByteArray();
    }

    /**
     * Writes {@code document} to {@code output}. The stream is flushed but not closed.
     */
    public void encode(Document document, OutputStream output) {
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(output, "output");

        List<Violation> violations = validator.check(document);
        if (!violations.isEmpty()) {
            Violation first = violations.get(0);
            throw new OpenDriveWriteException(first.kind(), first.message(), first.element(), first.field());
        }
        serializer.write(encodeRoot(document), output);
    }

    private XmlNode encodeRoot(Document document) {
        XmlNode root = XmlNode.element("OpenDRIVE").child(encodeHeader(document.header()));
        document.roads().forEach(road -> root.child(roadEncoder.encodeRoad(road)));
        document.controllers().forEach(controller -> root.child(signalEncoder.encodeController(controller)));
        document.junctions().forEach(junction -> root.child(junctionEncoder.encodeJunction(junction)));
        document.junctionGroups().forEach(group -> root.child(junctionEncoder.encodeJunctionGroup(group)));
        AdditionalDataEncoder.appendTo(root, document.additionalData());
        return root;
    }

    private static XmlNode encodeHeader(Header header) {
        XmlNode node = XmlNode.element("header")
                .optionalText("date", header.date())
                .optionalLength("east", header.east())
                .optionalText("name", header.name())
                .optionalLength("north", header.north())
                .attribute("revMajor", header.revMajor())
                .attribute("revMinor", header.revMinor())
                .optionalLength("south", header.south())
                .optionalText("vendor", header.vendor())
                .optionalText("version", header.version())
                .optionalLength("west", header.west());
        header.geoReference().ifPresent(projection -> node.child(XmlNode.element("geoReference").cdata(projection)));
        header.offset().ifPresent(offset -> node.child(encodeOffset(offset)));
        AdditionalDataEncoder.appendTo(node, header.additionalData());
        return node;
    }

    private static XmlNode encodeOffset(HeaderOffset offset) {
        return XmlNode.element("offset")
                .attribute("hdg", offset.hdg())
                .attribute("x", offset.x())
                .attribute("y", offset.y())
                .attribute("z", offset.z());
    }
}
