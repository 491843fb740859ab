package com.questrail.opendrive.internal.decode;

import com.questrail.opendrive.api.ErrorKind;
import com.questrail.opendrive.api.OpenDriveReadException;
import com.questrail.opendrive.api.XmlEnum;
import com.questrail.opendrive.geometry.CubicPolynomial;
import com.questrail.opendrive.model.OpaqueElement;
import com.questrail.opendrive.observability.ReadDiagnostic;
import com.questrail.opendrive.units.Angle;
import com.questrail.opendrive.units.Curvature;
import com.questrail.opendrive.units.Length;
import com.questrail.opendrive.units.NumericText;
import com.questrail.opendrive.validation.Ids;

import javax.xml.stream.Location;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * ElementReader
 * -----------------------------------------------------------------------------
 * Cursor over one XML element of the token stream.
 *
 * <p>An {@code ElementReader} is created when the underlying
 * {@link XMLStreamReader} sits on a start tag. Attributes are captured
 * immediately; content is consumed strictly forward through
 * {@link #forEachChild(Consumer)}, {@link #readText()} or
 * {@link #readOpaque()}, at most once.</p>
 *
 * <h2>Typed attribute access</h2>
 * <p>Each accessor converts raw attribute text and reports failures with the
 * element path, attribute name, raw text and position:</p>
 * <ul>
 *   <li>absent required attribute: {@link ErrorKind#MISSING_REQUIRED_FIELD}</li>
 *   <li>non-numeric text: {@link ErrorKind#MALFORMED_NUMBER}</li>
 *   <li>number outside the field's range: {@link ErrorKind#VALUE_OUT_OF_DOMAIN}</li>
 *   <li>token outside an enumeration: {@link ErrorKind#INVALID_ENUM_VALUE}</li>
 *   <li>malformed id: {@link ErrorKind#UNRESOLVED_REFERENCE}</li>
 * </ul>
 *
 * <h2>Unknown content</h2>
 * <p>Attributes never asked for are reported as
 * {@link ReadDiagnostic.Kind#UNKNOWN_ATTRIBUTE} when the element closes, so every
 * decoder must read its attributes before iterating children. Children a decoder
 * does not handle are skipped with {@link #skipUnknown()}. Attributes in a
 * namespace (for example {@code xsi:noNamespaceSchemaLocation}) are XML
 * infrastructure and are ignored silently.</p>
 */
final class ElementReader
{
    private final XMLStreamReader xml;
    private final ReadContext context;
    private final String name;
    private final String path;
    private final Map<String, String> attributes = new LinkedHashMap<>();
    private final Set<String> consumed = new HashSet<>();
    private final int line;
    private final int column;
    private boolean closed;

    private ElementReader(XMLStreamReader xml, ReadContext context, String parentPath) {
        this.xml = xml;
        this.context = context;
        this.name = xml.getLocalName();
        this.path = parentPath == null ? name : parentPath + "/" + name;
        Location location = xml.getLocation();
        this.line = location == null ? -1 : location.getLineNumber();
        this.column = location == null ? -1 : location.getColumnNumber();
        for (int i = 0; i < xml.getAttributeCount(); i++) {
            String ns = xml.getAttributeNamespace(i);
            if (ns != null && !ns.isEmpty()) {
                continue;
            }
            attributes.put(xml.getAttributeLocalName(i), xml.getAttributeValue(i));
        }
    }

    /**
     * Advances {@code xml} to the document element and returns a reader for it.
     */
    static ElementReader openRoot(XMLStreamReader xml, ReadContext context) {
        try {
            while (xml.hasNext()) {
                if (xml.next() == XMLStreamConstants.START_ELEMENT) {
                    return new ElementReader(xml, context, null);
                }
            }
        } catch (XMLStreamException e) {
            throw malformed(e, null);
        }
        throw new OpenDriveReadException(ErrorKind.MALFORMED_XML, "document has no root element",
                null, null, null, -1, -1);
    }

    /**
     * Drains the rest of the stream so that well-formedness errors after the
     * document element are still reported.
     */
    static void drain(XMLStreamReader xml) {
        try {
            while (xml.hasNext()) {
                xml.next();
            }
        } catch (XMLStreamException e) {
            throw malformed(e, null);
        }
    }

    String name() {
        return name;
    }

    String path() {
        return path;
    }

    int line() {
        return line;
    }

    int column() {
        return column;
    }

    ReadContext context() {
        return context;
    }

    // ---------------------------------------------------------------------
    // Attributes
    // ---------------------------------------------------------------------

    Optional<String> optionalText(String attribute) {
        consumed.add(attribute);
        return Optional.ofNullable(attributes.get(attribute));
    }

    String requiredText(String attribute) {
        return optionalText(attribute).orElseThrow(() -> missing(attribute));
    }

    String requiredId(String attribute) {
        return checkId(attribute, requiredText(attribute));
    }

    Optional<String> optionalId(String attribute) {
        return optionalText(attribute).map(raw -> checkId(attribute, raw));
    }

    double requiredDouble(String attribute) {
        return parseDouble(attribute, requiredText(attribute));
    }

    double requiredFinite(String attribute) {
        String raw = requiredText(attribute);
        return finite(attribute, raw, parseDouble(attribute, raw));
    }

    Optional<Double> optionalDouble(String attribute) {
        return optionalText(attribute).map(raw -> parseDouble(attribute, raw));
    }

    int requiredInt(String attribute) {
        return parseInt(attribute, requiredText(attribute));
    }

    Optional<Integer> optionalInt(String attribute) {
        return optionalText(attribute).map(raw -> parseInt(attribute, raw));
    }

    Length requiredLength(String attribute) {
        String raw = requiredText(attribute);
        return Length.of(finite(attribute, raw, parseDouble(attribute, raw)));
    }

    Optional<Length> optionalLength(String attribute) {
        return optionalText(attribute).map(raw -> Length.of(finite(attribute, raw, parseDouble(attribute, raw))));
    }

    Length optionalLength(String attribute, Length defaultValue) {
        return optionalLength(attribute).orElse(defaultValue);
    }

    /**
     * Arc lengths, segment lengths and offsets along the reference line.
     */
    Length requiredNonNegativeLength(String attribute) {
        String raw = requiredText(attribute);
        return nonNegative(attribute, raw, parseDouble(attribute, raw));
    }

    Optional<Length> optionalNonNegativeLength(String attribute) {
        return optionalText(attribute).map(raw -> nonNegative(attribute, raw, parseDouble(attribute, raw)));
    }

    Angle requiredAngle(String attribute) {
        String raw = requiredText(attribute);
        return Angle.ofRadians(finite(attribute, raw, parseDouble(attribute, raw)));
    }

    Optional<Angle> optionalAngle(String attribute) {
        return optionalText(attribute).map(raw -> Angle.ofRadians(finite(attribute, raw, parseDouble(attribute, raw))));
    }

    Curvature requiredCurvature(String attribute) {
        String raw = requiredText(attribute);
        return Curvature.of(finite(attribute, raw, parseDouble(attribute, raw)));
    }

    /**
     * Reads the four coefficient attributes {@code a<suffix>} .. {@code d<suffix>}.
     */
    CubicPolynomial polynomial(String suffix) {
        return new CubicPolynomial(
                requiredDouble("a" + suffix),
                requiredDouble("b" + suffix),
                requiredDouble("c" + suffix),
                requiredDouble("d" + suffix));
    }

    <E extends Enum<E> & XmlEnum> E requiredEnum(String attribute, Class<E> type) {
        String raw = requiredText(attribute);
        return parseEnum(attribute, raw, type);
    }

    <E extends Enum<E> & XmlEnum> Optional<E> optionalEnum(String attribute, Class<E> type) {
        return optionalText(attribute).map(raw -> parseEnum(attribute, raw, type));
    }

    <E extends Enum<E> & XmlEnum> E optionalEnum(String attribute, Class<E> type, E defaultValue) {
        return optionalEnum(attribute, type).orElse(defaultValue);
    }

    /**
     * {@code xs:boolean}: {@code true}, {@code false}, {@code 1} or {@code 0}.
     */
    boolean optionalBoolean(String attribute, boolean defaultValue) {
        return optionalBoolean(attribute).orElse(defaultValue);
    }

    Optional<Boolean> optionalBoolean(String attribute) {
        return optionalText(attribute).map(raw -> switch (raw.strip()) {
            case "true", "1" -> Boolean.TRUE;
            case "false", "0" -> Boolean.FALSE;
            default -> throw error(ErrorKind.INVALID_ENUM_VALUE, attribute, raw, "expected true or false");
        });
    }

    /**
     * The schema's {@code yes}/{@code no} boolean.
     */
    boolean requiredYesNo(String attribute) {
        return parseYesNo(attribute, requiredText(attribute));
    }

    boolean optionalYesNo(String attribute, boolean defaultValue) {
        return optionalText(attribute).map(raw -> parseYesNo(attribute, raw)).orElse(defaultValue);
    }

    // ---------------------------------------------------------------------
    // Content
    // ---------------------------------------------------------------------

    /**
     * Hands every child element to {@code handler} in document order and
     * consumes this element up to and including its end tag. Text content is
     * ignored.
     */
    void forEachChild(Consumer<ElementReader> handler) {
        consume(handler, null);
    }

    /**
     * @return the trimmed text content; child elements are skipped as unknown
     */
    String readText() {
        StringBuilder text = new StringBuilder();
        consume(ElementReader::skipUnknown, text);
        return text.toString().strip();
    }

    /**
     * Captures this element and its subtree verbatim.
     */
    OpaqueElement readOpaque() {
        consumed.addAll(attributes.keySet());
        StringBuilder text = new StringBuilder();
        List<OpaqueElement> children = new ArrayList<>();
        consume(child -> children.add(child.readOpaque()), text);
        return new OpaqueElement(name, attributes, children, text.toString().strip());
    }

    /**
     * Records this element as unknown and skips its subtree.
     */
    void skipUnknown() {
        context.report(ReadDiagnostic.Kind.UNKNOWN_ELEMENT, this, name, "element not part of the schema here; skipped");
        skipSilently();
    }

    private void skipSilently() {
        consumed.addAll(attributes.keySet());
        consume(ElementReader::skipSilently, null);
    }

    void finish() {
        if (!closed) {
            forEachChild(ElementReader::skipUnknown);
        }
    }

    private void consume(Consumer<ElementReader> handler, StringBuilder text) {
        if (closed) {
            throw new IllegalStateException("content of " + path + " already consumed");
        }
        try {
            while (true) {
                int event = xml.next();
                switch (event) {
                    case XMLStreamConstants.START_ELEMENT -> {
                        ElementReader child = new ElementReader(xml, context, path);
                        handler.accept(child);
                        child.finish();
                    }
                    case XMLStreamConstants.END_ELEMENT -> {
                        closed = true;
                        reportUnconsumedAttributes();
                        return;
                    }
                    case XMLStreamConstants.CHARACTERS,
                         XMLStreamConstants.CDATA,
                         XMLStreamConstants.SPACE -> {
                        if (text != null) {
                            text.append(xml.getText());
                        }
                    }
                    case XMLStreamConstants.END_DOCUMENT ->
                            throw error(ErrorKind.MALFORMED_XML, null, null, "unexpected end of document");
                    default -> {
                        // comments and processing instructions carry no model content
                    }
                }
            }
        } catch (XMLStreamException e) {
            throw malformed(e, path);
        }
    }

    private void reportUnconsumedAttributes() {
        for (String attribute : attributes.keySet()) {
            if (!consumed.contains(attribute)) {
                context.report(ReadDiagnostic.Kind.UNKNOWN_ATTRIBUTE, this, attribute,
                        "attribute not part of the schema here; ignored");
            }
        }
    }

    // ---------------------------------------------------------------------
    // Errors
    // ---------------------------------------------------------------------

    OpenDriveReadException error(ErrorKind kind, String field, String rawText, String message) {
        return new OpenDriveReadException(kind, message, path, field, rawText, line, column);
    }

    OpenDriveReadException missing(String field) {
        return error(ErrorKind.MISSING_REQUIRED_FIELD, field, null, "required field missing");
    }

    OpenDriveReadException missingChild(String child) {
        return error(ErrorKind.MISSING_REQUIRED_FIELD, child, null, "required child element missing");
    }

    /**
     * Fails unless this is the first occurrence of a child that may appear at most once.
     */
    void requireAbsent(Object previous, String child) {
        if (previous != null) {
            throw error(ErrorKind.STRUCTURAL_VIOLATION, child, null, "element may appear only once");
        }
    }

    private static OpenDriveReadException malformed(XMLStreamException e, String path) {
        Location location = e.getLocation();
        int line = location == null ? -1 : location.getLineNumber();
        int column = location == null ? -1 : location.getColumnNumber();
        return new OpenDriveReadException(ErrorKind.MALFORMED_XML, e.getMessage(), path, null, null,
                line, column, e);
    }

    private double parseDouble(String attribute, String raw) {
        try {
            return NumericText.parse(raw);
        } catch (NumberFormatException e) {
            throw error(ErrorKind.MALFORMED_NUMBER, attribute, raw, e.getMessage());
        }
    }

    private int parseInt(String attribute, String raw) {
        try {
            return NumericText.parseInt(raw);
        } catch (NumberFormatException e) {
            throw error(ErrorKind.MALFORMED_NUMBER, attribute, raw, "not an integer");
        }
    }

    private double finite(String attribute, String raw, double value) {
        if (!Double.isFinite(value)) {
            throw error(ErrorKind.VALUE_OUT_OF_DOMAIN, attribute, raw, "value must be finite");
        }
        return value;
    }

    private Length nonNegative(String attribute, String raw, double value) {
        finite(attribute, raw, value);
        if (value < 0.0) {
            throw error(ErrorKind.VALUE_OUT_OF_DOMAIN, attribute, raw, "value must be non-negative");
        }
        return Length.of(value);
    }

    private String checkId(String attribute, String raw) {
        if (!Ids.isWellFormed(raw)) {
            throw error(ErrorKind.UNRESOLVED_REFERENCE, attribute, raw, "malformed id");
        }
        return raw;
    }

    private <E extends Enum<E> & XmlEnum> E parseEnum(String attribute, String raw, Class<E> type) {
        return XmlEnum.fromXml(type, raw)
                .orElseThrow(() -> error(ErrorKind.INVALID_ENUM_VALUE, attribute, raw,
                        "not a valid " + type.getSimpleName() + " token"));
    }

    private boolean parseYesNo(String attribute, String raw) {
        return switch (raw.strip()) {
            case "yes" -> true;
            case "no" -> false;
            default -> throw error(ErrorKind.INVALID_ENUM_VALUE, attribute, raw, "expected yes or no");
        };
    }
}
