package com.questrail.opendrive.internal.encode;

import com.questrail.opendrive.api.ErrorKind;
import com.questrail.opendrive.api.OpenDriveWriteException;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Writes an {@link XmlNode} tree as an indented UTF-8 XML 1.0 document.
 *
 * <p>Layout is fixed: one element per line, children indented by the configured
 * indent, leaf elements self-closed, text content kept on the element's own line.
 * Identical trees always produce identical bytes.</p>
 *
 * <h2>Escaping</h2>
 * <p>Every string is written so that an XML parser hands back exactly the same
 * characters:</p>
 * <ul>
 *   <li>attribute values escape tab, line feed and carriage return as character
 *       references, since a parser would otherwise normalize them to spaces</li>
 *   <li>text escapes carriage return, which a parser would otherwise fold into
 *       a line feed</li>
 *   <li>CDATA sections are split at every {@code ]]>} and carriage return</li>
 * </ul>
 *
 * <p>XML 1.0 cannot carry some code points at all (most C0 controls, lone
 * surrogates, U+FFFE and U+FFFF). The whole tree is checked before the first
 * byte is written; such a string fails the write with
 * {@link ErrorKind#WRITE_FAILURE} and nothing reaches the output.</p>
 */
final class XmlNodeSerializer
{
    private static final Pattern NAME = Pattern.compile("[\\p{L}_][\\p{L}\\p{M}\\p{N}_.\\-\\u00B7]*");

    private final String indent;

    XmlNodeSerializer(String indent) {
        this.indent = indent;
    }

    void write(XmlNode root, OutputStream output) {
        checkWritable(root, root.name());
        try {
            Writer xml = new BufferedWriter(new OutputStreamWriter(output, StandardCharsets.UTF_8));
            xml.write("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n");
            writeNode(xml, root, 0);
            xml.write('\n');
            xml.flush();
        } catch (IOException e) {
            throw new OpenDriveWriteException(ErrorKind.WRITE_FAILURE, e.getMessage(), e);
        }
    }

    private void writeNode(Writer xml, XmlNode node, int depth) throws IOException {
        xml.write('<');
        xml.write(node.name());
        for (Map.Entry<String, String> attribute : node.attributes().entrySet()) {
            xml.write(' ');
            xml.write(attribute.getKey());
            xml.write("=\"");
            xml.write(escapeAttribute(attribute.getValue()));
            xml.write('"');
        }
        if (node.children().isEmpty() && node.text().isEmpty()) {
            xml.write("/>");
            return;
        }
        xml.write('>');
        if (!node.text().isEmpty()) {
            xml.write(node.isCdata() ? cdata(node.text()) : escapeText(node.text()));
        }
        if (!node.children().isEmpty()) {
            for (XmlNode child : node.children()) {
                newline(xml, depth + 1);
                writeNode(xml, child, depth + 1);
            }
            newline(xml, depth);
        }
        xml.write("</");
        xml.write(node.name());
        xml.write('>');
    }

    private void newline(Writer xml, int depth) throws IOException {
        xml.write('\n');
        xml.write(indent.repeat(depth));
    }

    static String escapeAttribute(String value) {
        StringBuilder escaped = new StringBuilder(value.length() + 16);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '&' -> escaped.append("&amp;");
                case '<' -> escaped.append("&lt;");
                case '>' -> escaped.append("&gt;");
                case '"' -> escaped.append("&quot;");
                case '\t' -> escaped.append("&#9;");
                case '\n' -> escaped.append("&#10;");
                case '\r' -> escaped.append("&#13;");
                default -> escaped.append(c);
            }
        }
        return escaped.toString();
    }

    static String escapeText(String text) {
        StringBuilder escaped = new StringBuilder(text.length() + 16);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '&' -> escaped.append("&amp;");
                case '<' -> escaped.append("&lt;");
                case '>' -> escaped.append("&gt;");
                case '\r' -> escaped.append("&#13;");
                default -> escaped.append(c);
            }
        }
        return escaped.toString();
    }

    /**
     * {@code a]]>b} becomes {@code <![CDATA[a]]]]><![CDATA[>b]]>}; a carriage
     * return is closed out of the section and written as a character reference.
     */
    static String cdata(String text) {
        String body = text.replace("]]>", "]]]]><![CDATA[>")
                .replace("\r", "]]>&#13;<![CDATA[");
        return "<![CDATA[" + body + "]]>";
    }

    static boolean isXmlChar(int codePoint) {
        return codePoint == 0x9 || codePoint == 0xA || codePoint == 0xD
                || (codePoint >= 0x20 && codePoint <= 0xD7FF)
                || (codePoint >= 0xE000 && codePoint <= 0xFFFD)
                || (codePoint >= 0x10000 && codePoint <= 0x10FFFF);
    }

    private static void checkWritable(XmlNode node, String path) {
        checkName(node.name(), path, null);
        for (Map.Entry<String, String> attribute : node.attributes().entrySet()) {
            checkName(attribute.getKey(), path, attribute.getKey());
            checkCharacters(attribute.getValue(), path, attribute.getKey());
        }
        checkCharacters(node.text(), path, null);
        for (XmlNode child : node.children()) {
            checkWritable(child, path + "/" + child.name());
        }
    }

    private static void checkName(String name, String path, String field) {
        if (!NAME.matcher(name).matches()) {
            throw new OpenDriveWriteException(ErrorKind.WRITE_FAILURE,
                    "'" + name + "' is not a valid XML name", path, field);
        }
    }

    private static void checkCharacters(String value, String path, String field) {
        value.codePoints()
                .filter(codePoint -> !isXmlChar(codePoint))
                .findFirst()
                .ifPresent(codePoint -> {
                    throw new OpenDriveWriteException(ErrorKind.WRITE_FAILURE,
                            String.format("U+%04X cannot be represented in XML 1.0", codePoint), path, field);
                });
    }
}
