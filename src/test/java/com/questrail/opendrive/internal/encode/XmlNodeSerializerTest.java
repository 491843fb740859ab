package com.questrail.opendrive.internal.encode;

import com.questrail.opendrive.api.ErrorKind;
import com.questrail.opendrive.api.OpenDriveWriteException;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * XmlNodeSerializerTest
 * -----------------------------------------------------------------------------
 * Escaping rules and the up-front character check of {@link XmlNodeSerializer}.
 */
final class XmlNodeSerializerTest
{
    private final XmlNodeSerializer serializer = new XmlNodeSerializer("  ");

    private String write(XmlNode root)
    {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        serializer.write(root, out);
        return out.toString(StandardCharsets.UTF_8);
    }

    @Test
    void attributeEscapesMarkupAndLineBreaks()
    {
        assertEquals("a&amp;b&lt;c&gt;d&quot;e'f", XmlNodeSerializer.escapeAttribute("a&b<c>d\"e'f"));
        assertEquals("&#9;x&#10;y&#13;", XmlNodeSerializer.escapeAttribute("\tx\ny\r"));
    }

    @Test
    void textKeepsTabAndLineFeed()
    {
        assertEquals("a\tb\nc&#13;d &amp; &lt;e&gt;", XmlNodeSerializer.escapeText("a\tb\nc\rd & <e>"));
    }

    @Test
    void cdataIsSplitAtTerminator()
    {
        assertEquals("<![CDATA[plain]]>", XmlNodeSerializer.cdata("plain"));
        assertEquals("<![CDATA[a]]]]><![CDATA[>b]]>", XmlNodeSerializer.cdata("a]]>b"));
        assertEquals("<![CDATA[a]]>&#13;<![CDATA[b]]>", XmlNodeSerializer.cdata("a\rb"));
    }

    @Test
    void recognisesXmlCharacters()
    {
        assertTrue(XmlNodeSerializer.isXmlChar('\t'));
        assertTrue(XmlNodeSerializer.isXmlChar('é'));
        assertTrue(XmlNodeSerializer.isXmlChar(0x1F697));
        assertFalse(XmlNodeSerializer.isXmlChar(0x0));
        assertFalse(XmlNodeSerializer.isXmlChar(0x1));
        assertFalse(XmlNodeSerializer.isXmlChar(0xD800));
        assertFalse(XmlNodeSerializer.isXmlChar(0xFFFE));
    }

    @Test
    void writesIndentedTree()
    {
        XmlNode root = XmlNode.element("OpenDRIVE")
                .child(XmlNode.element("header").attribute("name", "x & y"))
                .child(XmlNode.element("geoReference").cdata("+proj=utm"));

        assertEquals("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n"
                + "<OpenDRIVE>\n"
                + "  <header name=\"x &amp; y\"/>\n"
                + "  <geoReference><![CDATA[+proj=utm]]></geoReference>\n"
                + "</OpenDRIVE>\n", write(root));
    }

    @Test
    void controlCharacterInTextFailsBeforeAnyOutput()
    {
        XmlNode root = XmlNode.element("OpenDRIVE")
                .child(XmlNode.element("road").child(XmlNode.element("note").text("bell\u0007")));
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        OpenDriveWriteException e = assertThrows(OpenDriveWriteException.class, () -> serializer.write(root, out));
        assertEquals(ErrorKind.WRITE_FAILURE, e.kind());
        assertEquals("OpenDRIVE/road/note", e.element().orElseThrow());
        assertTrue(e.field().isEmpty());
        assertEquals(0, out.size());
    }

    @Test
    void loneSurrogateInAttributeFails()
    {
        XmlNode root = XmlNode.element("OpenDRIVE").attribute("name", "half\uD83D");

        OpenDriveWriteException e = assertThrows(OpenDriveWriteException.class, () -> write(root));
        assertEquals("name", e.field().orElseThrow());
        assertTrue(e.getMessage().contains("U+D83D"), e.getMessage());
    }

    @Test
    void invalidElementNameFails()
    {
        XmlNode root = XmlNode.element("OpenDRIVE").child(XmlNode.element("1st"));

        OpenDriveWriteException e = assertThrows(OpenDriveWriteException.class, () -> write(root));
        assertEquals(ErrorKind.WRITE_FAILURE, e.kind());
        assertTrue(e.getMessage().contains("'1st'"), e.getMessage());
    }
}
