package com.questrail.opendrive.internal.encode;

import com.questrail.opendrive.model.AdditionalData;
import com.questrail.opendrive.model.DataQuality;
import com.questrail.opendrive.model.Include;
import com.questrail.opendrive.model.OpaqueElement;
import com.questrail.opendrive.model.UserData;

import java.util.Map;

/**
 * Appends {@code include} / {@code userData} / {@code dataQuality} children.
 * Always called last for an element, since the schema places additional data
 * at the end of every sequence.
 */
final class AdditionalDataEncoder
{
    private AdditionalDataEncoder() {
    }

    static void appendTo(XmlNode parent, AdditionalData additionalData) {
        for (Include include : additionalData.includes()) {
            parent.child(XmlNode.element("include").attribute("file", include.file()));
        }
        for (UserData userData : additionalData.userData()) {
            XmlNode node = XmlNode.element("userData")
                    .attribute("code", userData.code())
                    .optionalText("value", userData.value());
            userData.content().forEach(element -> node.child(encodeOpaque(element)));
            parent.child(node);
        }
        additionalData.dataQuality().ifPresent(quality -> parent.child(encodeDataQuality(quality)));
    }

    static XmlNode encodeOpaque(OpaqueElement element) {
        XmlNode node = XmlNode.element(element.name());
        for (Map.Entry<String, String> attribute : element.attributes().entrySet()) {
            node.attribute(attribute.getKey(), attribute.getValue());
        }
        node.text(element.text());
        element.children().forEach(child -> node.child(encodeOpaque(child)));
        return node;
    }

    private static XmlNode encodeDataQuality(DataQuality quality) {
        XmlNode node = XmlNode.element("dataQuality");
        quality.error().ifPresent(error -> node.child(XmlNode.element("error")
                .attribute("xyAbsolute", error.xyAbsolute())
                .attribute("xyRelative", error.xyRelative())
                .attribute("zAbsolute", error.zAbsolute())
                .attribute("zRelative", error.zRelative())));
        quality.rawData().ifPresent(raw -> node.child(XmlNode.element("rawData")
                .attribute("date", raw.date())
                .attribute("postProcessing", raw.postProcessing())
                .optionalText("postProcessingComment", raw.postProcessingComment())
                .attribute("source", raw.source())
                .optionalText("sourceComment", raw.sourceComment())));
        return node;
    }
}
