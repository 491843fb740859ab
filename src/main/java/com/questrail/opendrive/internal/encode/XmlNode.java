package com.questrail.opendrive.internal.encode;

import com.questrail.opendrive.api.XmlEnum;
import com.questrail.opendrive.geometry.CubicPolynomial;
import com.questrail.opendrive.units.Angle;
import com.questrail.opendrive.units.Curvature;
import com.questrail.opendrive.units.Length;
import com.questrail.opendrive.units.NumericText;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * XmlNode
 * -----------------------------------------------------------------------------
 * Output-side element tree built by the encoders and written by
 * {@link XmlNodeSerializer}.
 *
 * <p>Attributes and children are emitted in insertion order, so each encoder
 * fixes the output order simply by the order of its calls. Numeric values go
 * through {@link NumericText#format(double)}; no other formatting path exists.</p>
 */
final class XmlNode
{
    private final String name;
    private final Map<String, String> attributes = new LinkedHashMap<>();
    private final List<XmlNode> children = new ArrayList<>();
    private String text = "";
    private boolean cdata;

    private XmlNode(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    static XmlNode element(String name) {
        return new XmlNode(name);
    }

    String name() {
        return name;
    }

    Map<String, String> attributes() {
        return Collections.unmodifiableMap(attributes);
    }

    List<XmlNode> children() {
        return Collections.unmodifiableList(children);
    }

    String text() {
        return text;
    }

    boolean isCdata() {
        return cdata;
    }

    XmlNode attribute(String attribute, String value) {
        attributes.put(attribute, Objects.requireNonNull(value, attribute));
        return this;
    }

    XmlNode attribute(String attribute, double value) {
        return attribute(attribute, NumericText.format(value));
    }

    XmlNode attribute(String attribute, int value) {
        return attribute(attribute, NumericText.format(value));
    }

    XmlNode attribute(String attribute, Length value) {
        return attribute(attribute, value.meters());
    }

    XmlNode attribute(String attribute, Angle value) {
        return attribute(attribute, value.radians());
    }

    XmlNode attribute(String attribute, Curvature value) {
        return attribute(attribute, value.perMeter());
    }

    XmlNode attribute(String attribute, XmlEnum value) {
        return attribute(attribute, value.xmlValue());
    }

    XmlNode attribute(String attribute, boolean value) {
        return attribute(attribute, value ? "true" : "false");
    }

    XmlNode yesNo(String attribute, boolean value) {
        return attribute(attribute, value ? "yes" : "no");
    }

    /**
     * Writes {@code a<suffix>}, {@code b<suffix>}, {@code c<suffix>}, {@code d<suffix>}.
     */
    XmlNode polynomial(String suffix, CubicPolynomial polynomial) {
        return attribute("a" + suffix, polynomial.a())
                .attribute("b" + suffix, polynomial.b())
                .attribute("c" + suffix, polynomial.c())
                .attribute("d" + suffix, polynomial.d());
    }

    XmlNode optionalText(String attribute, Optional<String> value) {
        value.ifPresent(v -> attribute(attribute, v));
        return this;
    }

    XmlNode optionalDouble(String attribute, Optional<Double> value) {
        value.ifPresent(v -> attribute(attribute, v.doubleValue()));
        return this;
    }

    XmlNode optionalInt(String attribute, Optional<Integer> value) {
        value.ifPresent(v -> attribute(attribute, v.intValue()));
        return this;
    }

    XmlNode optionalLength(String attribute, Optional<Length> value) {
        value.ifPresent(v -> attribute(attribute, v));
        return this;
    }

    XmlNode optionalAngle(String attribute, Optional<Angle> value) {
        value.ifPresent(v -> attribute(attribute, v));
        return this;
    }

    XmlNode optionalEnum(String attribute, Optional<? extends XmlEnum> value) {
        value.ifPresent(v -> attribute(attribute, v));
        return this;
    }

    XmlNode optionalBoolean(String attribute, Optional<Boolean> value) {
        value.ifPresent(v -> attribute(attribute, v.booleanValue()));
        return this;
    }

    /**
     * Writes the attribute only when it differs from its documented default.
     */
    XmlNode unlessDefault(String attribute, XmlEnum value, XmlEnum defaultValue) {
        if (value != defaultValue) {
            attribute(attribute, value);
        }
        return this;
    }

    XmlNode unlessDefault(String attribute, String value, String defaultValue) {
        if (!value.equals(defaultValue)) {
            attribute(attribute, value);
        }
        return this;
    }

    XmlNode unlessDefault(String attribute, Length value, Length defaultValue) {
        if (!value.equals(defaultValue)) {
            attribute(attribute, value);
        }
        return this;
    }

    XmlNode unlessFalse(String attribute, boolean value) {
        if (value) {
            attribute(attribute, true);
        }
        return this;
    }

    XmlNode child(XmlNode child) {
        children.add(Objects.requireNonNull(child, "child"));
        return this;
    }

    XmlNode children(List<XmlNode> nodes) {
        nodes.forEach(this::child);
        return this;
    }

    XmlNode text(String text) {
        this.text = Objects.requireNonNull(text, "text");
        this.cdata = false;
        return this;
    }

    XmlNode cdata(String text) {
        this.text = Objects.requireNonNull(text, "text");
        this.cdata = true;
        return this;
    }
}
