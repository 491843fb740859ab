package com.questrail.opendrive.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An element preserved verbatim from an extension point of the schema.
 *
 * <p>Attribute order is kept as read. Text content is stripped of surrounding
 * whitespace on construction; an element with no text has the empty string.
 * Equality ignores attribute order.</p>
 */
public record OpaqueElement(String name, Map<String, String> attributes, List<OpaqueElement> children, String text)
{
    public OpaqueElement {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(text, "text");
        text = text.strip();
        attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        children = List.copyOf(children);
    }

    public static OpaqueElement leaf(String name, Map<String, String> attributes) {
        return new OpaqueElement(name, attributes, List.of(), "");
    }
}
