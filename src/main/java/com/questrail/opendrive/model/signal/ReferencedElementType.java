package com.questrail.opendrive.model.signal;

import com.questrail.opendrive.api.XmlEnum;

/**
 * Kind of element a signal {@code <reference>} points at.
 */
public enum ReferencedElementType implements XmlEnum
{
    OBJECT("object"),
    SIGNAL("signal");

    private final String xmlValue;

    ReferencedElementType(String xmlValue) {
        this.xmlValue = xmlValue;
    }

    @Override
    public String xmlValue() {
        return xmlValue;
    }
}
