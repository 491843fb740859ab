package com.questrail.opendrive.model;

import com.questrail.opendrive.api.XmlEnum;

/**
 * Validity direction of signals and objects relative to the reference line; {@code none} means both directions.
 */
public enum Orientation implements XmlEnum
{
    PLUS("+"),
    MINUS("-"),
    NONE("none");

    private final String xmlValue;

    Orientation(String xmlValue) {
        this.xmlValue = xmlValue;
    }

    @Override
    public String xmlValue() {
        return xmlValue;
    }
}
