package com.questrail.opendrive.model.road;

import com.questrail.opendrive.api.XmlEnum;

/**
 * Kind of element a road link points to.
 */
public enum LinkElementType implements XmlEnum
{
    ROAD("road"),
    JUNCTION("junction");

    private final String xmlValue;

    LinkElementType(String xmlValue) {
        this.xmlValue = xmlValue;
    }

    @Override
    public String xmlValue() {
        return xmlValue;
    }
}
