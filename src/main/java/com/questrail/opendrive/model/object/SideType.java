package com.questrail.opendrive.model.object;

import com.questrail.opendrive.api.XmlEnum;

/**
 * Side of an object's bounding box that a marking runs along.
 */
public enum SideType implements XmlEnum
{
    LEFT("left"),
    RIGHT("right"),
    FRONT("front"),
    REAR("rear");

    private final String xmlValue;

    SideType(String xmlValue) {
        this.xmlValue = xmlValue;
    }

    @Override
    public String xmlValue() {
        return xmlValue;
    }
}
