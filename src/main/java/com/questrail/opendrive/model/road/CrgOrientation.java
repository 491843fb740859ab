package com.questrail.opendrive.model.road;

import com.questrail.opendrive.api.XmlEnum;

/**
 * Orientation of a CRG data set relative to the road.
 */
public enum CrgOrientation implements XmlEnum
{
    SAME("same"),
    OPPOSITE("opposite");

    private final String xmlValue;

    CrgOrientation(String xmlValue) {
        this.xmlValue = xmlValue;
    }

    @Override
    public String xmlValue() {
        return xmlValue;
    }
}
