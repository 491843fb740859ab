package com.questrail.opendrive.model.junction;

import com.questrail.opendrive.api.XmlEnum;

public enum JunctionGroupType implements XmlEnum
{
    ROUNDABOUT("roundabout"),
    UNKNOWN("unknown");

    private final String xmlValue;

    JunctionGroupType(String xmlValue) {
        this.xmlValue = xmlValue;
    }

    @Override
    public String xmlValue() {
        return xmlValue;
    }
}
