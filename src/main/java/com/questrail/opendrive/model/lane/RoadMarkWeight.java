package com.questrail.opendrive.model.lane;

import com.questrail.opendrive.api.XmlEnum;

/**
 * Line weight of a road mark.
 */
public enum RoadMarkWeight implements XmlEnum
{
    STANDARD("standard"),
    BOLD("bold");

    private final String xmlValue;

    RoadMarkWeight(String xmlValue) {
        this.xmlValue = xmlValue;
    }

    @Override
    public String xmlValue() {
        return xmlValue;
    }
}
