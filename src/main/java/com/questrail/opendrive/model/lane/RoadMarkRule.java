package com.questrail.opendrive.model.lane;

import com.questrail.opendrive.api.XmlEnum;

/**
 * Rule carried by a single line of a detailed road mark type.
 */
public enum RoadMarkRule implements XmlEnum
{
    NO_PASSING("no passing"),
    CAUTION("caution"),
    NONE("none");

    private final String xmlValue;

    RoadMarkRule(String xmlValue) {
        this.xmlValue = xmlValue;
    }

    @Override
    public String xmlValue() {
        return xmlValue;
    }
}
