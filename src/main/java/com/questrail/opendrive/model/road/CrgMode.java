package com.questrail.opendrive.model.road;

import com.questrail.opendrive.api.XmlEnum;

/**
 * How a CRG surface data set is attached to the road. The schema restricts junction surfaces to {@code global}.
 */
public enum CrgMode implements XmlEnum
{
    ATTACHED("attached"),
    ATTACHED0("attached0"),
    GENUINE("genuine"),
    GLOBAL("global");

    private final String xmlValue;

    CrgMode(String xmlValue) {
        this.xmlValue = xmlValue;
    }

    @Override
    public String xmlValue() {
        return xmlValue;
    }
}
