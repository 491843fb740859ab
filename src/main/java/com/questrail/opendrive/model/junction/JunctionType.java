package com.questrail.opendrive.model.junction;

import com.questrail.opendrive.api.XmlEnum;

/**
 * Junction kinds. Virtual junctions connect roads without a physical intersection.
 */
public enum JunctionType implements XmlEnum
{
    DEFAULT("default"),
    VIRTUAL("virtual");

    private final String xmlValue;

    JunctionType(String xmlValue) {
        this.xmlValue = xmlValue;
    }

    @Override
    public String xmlValue() {
        return xmlValue;
    }
}
