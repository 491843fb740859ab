package com.questrail.opendrive.model.junction;

import com.questrail.opendrive.api.XmlEnum;

/**
 * Connection kinds inside a junction.
 */
public enum ConnectionType implements XmlEnum
{
    DEFAULT("default"),
    VIRTUAL("virtual");

    private final String xmlValue;

    ConnectionType(String xmlValue) {
        this.xmlValue = xmlValue;
    }

    @Override
    public String xmlValue() {
        return xmlValue;
    }
}
