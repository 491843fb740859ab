package com.questrail.opendrive.model;

import com.questrail.opendrive.api.XmlEnum;

/**
 * Origin of the raw data behind an element.
 */
public enum RawDataSource implements XmlEnum
{
    SENSOR("sensor"),
    CADASTER("cadaster"),
    CUSTOM("custom");

    private final String xmlValue;

    RawDataSource(String xmlValue) {
        this.xmlValue = xmlValue;
    }

    @Override
    public String xmlValue() {
        return xmlValue;
    }
}
