package com.questrail.opendrive.model.road;

import com.questrail.opendrive.api.XmlEnum;

/**
 * Driving side of a road; right-hand traffic unless declared otherwise.
 */
public enum TrafficRule implements XmlEnum
{
    RHT("RHT"),
    LHT("LHT");

    private final String xmlValue;

    TrafficRule(String xmlValue) {
        this.xmlValue = xmlValue;
    }

    @Override
    public String xmlValue() {
        return xmlValue;
    }
}
