package com.questrail.opendrive.model;

import com.questrail.opendrive.api.XmlEnum;

/**
 * Which end of a road or connecting road a link attaches to.
 */
public enum ContactPoint implements XmlEnum
{
    START("start"),
    END("end");

    private final String xmlValue;

    ContactPoint(String xmlValue) {
        this.xmlValue = xmlValue;
    }

    @Override
    public String xmlValue() {
        return xmlValue;
    }
}
