package com.questrail.opendrive.model.road;

import com.questrail.opendrive.api.XmlEnum;

/**
 * Which road property a CRG data set describes.
 */
public enum CrgPurpose implements XmlEnum
{
    ELEVATION("elevation"),
    FRICTION("friction"),
    ALL("all");

    private final String xmlValue;

    CrgPurpose(String xmlValue) {
        this.xmlValue = xmlValue;
    }

    @Override
    public String xmlValue() {
        return xmlValue;
    }
}
