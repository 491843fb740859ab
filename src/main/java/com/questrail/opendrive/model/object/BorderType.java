package com.questrail.opendrive.model.object;

import com.questrail.opendrive.api.XmlEnum;

/**
 * Construction of an object border.
 */
public enum BorderType implements XmlEnum
{
    CONCRETE("concrete"),
    CURB("curb");

    private final String xmlValue;

    BorderType(String xmlValue) {
        this.xmlValue = xmlValue;
    }

    @Override
    public String xmlValue() {
        return xmlValue;
    }
}
