package com.questrail.opendrive.model;

import com.questrail.opendrive.api.XmlEnum;

/**
 * Direction of a link target relative to its reference line.
 */
public enum ElementDir implements XmlEnum
{
    PLUS("+"),
    MINUS("-");

    private final String xmlValue;

    ElementDir(String xmlValue) {
        this.xmlValue = xmlValue;
    }

    @Override
    public String xmlValue() {
        return xmlValue;
    }
}
