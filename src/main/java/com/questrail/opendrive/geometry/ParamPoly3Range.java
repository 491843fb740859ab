package com.questrail.opendrive.geometry;

import com.questrail.opendrive.api.XmlEnum;

/**
 * Domain of the parameter {@code p} of a {@link ParamPoly3}.
 */
public enum ParamPoly3Range implements XmlEnum
{
    /** {@code p} runs over {@code [0, length]}. */
    ARC_LENGTH("arcLength"),

    /** {@code p} runs over {@code [0, 1]}. */
    NORMALIZED("normalized");

    private final String xmlValue;

    ParamPoly3Range(String xmlValue) {
        this.xmlValue = xmlValue;
    }

    @Override
    public String xmlValue() {
        return xmlValue;
    }
}
