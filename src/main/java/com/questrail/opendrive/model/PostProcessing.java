package com.questrail.opendrive.model;

import com.questrail.opendrive.api.XmlEnum;

/**
 * Processing applied to raw data before it was converted.
 */
public enum PostProcessing implements XmlEnum
{
    RAW("raw"),
    CLEANED("cleaned"),
    PROCESSED("processed"),
    FUSED("fused");

    private final String xmlValue;

    PostProcessing(String xmlValue) {
        this.xmlValue = xmlValue;
    }

    @Override
    public String xmlValue() {
        return xmlValue;
    }
}
