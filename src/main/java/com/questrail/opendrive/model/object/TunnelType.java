package com.questrail.opendrive.model.object;

import com.questrail.opendrive.api.XmlEnum;

public enum TunnelType implements XmlEnum
{
    STANDARD("standard"),
    UNDERPASS("underpass");

    private final String xmlValue;

    TunnelType(String xmlValue) {
        this.xmlValue = xmlValue;
    }

    @Override
    public String xmlValue() {
        return xmlValue;
    }
}
