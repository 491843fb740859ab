package com.questrail.opendrive.model.object;

import com.questrail.opendrive.api.XmlEnum;

/**
 * Construction material of a bridge.
 */
public enum BridgeType implements XmlEnum
{
    CONCRETE("concrete"),
    STEEL("steel"),
    BRICK("brick"),
    WOOD("wood");

    private final String xmlValue;

    BridgeType(String xmlValue) {
        this.xmlValue = xmlValue;
    }

    @Override
    public String xmlValue() {
        return xmlValue;
    }
}
