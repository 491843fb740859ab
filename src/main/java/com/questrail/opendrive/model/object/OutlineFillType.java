package com.questrail.opendrive.model.object;

import com.questrail.opendrive.api.XmlEnum;

/**
 * Surface inside an object outline.
 */
public enum OutlineFillType implements XmlEnum
{
    GRASS("grass"),
    CONCRETE("concrete"),
    COBBLE("cobble"),
    ASPHALT("asphalt"),
    PAVEMENT("pavement"),
    GRAVEL("gravel"),
    SOIL("soil");

    private final String xmlValue;

    OutlineFillType(String xmlValue) {
        this.xmlValue = xmlValue;
    }

    @Override
    public String xmlValue() {
        return xmlValue;
    }
}
