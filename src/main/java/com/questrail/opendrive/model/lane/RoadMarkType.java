package com.questrail.opendrive.model.lane;

import com.questrail.opendrive.api.XmlEnum;

/**
 * Simplified road mark types. Compound types use a space-separated token, e.g. {@code solid broken}.
 */
public enum RoadMarkType implements XmlEnum
{
    NONE("none"),
    SOLID("solid"),
    BROKEN("broken"),
    SOLID_SOLID("solid solid"),
    SOLID_BROKEN("solid broken"),
    BROKEN_SOLID("broken solid"),
    BROKEN_BROKEN("broken broken"),
    BOTTS_DOTS("botts dots"),
    GRASS("grass"),
    CURB("curb"),
    CUSTOM("custom"),
    EDGE("edge");

    private final String xmlValue;

    RoadMarkType(String xmlValue) {
        this.xmlValue = xmlValue;
    }

    @Override
    public String xmlValue() {
        return xmlValue;
    }
}
