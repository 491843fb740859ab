package com.questrail.opendrive.model.lane;

import com.questrail.opendrive.api.XmlEnum;

/**
 * Lane change permission across a road mark, relative to the lane ids.
 */
public enum LaneChange implements XmlEnum
{
    INCREASE("increase"),
    DECREASE("decrease"),
    BOTH("both"),
    NONE("none");

    private final String xmlValue;

    LaneChange(String xmlValue) {
        this.xmlValue = xmlValue;
    }

    @Override
    public String xmlValue() {
        return xmlValue;
    }
}
