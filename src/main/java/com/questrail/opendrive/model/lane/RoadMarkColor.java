package com.questrail.opendrive.model.lane;

import com.questrail.opendrive.api.XmlEnum;

/**
 * Road mark colors. {@code standard} means the locally customary color, typically white.
 */
public enum RoadMarkColor implements XmlEnum
{
    STANDARD("standard"),
    BLUE("blue"),
    GREEN("green"),
    RED("red"),
    WHITE("white"),
    YELLOW("yellow"),
    ORANGE("orange"),
    BLACK("black"),
    VIOLET("violet");

    private final String xmlValue;

    RoadMarkColor(String xmlValue) {
        this.xmlValue = xmlValue;
    }

    @Override
    public String xmlValue() {
        return xmlValue;
    }
}
