package com.questrail.opendrive.model.road;

import com.questrail.opendrive.api.XmlEnum;

/**
 * Road classification used by {@code <type>} records.
 */
public enum RoadType implements XmlEnum
{
    UNKNOWN("unknown"),
    RURAL("rural"),
    MOTORWAY("motorway"),
    TOWN("town"),
    LOW_SPEED("lowSpeed"),
    PEDESTRIAN("pedestrian"),
    BICYCLE("bicycle"),
    TOWN_EXPRESSWAY("townExpressway"),
    TOWN_COLLECTOR("townCollector"),
    TOWN_ARTERIAL("townArterial"),
    TOWN_PRIVATE("townPrivate"),
    TOWN_LOCAL("townLocal"),
    TOWN_PLAY_STREET("townPlayStreet");

    private final String xmlValue;

    RoadType(String xmlValue) {
        this.xmlValue = xmlValue;
    }

    @Override
    public String xmlValue() {
        return xmlValue;
    }
}
