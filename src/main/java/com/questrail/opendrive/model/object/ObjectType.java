package com.questrail.opendrive.model.object;

import com.questrail.opendrive.api.XmlEnum;

/**
 * Object classification for {@code <object type=...>}. The vehicle, person and wind types are deprecated in 1.7 but still accepted.
 */
public enum ObjectType implements XmlEnum
{
    NONE("none"),
    OBSTACLE("obstacle"),
    POLE("pole"),
    TREE("tree"),
    VEGETATION("vegetation"),
    BARRIER("barrier"),
    BUILDING("building"),
    PARKING_SPACE("parkingSpace"),
    PATCH("patch"),
    RAILING("railing"),
    TRAFFIC_ISLAND("trafficIsland"),
    CROSSWALK("crosswalk"),
    STREET_LAMP("streetLamp"),
    GANTRY("gantry"),
    SOUND_BARRIER("soundBarrier"),
    ROAD_MARK("roadMark"),
    CAR("car"),
    VAN("van"),
    BUS("bus"),
    TRAILER("trailer"),
    BIKE("bike"),
    MOTORBIKE("motorbike"),
    TRAM("tram"),
    TRAIN("train"),
    PEDESTRIAN("pedestrian"),
    WIND("wind");

    private final String xmlValue;

    ObjectType(String xmlValue) {
        this.xmlValue = xmlValue;
    }

    @Override
    public String xmlValue() {
        return xmlValue;
    }
}
