package com.questrail.opendrive.model.lane;

import com.questrail.opendrive.api.XmlEnum;

/**
 * Lane usage types defined for {@code <lane type=...>}.
 */
public enum LaneType implements XmlEnum
{
    SHOULDER("shoulder"),
    BORDER("border"),
    DRIVING("driving"),
    STOP("stop"),
    NONE("none"),
    RESTRICTED("restricted"),
    PARKING("parking"),
    MEDIAN("median"),
    BIKING("biking"),
    SIDEWALK("sidewalk"),
    CURB("curb"),
    EXIT("exit"),
    ENTRY("entry"),
    ON_RAMP("onRamp"),
    OFF_RAMP("offRamp"),
    CONNECTING_RAMP("connectingRamp"),
    BIDIRECTIONAL("bidirectional"),
    SPECIAL1("special1"),
    SPECIAL2("special2"),
    SPECIAL3("special3"),
    ROAD_WORKS("roadWorks"),
    TRAM("tram"),
    RAIL("rail"),
    BUS("bus"),
    TAXI("taxi"),
    HOV("HOV"),
    MWY_ENTRY("mwyEntry"),
    MWY_EXIT("mwyExit");

    private final String xmlValue;

    LaneType(String xmlValue) {
        this.xmlValue = xmlValue;
    }

    @Override
    public String xmlValue() {
        return xmlValue;
    }
}
