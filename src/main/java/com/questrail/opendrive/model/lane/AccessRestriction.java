package com.questrail.opendrive.model.lane;

import com.questrail.opendrive.api.XmlEnum;

/**
 * Road users an access record applies to.
 */
public enum AccessRestriction implements XmlEnum
{
    SIMULATOR("simulator"),
    AUTONOMOUS_VEHICLE("autonomousVehicle"),
    PEDESTRIAN("pedestrian"),
    PASSENGER_CAR("passengerCar"),
    BUS("bus"),
    DELIVERY("delivery"),
    EMERGENCY("emergency"),
    TAXI("taxi"),
    THROUGH_TRAFFIC("throughTraffic"),
    TRUCK("truck"),
    BICYCLE("bicycle"),
    MOTORCYCLE("motorcycle"),
    NONE("none"),
    TRUCKS("trucks");

    private final String xmlValue;

    AccessRestriction(String xmlValue) {
        this.xmlValue = xmlValue;
    }

    @Override
    public String xmlValue() {
        return xmlValue;
    }
}
