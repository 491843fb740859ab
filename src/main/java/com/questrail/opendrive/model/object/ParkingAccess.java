package com.questrail.opendrive.model.object;

import com.questrail.opendrive.api.XmlEnum;

/**
 * Vehicle class a parking space is reserved for.
 */
public enum ParkingAccess implements XmlEnum
{
    ALL("all"),
    CAR("car"),
    WOMEN("women"),
    HANDICAPPED("handicapped"),
    BUS("bus"),
    TRUCK("truck"),
    ELECTRIC("electric"),
    RESIDENTS("residents");

    private final String xmlValue;

    ParkingAccess(String xmlValue) {
        this.xmlValue = xmlValue;
    }

    @Override
    public String xmlValue() {
        return xmlValue;
    }
}
