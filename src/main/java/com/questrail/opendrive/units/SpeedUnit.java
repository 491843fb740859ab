package com.questrail.opendrive.units;

import com.questrail.opendrive.api.XmlEnum;

/**
 * Speed units permitted by the {@code unit} attribute of speed records.
 */
public enum SpeedUnit implements XmlEnum
{
    METERS_PER_SECOND("m/s", 1.0),
    MILES_PER_HOUR("mph", 0.44704),
    KILOMETERS_PER_HOUR("km/h", 1.0 / 3.6);

    private final String xmlValue;
    private final double metersPerSecond;

    SpeedUnit(String xmlValue, double metersPerSecond) {
        this.xmlValue = xmlValue;
        this.metersPerSecond = metersPerSecond;
    }

    @Override
    public String xmlValue() {
        return xmlValue;
    }

    /**
     * @return the size of one unit expressed in m/s
     */
    public double metersPerSecond() {
        return metersPerSecond;
    }
}
