package com.questrail.opendrive.model.lane;

import com.questrail.opendrive.api.XmlEnum;

/**
 * Whether an access record allows or denies the restricted users.
 */
public enum AccessRule implements XmlEnum
{
    ALLOW("allow"),
    DENY("deny");

    private final String xmlValue;

    AccessRule(String xmlValue) {
        this.xmlValue = xmlValue;
    }

    @Override
    public String xmlValue() {
        return xmlValue;
    }
}
