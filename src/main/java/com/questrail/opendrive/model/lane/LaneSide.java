package com.questrail.opendrive.model.lane;

/**
 * The three partitions of a lane section. Lane ids are positive on the left,
 * zero in the center and negative on the right, growing in magnitude outwards.
 */
public enum LaneSide
{
    LEFT("left"),
    CENTER("center"),
    RIGHT("right");

    private final String elementName;

    LaneSide(String elementName) {
        this.elementName = elementName;
    }

    public String elementName() {
        return elementName;
    }

    public boolean accepts(int laneId) {
        return switch (this) {
            case LEFT -> laneId > 0;
            case CENTER -> laneId == 0;
            case RIGHT -> laneId < 0;
        };
    }
}
