package com.questrail.opendrive.model.road;

import com.questrail.opendrive.units.NumericText;

import java.util.Objects;

/**
 * The {@code max} attribute of a road speed record: a number, or one of the
 * tokens {@code no limit} and {@code undefined}.
 */
public record MaxSpeed(Kind kind, double value)
{
    public enum Kind
    {
        VALUE,
        NO_LIMIT,
        UNDEFINED
    }

    public static final String NO_LIMIT_TOKEN = "no limit";
    public static final String UNDEFINED_TOKEN = "undefined";

    public MaxSpeed {
        Objects.requireNonNull(kind, "kind");
        if (kind != Kind.VALUE && value != 0.0) {
            throw new IllegalArgumentException(kind + " carries no value");
        }
        if (kind == Kind.VALUE && !Double.isFinite(value)) {
            throw new IllegalArgumentException("max speed must be finite (was " + value + ")");
        }
    }

    public static MaxSpeed of(double value) {
        return new MaxSpeed(Kind.VALUE, value);
    }

    public static MaxSpeed noLimit() {
        return new MaxSpeed(Kind.NO_LIMIT, 0.0);
    }

    public static MaxSpeed undefined() {
        return new MaxSpeed(Kind.UNDEFINED, 0.0);
    }

    public String toXml() {
        return switch (kind) {
            case NO_LIMIT -> NO_LIMIT_TOKEN;
            case UNDEFINED -> UNDEFINED_TOKEN;
            case VALUE -> NumericText.format(value);
        };
    }
}
