package com.questrail.opendrive.observability;

import java.util.Objects;

/**
 * A non-fatal observation made while reading a document.
 *
 * @param kind    what was observed
 * @param element slash-separated path of the element concerned
 * @param name    the unknown element or attribute name, or the workaround flag applied
 * @param line    1-based line of the element, or -1 if unknown
 * @param column  1-based column of the element, or -1 if unknown
 * @param message human-readable detail
 */
public record ReadDiagnostic(Kind kind, String element, String name, int line, int column, String message)
{
    public enum Kind
    {
        /** An element outside the schema was skipped. */
        UNKNOWN_ELEMENT,

        /** An attribute outside the schema was ignored. */
        UNKNOWN_ATTRIBUTE,

        /** A compatibility workaround substituted a value. */
        WORKAROUND_APPLIED
    }

    public ReadDiagnostic {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(element, "element");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(message, "message");
    }
}
