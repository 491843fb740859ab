package com.questrail.opendrive.validation;

import com.questrail.opendrive.api.ErrorKind;

import java.util.Objects;

/**
 * A broken structural invariant.
 *
 * @param kind    {@link ErrorKind#STRUCTURAL_VIOLATION}, {@link ErrorKind#UNRESOLVED_REFERENCE}
 *                or {@link ErrorKind#UNSUPPORTED_VERSION}
 * @param element path of the offending element, e.g. {@code road[7]/planView/geometry[2]}
 * @param field   attribute involved
 * @param message what is wrong
 */
public record Violation(ErrorKind kind, String element, String field, String message)
{
    public Violation {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(element, "element");
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(message, "message");
    }
}
