package com.questrail.opendrive.api;

/**
 * Classification of every recoverable failure the codec reports.
 *
 * <p>Each kind identifies a class of document defect (or, for
 * {@link #WRITE_FAILURE}, an output failure). Callers are expected to branch
 * on the kind rather than on message text.</p>
 */
public enum ErrorKind
{
    /** The token stream is not well-formed XML. */
    MALFORMED_XML,

    /** A required attribute or child element is absent. */
    MISSING_REQUIRED_FIELD,

    /** An enumerated attribute carries a token outside the standard's vocabulary. */
    INVALID_ENUM_VALUE,

    /** Numeric text is not a decimal literal, or its magnitude overflows. */
    MALFORMED_NUMBER,

    /** A number parses but violates the documented range of its field. */
    VALUE_OUT_OF_DOMAIN,

    /** An id or id reference is syntactically unable to resolve. */
    UNRESOLVED_REFERENCE,

    /** Geometry evaluation was requested outside {@code [0, length]}. */
    OFFSET_OUT_OF_RANGE,

    /** The document declares a standard revision this codec does not implement. */
    UNSUPPORTED_VERSION,

    /** A per-element structural invariant (ordering, contiguity, uniqueness) is violated. */
    STRUCTURAL_VIOLATION,

    /** The underlying XML writer failed while producing output. */
    WRITE_FAILURE
}
