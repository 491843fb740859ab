package com.questrail.opendrive.api;

/**
 * Indicates that a {@code Document} could not be written.
 *
 * Raised when the model violates a structural invariant the output grammar
 * depends on, or when the underlying XML writer fails.
 */
public final class OpenDriveWriteException extends OpenDriveException
{
    public OpenDriveWriteException(ErrorKind kind, String message, String element, String field) {
        super(kind, message, element, field, null, UNKNOWN_POSITION, UNKNOWN_POSITION, null);
    }

    public OpenDriveWriteException(ErrorKind kind, String message, Throwable cause) {
        super(kind, message, null, null, null, UNKNOWN_POSITION, UNKNOWN_POSITION, cause);
    }
}
