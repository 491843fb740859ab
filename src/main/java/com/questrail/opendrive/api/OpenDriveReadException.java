package com.questrail.opendrive.api;

/**
 * Indicates that a document could not be translated into a valid
 * {@code Document} model.
 *
 * This typically reflects:
 * <ul>
 *   <li>XML that is not well-formed</li>
 *   <li>A required attribute or element missing from the source</li>
 *   <li>Attribute text that is not a valid number, enum token or id</li>
 *   <li>A structural invariant violated by the element sequence</li>
 * </ul>
 *
 * No partially populated document is ever returned alongside this exception.
 */
public final class OpenDriveReadException extends OpenDriveException
{
    public OpenDriveReadException(ErrorKind kind,
                                  String message,
                                  String element,
                                  String field,
                                  String rawText,
                                  int line,
                                  int column) {
        super(kind, message, element, field, rawText, line, column, null);
    }

    public OpenDriveReadException(ErrorKind kind,
                                  String message,
                                  String element,
                                  String field,
                                  String rawText,
                                  int line,
                                  int column,
                                  Throwable cause) {
        super(kind, message, element, field, rawText, line, column, cause);
    }
}
