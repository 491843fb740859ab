package com.questrail.opendrive.api;

import java.util.Objects;
import java.util.Optional;

/**
 * OpenDriveException
 * -----------------------------------------------------------------------------
 * Root of all recoverable codec failures.
 *
 * <p>Every instance carries an {@link ErrorKind} plus as much locating context as
 * was available at the point of failure:</p>
 * <ul>
 *   <li>the element path (for example {@code OpenDRIVE/road/planView/geometry})</li>
 *   <li>the attribute or child element name involved</li>
 *   <li>the offending raw text</li>
 *   <li>the 1-based line and column of the element start tag</li>
 * </ul>
 *
 * <p>Programming errors (null model parts, a negative geometry length passed to a
 * constructor) are <strong>not</strong> reported through this type; they surface
 * as {@link IllegalArgumentException} or {@link NullPointerException}.</p>
 */
public class OpenDriveException extends RuntimeException
{
    /** Marker for an unknown line or column. */
    public static final int UNKNOWN_POSITION = -1;

    private final ErrorKind kind;
    private final String element;
    private final String field;
    private final String rawText;
    private final int line;
    private final int column;

    public OpenDriveException(ErrorKind kind, String message) {
        this(kind, message, null, null, null, UNKNOWN_POSITION, UNKNOWN_POSITION, null);
    }

    public OpenDriveException(ErrorKind kind, String message, Throwable cause) {
        this(kind, message, null, null, null, UNKNOWN_POSITION, UNKNOWN_POSITION, cause);
    }

    public OpenDriveException(ErrorKind kind,
                              String message,
                              String element,
                              String field,
                              String rawText,
                              int line,
                              int column,
                              Throwable cause) {
        super(describe(kind, message, element, field, rawText, line, column), cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.element = element;
        this.field = field;
        this.rawText = rawText;
        this.line = line;
        this.column = column;
    }

    public ErrorKind kind() {
        return kind;
    }

    /**
     * @return the slash-separated path of the element being processed, if known
     */
    public Optional<String> element() {
        return Optional.ofNullable(element);
    }

    /**
     * @return the attribute or child element name involved, if any
     */
    public Optional<String> field() {
        return Optional.ofNullable(field);
    }

    /**
     * @return the offending raw text, if any
     */
    public Optional<String> rawText() {
        return Optional.ofNullable(rawText);
    }

    public int line() {
        return line;
    }

    public int column() {
        return column;
    }

    private static String describe(ErrorKind kind,
                                   String message,
                                   String element,
                                   String field,
                                   String rawText,
                                   int line,
                                   int column) {
        StringBuilder sb = new StringBuilder();
        sb.append(kind);
        if (element != null) {
            sb.append(" at ").append(element);
        }
        if (line != UNKNOWN_POSITION) {
            sb.append(" (line ").append(line);
            if (column != UNKNOWN_POSITION) {
                sb.append(", column ").append(column);
            }
            sb.append(')');
        }
        if (field != null) {
            sb.append(" [").append(field).append(']');
        }
        if (rawText != null) {
            sb.append(" '").append(rawText).append('\'');
        }
        if (message != null && !message.isEmpty()) {
            sb.append(": ").append(message);
        }
        return sb.toString();
    }
}
