package com.questrail.opendrive.validation;

/**
 * Syntax of element ids and id references.
 *
 * <p>An id is well-formed when it is non-empty and contains no whitespace. Only
 * syntax is checked here; whether a reference names an element that exists is a
 * network-level question answered through the document lookups.</p>
 */
public final class Ids
{
    private Ids() {
    }

    public static boolean isWellFormed(String id) {
        if (id == null || id.isEmpty()) {
            return false;
        }
        for (int i = 0; i < id.length(); i++) {
            if (Character.isWhitespace(id.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
