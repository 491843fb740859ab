package com.questrail.opendrive.api;

import java.util.Optional;

/**
 * An enumerated vocabulary whose constants map one-to-one onto XML tokens.
 *
 * <p>Token matching is exact and case-sensitive: {@code "Driving"} is not a
 * lane type, {@code "driving"} is.</p>
 */
public interface XmlEnum
{
    /**
     * @return the token written to and read from the document
     */
    String xmlValue();

    /**
     * Resolves {@code raw} against the constants of {@code type}.
     *
     * @param type the enum class to search
     * @param raw  the raw attribute text
     * @return the matching constant, or empty if the token is not in the vocabulary
     */
    static <E extends Enum<E> & XmlEnum> Optional<E> fromXml(Class<E> type, String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        for (E constant : type.getEnumConstants()) {
            if (constant.xmlValue().equals(raw)) {
                return Optional.of(constant);
            }
        }
        return Optional.empty();
    }
}
