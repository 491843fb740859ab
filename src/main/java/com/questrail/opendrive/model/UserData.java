package com.questrail.opendrive.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@code <userData>}: application-defined data attached to an element.
 *
 * @param code    required user data key
 * @param value   optional inline value
 * @param content nested elements, preserved uninterpreted
 */
public record UserData(String code, Optional<String> value, List<OpaqueElement> content)
{
    public UserData {
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(value, "value");
        content = List.copyOf(content);
    }

    public static UserData of(String code, String value) {
        return new UserData(code, Optional.of(value), List.of());
    }
}
