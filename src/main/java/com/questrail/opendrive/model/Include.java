package com.questrail.opendrive.model;

import java.util.Objects;

/**
 * {@code <include file="..."/>}. The referenced file is recorded, never resolved.
 */
public record Include(String file)
{
    public Include {
        Objects.requireNonNull(file, "file");
    }
}
