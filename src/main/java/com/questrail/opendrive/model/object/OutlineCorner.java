package com.questrail.opendrive.model.object;

import com.questrail.opendrive.units.Length;

import java.util.Objects;
import java.util.Optional;

/**
 * One corner of an object {@link Outline}.
 *
 * <p>A corner is given either in road coordinates ({@link Road},
 * {@code <cornerRoad>}) or in the object's local u/v frame ({@link Local},
 * {@code <cornerLocal>}). {@code height} is the object's height at the corner;
 * {@code id} is only needed where markings or borders refer to the corner.</p>
 */
public sealed interface OutlineCorner permits OutlineCorner.Road, OutlineCorner.Local
{
    Length height();

    Optional<Integer> id();

    /**
     * {@code <cornerRoad>}: {@code dz} is relative to the reference line elevation.
     */
    record Road(Length s, Length t, Length dz, Length height, Optional<Integer> id) implements OutlineCorner
    {
        public Road {
            Objects.requireNonNull(s, "s");
            Objects.requireNonNull(t, "t");
            Objects.requireNonNull(dz, "dz");
            Objects.requireNonNull(height, "height");
            Objects.requireNonNull(id, "id");
        }
    }

    /**
     * {@code <cornerLocal>}: {@code z} is relative to the object's origin.
     */
    record Local(Length u, Length v, Length z, Length height, Optional<Integer> id) implements OutlineCorner
    {
        public Local {
            Objects.requireNonNull(u, "u");
            Objects.requireNonNull(v, "v");
            Objects.requireNonNull(z, "z");
            Objects.requireNonNull(height, "height");
            Objects.requireNonNull(id, "id");
        }
    }
}
