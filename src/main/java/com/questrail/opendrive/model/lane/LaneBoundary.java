package com.questrail.opendrive.model.lane;

import com.questrail.opendrive.geometry.CubicPolynomial;
import com.questrail.opendrive.units.Length;

/**
 * A lane extent record: either a {@link LaneWidth} or a {@link LaneBorder}.
 *
 * <p>Both share the same attributes; they differ in what the polynomial
 * describes. Width and border records keep their document order in one list.</p>
 */
public sealed interface LaneBoundary permits LaneWidth, LaneBorder
{
    /**
     * @return start offset relative to the enclosing lane section
     */
    Length sOffset();

    CubicPolynomial polynomial();

    String elementName();
}
