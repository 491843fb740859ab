package com.questrail.opendrive.internal.decode;

import com.questrail.opendrive.api.ErrorKind;
import com.questrail.opendrive.config.Workaround;
import com.questrail.opendrive.geometry.Arc;
import com.questrail.opendrive.geometry.Geometry;
import com.questrail.opendrive.geometry.GeometryShape;
import com.questrail.opendrive.geometry.Line;
import com.questrail.opendrive.geometry.ParamPoly3;
import com.questrail.opendrive.geometry.ParamPoly3Range;
import com.questrail.opendrive.geometry.Poly3;
import com.questrail.opendrive.geometry.Spiral;
import com.questrail.opendrive.model.road.PlanView;
import com.questrail.opendrive.units.Angle;
import com.questrail.opendrive.units.Length;

import java.util.ArrayList;
import java.util.List;

/**
 * Decodes {@code <planView>} and its {@code <geometry>} records.
 *
 * <p>This is where the {@link Workaround#SUMO_ISSUE_10301} decision point lives:
 * a {@code <paramPoly3>} without {@code pRange} is either rejected or read as
 * normalized.</p>
 */
final class GeometryDecoder
{
    private static final String SHAPE_ELEMENTS = "line|spiral|arc|poly3|paramPoly3";

    PlanView decodePlanView(ElementReader element) {
        List<Geometry> geometries = new ArrayList<>();
        element.forEachChild(child -> {
            if (child.name().equals("geometry")) {
                geometries.add(decodeGeometry(child));
            } else {
                child.skipUnknown();
            }
        });
        if (geometries.isEmpty()) {
            throw element.missingChild("geometry");
        }
        return new PlanView(geometries);
    }

    Geometry decodeGeometry(ElementReader element) {
        Length s = element.requiredNonNegativeLength("s");
        Length x = element.requiredLength("x");
        Length y = element.requiredLength("y");
        Angle hdg = element.requiredAngle("hdg");
        Length length = element.requiredNonNegativeLength("length");

        List<GeometryShape> shapes = new ArrayList<>(1);
        AdditionalDataCollector additional = new AdditionalDataCollector();
        element.forEachChild(child -> {
            switch (child.name()) {
                case "line", "spiral", "arc", "poly3", "paramPoly3" -> {
                    if (!shapes.isEmpty()) {
                        throw child.error(ErrorKind.STRUCTURAL_VIOLATION, child.name(), null,
                                "geometry already has a " + shapes.get(0).elementName() + " shape");
                    }
                    shapes.add(decodeShape(child));
                }
                default -> additional.acceptOrSkip(child);
            }
        });
        if (shapes.isEmpty()) {
            throw element.missingChild(SHAPE_ELEMENTS);
        }
        return new Geometry(s, x, y, hdg, length, shapes.get(0), additional.build());
    }

    private GeometryShape decodeShape(ElementReader element) {
        return switch (element.name()) {
            case "line" -> new Line();
            case "arc" -> new Arc(element.requiredCurvature("curvature"));
            case "spiral" -> new Spiral(element.requiredCurvature("curvStart"), element.requiredCurvature("curvEnd"));
            case "poly3" -> new Poly3(element.polynomial(""));
            case "paramPoly3" -> decodeParamPoly3(element);
            default -> throw new IllegalStateException("not a shape element: " + element.name());
        };
    }

    private ParamPoly3 decodeParamPoly3(ElementReader element) {
        ParamPoly3Range range = element.optionalEnum("pRange", ParamPoly3Range.class)
                .orElseGet(() -> missingRange(element));
        return new ParamPoly3(element.polynomial("U"), element.polynomial("V"), range);
    }

    private ParamPoly3Range missingRange(ElementReader element) {
        ReadContext context = element.context();
        if (!context.isEnabled(Workaround.SUMO_ISSUE_10301)) {
            throw element.missing("pRange");
        }
        context.workaroundApplied(Workaround.SUMO_ISSUE_10301, element, "missing pRange read as normalized");
        return ParamPoly3Range.NORMALIZED;
    }
}
