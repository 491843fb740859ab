package com.questrail.opendrive.internal.encode;

import com.questrail.opendrive.geometry.Arc;
import com.questrail.opendrive.geometry.Geometry;
import com.questrail.opendrive.geometry.GeometryShape;
import com.questrail.opendrive.geometry.Line;
import com.questrail.opendrive.geometry.ParamPoly3;
import com.questrail.opendrive.geometry.Poly3;
import com.questrail.opendrive.geometry.Spiral;
import com.questrail.opendrive.model.road.PlanView;

/**
 * Encodes {@code <planView>}. {@code pRange} is always written, so documents
 * produced here never depend on a reader's missing-range policy.
 */
final class GeometryEncoder
{
    XmlNode encodePlanView(PlanView planView) {
        XmlNode node = XmlNode.element("planView");
        planView.geometries().forEach(geometry -> node.child(encodeGeometry(geometry)));
        return node;
    }

    XmlNode encodeGeometry(Geometry geometry) {
        XmlNode node = XmlNode.element("geometry")
                .attribute("hdg", geometry.hdg())
                .attribute("length", geometry.length())
                .attribute("s", geometry.s())
                .attribute("x", geometry.x())
                .attribute("y", geometry.y())
                .child(encodeShape(geometry.shape()));
        AdditionalDataEncoder.appendTo(node, geometry.additionalData());
        return node;
    }

    private static XmlNode encodeShape(GeometryShape shape) {
        XmlNode node = XmlNode.element(shape.elementName());
        if (shape instanceof Line) {
            return node;
        }
        if (shape instanceof Arc arc) {
            return node.attribute("curvature", arc.curvature());
        }
        if (shape instanceof Spiral spiral) {
            return node.attribute("curvEnd", spiral.curvEnd())
                    .attribute("curvStart", spiral.curvStart());
        }
        if (shape instanceof Poly3 poly3) {
            return node.polynomial("", poly3.v());
        }
        if (shape instanceof ParamPoly3 paramPoly3) {
            return node.attribute("aU", paramPoly3.u().a())
                    .attribute("aV", paramPoly3.v().a())
                    .attribute("bU", paramPoly3.u().b())
                    .attribute("bV", paramPoly3.v().b())
                    .attribute("cU", paramPoly3.u().c())
                    .attribute("cV", paramPoly3.v().c())
                    .attribute("dU", paramPoly3.u().d())
                    .attribute("dV", paramPoly3.v().d())
                    .attribute("pRange", paramPoly3.pRange());
        }
        throw new IllegalStateException("unhandled geometry shape: " + shape);
    }
}
