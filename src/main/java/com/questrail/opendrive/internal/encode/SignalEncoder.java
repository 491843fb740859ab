package com.questrail.opendrive.internal.encode;

import com.questrail.opendrive.model.signal.Control;
import com.questrail.opendrive.model.signal.Controller;
import com.questrail.opendrive.model.signal.LaneValidity;
import com.questrail.opendrive.model.signal.Signal;
import com.questrail.opendrive.model.signal.SignalDependency;
import com.questrail.opendrive.model.signal.SignalElementReference;
import com.questrail.opendrive.model.signal.SignalPosition;
import com.questrail.opendrive.model.signal.SignalReference;
import com.questrail.opendrive.model.signal.Signals;

import java.util.List;

/**
 * Encodes road {@code <signals>} and top-level {@code <controller>}s.
 */
final class SignalEncoder
{
    XmlNode encodeSignals(Signals signals) {
        XmlNode node = XmlNode.element("signals");
        signals.signals().forEach(signal -> node.child(encodeSignal(signal)));
        signals.references().forEach(reference -> node.child(encodeReference(reference)));
        return node;
    }

    private static XmlNode encodeSignal(Signal signal) {
        XmlNode node = XmlNode.element("signal")
                .optionalText("country", signal.country())
                .optionalText("countryRevision", signal.countryRevision())
                .yesNo("dynamic", signal.dynamic())
                .optionalLength("height", signal.height())
                .optionalAngle("hOffset", signal.hOffset())
                .attribute("id", signal.id())
                .optionalText("name", signal.name())
                .attribute("orientation", signal.orientation())
                .optionalAngle("pitch", signal.pitch())
                .optionalAngle("roll", signal.roll())
                .attribute("s", signal.s())
                .attribute("subtype", signal.subtype())
                .attribute("t", signal.t())
                .optionalText("text", signal.text())
                .attribute("type", signal.type())
                .optionalText("unit", signal.unit())
                .optionalDouble("value", signal.value())
                .optionalLength("width", signal.width())
                .attribute("zOffset", signal.zOffset());
        appendValidities(node, signal.validities());
        for (SignalDependency dependency : signal.dependencies()) {
            node.child(XmlNode.element("dependency")
                    .attribute("id", dependency.id())
                    .optionalText("type", dependency.type()));
        }
        for (SignalElementReference reference : signal.references()) {
            node.child(XmlNode.element("reference")
                    .attribute("elementId", reference.elementId())
                    .attribute("elementType", reference.elementType())
                    .optionalText("type", reference.type()));
        }
        signal.position().ifPresent(position -> node.child(encodePosition(position)));
        AdditionalDataEncoder.appendTo(node, signal.additionalData());
        return node;
    }

    private static XmlNode encodePosition(SignalPosition position) {
        if (position instanceof SignalPosition.Road road) {
            return XmlNode.element("positionRoad")
                    .attribute("hOffset", road.hOffset())
                    .optionalAngle("pitch", road.pitch())
                    .attribute("roadId", road.roadId())
                    .optionalAngle("roll", road.roll())
                    .attribute("s", road.s())
                    .attribute("t", road.t())
                    .attribute("zOffset", road.zOffset());
        }
        SignalPosition.Inertial inertial = (SignalPosition.Inertial) position;
        return XmlNode.element("positionInertial")
                .attribute("hdg", inertial.hdg())
                .optionalAngle("pitch", inertial.pitch())
                .optionalAngle("roll", inertial.roll())
                .attribute("x", inertial.x())
                .attribute("y", inertial.y())
                .attribute("z", inertial.z());
    }

    private static XmlNode encodeReference(SignalReference reference) {
        XmlNode node = XmlNode.element("signalReference")
                .attribute("id", reference.id())
                .attribute("orientation", reference.orientation())
                .attribute("s", reference.s())
                .attribute("t", reference.t());
        appendValidities(node, reference.validities());
        return node;
    }

    XmlNode encodeController(Controller controller) {
        XmlNode node = XmlNode.element("controller")
                .attribute("id", controller.id())
                .optionalText("name", controller.name())
                .optionalInt("sequence", controller.sequence());
        for (Control control : controller.controls()) {
            node.child(XmlNode.element("control")
                    .attribute("signalId", control.signalId())
                    .optionalText("type", control.type()));
        }
        return node;
    }

    static void appendValidities(XmlNode parent, List<LaneValidity> validities) {
        for (LaneValidity validity : validities) {
            parent.child(XmlNode.element("validity")
                    .attribute("fromLane", validity.fromLane())
                    .attribute("toLane", validity.toLane()));
        }
    }
}
