package com.questrail.opendrive.internal.decode;

import com.questrail.opendrive.model.Orientation;
import com.questrail.opendrive.model.signal.Control;
import com.questrail.opendrive.model.signal.Controller;
import com.questrail.opendrive.model.signal.LaneValidity;
import com.questrail.opendrive.model.signal.ReferencedElementType;
import com.questrail.opendrive.model.signal.Signal;
import com.questrail.opendrive.model.signal.SignalDependency;
import com.questrail.opendrive.model.signal.SignalElementReference;
import com.questrail.opendrive.model.signal.SignalPosition;
import com.questrail.opendrive.model.signal.SignalReference;
import com.questrail.opendrive.model.signal.Signals;
import com.questrail.opendrive.units.Angle;
import com.questrail.opendrive.units.Length;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Decodes road {@code <signals>} and top-level {@code <controller>}s.
 */
final class SignalDecoder
{
    Signals decodeSignals(ElementReader element) {
        List<Signal> signals = new ArrayList<>();
        List<SignalReference> references = new ArrayList<>();
        element.forEachChild(child -> {
            switch (child.name()) {
                case "signal" -> signals.add(decodeSignal(child));
                case "signalReference" -> references.add(decodeReference(child));
                default -> child.skipUnknown();
            }
        });
        return new Signals(signals, references);
    }

    private static Signal decodeSignal(ElementReader element) {
        String id = element.requiredId("id");
        Length s = element.requiredNonNegativeLength("s");
        Length t = element.requiredLength("t");
        Length zOffset = element.requiredLength("zOffset");
        boolean dynamic = element.requiredYesNo("dynamic");
        Orientation orientation = element.requiredEnum("orientation", Orientation.class);
        String type = element.requiredText("type");
        String subtype = element.requiredText("subtype");
        Optional<String> name = element.optionalText("name");
        Optional<String> country = element.optionalText("country");
        Optional<String> countryRevision = element.optionalText("countryRevision");
        Optional<Double> value = element.optionalDouble("value");
        Optional<String> unit = element.optionalText("unit");
        Optional<Length> height = element.optionalLength("height");
        Optional<Length> width = element.optionalLength("width");
        Optional<String> text = element.optionalText("text");
        Optional<Angle> hOffset = element.optionalAngle("hOffset");
        Optional<Angle> pitch = element.optionalAngle("pitch");
        Optional<Angle> roll = element.optionalAngle("roll");

        List<LaneValidity> validities = new ArrayList<>();
        List<SignalDependency> dependencies = new ArrayList<>();
        List<SignalElementReference> references = new ArrayList<>();
        SignalPosition[] position = new SignalPosition[1];
        AdditionalDataCollector additional = new AdditionalDataCollector();
        element.forEachChild(child -> {
            switch (child.name()) {
                case "validity" -> validities.add(decodeValidity(child));
                case "dependency" -> dependencies.add(
                        new SignalDependency(child.requiredId("id"), child.optionalText("type")));
                case "reference" -> references.add(new SignalElementReference(
                        child.requiredEnum("elementType", ReferencedElementType.class),
                        child.requiredId("elementId"),
                        child.optionalText("type")));
                case "positionRoad" -> {
                    element.requireAbsent(position[0], "positionRoad");
                    position[0] = decodePositionRoad(child);
                }
                case "positionInertial" -> {
                    element.requireAbsent(position[0], "positionInertial");
                    position[0] = decodePositionInertial(child);
                }
                default -> additional.acceptOrSkip(child);
            }
        });
        return new Signal(id, s, t, zOffset, dynamic, orientation, type, subtype, name, country, countryRevision,
                value, unit, height, width, text, hOffset, pitch, roll, validities, dependencies, references,
                Optional.ofNullable(position[0]), additional.build());
    }

    private static SignalPosition.Road decodePositionRoad(ElementReader element) {
        return new SignalPosition.Road(
                element.requiredId("roadId"),
                element.requiredNonNegativeLength("s"),
                element.requiredLength("t"),
                element.requiredLength("zOffset"),
                element.requiredAngle("hOffset"),
                element.optionalAngle("pitch"),
                element.optionalAngle("roll"));
    }

    private static SignalPosition.Inertial decodePositionInertial(ElementReader element) {
        return new SignalPosition.Inertial(
                element.requiredLength("x"),
                element.requiredLength("y"),
                element.requiredLength("z"),
                element.requiredAngle("hdg"),
                element.optionalAngle("pitch"),
                element.optionalAngle("roll"));
    }

    private static SignalReference decodeReference(ElementReader element) {
        String id = element.requiredId("id");
        Length s = element.requiredNonNegativeLength("s");
        Length t = element.requiredLength("t");
        Orientation orientation = element.requiredEnum("orientation", Orientation.class);
        List<LaneValidity> validities = decodeValidities(element);
        return new SignalReference(id, s, t, orientation, validities);
    }

    Controller decodeController(ElementReader element) {
        String id = element.requiredId("id");
        Optional<String> name = element.optionalText("name");
        Optional<Integer> sequence = element.optionalInt("sequence");
        List<Control> controls = new ArrayList<>();
        element.forEachChild(child -> {
            if (child.name().equals("control")) {
                controls.add(new Control(child.requiredId("signalId"), child.optionalText("type")));
            } else {
                child.skipUnknown();
            }
        });
        return new Controller(id, name, sequence, controls);
    }

    static List<LaneValidity> decodeValidities(ElementReader element) {
        List<LaneValidity> validities = new ArrayList<>();
        element.forEachChild(child -> {
            if (child.name().equals("validity")) {
                validities.add(decodeValidity(child));
            } else {
                child.skipUnknown();
            }
        });
        return validities;
    }

    static LaneValidity decodeValidity(ElementReader element) {
        return new LaneValidity(element.requiredInt("fromLane"), element.requiredInt("toLane"));
    }
}
