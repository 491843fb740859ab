package com.questrail.opendrive.internal.decode;

import com.questrail.opendrive.config.CompatibilityConfig;
import com.questrail.opendrive.config.Workaround;
import com.questrail.opendrive.observability.DiagnosticSink;
import com.questrail.opendrive.observability.ReadDiagnostic;
import com.questrail.opendrive.validation.StructuralValidator;

import java.util.Objects;

/**
 * Per-read state shared by all element decoders of one {@code read} call.
 */
record ReadContext(CompatibilityConfig compatibility, DiagnosticSink sink, StructuralValidator validator)
{
    ReadContext {
        Objects.requireNonNull(compatibility, "compatibility");
        Objects.requireNonNull(sink, "sink");
        Objects.requireNonNull(validator, "validator");
    }

    boolean isEnabled(Workaround workaround) {
        return compatibility.isEnabled(workaround);
    }

    void report(ReadDiagnostic.Kind kind, ElementReader element, String name, String message) {
        sink.onDiagnostic(new ReadDiagnostic(kind, element.path(), name, element.line(), element.column(), message));
    }

    void workaroundApplied(Workaround workaround, ElementReader element, String message) {
        report(ReadDiagnostic.Kind.WORKAROUND_APPLIED, element, workaround.flag(), message);
    }
}
