package com.questrail.opendrive.observability;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records diagnostics for assertions.
 */
public final class RecordingDiagnosticSink implements DiagnosticSink {
    private final List<ReadDiagnostic> diagnostics = new ArrayList<>();

    @Override
    public synchronized void onDiagnostic(ReadDiagnostic diagnostic) {
        diagnostics.add(diagnostic);
    }

    public synchronized List<ReadDiagnostic> getAll() {
        return new ArrayList<>(diagnostics);
    }

    public synchronized List<ReadDiagnostic> ofKind(ReadDiagnostic.Kind kind) {
        return diagnostics.stream()
            .filter(d -> d.kind() == kind)
            .collect(Collectors.toList());
    }

    public synchronized boolean hasDiagnostic(ReadDiagnostic.Kind kind, String name) {
        return diagnostics.stream().anyMatch(d -> d.kind() == kind && d.name().equals(name));
    }
}
