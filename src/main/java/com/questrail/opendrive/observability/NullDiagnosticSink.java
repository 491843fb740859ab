package com.questrail.opendrive.observability;

/**
 * No-op implementation of DiagnosticSink.
 */
public final class NullDiagnosticSink implements DiagnosticSink {
    public static final NullDiagnosticSink INSTANCE = new NullDiagnosticSink();

    private NullDiagnosticSink() {}

    @Override
    public void onDiagnostic(ReadDiagnostic diagnostic) {}
}
