package com.questrail.opendrive.observability;

/**
 * Receives non-fatal reader diagnostics.
 * Implementations can provide logging, collection for later inspection, or nothing.
 */
public interface DiagnosticSink {
    /**
     * Called once per diagnostic, in document order.
     * @param diagnostic the diagnostic
     */
    void onDiagnostic(ReadDiagnostic diagnostic);
}
