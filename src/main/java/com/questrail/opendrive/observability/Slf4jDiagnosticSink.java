package com.questrail.opendrive.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default implementation of DiagnosticSink that emits logs via SLF4J.
 */
public final class Slf4jDiagnosticSink implements DiagnosticSink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jDiagnosticSink.class);

    @Override
    public void onDiagnostic(ReadDiagnostic diagnostic) {
        switch (diagnostic.kind()) {
            case WORKAROUND_APPLIED -> log.info("OpenDRIVE workaround {} applied at {} (line {}): {}",
                diagnostic.name(),
                diagnostic.element(),
                diagnostic.line(),
                diagnostic.message());
            case UNKNOWN_ELEMENT, UNKNOWN_ATTRIBUTE -> log.warn("OpenDRIVE {} '{}' at {} (line {}, column {}): {}",
                diagnostic.kind(),
                diagnostic.name(),
                diagnostic.element(),
                diagnostic.line(),
                diagnostic.column(),
                diagnostic.message());
        }
    }
}
