package game.impl;

import game.contracts.Diagnostics;
import game.records.Diagnostic;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default reporter: writes every diagnostic to the log.
 *
 * <p>Structural misuse points at a caller bug and is logged at WARN. Malformed import input is
 * routine for hand-written PGN and stays at DEBUG.
 */
public final class LoggingDiagnostics implements Diagnostics {

    private static final Logger LOGGER = LoggerFactory.getLogger(LoggingDiagnostics.class);

    public static final LoggingDiagnostics INSTANCE = new LoggingDiagnostics();

    private LoggingDiagnostics() {}

    @Override
    public void report(Diagnostic diagnostic) {
        switch (diagnostic.kind()) {
            case STRUCTURAL_MISUSE -> LOGGER.warn("{}", diagnostic);
            case MALFORMED_INPUT, VARIATION_UNDERFLOW -> LOGGER.debug("{}", diagnostic);
        }
    }
}
