// file: core/src/main/java/io/compsync/core/diag/LoggingDiagnostics.java
package io.compsync.core.diag;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Writes diagnostic events to java.util.logging.
 * <p>
 * Levels:
 *  - FINE:    resolution attempts and per-node diff decisions,
 *  - WARNING: duplicate identities and key collisions (data problems in a document).
 * Enabled only while the logger would publish FINE records or a warning.
 */
public final class LoggingDiagnostics implements OverrideDiagnostics {
    private static final Logger log = Logger.getLogger(LoggingDiagnostics.class.getName());

    @Override
    public boolean enabled() {
        return log.isLoggable(Level.WARNING);
    }

    @Override
    public void emit(DiagnosticEvent event) {
        Level level = levelOf(event);
        if (!log.isLoggable(level)) return;
        log.log(level, format(event));
    }

    static Level levelOf(DiagnosticEvent event) {
        if (event instanceof DiagnosticEvent.DuplicateIdentity
                || event instanceof DiagnosticEvent.KeyCollision) {
            return Level.WARNING;
        }
        return Level.FINE;
    }

    static String format(DiagnosticEvent event) {
        if (event instanceof DiagnosticEvent.ResolutionSucceeded e) {
            return String.format("resolved instance=%s doc=%s -> ref=%s via %s",
                    e.instanceId(), e.documentId(), e.referenceId(), e.strategy());
        }
        if (event instanceof DiagnosticEvent.ResolutionFailed e) {
            return String.format("no reference for instance=%s doc=%s (%s)",
                    e.instanceId(), e.documentId(), e.reason());
        }
        if (event instanceof DiagnosticEvent.AmbiguousName e) {
            return String.format("ambiguous name '%s' in doc=%s (%d candidates), using %s",
                    e.name(), e.documentId(), e.candidates(), e.chosenId());
        }
        if (event instanceof DiagnosticEvent.DiffFound e) {
            return String.format("override key='%s' node=%s style=%s content=%s",
                    e.key(), e.nodeId(), e.styleFields(), e.contentFields());
        }
        if (event instanceof DiagnosticEvent.DiffSuppressed e) {
            return String.format("no override key='%s' node=%s", e.key(), e.nodeId());
        }
        if (event instanceof DiagnosticEvent.DuplicateIdentity e) {
            return String.format("duplicate node id %s in doc=%s, keeping first", e.nodeId(), e.documentId());
        }
        if (event instanceof DiagnosticEvent.KeyCollision e) {
            return String.format("override key '%s' collision: kept node=%s, dropped node=%s",
                    e.key(), e.keptNodeId(), e.droppedNodeId());
        }
        if (event instanceof DiagnosticEvent.UnmatchedDescendant e) {
            return String.format("no counterpart for node=%s '%s' under ref=%s",
                    e.nodeId(), e.name(), e.parentReferenceId());
        }
        return event.toString();
    }
}
