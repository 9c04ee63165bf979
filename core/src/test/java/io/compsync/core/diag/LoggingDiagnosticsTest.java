// file: core/src/test/java/io/compsync/core/diag/LoggingDiagnosticsTest.java
package io.compsync.core.diag;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.logging.Level;

import static org.junit.jupiter.api.Assertions.*;

class LoggingDiagnosticsTest {

    @Test
    void data_problems_are_warnings_everything_else_fine() {
        assertEquals(Level.WARNING, LoggingDiagnostics.levelOf(new DiagnosticEvent.DuplicateIdentity("d", "1")));
        assertEquals(Level.WARNING, LoggingDiagnostics.levelOf(new DiagnosticEvent.KeyCollision("Label", "a", "b")));
        assertEquals(Level.FINE, LoggingDiagnostics.levelOf(new DiagnosticEvent.DiffSuppressed("Label", "a")));
        assertEquals(Level.FINE, LoggingDiagnostics.levelOf(new DiagnosticEvent.ResolutionFailed("i", "d", "no match")));
    }

    @Test
    void messages_name_the_nodes_involved() {
        String collision = LoggingDiagnostics.format(new DiagnosticEvent.KeyCollision("Label", "n1", "n2"));
        assertEquals("override key 'Label' collision: kept node=n1, dropped node=n2", collision);

        String diff = LoggingDiagnostics.format(
                new DiagnosticEvent.DiffFound("MyButton", "i1", List.of("FILLS"), List.of()));
        assertTrue(diff.contains("style=[FILLS]"));
    }

    @Test
    void emit_never_throws() {
        var sink = new LoggingDiagnostics();
        assertDoesNotThrow(() -> sink.emit(new DiagnosticEvent.UnmatchedDescendant("n", "Badge", "r")));
    }
}
