// file: core/src/main/java/io/compsync/core/diag/OverrideDiagnostics.java
package io.compsync.core.diag;

/**
 * Sink for {@link DiagnosticEvent}s.
 * <p>
 * Implementations must not throw. Callers check {@link #enabled()} before
 * building an event so a disabled sink costs a single branch.
 */
public interface OverrideDiagnostics {

    /** Sink that drops everything. */
    OverrideDiagnostics NOOP = new OverrideDiagnostics() {
        @Override public boolean enabled() { return false; }
        @Override public void emit(DiagnosticEvent event) { }
    };

    default boolean enabled() { return true; }

    void emit(DiagnosticEvent event);
}
