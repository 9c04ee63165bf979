// file: core/src/main/java/io/compsync/core/sync/LibrarySyncMode.java
package io.compsync.core.sync;

/**
 * How a consumer should render an instance when syncing with its library.
 */
public enum LibrarySyncMode {
    /** Not linked to a library component: render the authored subtree. */
    ORIGINAL,
    /** No overrides: the current library component can be used as is. */
    LIBRARY,
    /** Fetch the library component and apply the overrides on top. */
    LIBRARY_WITH_OVERRIDES;

    public static LibrarySyncMode classify(ComponentInfo info) {
        if (info.componentId() == null && info.componentName() == null) return ORIGINAL;
        if (info.overrides().isEmpty()) return LIBRARY;
        return LIBRARY_WITH_OVERRIDES;
    }
}
