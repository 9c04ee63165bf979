// file: core/src/main/java/io/compsync/core/model/ComponentRef.java
package io.compsync.core.model;

/**
 * Back reference from an instance to the component it was created from.
 * <p>
 * The component is addressed by (documentId, componentId) rather than by an
 * object reference, so an instance never holds on to a library document that
 * may be reloaded independently.
 * <p>
 * Fields:
 *  - documentId:       document that owns the component; null means the
 *                      document the instance itself lives in.
 *  - componentId:      node identity of the component in that document.
 *  - componentName:    component name, used when the identity is unknown there.
 *  - componentSetName: variant group of the component, null for plain components.
 */
public record ComponentRef(
        String documentId,
        String componentId,
        String componentName,
        String componentSetName
) {
    public ComponentRef {
        if (isBlank(componentId) && isBlank(componentName)) {
            throw new IllegalArgumentException("componentRef needs a componentId or a componentName");
        }
    }

    public static ComponentRef byName(String documentId, String componentName) {
        return new ComponentRef(documentId, null, componentName, null);
    }

    public boolean hasVariantGroup() {
        return !isBlank(componentSetName);
    }

    static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
