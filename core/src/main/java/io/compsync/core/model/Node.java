// file: core/src/main/java/io/compsync/core/model/Node.java
package io.compsync.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Immutable node of a parsed document tree.
 * <p>
 *  - id:           unique within the owning document.
 *  - name:         display name, not unique.
 *  - variantGroup: name of the variant family this node belongs to, or null.
 *  - componentRef: present iff this node is an instance of a component.
 */
public record Node(
        String id,
        String name,
        String variantGroup,
        StyleBundle style,
        ContentPayload content,
        List<Node> children,
        ComponentRef componentRef
) {
    public Node {
        Objects.requireNonNull(id, "id");
        if (id.isBlank()) throw new IllegalArgumentException("id must not be blank");
        if (name == null) name = "";
        if (style == null) style = StyleBundle.DEFAULT;
        if (content == null) content = ContentPayload.Container.DEFAULT;
        children = children == null ? List.of() : List.copyOf(children);
    }

    /** True for an InstanceNode, i.e. a node carrying a back reference to its component. */
    public boolean isInstance() {
        return componentRef != null;
    }

    public static Builder builder(String id, String name) {
        return new Builder(id, name);
    }

    public Builder toBuilder() {
        return new Builder(id, name)
                .variantGroup(variantGroup)
                .style(style)
                .content(content)
                .children(children)
                .componentRef(componentRef);
    }

    @Override
    public String toString() {
        return "Node[" + id + " '" + name + "'" + (isInstance() ? " instance" : "") + "]";
    }

    public static final class Builder {
        private final String id;
        private final String name;
        private String variantGroup;
        private StyleBundle style = StyleBundle.DEFAULT;
        private ContentPayload content = ContentPayload.Container.DEFAULT;
        private List<Node> children = List.of();
        private ComponentRef componentRef;

        private Builder(String id, String name) {
            this.id = id;
            this.name = name;
        }

        public Builder variantGroup(String g) { this.variantGroup = g; return this; }
        public Builder style(StyleBundle s) { this.style = s; return this; }
        public Builder content(ContentPayload c) { this.content = c; return this; }
        public Builder children(List<Node> c) { this.children = c; return this; }
        public Builder children(Node... c) { this.children = List.of(c); return this; }
        public Builder componentRef(ComponentRef r) { this.componentRef = r; return this; }

        public Node build() {
            return new Node(id, name, variantGroup, style, content, children, componentRef);
        }
    }
}
