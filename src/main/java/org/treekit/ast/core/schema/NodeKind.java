package org.treekit.ast.core.schema;

import java.util.List;
import java.util.Optional;

/**
 * The runtime description of a registered node kind: its name, its Java type and its declared
 * fields in order. The span is implicit and not part of {@link #fields()}.
 *
 * @param name   The kind name, unique within a registry.
 * @param type   The concrete class implementing the kind.
 * @param fields The declared fields in declaration order.
 */
public record NodeKind(String name, Class<?> type, List<FieldSpec> fields) {

    public NodeKind {
        fields = List.copyOf(fields);
    }

    /**
     * @return {@code true} if no field can hold a child.
     */
    public boolean isLeafKind() {
        return fields.stream().noneMatch(f -> f.category().isChild());
    }

    public List<FieldSpec> scalarFields() {
        return fields.stream().filter(f -> !f.category().isChild()).toList();
    }

    public List<FieldSpec> childFields() {
        return fields.stream().filter(f -> f.category().isChild()).toList();
    }

    public Optional<FieldSpec> field(String fieldName) {
        return fields.stream().filter(f -> f.name().equals(fieldName)).findFirst();
    }
}
