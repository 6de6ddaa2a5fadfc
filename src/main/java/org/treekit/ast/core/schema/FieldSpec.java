package org.treekit.ast.core.schema;

import java.util.Objects;

/**
 * One declared field of a node kind.
 *
 * @param name     The field name.
 * @param category Whether the field holds a scalar, a child or a list of children.
 * @param type     The declared (erased) field type.
 */
public record FieldSpec(String name, FieldCategory category, Class<?> type) {

    public FieldSpec {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(type, "type");
    }
}
