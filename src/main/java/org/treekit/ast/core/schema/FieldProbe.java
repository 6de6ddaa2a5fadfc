package org.treekit.ast.core.schema;

import org.treekit.ast.core.DisplayField;
import org.treekit.ast.core.Node;
import org.treekit.ast.core.repr.ValueLeaf;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.RecordComponent;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Best-effort lookup of simple scalar fields for generic renderers and debug output.
 * <p>
 * Kinds implementing {@link DisplayField} answer directly. Otherwise record components named
 * {@code value}, {@code name} or {@code operator} are read in that order. Value-type leaves are
 * probed through their wrapper.
 */
public final class FieldProbe {

    private static final List<String> PREFERRED = List.of("value", "name", "operator");

    private FieldProbe() {}

    /**
     * @param node The node to probe.
     * @return The display text, or empty if the kind exposes no obvious scalar.
     */
    public static Optional<String> displayValue(Node node) {
        Optional<DisplayField> field = node.as(DisplayField.class);
        if (field.isPresent()) {
            return Optional.of(field.get().displayValue());
        }
        Map<String, Object> scalars = scalarFields(node);
        for (String name : PREFERRED) {
            if (scalars.containsKey(name)) {
                return Optional.of(String.valueOf(scalars.get(name)));
            }
        }
        return Optional.empty();
    }

    /**
     * Reads the scalar record components of {@code node} (or of the value it wraps) in declaration
     * order. The span and all node-typed components are excluded. Non-record kinds yield an empty map.
     *
     * @param node The node to probe.
     * @return Component name to value; {@code null} values are kept.
     */
    public static Map<String, Object> scalarFields(Node node) {
        Map<String, Object> result = new LinkedHashMap<>();
        Object target = node.as(ValueLeaf.class).map(Object.class::cast).orElse(node);
        Class<?> type = target.getClass();
        if (!type.isRecord()) {
            return result;
        }
        for (RecordComponent component : type.getRecordComponents()) {
            if (component.getName().equals("span") || NodeKindRegistry.categorize(component.getType(),
                    component.getGenericType()).isChild()) {
                continue;
            }
            result.put(component.getName(), read(component, target));
        }
        return result;
    }

    private static Object read(RecordComponent component, Object target) {
        try {
            return component.getAccessor().invoke(target);
        } catch (IllegalAccessException | InvocationTargetException e) {
            throw new IllegalStateException("Cannot read field '" + component.getName() + "' of "
                    + target.getClass().getSimpleName(), e);
        }
    }
}
