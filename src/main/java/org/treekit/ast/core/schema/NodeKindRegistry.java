package org.treekit.ast.core.schema;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.treekit.ast.core.Node;
import org.treekit.ast.core.NodeContractException;
import org.treekit.ast.core.NodeVisitor;
import org.treekit.ast.core.repr.ValueLeaf;

import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.RecordComponent;
import java.lang.reflect.Type;
import java.lang.reflect.WildcardType;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Registry of the node kinds of one grammar.
 * <p>
 * Registration derives each kind's field table from its record components (or declared instance
 * fields for non-record kinds) and rejects kinds that break the node contract: abstract types,
 * types without their own {@code equals}/{@code hashCode}, fields whose names collide with
 * kernel operations, and duplicate kind names. When the registry is bound to a visitor interface,
 * every kind must also have a matching {@code visit<KindName>} method on it.
 * <p>
 * Registration is expected to happen once during startup. Lookups are not synchronized against
 * concurrent registration.
 */
public class NodeKindRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(NodeKindRegistry.class);

    /** Field names that would shadow kernel operations or the implicit span. */
    public static final Set<String> RESERVED_FIELD_NAMES =
            Set.of("span", "children", "accept", "deepCopy", "parent", "kindType");

    private final Class<?> visitorType;
    private final Map<Class<?>, NodeKind> byType = new LinkedHashMap<>();
    private final Map<String, NodeKind> byName = new HashMap<>();

    /**
     * Creates a registry that does not check visitor coverage.
     */
    public NodeKindRegistry() {
        this(null);
    }

    /**
     * @param visitorType The grammar's visitor interface, a {@link NodeVisitor} subtype, or
     *                    {@code null} to skip coverage checks.
     * @throws IllegalArgumentException if {@code visitorType} is not a {@link NodeVisitor}.
     */
    public NodeKindRegistry(Class<?> visitorType) {
        if (visitorType != null && !NodeVisitor.class.isAssignableFrom(visitorType)) {
            throw new IllegalArgumentException(visitorType.getName() + " is not a "
                    + NodeVisitor.class.getSimpleName());
        }
        this.visitorType = visitorType;
    }

    /**
     * Registers a node kind. Registering the same type twice returns the existing kind.
     *
     * @param type A concrete {@link Node} or {@link ValueLeaf} class.
     * @return The registered kind.
     * @throws NodeContractException if the type breaks the node contract.
     */
    public NodeKind register(Class<?> type) {
        NodeKind existing = byType.get(type);
        if (existing != null) {
            return existing;
        }
        checkShape(type);
        String name = type.getSimpleName();
        if (byName.containsKey(name)) {
            throw new NodeContractException(String.format(
                    "Node kind name '%s' is already registered by %s", name, byName.get(name).type().getName()));
        }
        checkVisitorCoverage(type, name);

        NodeKind kind = new NodeKind(name, type, deriveFields(type));
        byType.put(type, kind);
        byName.put(name, kind);
        LOG.debug("Registered node kind {} with fields {}", name,
                kind.fields().stream().map(FieldSpec::name).toList());
        return kind;
    }

    /**
     * Registers several kinds in order.
     * @param types The kinds to register.
     * @return This registry.
     */
    public NodeKindRegistry registerAll(Class<?>... types) {
        for (Class<?> type : types) {
            register(type);
        }
        return this;
    }

    /**
     * @param node A node instance.
     * @return The registered kind of the node, if its type is registered.
     */
    public Optional<NodeKind> kindOf(Node node) {
        return Optional.ofNullable(byType.get(node.kindType()));
    }

    public Optional<NodeKind> kindNamed(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    /**
     * @return All registered kinds in registration order.
     */
    public Collection<NodeKind> kinds() {
        return Collections.unmodifiableCollection(byType.values());
    }

    public boolean isRegistered(Class<?> type) {
        return byType.containsKey(type);
    }

    private void checkShape(Class<?> type) {
        if (type.isInterface() || Modifier.isAbstract(type.getModifiers())) {
            throw new NodeContractException("Node kind " + type.getName() + " must be a concrete class");
        }
        if (!Node.class.isAssignableFrom(type) && !ValueLeaf.class.isAssignableFrom(type)) {
            throw new NodeContractException("Node kind " + type.getName()
                    + " must implement " + Node.class.getSimpleName() + " or " + ValueLeaf.class.getSimpleName());
        }
        requireOwnMethod(type, "equals", Object.class);
        requireOwnMethod(type, "hashCode");
    }

    private static void requireOwnMethod(Class<?> type, String name, Class<?>... parameterTypes) {
        try {
            Method method = type.getMethod(name, parameterTypes);
            if (method.getDeclaringClass() == Object.class) {
                throw new NodeContractException(String.format(
                        "Node kind %s must implement structural %s()", type.getName(), name));
            }
        } catch (NoSuchMethodException e) {
            throw new NodeContractException("Node kind " + type.getName() + " has no " + name + "()");
        }
    }

    private void checkVisitorCoverage(Class<?> type, String name) {
        if (visitorType == null) {
            return;
        }
        String methodName = "visit" + name;
        for (Method method : visitorType.getMethods()) {
            if (method.getName().equals(methodName) && method.getParameterCount() == 1
                    && method.getParameterTypes()[0].isAssignableFrom(type)) {
                return;
            }
        }
        throw new NodeContractException(String.format(
                "Visitor %s has no method %s(%s)", visitorType.getSimpleName(), methodName, name));
    }

    private static List<FieldSpec> deriveFields(Class<?> type) {
        List<FieldSpec> fields = new ArrayList<>();
        if (type.isRecord()) {
            for (RecordComponent component : type.getRecordComponents()) {
                if (component.getName().equals("span")) {
                    continue;
                }
                fields.add(spec(type, component.getName(), component.getType(), component.getGenericType()));
            }
            return fields;
        }
        List<Class<?>> hierarchy = new ArrayList<>();
        for (Class<?> c = type; c != null && c != Object.class; c = c.getSuperclass()) {
            hierarchy.add(0, c);
        }
        for (Class<?> c : hierarchy) {
            for (Field field : c.getDeclaredFields()) {
                if (Modifier.isStatic(field.getModifiers()) || field.isSynthetic() || field.getName().equals("span")) {
                    continue;
                }
                fields.add(spec(type, field.getName(), field.getType(), field.getGenericType()));
            }
        }
        return fields;
    }

    private static FieldSpec spec(Class<?> owner, String name, Class<?> rawType, Type genericType) {
        if (RESERVED_FIELD_NAMES.contains(name)) {
            throw new NodeContractException(String.format(
                    "Field '%s' of node kind %s collides with a reserved name", name, owner.getName()));
        }
        return new FieldSpec(name, categorize(rawType, genericType), rawType);
    }

    /**
     * Classifies a declared field type.
     * @param rawType     The erased type.
     * @param genericType The generic type, used to inspect list element types.
     * @return The category.
     */
    static FieldCategory categorize(Class<?> rawType, Type genericType) {
        if (Node.class.isAssignableFrom(rawType)) {
            return FieldCategory.NODE;
        }
        if (List.class.isAssignableFrom(rawType) && genericType instanceof ParameterizedType parameterized) {
            Type element = parameterized.getActualTypeArguments()[0];
            if (element instanceof WildcardType wildcard) {
                element = wildcard.getUpperBounds()[0];
            }
            if (element instanceof Class<?> elementClass && Node.class.isAssignableFrom(elementClass)) {
                return FieldCategory.NODE_LIST;
            }
        }
        return FieldCategory.SCALAR;
    }
}
