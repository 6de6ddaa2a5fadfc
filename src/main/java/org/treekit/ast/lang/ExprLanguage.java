package org.treekit.ast.lang;

import org.treekit.ast.core.schema.NodeKindRegistry;
import org.treekit.ast.lang.optimized.OptBinaryOp;
import org.treekit.ast.lang.optimized.OptIntLit;
import org.treekit.ast.lang.optimized.OptStringLit;
import org.treekit.ast.lang.pooled.PooledBoolLit;
import org.treekit.ast.lang.pooled.PooledIdentifier;
import org.treekit.ast.lang.pooled.PooledIntLit;
import org.treekit.ast.lang.pooled.PooledStringLit;
import org.treekit.ast.lang.value.BoolValue;
import org.treekit.ast.lang.value.IntValue;

import java.util.List;

/**
 * Entry point of the reference grammar: the list of its node kinds and a registry describing them.
 */
public final class ExprLanguage {

    /** Every node kind of the grammar, in declaration order. */
    public static final List<Class<?>> KINDS = List.of(
            IntLit.class, StringLit.class, BoolLit.class, Identifier.class, ListLit.class,
            Add.class, Mul.class, BinaryOp.class, UnaryOp.class, Call.class,
            VarDecl.class, ExprStmt.class, Block.class, IfStmt.class,
            OptIntLit.class, OptStringLit.class, OptBinaryOp.class,
            PooledIntLit.class, PooledBoolLit.class, PooledStringLit.class, PooledIdentifier.class,
            IntValue.class, BoolValue.class);

    private ExprLanguage() {}

    /**
     * Creates a registry holding every kind of the grammar, checked against {@link ExprVisitor}.
     * @return A new registry.
     */
    public static NodeKindRegistry newRegistry() {
        NodeKindRegistry registry = new NodeKindRegistry(ExprVisitor.class);
        registry.registerAll(KINDS.toArray(new Class<?>[0]));
        return registry;
    }
}
