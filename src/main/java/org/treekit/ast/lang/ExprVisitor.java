package org.treekit.ast.lang;

import org.treekit.ast.core.NodeContractException;
import org.treekit.ast.core.NodeVisitor;
import org.treekit.ast.lang.optimized.OptBinaryOp;
import org.treekit.ast.lang.optimized.OptIntLit;
import org.treekit.ast.lang.optimized.OptStringLit;
import org.treekit.ast.lang.pooled.PooledBoolLit;
import org.treekit.ast.lang.pooled.PooledIdentifier;
import org.treekit.ast.lang.pooled.PooledIntLit;
import org.treekit.ast.lang.pooled.PooledStringLit;
import org.treekit.ast.lang.value.BoolValue;
import org.treekit.ast.lang.value.IntValue;

/**
 * A visitor for the reference expression grammar, with one method per node kind.
 *
 * @param <T> The result type of the visit methods.
 */
public interface ExprVisitor<T> extends NodeVisitor<T> {

    /**
     * Narrows a core visitor for dispatch from an expression-language node.
     *
     * @param visitor The visitor passed to {@code accept}.
     * @return The same visitor as an {@link ExprVisitor}.
     * @throws NodeContractException if the visitor belongs to another grammar.
     */
    static <T> ExprVisitor<T> of(NodeVisitor<T> visitor) {
        if (visitor instanceof ExprVisitor<T> exprVisitor) {
            return exprVisitor;
        }
        throw new NodeContractException("Visitor " + visitor.getClass().getName()
                + " cannot visit nodes of the expression grammar");
    }

    T visitIntLit(IntLit node);
    T visitStringLit(StringLit node);
    T visitBoolLit(BoolLit node);
    T visitIdentifier(Identifier node);
    T visitListLit(ListLit node);
    T visitAdd(Add node);
    T visitMul(Mul node);
    T visitBinaryOp(BinaryOp node);
    T visitUnaryOp(UnaryOp node);
    T visitCall(Call node);
    T visitVarDecl(VarDecl node);
    T visitExprStmt(ExprStmt node);
    T visitBlock(Block node);
    T visitIfStmt(IfStmt node);

    T visitOptIntLit(OptIntLit node);
    T visitOptStringLit(OptStringLit node);
    T visitOptBinaryOp(OptBinaryOp node);

    T visitPooledIntLit(PooledIntLit node);
    T visitPooledBoolLit(PooledBoolLit node);
    T visitPooledStringLit(PooledStringLit node);
    T visitPooledIdentifier(PooledIdentifier node);

    T visitIntValue(IntValue node);
    T visitBoolValue(BoolValue node);
}
