package org.treekit.ast.lang;

import org.treekit.ast.core.Node;
import org.treekit.ast.core.NodeTransformer;
import org.treekit.ast.core.repr.ValueNode;
import org.treekit.ast.lang.optimized.OptBinaryOp;
import org.treekit.ast.lang.optimized.OptIntLit;
import org.treekit.ast.lang.optimized.OptStringLit;
import org.treekit.ast.lang.pooled.PooledBoolLit;
import org.treekit.ast.lang.pooled.PooledIdentifier;
import org.treekit.ast.lang.pooled.PooledIntLit;
import org.treekit.ast.lang.pooled.PooledStringLit;
import org.treekit.ast.lang.value.BoolValue;
import org.treekit.ast.lang.value.IntValue;

import java.util.ArrayList;
import java.util.List;

/**
 * Base transformer for the reference grammar. Every kind is returned unchanged; subclasses
 * override the kinds they rewrite and use {@link #descend(Node)} to transform children first.
 * <p>
 * Value-type leaves are not nodes, so their default result is a new {@link ValueNode} wrapping the
 * same value; {@link #descend(Node)} treats such an equal wrapper as unchanged.
 */
public class ExprTransformer implements ExprVisitor<Node>, NodeTransformer {

    /**
     * Transforms every child of {@code node} and rebuilds it through
     * {@link Node#withChildren(List)} if any child was replaced.
     *
     * @param node The node whose children to transform.
     * @return {@code node} itself if no child changed, otherwise the rebuilt node.
     */
    protected Node descend(Node node) {
        List<Node> children = node.children();
        List<Node> transformed = new ArrayList<>(children.size());
        boolean changed = false;
        for (Node child : children) {
            Node result = transformChild(child);
            changed |= result != child;
            transformed.add(result);
        }
        return changed ? node.withChildren(transformed) : node;
    }

    private Node transformChild(Node child) {
        Node result = visit(child);
        if (child instanceof ValueNode<?> && child.equals(result)) {
            return child;
        }
        return result;
    }

    @Override public Node visitIntLit(IntLit node) { return node; }
    @Override public Node visitStringLit(StringLit node) { return node; }
    @Override public Node visitBoolLit(BoolLit node) { return node; }
    @Override public Node visitIdentifier(Identifier node) { return node; }
    @Override public Node visitListLit(ListLit node) { return node; }
    @Override public Node visitAdd(Add node) { return node; }
    @Override public Node visitMul(Mul node) { return node; }
    @Override public Node visitBinaryOp(BinaryOp node) { return node; }
    @Override public Node visitUnaryOp(UnaryOp node) { return node; }
    @Override public Node visitCall(Call node) { return node; }
    @Override public Node visitVarDecl(VarDecl node) { return node; }
    @Override public Node visitExprStmt(ExprStmt node) { return node; }
    @Override public Node visitBlock(Block node) { return node; }
    @Override public Node visitIfStmt(IfStmt node) { return node; }
    @Override public Node visitOptIntLit(OptIntLit node) { return node; }
    @Override public Node visitOptStringLit(OptStringLit node) { return node; }
    @Override public Node visitOptBinaryOp(OptBinaryOp node) { return node; }
    @Override public Node visitPooledIntLit(PooledIntLit node) { return node; }
    @Override public Node visitPooledBoolLit(PooledBoolLit node) { return node; }
    @Override public Node visitPooledStringLit(PooledStringLit node) { return node; }
    @Override public Node visitPooledIdentifier(PooledIdentifier node) { return node; }
    @Override public Node visitIntValue(IntValue node) { return ValueNode.of(node); }
    @Override public Node visitBoolValue(BoolValue node) { return ValueNode.of(node); }
}
