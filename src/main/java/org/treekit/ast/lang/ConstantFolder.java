package org.treekit.ast.lang;

import org.treekit.ast.api.Span;
import org.treekit.ast.core.Node;
import org.treekit.ast.lang.optimized.OptBinaryOp;

import java.util.Optional;
import java.util.function.IntBinaryOperator;

/**
 * Folds constant integer and boolean operations bottom-up.
 * <p>
 * Literals of every strategy count as constants; folded results are standard {@link IntLit} or
 * {@link BoolLit} nodes carrying the span of the folded operation. Operations that would overflow
 * or divide by zero stay as they are. Parents are rebuilt only when a descendant changed, so an
 * unfoldable tree comes back as the same instance.
 */
public class ConstantFolder extends ExprTransformer {

    @Override
    public Node visitAdd(Add node) {
        Add rebuilt = (Add) descend(node);
        return fold(rebuilt.span(), "+", rebuilt.left(), rebuilt.right()).orElse(rebuilt);
    }

    @Override
    public Node visitMul(Mul node) {
        Mul rebuilt = (Mul) descend(node);
        return fold(rebuilt.span(), "*", rebuilt.left(), rebuilt.right()).orElse(rebuilt);
    }

    @Override
    public Node visitBinaryOp(BinaryOp node) {
        BinaryOp rebuilt = (BinaryOp) descend(node);
        return fold(rebuilt.span(), rebuilt.operator(), rebuilt.left(), rebuilt.right()).orElse(rebuilt);
    }

    @Override
    public Node visitOptBinaryOp(OptBinaryOp node) {
        OptBinaryOp rebuilt = (OptBinaryOp) descend(node);
        return fold(rebuilt.span(), rebuilt.operator(), rebuilt.left(), rebuilt.right()).orElse(rebuilt);
    }

    @Override
    public Node visitUnaryOp(UnaryOp node) {
        UnaryOp rebuilt = (UnaryOp) descend(node);
        Expr operand = rebuilt.operand();
        if (rebuilt.operator().equals("-")) {
            Optional<Integer> value = Operators.intConstant(operand);
            if (value.isPresent() && value.get() != Integer.MIN_VALUE) {
                return new IntLit(rebuilt.span(), -value.get());
            }
        } else if (rebuilt.operator().equals("!")) {
            Optional<Boolean> value = Operators.boolConstant(operand);
            if (value.isPresent()) {
                return new BoolLit(rebuilt.span(), !value.get());
            }
        }
        return rebuilt;
    }

    @Override public Node visitListLit(ListLit node) { return descend(node); }
    @Override public Node visitCall(Call node) { return descend(node); }
    @Override public Node visitVarDecl(VarDecl node) { return descend(node); }
    @Override public Node visitExprStmt(ExprStmt node) { return descend(node); }
    @Override public Node visitBlock(Block node) { return descend(node); }
    @Override public Node visitIfStmt(IfStmt node) { return descend(node); }

    private static Optional<Expr> fold(Span span, String operator, Expr left, Expr right) {
        Optional<Integer> l = Operators.intConstant(left);
        Optional<Integer> r = Operators.intConstant(right);
        if (l.isPresent() && r.isPresent()) {
            return foldInts(span, operator, l.get(), r.get());
        }
        Optional<Boolean> lb = Operators.boolConstant(left);
        Optional<Boolean> rb = Operators.boolConstant(right);
        if (lb.isPresent() && rb.isPresent()) {
            return foldBools(span, operator, lb.get(), rb.get());
        }
        return Optional.empty();
    }

    private static Optional<Expr> foldInts(Span span, String operator, int a, int b) {
        switch (operator) {
            case "+": return arithmetic(span, a, b, Math::addExact);
            case "-": return arithmetic(span, a, b, Math::subtractExact);
            case "*": return arithmetic(span, a, b, Math::multiplyExact);
            case "/":
                return b == 0 || (a == Integer.MIN_VALUE && b == -1)
                        ? Optional.empty() : Optional.of(new IntLit(span, a / b));
            case "%":
                return b == 0 ? Optional.empty() : Optional.of(new IntLit(span, a % b));
            case "==": return Optional.of(new BoolLit(span, a == b));
            case "!=": return Optional.of(new BoolLit(span, a != b));
            case "<": return Optional.of(new BoolLit(span, a < b));
            case "<=": return Optional.of(new BoolLit(span, a <= b));
            case ">": return Optional.of(new BoolLit(span, a > b));
            case ">=": return Optional.of(new BoolLit(span, a >= b));
            default: return Optional.empty();
        }
    }

    private static Optional<Expr> foldBools(Span span, String operator, boolean a, boolean b) {
        switch (operator) {
            case "&&": return Optional.of(new BoolLit(span, a && b));
            case "||": return Optional.of(new BoolLit(span, a || b));
            case "==": return Optional.of(new BoolLit(span, a == b));
            case "!=": return Optional.of(new BoolLit(span, a != b));
            default: return Optional.empty();
        }
    }

    private static Optional<Expr> arithmetic(Span span, int a, int b, IntBinaryOperator op) {
        try {
            return Optional.of(new IntLit(span, op.applyAsInt(a, b)));
        } catch (ArithmeticException overflow) {
            return Optional.empty();
        }
    }
}
