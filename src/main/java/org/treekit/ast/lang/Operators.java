package org.treekit.ast.lang;

import org.treekit.ast.lang.optimized.OptIntLit;
import org.treekit.ast.lang.pooled.PooledBoolLit;
import org.treekit.ast.lang.pooled.PooledIntLit;

import java.util.Optional;
import java.util.Set;

/**
 * Operator spellings of the reference grammar, and the literal values operators act on.
 */
public final class Operators {

    public static final Set<String> BINARY = Set.of(
            "+", "-", "*", "/", "%", "==", "!=", "<", "<=", ">", ">=", "&&", "||");

    public static final Set<String> UNARY = Set.of("-", "!");

    private Operators() {}

    /**
     * @param expr An operand.
     * @return Its value if it is an integer literal of any representation.
     */
    static Optional<Integer> intConstant(Expr expr) {
        if (expr instanceof IntLit lit) {
            return Optional.of(lit.value());
        }
        if (expr instanceof OptIntLit lit) {
            return Optional.of(lit.value());
        }
        if (expr instanceof PooledIntLit lit) {
            return Optional.of(lit.value());
        }
        return Optional.empty();
    }

    /**
     * @param expr An operand.
     * @return Its value if it is a boolean literal of any representation.
     */
    static Optional<Boolean> boolConstant(Expr expr) {
        if (expr instanceof BoolLit lit) {
            return Optional.of(lit.value());
        }
        if (expr instanceof PooledBoolLit lit) {
            return Optional.of(lit.value());
        }
        return Optional.empty();
    }
}
