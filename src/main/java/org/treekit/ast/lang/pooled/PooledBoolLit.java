package org.treekit.ast.lang.pooled;

import org.treekit.ast.api.Span;
import org.treekit.ast.core.NodeVisitor;
import org.treekit.ast.core.repr.PooledLeaf;
import org.treekit.ast.lang.Expr;
import org.treekit.ast.lang.ExprVisitor;
import org.treekit.ast.pool.NodePool;
import org.treekit.ast.pool.PoolCategory;

/**
 * A boolean literal shared through a {@link NodePool}.
 */
public final class PooledBoolLit extends PooledLeaf<Boolean> implements Expr {

    private PooledBoolLit(Span span, boolean value) {
        super(span, value);
    }

    /**
     * Returns the instance for {@code value} from the process-wide pool.
     */
    public static PooledBoolLit of(Span span, boolean value) {
        return of(NodePool.global(), span, value);
    }

    /**
     * Returns the instance for {@code value} from {@code pool}. The span of a shared instance is the
     * span of the request that created it.
     */
    public static PooledBoolLit of(NodePool pool, Span span, boolean value) {
        return pool.getOrCreate(PoolCategory.BOOLEAN, value, PooledBoolLit.class, () -> new PooledBoolLit(span, value));
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) {
        return ExprVisitor.of(visitor).visitPooledBoolLit(this);
    }
}
