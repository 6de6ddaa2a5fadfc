package org.treekit.ast.lang.pooled;

import org.treekit.ast.api.Span;
import org.treekit.ast.core.NodeVisitor;
import org.treekit.ast.core.repr.PooledLeaf;
import org.treekit.ast.lang.Expr;
import org.treekit.ast.lang.ExprVisitor;
import org.treekit.ast.pool.NodePool;
import org.treekit.ast.pool.PoolCategory;

/**
 * An integer literal shared through a {@link NodePool}.
 */
public final class PooledIntLit extends PooledLeaf<Integer> implements Expr {

    private PooledIntLit(Span span, int value) {
        super(span, value);
    }

    /**
     * Returns the instance for {@code value} from the process-wide pool.
     */
    public static PooledIntLit of(Span span, int value) {
        return of(NodePool.global(), span, value);
    }

    /**
     * Returns the instance for {@code value} from {@code pool}. The span of a shared instance is the
     * span of the request that created it.
     */
    public static PooledIntLit of(NodePool pool, Span span, int value) {
        return pool.getOrCreate(PoolCategory.INTEGER, value, PooledIntLit.class, () -> new PooledIntLit(span, value));
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) {
        return ExprVisitor.of(visitor).visitPooledIntLit(this);
    }
}
