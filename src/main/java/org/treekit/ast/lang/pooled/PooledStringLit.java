package org.treekit.ast.lang.pooled;

import org.treekit.ast.api.Span;
import org.treekit.ast.core.NodeVisitor;
import org.treekit.ast.core.repr.PooledLeaf;
import org.treekit.ast.lang.Expr;
import org.treekit.ast.lang.ExprVisitor;
import org.treekit.ast.pool.NodePool;
import org.treekit.ast.pool.PoolCategory;

/**
 * A short string literal shared through a {@link NodePool}.
 */
public final class PooledStringLit extends PooledLeaf<String> implements Expr {

    private PooledStringLit(Span span, String value) {
        super(span, value);
    }

    /**
     * Returns the instance for {@code value} from the process-wide pool.
     */
    public static PooledStringLit of(Span span, String value) {
        return of(NodePool.global(), span, value);
    }

    /**
     * Returns the instance for {@code value} from {@code pool}. The span of a shared instance is the
     * span of the request that created it.
     */
    public static PooledStringLit of(NodePool pool, Span span, String value) {
        return pool.getOrCreate(PoolCategory.STRING, value, PooledStringLit.class, () -> new PooledStringLit(span, value));
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) {
        return ExprVisitor.of(visitor).visitPooledStringLit(this);
    }
}
