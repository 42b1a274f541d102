package com.enterprise.qb.sql.clause;

import com.enterprise.qb.sql.compiler.CompilerContext;
import com.enterprise.qb.sql.core.JoinType;

import java.util.Objects;

/**
 * {@code <left>\n<JOIN TYPE> <right>[ ON <onClause>]}.
 *
 * <p>The left side is the FROM table or a previous join, so several joins form a
 * left-deep chain whose {@link #defaultName()} stays the leftmost table.
 * {@code onClause} is {@code null} for CROSS joins.
 */
public record JoinClause(JoinType joinType, Selectable left, TableElem right, Clause onClause)
        implements Selectable {

    public JoinClause {
        Objects.requireNonNull(joinType, "joinType");
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
        if (joinType != JoinType.CROSS && onClause == null) {
            throw new IllegalArgumentException(joinType.sql() + " requires an ON clause");
        }
    }

    @Override
    public String defaultName() {
        return left.defaultName();
    }

    @Override
    public String compile(CompilerContext context) {
        return context.compiler().visitJoin(context, this);
    }
}
