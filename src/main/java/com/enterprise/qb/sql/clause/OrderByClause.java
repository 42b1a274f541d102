package com.enterprise.qb.sql.clause;

import com.enterprise.qb.sql.compiler.CompilerContext;
import com.enterprise.qb.sql.core.SortDirection;

import java.util.List;
import java.util.Objects;

/** {@code ORDER BY c1, c2 ASC|DESC}. One direction for the whole list. */
public record OrderByClause(List<ColumnElem> columns, SortDirection direction) implements Clause {

    public OrderByClause {
        Objects.requireNonNull(columns, "columns");
        Objects.requireNonNull(direction, "direction");
        if (columns.isEmpty()) {
            throw new IllegalArgumentException("ORDER BY requires at least one column");
        }
        columns = List.copyOf(columns);
    }

    public OrderByClause withDirection(SortDirection newDirection) {
        return new OrderByClause(columns, newDirection);
    }

    @Override
    public String compile(CompilerContext context) {
        return context.compiler().visitOrderBy(context, this);
    }
}
