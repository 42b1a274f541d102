package com.enterprise.qb.sql.clause;

import com.enterprise.qb.sql.compiler.CompilerContext;
import com.enterprise.qb.sql.validation.ExpressionValidator;

import java.util.Objects;

/** {@code <selectable> AS <name>}. */
public record AliasClause(Clause selectable, String name) implements Clause {

    public AliasClause {
        Objects.requireNonNull(selectable, "selectable");
        ExpressionValidator.validateIdentifier(name);
    }

    @Override
    public String compile(CompilerContext context) {
        return context.compiler().visitAlias(context, this);
    }
}
