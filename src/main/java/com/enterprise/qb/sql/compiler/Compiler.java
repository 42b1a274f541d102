package com.enterprise.qb.sql.compiler;

import com.enterprise.qb.sql.builder.DeleteStmt;
import com.enterprise.qb.sql.builder.InsertStmt;
import com.enterprise.qb.sql.builder.SelectStmt;
import com.enterprise.qb.sql.builder.UpdateStmt;
import com.enterprise.qb.sql.builder.UpsertStmt;
import com.enterprise.qb.sql.clause.AggregateClause;
import com.enterprise.qb.sql.clause.AliasClause;
import com.enterprise.qb.sql.clause.BinaryExpressionClause;
import com.enterprise.qb.sql.clause.BindClause;
import com.enterprise.qb.sql.clause.ColumnElem;
import com.enterprise.qb.sql.clause.CombinerClause;
import com.enterprise.qb.sql.clause.ExistsClause;
import com.enterprise.qb.sql.clause.HavingClause;
import com.enterprise.qb.sql.clause.JoinClause;
import com.enterprise.qb.sql.clause.ListClause;
import com.enterprise.qb.sql.clause.OrderByClause;
import com.enterprise.qb.sql.clause.TableElem;
import com.enterprise.qb.sql.clause.TextClause;
import com.enterprise.qb.sql.clause.WhereClause;

/**
 * Visitor producing SQL from each kind of {@link com.enterprise.qb.sql.clause.Clause}.
 *
 * <p>{@link SqlCompiler} is the ANSI implementation. Dialects extend it and
 * override single rules, typically {@link #visitUpsert}.
 */
public interface Compiler {

    String visitAggregate(CompilerContext context, AggregateClause aggregate);

    String visitAlias(CompilerContext context, AliasClause alias);

    String visitBinary(CompilerContext context, BinaryExpressionClause binary);

    String visitBind(CompilerContext context, BindClause bind);

    String visitColumn(CompilerContext context, ColumnElem column);

    String visitCombiner(CompilerContext context, CombinerClause combiner);

    String visitDelete(CompilerContext context, DeleteStmt delete);

    String visitExists(CompilerContext context, ExistsClause exists);

    String visitHaving(CompilerContext context, HavingClause having);

    String visitInsert(CompilerContext context, InsertStmt insert);

    String visitJoin(CompilerContext context, JoinClause join);

    /** Renders a bare name (table name, value-map key), escaped per dialect. */
    String visitLabel(CompilerContext context, String label);

    String visitList(CompilerContext context, ListClause list);

    String visitOrderBy(CompilerContext context, OrderByClause orderBy);

    String visitSelect(CompilerContext context, SelectStmt select);

    String visitTable(CompilerContext context, TableElem table);

    String visitText(CompilerContext context, TextClause text);

    String visitUpdate(CompilerContext context, UpdateStmt update);

    String visitUpsert(CompilerContext context, UpsertStmt upsert);

    String visitWhere(CompilerContext context, WhereClause where);
}
