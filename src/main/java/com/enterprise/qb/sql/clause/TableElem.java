package com.enterprise.qb.sql.clause;

import com.enterprise.qb.sql.compiler.CompilerContext;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Table reference. Optionally declares its columns, in which case
 * {@link #c(String)} rejects names that were not declared.
 *
 * <p>Example:
 * <pre>{@code
 * TableElem users = TableElem.table("users", "id", "email", "status");
 * SelectStmt.select(users.c("id"), users.c("email")).from(users);
 * }</pre>
 */
public final class TableElem implements Selectable {

    private final String name;
    private final Map<String, ColumnElem> columns = new LinkedHashMap<>();

    public TableElem(String name, String... columnNames) {
        this.name = Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Table name cannot be blank");
        }
        for (String columnName : columnNames) {
            Objects.requireNonNull(columnName, "column name");
            if (columns.putIfAbsent(columnName, new ColumnElem(name, columnName)) != null) {
                throw new IllegalArgumentException(
                        "Duplicate column '" + columnName + "' in table " + name);
            }
        }
    }

    public static TableElem table(String name, String... columnNames) {
        return new TableElem(name, columnNames);
    }

    public String name() {
        return name;
    }

    /**
     * Returns the column with the given name. Tables declared without columns
     * accept any name.
     *
     * @throws IllegalArgumentException if columns were declared and this one is not among them
     */
    public ColumnElem c(String columnName) {
        Objects.requireNonNull(columnName, "column name");
        if (columns.isEmpty()) {
            return new ColumnElem(name, columnName);
        }
        ColumnElem column = columns.get(columnName);
        if (column == null) {
            throw new IllegalArgumentException(
                    "Table " + name + " has no column '" + columnName + "'");
        }
        return column;
    }

    /** Declared columns in declaration order. */
    public List<ColumnElem> allColumns() {
        return Collections.unmodifiableList(new ArrayList<>(columns.values()));
    }

    @Override
    public String defaultName() {
        return name;
    }

    @Override
    public String compile(CompilerContext context) {
        return context.compiler().visitTable(context, this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TableElem other)) return false;
        return name.equals(other.name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return "TableElem[" + name + "]";
    }
}
