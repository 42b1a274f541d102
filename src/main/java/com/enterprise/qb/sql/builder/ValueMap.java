package com.enterprise.qb.sql.builder;

import com.enterprise.qb.sql.clause.TableElem;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Column-name to value mapping shared by INSERT, UPDATE and UPSERT. Kept sorted
 * by column name so rendering order is deterministic. Null values are allowed
 * and bind as SQL NULL.
 */
final class ValueMap {

    private final TableElem table;
    private final SortedMap<String, Object> values = new TreeMap<>();

    ValueMap(TableElem table) {
        this.table = table;
    }

    void put(String column, Object value) {
        Objects.requireNonNull(column, "column");
        table.c(column); // rejects columns the table does not declare
        values.put(column, value);
    }

    void putAll(Map<String, ?> more) {
        Objects.requireNonNull(more, "values");
        for (Map.Entry<String, ?> entry : more.entrySet()) {
            put(entry.getKey(), entry.getValue());
        }
    }

    SortedMap<String, Object> view() {
        return Collections.unmodifiableSortedMap(values);
    }
}
