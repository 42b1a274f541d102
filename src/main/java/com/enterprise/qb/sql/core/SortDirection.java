package com.enterprise.qb.sql.core;

public enum SortDirection {
    ASC,
    DESC
}
