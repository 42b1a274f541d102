package com.enterprise.qb.sql;

import com.enterprise.qb.sql.clause.TableElem;

/** Shared table fixtures. */
final class Tables {

    private Tables() {}

    static final TableElem USERS = TableElem.table("users", "id", "email", "status", "created_at");
    static final TableElem SESSIONS = TableElem.table("sessions", "id", "user_id", "token", "expires_at");
    static final TableElem AUDIT = TableElem.table("audit", "id", "session_id", "action");
    static final TableElem ROLES = TableElem.table("roles");
}
