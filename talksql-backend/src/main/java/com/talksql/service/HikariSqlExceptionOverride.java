package com.talksql.service;

import com.zaxxer.hikari.SQLExceptionOverride;

import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.sql.SQLSyntaxErrorException;

/**
 * Keeps pooled connections alive across errors caused by the generated SQL itself.
 *
 * <p>Generated queries fail routinely (bad column, unknown table, unsupported syntax) and each
 * failure feeds the retry loop. None of these mean the connection is broken.
 */
public class HikariSqlExceptionOverride implements SQLExceptionOverride {

    @java.lang.Override
    public SQLExceptionOverride.Override adjudicate(SQLException sqlException) {
        if (sqlException == null) {
            return Override.CONTINUE_EVICT;
        }

        if (sqlException instanceof SQLFeatureNotSupportedException
                || sqlException instanceof SQLSyntaxErrorException) {
            return Override.DO_NOT_EVICT;
        }

        String sqlState = sqlException.getSQLState();
        if (sqlState == null) {
            return Override.CONTINUE_EVICT;
        }
        // 0A: feature not supported, 22: data exception, 42: syntax error or access rule violation
        if (sqlState.startsWith("0A") || sqlState.startsWith("22") || sqlState.startsWith("42")) {
            return Override.DO_NOT_EVICT;
        }

        return Override.CONTINUE_EVICT;
    }
}
