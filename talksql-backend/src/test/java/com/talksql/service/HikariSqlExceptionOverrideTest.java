package com.talksql.service;

import com.zaxxer.hikari.SQLExceptionOverride;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;

import static org.junit.jupiter.api.Assertions.assertEquals;

class HikariSqlExceptionOverrideTest {

    private final HikariSqlExceptionOverride override = new HikariSqlExceptionOverride();

    @Test
    void queryErrorsKeepTheConnection() {
        assertEquals(SQLExceptionOverride.Override.DO_NOT_EVICT,
                override.adjudicate(new SQLException("relation \"x\" does not exist", "42P01")));
        assertEquals(SQLExceptionOverride.Override.DO_NOT_EVICT,
                override.adjudicate(new SQLException("invalid input syntax", "22P02")));
        assertEquals(SQLExceptionOverride.Override.DO_NOT_EVICT,
                override.adjudicate(new SQLFeatureNotSupportedException("nope")));
    }

    @Test
    void connectionErrorsEvict() {
        assertEquals(SQLExceptionOverride.Override.CONTINUE_EVICT,
                override.adjudicate(new SQLException("connection reset", "08006")));
        assertEquals(SQLExceptionOverride.Override.CONTINUE_EVICT,
                override.adjudicate(new SQLException("no state")));
        assertEquals(SQLExceptionOverride.Override.CONTINUE_EVICT, override.adjudicate(null));
    }
}
