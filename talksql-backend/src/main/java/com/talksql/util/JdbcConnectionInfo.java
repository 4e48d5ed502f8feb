package com.talksql.util;

import lombok.Builder;
import lombok.Data;

/**
 * Resolved JDBC target for one database connection.
 */
@Data
@Builder
public class JdbcConnectionInfo {
    private String url;
    private String username;
    private String password;
    private String dialect;
    private String driverClassName;

    /**
     * JDBC URL safe to log: the query/property part may carry credentials and is dropped.
     *
     * @return masked url
     */
    public String maskedUrl() {
        if (url == null) {
            return null;
        }
        int cut = url.indexOf('?');
        if (cut < 0 && url.startsWith("jdbc:sqlserver:")) {
            cut = url.indexOf(';');
        }
        return cut >= 0 ? url.substring(0, cut) : url;
    }
}
