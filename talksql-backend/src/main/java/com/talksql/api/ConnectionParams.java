package com.talksql.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Database coordinates supplied by the client. For sqlite, {@code database} is the file path and
 * {@code host} is ignored.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ConnectionParams {
    @NotBlank(message = "Database type is required")
    private String dbType;

    private String host;

    private Integer port;

    @NotBlank(message = "Database name is required")
    private String database;

    private String username;

    private String password;

    private String sslmode;

    @Override
    public String toString() {
        return "ConnectionParams(dbType=" + dbType + ", host=" + host + ", port=" + port
                + ", database=" + database + ", username=" + username + ", sslmode=" + sslmode + ")";
    }
}
