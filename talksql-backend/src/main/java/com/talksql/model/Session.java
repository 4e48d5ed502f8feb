package com.talksql.model;

import com.talksql.service.DatabaseConnection;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * A caller-scoped, time-limited binding between a session id and one live database connection.
 */
@Data
@Builder
public class Session {
    private String id;
    private DatabaseConnection connection;
    private Instant createdAt;
    private Instant expiresAt;

    /**
     * A session is expired once the clock reaches its expiry instant, so a zero TTL is expired immediately.
     *
     * @param now current instant
     * @return true if expired
     */
    public boolean isExpiredAt(Instant now) {
        return expiresAt == null || !now.isBefore(expiresAt);
    }
}
