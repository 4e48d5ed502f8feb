package com.talksql.service;

import com.talksql.model.Session;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Maps session ids to live database connections, each with its own expiry.
 *
 * <p>Expired entries are evicted lazily on lookup and by a periodic sweep. Every connection that
 * leaves the registry (expiry, removal, replacement, shutdown) is closed exactly once; close failures
 * are logged and never propagate to the caller.
 */
@Slf4j
@Service
public class SessionRegistry {
    private final Map<String, Session> sessions = new ConcurrentHashMap<>();
    private final List<Consumer<String>> removalListeners = new CopyOnWriteArrayList<>();
    private final Clock clock;
    private final ScheduledExecutorService scheduler;

    @Autowired
    public SessionRegistry(@Value("${talksql.session.sweep-interval-seconds:300}") long sweepIntervalSeconds) {
        this.clock = Clock.systemUTC();
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "talksql-session-sweep");
            t.setDaemon(true);
            return t;
        });
        long interval = Math.max(1, sweepIntervalSeconds);
        scheduler.scheduleAtFixedRate(this::sweep, interval, interval, TimeUnit.SECONDS);
    }

    /**
     * Registry without a background sweep; expiry is driven by lookups and {@link #evictExpired()}.
     *
     * @param clock time source
     */
    public SessionRegistry(Clock clock) {
        this.clock = clock;
        this.scheduler = null;
    }

    /**
     * Bind a session id to a connection. A previous binding for the same id is replaced and its
     * connection closed.
     *
     * @param sessionId session id
     * @param connection live connection
     * @param ttl time to live; zero expires the entry immediately
     * @return stored session
     */
    public Session store(String sessionId, DatabaseConnection connection, Duration ttl) {
        Session session = newSession(sessionId, connection, ttl);
        Session previous = sessions.put(sessionId, session);
        if (previous != null && previous.getConnection() != connection) {
            log.info("Session {} replaced, closing previous connection", sessionId);
            closeQuietly(previous);
        }
        log.info("Session {} stored, expires at {}", sessionId, session.getExpiresAt());
        return session;
    }

    /**
     * Bind a session id to a connection unless a live session already holds the id. An expired
     * holder is evicted and closed first. The caller keeps ownership of the connection when the
     * binding is refused.
     *
     * @param sessionId session id
     * @param connection live connection
     * @param ttl time to live; zero expires the entry immediately
     * @return stored session, or empty if the id is taken by a live session
     */
    public Optional<Session> storeIfAbsent(String sessionId, DatabaseConnection connection, Duration ttl) {
        Session session = newSession(sessionId, connection, ttl);
        while (true) {
            Session existing = sessions.putIfAbsent(sessionId, session);
            if (existing == null) {
                log.info("Session {} stored, expires at {}", sessionId, session.getExpiresAt());
                return Optional.of(session);
            }
            if (!existing.isExpiredAt(clock.instant())) {
                log.info("Session {} already bound to a live connection", sessionId);
                return Optional.empty();
            }
            if (sessions.remove(sessionId, existing)) {
                log.info("Session {} expired", sessionId);
                closeQuietly(existing);
            }
        }
    }

    /**
     * Look up the live session for an id. An expired entry is evicted and closed.
     *
     * @param sessionId session id
     * @return session if present and not expired
     */
    public Optional<Session> find(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        Session session = sessions.get(sessionId);
        if (session == null) {
            return Optional.empty();
        }
        if (session.isExpiredAt(clock.instant())) {
            if (sessions.remove(sessionId, session)) {
                log.info("Session {} expired", sessionId);
                closeQuietly(session);
            }
            return Optional.empty();
        }
        return Optional.of(session);
    }

    /**
     * Connection for a session id.
     *
     * @param sessionId session id
     * @return connection if the session is live
     */
    public Optional<DatabaseConnection> get(String sessionId) {
        return find(sessionId).map(Session::getConnection);
    }

    /**
     * Remove and close a session. Unknown ids are ignored.
     *
     * @param sessionId session id
     * @return true if a session was removed
     */
    public boolean remove(String sessionId) {
        if (sessionId == null) {
            return false;
        }
        Session session = sessions.remove(sessionId);
        if (session == null) {
            return false;
        }
        closeQuietly(session);
        log.info("Session {} removed", sessionId);
        return true;
    }

    /**
     * Evict and close every expired session.
     *
     * @return number of sessions evicted
     */
    public int evictExpired() {
        Instant now = clock.instant();
        List<Session> evicted = new ArrayList<>();
        for (Map.Entry<String, Session> entry : sessions.entrySet()) {
            Session session = entry.getValue();
            if (session.isExpiredAt(now) && sessions.remove(entry.getKey(), session)) {
                evicted.add(session);
            }
        }
        evicted.forEach(this::closeQuietly);
        if (!evicted.isEmpty()) {
            log.info("Evicted {} expired session(s)", evicted.size());
        }
        return evicted.size();
    }

    /**
     * Register a callback invoked with the session id after a session's connection is closed.
     *
     * @param listener removal callback
     */
    public void onRemoval(Consumer<String> listener) {
        removalListeners.add(listener);
    }

    public int size() {
        return sessions.size();
    }

    @PreDestroy
    public void closeAll() {
        if (scheduler != null) {
            scheduler.shutdownNow();
        }
        for (String sessionId : new ArrayList<>(sessions.keySet())) {
            remove(sessionId);
        }
    }

    private Session newSession(String sessionId, DatabaseConnection connection, Duration ttl) {
        Instant now = clock.instant();
        return Session.builder()
                .id(sessionId)
                .connection(connection)
                .createdAt(now)
                .expiresAt(now.plus(ttl.isNegative() ? Duration.ZERO : ttl))
                .build();
    }

    private void sweep() {
        try {
            evictExpired();
        } catch (RuntimeException e) {
            log.warn("Session sweep failed: {}", e.getMessage(), e);
        }
    }

    private void closeQuietly(Session session) {
        DatabaseConnection connection = session.getConnection();
        try {
            if (connection != null) {
                connection.close();
            }
        } catch (RuntimeException e) {
            log.warn("Failed to close connection for session {}: {}", session.getId(), e.getMessage());
        }
        for (Consumer<String> listener : removalListeners) {
            try {
                listener.accept(session.getId());
            } catch (RuntimeException e) {
                log.warn("Session removal listener failed for {}: {}", session.getId(), e.getMessage());
            }
        }
    }
}
