package com.geohub.tracker.live;

import lombok.extern.slf4j.Slf4j;
import org.postgresql.PGConnection;
import org.postgresql.PGNotification;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Change source over PostgreSQL LISTEN/NOTIFY.
 *
 * Connection handling:
 * - Holds one connection, borrowed from the pool on first use and kept for
 *   the lifetime of the dispatcher. Only the dispatcher thread uses it.
 * - Runs in autocommit mode; notifications are only delivered outside a
 *   transaction.
 * - When a statement fails, the connection is discarded. The next call
 *   borrows a fresh one and re-issues LISTEN for every key still subscribed.
 *   Notifications sent while no connection was listening are lost; waiters
 *   pick up the next one.
 *
 * Channel names are always double-quoted so the case of client names
 * survives (unquoted identifiers are folded to lower case by the server).
 * Notification payloads carry the same token, and the key is decoded from
 * the payload.
 */
@Slf4j
public class PostgresChangeSource implements ChangeSource, AutoCloseable {

    private final DataSource dataSource;
    private final ChannelKeyCodec codec;

    private final Set<ChannelKey> listening = new LinkedHashSet<>();
    private final Deque<ChannelKey> buffered = new ArrayDeque<>();

    private Connection connection;
    private PGConnection pgConnection;

    public PostgresChangeSource(DataSource dataSource, ChannelKeyCodec codec) {
        this.dataSource = dataSource;
        this.codec = codec;
    }

    @Override
    public void subscribe(ChannelKey key) {
        String channel = quote(codec.encode(key));
        boolean connected = connection != null;
        // Recorded first so a reconnect re-listens even if this statement fails
        listening.add(key);
        if (!connected) {
            // Opening the connection listens on every recorded key
            rawConnection();
            return;
        }
        execute("LISTEN " + channel);
    }

    @Override
    public void unsubscribe(ChannelKey key) {
        String channel = quote(codec.encode(key));
        listening.remove(key);
        if (connection == null) {
            return;
        }
        execute("UNLISTEN " + channel);
    }

    @Override
    public Optional<ChannelKey> next(Duration timeout) {
        if (!buffered.isEmpty()) {
            return Optional.of(buffered.poll());
        }
        PGConnection pg = connection();
        PGNotification[] notifications;
        try {
            if (timeout.isZero() || timeout.isNegative()) {
                notifications = pg.getNotifications();
            } else {
                // 0 would block forever
                notifications = pg.getNotifications((int) Math.max(1L, Math.min(Integer.MAX_VALUE, timeout.toMillis())));
            }
        } catch (SQLException e) {
            discardConnection();
            throw new ChangeSourceException("Polling notifications failed", e);
        }
        if (notifications != null) {
            for (PGNotification notification : notifications) {
                decode(notification).ifPresent(buffered::add);
            }
        }
        return Optional.ofNullable(buffered.poll());
    }

    private Optional<ChannelKey> decode(PGNotification notification) {
        String token = notification.getParameter();
        if (token == null || token.isEmpty()) {
            token = notification.getName();
        }
        try {
            return Optional.of(codec.decode(token));
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring notification on channel {} with undecodable payload", notification.getName());
            return Optional.empty();
        }
    }

    private void execute(String sql) {
        Connection conn = rawConnection();
        try (Statement statement = conn.createStatement()) {
            statement.execute(sql);
        } catch (SQLException e) {
            discardConnection();
            throw new ChangeSourceException("Statement failed: " + sql, e);
        }
    }

    private PGConnection connection() {
        rawConnection();
        return pgConnection;
    }

    private Connection rawConnection() {
        if (connection != null) {
            return connection;
        }
        Connection conn = null;
        try {
            conn = dataSource.getConnection();
            conn.setAutoCommit(true);
            PGConnection pg = conn.unwrap(PGConnection.class);
            try (Statement statement = conn.createStatement()) {
                for (ChannelKey key : listening) {
                    statement.execute("LISTEN " + quote(codec.encode(key)));
                }
            }
            connection = conn;
            pgConnection = pg;
            log.info("Listening connection established ({} channel(s) restored)", listening.size());
            return conn;
        } catch (SQLException e) {
            closeQuietly(conn);
            throw new ChangeSourceException("Could not open listening connection", e);
        }
    }

    private void discardConnection() {
        Connection conn = connection;
        connection = null;
        pgConnection = null;
        buffered.clear();
        closeQuietly(conn);
    }

    private static void closeQuietly(Connection conn) {
        if (conn == null) {
            return;
        }
        try {
            conn.close();
        } catch (SQLException e) {
            log.debug("Closing listening connection failed: {}", e.getMessage());
        }
    }

    static String quote(String token) {
        return '"' + token + '"';
    }

    public Set<ChannelKey> listeningKeys() {
        return Set.copyOf(listening);
    }

    @Override
    public void close() {
        listening.clear();
        discardConnection();
    }
}
