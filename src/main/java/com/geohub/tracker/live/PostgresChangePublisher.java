package com.geohub.tracker.live;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.ResultSetExtractor;

/**
 * Publishes change events with {@code pg_notify(channel, payload)}.
 *
 * Bound parameters instead of a formatted NOTIFY statement: the channel name
 * never becomes part of the SQL text. Channel and payload are both the
 * encoded token.
 */
@Slf4j
@RequiredArgsConstructor
public class PostgresChangePublisher implements ChangePublisher {

    private static final String NOTIFY_SQL = "SELECT pg_notify(?, ?)";

    private final JdbcTemplate jdbcTemplate;
    private final ChannelKeyCodec codec;

    @Override
    public void publish(ChannelKey key) {
        String token = codec.encode(key);
        try {
            jdbcTemplate.query(NOTIFY_SQL, (ResultSetExtractor<Void>) rs -> null, token, token);
            log.debug("Notified {}", key);
        } catch (DataAccessException e) {
            throw new ChangeSourceException("pg_notify failed for " + key, e);
        }
    }
}
