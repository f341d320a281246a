package com.geohub.tracker.config;

import com.geohub.tracker.live.ChangeSource;
import com.geohub.tracker.live.ChannelKeyCodec;
import com.geohub.tracker.live.InProcessChangeSource;
import com.geohub.tracker.live.LiveDispatcher;
import com.geohub.tracker.live.PostgresChangePublisher;
import com.geohub.tracker.live.PostgresChangeSource;
import com.geohub.tracker.service.PointQueryService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;
import java.time.Duration;

/**
 * Wiring of the live-update broker.
 *
 * The change source is chosen with {@code geohub.live.change-source}:
 * - postgres (default): LISTEN/NOTIFY on the application database
 * - redis: Redis pub/sub, see {@link RedisConfig}
 * - in-process: in-JVM queue, single instance only
 *
 * Exactly one {@link ChangeSource} and one
 * {@link com.geohub.tracker.live.ChangePublisher} exist per mode.
 */
@Configuration
@Slf4j
public class LiveUpdateConfig {

    @Bean
    public ChannelKeyCodec channelKeyCodec(@Value("${geohub.live.channel-prefix:geohub}") String prefix) {
        return new ChannelKeyCodec(prefix);
    }

    /**
     * The dispatcher thread starts once the context is up and is stopped
     * (answering all pending waiters) before the change source is closed.
     */
    @Bean(initMethod = "start", destroyMethod = "stop")
    public LiveDispatcher liveDispatcher(
        ChangeSource changeSource,
        PointQueryService pointQueryService,
        @Value("${geohub.live.tick:500ms}") Duration tick,
        @Value("${geohub.live.max-events-per-tick:4}") int maxEventsPerTick,
        @Value("${geohub.live.fetch-limit:1}") int fetchLimit
    ) {
        log.info("Live updates use change source {}", changeSource.getClass().getSimpleName());
        return new LiveDispatcher(changeSource, pointQueryService, tick, maxEventsPerTick, fetchLimit);
    }

    @Configuration
    @ConditionalOnProperty(name = "geohub.live.change-source", havingValue = "postgres", matchIfMissing = true)
    static class PostgresChangeSourceConfig {

        @Bean(destroyMethod = "close")
        public PostgresChangeSource postgresChangeSource(DataSource dataSource, ChannelKeyCodec codec) {
            return new PostgresChangeSource(dataSource, codec);
        }

        @Bean
        public PostgresChangePublisher postgresChangePublisher(JdbcTemplate jdbcTemplate, ChannelKeyCodec codec) {
            return new PostgresChangePublisher(jdbcTemplate, codec);
        }
    }

    @Configuration
    @ConditionalOnProperty(name = "geohub.live.change-source", havingValue = "in-process")
    static class InProcessChangeSourceConfig {

        @Bean
        public InProcessChangeSource inProcessChangeSource() {
            return new InProcessChangeSource();
        }
    }
}
