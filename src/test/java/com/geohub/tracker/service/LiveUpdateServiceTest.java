package com.geohub.tracker.service;

import com.geohub.tracker.dto.GeoJsonFeatureCollection;
import com.geohub.tracker.dto.LiveUpdateRecord;
import com.geohub.tracker.live.ChannelKey;
import com.geohub.tracker.live.Delta;
import com.geohub.tracker.live.InProcessChangeSource;
import com.geohub.tracker.live.LiveDispatcher;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class LiveUpdateServiceTest {

    private InProcessChangeSource source;
    private AtomicReference<Delta> nextDelta;
    private LiveDispatcher dispatcher;
    private LiveUpdateService service;

    private final ChannelKey alice = ChannelKey.of("alice", null);

    @BeforeEach
    void setUp() {
        source = new InProcessChangeSource();
        nextDelta = new AtomicReference<>(Delta.absent());
        dispatcher = new LiveDispatcher(source, (key, cursor, limit) -> nextDelta.get(), Duration.ofMillis(20), 4, 1);
        dispatcher.start();
        service = new LiveUpdateService(dispatcher, 30, 300);
    }

    @AfterEach
    void tearDown() {
        dispatcher.stop();
    }

    @Test
    @DisplayName("a wait without explicit timeout lasts 30 seconds")
    void shouldDefaultToThirtySeconds() {
        assertThat(service.effectiveTimeout(null)).isEqualTo(Duration.ofSeconds(30));
    }

    @Test
    void shouldClampRequestedTimeout() {
        assertThat(service.effectiveTimeout(5)).isEqualTo(Duration.ofSeconds(5));
        assertThat(service.effectiveTimeout(10_000)).isEqualTo(Duration.ofSeconds(300));
        assertThat(service.effectiveTimeout(-3)).isEqualTo(Duration.ZERO);
    }

    @Test
    void shouldReturnNewPointsWhenChangeArrives() throws Exception {
        Delta delta = Delta.of(GeoJsonFeatureCollection.of(List.of()), 17L);
        nextDelta.set(delta);

        CompletableFuture<LiveUpdateRecord> result =
            CompletableFuture.supplyAsync(() -> service.waitForUpdate(alice, 10, 3L));
        await().alias("alice subscribed").atMost(Duration.ofSeconds(5)).until(() -> source.isSubscribed(alice));
        source.publish(alice);

        LiveUpdateRecord record = result.get(5, TimeUnit.SECONDS);
        assertThat(record.type()).isEqualTo(LiveUpdateRecord.TYPE);
        assertThat(record.client()).isEqualTo("alice");
        assertThat(record.last()).isEqualTo(17L);
        assertThat(record.geo()).isSameAs(delta.geo());
        assertThat(record.error()).isNull();
    }

    @Test
    void shouldReturnNoNewRowsWithUnchangedCursorOnTimeout() {
        LiveUpdateRecord record = service.waitForUpdate(alice, 1, 41L);

        assertThat(record.hasUpdate()).isFalse();
        assertThat(record.last()).isEqualTo(41L);
        assertThat(record.error()).isEqualTo(LiveUpdateService.NO_NEW_ROWS);
    }

    @Test
    void shouldDeregisterWaiterAfterTimeout() {
        service.waitForUpdate(alice, 1, null);

        await().alias("alice unsubscribed").atMost(Duration.ofSeconds(5)).until(() -> !source.isSubscribed(alice));
        await().alias("registry empty").atMost(Duration.ofSeconds(5)).until(() -> dispatcher.stats().registeredWaiters() == 0);
    }

    @Test
    void shouldReportNoNewRowsWhenLookupFindsNothing() throws Exception {
        CompletableFuture<LiveUpdateRecord> result =
            CompletableFuture.supplyAsync(() -> service.waitForUpdate(alice, 10, null));
        await().alias("alice subscribed").atMost(Duration.ofSeconds(5)).until(() -> source.isSubscribed(alice));
        source.publish(alice);

        LiveUpdateRecord record = result.get(5, TimeUnit.SECONDS);
        assertThat(record.hasUpdate()).isFalse();
        assertThat(record.last()).isNull();
        assertThat(record.error()).isEqualTo(LiveUpdateService.NO_NEW_ROWS);
    }
}
