package com.geohub.tracker.live;

import com.geohub.tracker.dto.GeoJsonFeatureCollection;
import com.geohub.tracker.dto.GeoJsonFeatureCollection.Feature;
import com.geohub.tracker.dto.GeoJsonFeatureCollection.Geometry;
import com.geohub.tracker.dto.GeoJsonFeatureCollection.Properties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("LiveDispatcher")
class LiveDispatcherTest {

    private static final Duration TICK = Duration.ofMillis(20);

    private InProcessChangeSource source;
    private StubFetcher fetcher;
    private LiveDispatcher dispatcher;

    private final ChannelKey alice = ChannelKey.of("alice", null);
    private final ChannelKey bobXyz = ChannelKey.of("bob", "xyz");
    private final ChannelKey bobAbc = ChannelKey.of("bob", "abc");

    @BeforeEach
    void setUp() {
        source = new InProcessChangeSource();
        fetcher = new StubFetcher();
        dispatcher = new LiveDispatcher(source, fetcher, TICK, 4, 1);
    }

    @AfterEach
    void tearDown() {
        dispatcher.stop();
    }

    @Nested
    @DisplayName("registration")
    class Registration {

        @Test
        void shouldSubscribeOnFirstWaiterOnly() {
            dispatcher.register(Waiter.forKey(alice, null));
            dispatcher.register(Waiter.forKey(alice, null));

            dispatcher.tick();

            assertThat(source.isSubscribed(alice)).isTrue();
            assertThat(dispatcher.registry().waiterCount()).isEqualTo(2);
            assertThat(dispatcher.stats().registeredKeys()).isEqualTo(1);
            assertThat(dispatcher.stats().registeredWaiters()).isEqualTo(2);
        }

        @Test
        void shouldSkipWaiterThatGaveUpBeforeRegistration() {
            Waiter waiter = Waiter.forKey(alice, null);
            waiter.sink().abandon();
            dispatcher.register(waiter);

            dispatcher.tick();

            assertThat(source.isSubscribed(alice)).isFalse();
            assertThat(dispatcher.registry().isEmpty()).isTrue();
        }

        @Test
        void shouldKeepRunningWhenSubscribeFails() {
            ChangeSource failing = mock(ChangeSource.class);
            doThrow(new ChangeSourceException("connection refused")).when(failing).subscribe(any());
            when(failing.next(any())).thenReturn(Optional.empty());
            LiveDispatcher broken = new LiveDispatcher(failing, fetcher, TICK, 4, 1);

            broken.register(Waiter.forKey(alice, null));
            broken.tick();

            assertThat(broken.stats().subscribeFailures()).isEqualTo(1);
            assertThat(broken.registry().contains(alice)).isTrue();
        }

        @Test
        void shouldAnswerWaitersOfKeyTheSourceRejects() throws Exception {
            ChangeSource rejecting = mock(ChangeSource.class);
            doThrow(new IllegalArgumentException("bad key")).when(rejecting).subscribe(any());
            when(rejecting.next(any())).thenReturn(Optional.empty());
            LiveDispatcher strict = new LiveDispatcher(rejecting, fetcher, TICK, 4, 1);
            Waiter waiter = Waiter.forKey(alice, null);

            strict.register(waiter);
            strict.tick();

            assertThat(waiter.sink().await(Duration.ZERO)).contains(Delta.absent());
            assertThat(strict.registry().isEmpty()).isTrue();
        }
    }

    @Nested
    @DisplayName("dispatch")
    class Dispatch {

        @Test
        void shouldReplyToEveryWaiterOfKeyExactlyOnce() throws Exception {
            Waiter first = Waiter.forKey(alice, null);
            Waiter second = Waiter.forKey(alice, 3L);
            dispatcher.register(first);
            dispatcher.register(second);
            dispatcher.tick();
            fetcher.answer(alice, 7L);

            source.publish(alice);
            dispatcher.tick();

            Delta expected = fetcher.deltaFor(alice);
            assertThat(first.sink().await(Duration.ZERO)).contains(expected);
            assertThat(second.sink().await(Duration.ZERO)).contains(expected);
            assertThat(fetcher.calls(alice)).isEqualTo(1);
            assertThat(dispatcher.registry().contains(alice)).isFalse();
            assertThat(source.isSubscribed(alice)).isFalse();
            assertThat(dispatcher.stats().replies()).isEqualTo(2);
        }

        @Test
        @DisplayName("a waiter that already has the newest row keeps waiting")
        void shouldKeepWaiterWhoseCursorIsAlreadyCurrent() throws Exception {
            Waiter upToDate = Waiter.forKey(alice, 7L);
            dispatcher.register(upToDate);
            dispatcher.tick();
            fetcher.answer(alice, 7L);

            source.publish(alice);
            dispatcher.tick();

            assertThat(upToDate.sink().isDone()).isFalse();
            assertThat(dispatcher.registry().contains(alice)).isTrue();
            assertThat(source.isSubscribed(alice)).isTrue();
            assertThat(dispatcher.stats().replies()).isZero();

            fetcher.answer(alice, 8L);
            source.publish(alice);
            dispatcher.tick();

            assertThat(upToDate.sink().await(Duration.ZERO)).contains(fetcher.deltaFor(alice));
            assertThat(dispatcher.registry().contains(alice)).isFalse();
            assertThat(source.isSubscribed(alice)).isFalse();
        }

        @Test
        void shouldAnswerBehindWaiterAndKeepCurrentOne() throws Exception {
            Waiter behind = Waiter.forKey(alice, 3L);
            Waiter current = Waiter.forKey(alice, 9L);
            dispatcher.register(behind);
            dispatcher.register(current);
            dispatcher.tick();
            fetcher.answer(alice, 9L);

            source.publish(alice);
            dispatcher.tick();

            assertThat(behind.sink().await(Duration.ZERO)).contains(fetcher.deltaFor(alice));
            assertThat(current.sink().isDone()).isFalse();
            assertThat(dispatcher.registry().waiterCount()).isEqualTo(1);
            assertThat(source.isSubscribed(alice)).isTrue();
        }

        @Test
        void shouldIgnoreSecondEventForAlreadyAnsweredKey() {
            Waiter waiter = Waiter.forKey(alice, null);
            dispatcher.register(waiter);
            dispatcher.tick();
            fetcher.answer(alice, 7L);
            source.publish(alice);
            dispatcher.tick();

            // Late duplicate notification for the same key
            source.subscribe(alice);
            source.publish(alice);
            dispatcher.tick();

            assertThat(fetcher.calls(alice)).isEqualTo(1);
            assertThat(dispatcher.stats().replies()).isEqualTo(1);
            assertThat(dispatcher.stats().events()).isEqualTo(2);
        }

        @Test
        void shouldNotWakeWaitersOfOtherKeys() throws Exception {
            Waiter xyz = Waiter.forKey(bobXyz, null);
            Waiter abc = Waiter.forKey(bobAbc, null);
            Waiter other = Waiter.forKey(alice, null);
            dispatcher.register(xyz);
            dispatcher.register(abc);
            dispatcher.register(other);
            dispatcher.tick();
            fetcher.answer(bobXyz, 11L);

            source.publish(bobXyz);
            dispatcher.tick();

            assertThat(xyz.sink().await(Duration.ZERO)).contains(fetcher.deltaFor(bobXyz));
            assertThat(abc.sink().isDone()).isFalse();
            assertThat(other.sink().isDone()).isFalse();
            assertThat(source.isSubscribed(bobAbc)).isTrue();
            assertThat(source.isSubscribed(alice)).isTrue();
            assertThat(fetcher.calls(bobAbc)).isZero();
        }

        @Test
        void shouldReplyAbsentWhenFetchFails() throws Exception {
            Waiter waiter = Waiter.forKey(alice, null);
            dispatcher.register(waiter);
            dispatcher.tick();
            fetcher.failFor(alice);

            source.publish(alice);
            dispatcher.tick();

            assertThat(waiter.sink().await(Duration.ZERO)).contains(Delta.absent());
            assertThat(dispatcher.stats().fetchFailures()).isEqualTo(1);
        }

        @Test
        void shouldReplyAbsentWhenNothingNewIsFound() throws Exception {
            Waiter waiter = Waiter.forKey(alice, null);
            dispatcher.register(waiter);
            dispatcher.tick();

            source.publish(alice);
            dispatcher.tick();

            assertThat(waiter.sink().await(Duration.ZERO)).contains(Delta.absent());
            assertThat(dispatcher.stats().fetchFailures()).isZero();
        }

        @Test
        void shouldIgnoreEventWithoutWaiters() {
            source.subscribe(alice);
            source.publish(alice);

            dispatcher.tick();

            assertThat(fetcher.calls(alice)).isZero();
            assertThat(dispatcher.stats().events()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("fairness")
    class Fairness {

        @Test
        void shouldCapEventsPerTickAndStillDrainRegistrations() {
            List<Waiter> waiters = new ArrayList<>();
            for (int i = 0; i < 10; i++) {
                Waiter waiter = Waiter.forKey(ChannelKey.of("client" + i, null), null);
                waiters.add(waiter);
                dispatcher.register(waiter);
            }
            dispatcher.tick();
            waiters.forEach(w -> source.publish(w.key()));

            ChannelKey late = ChannelKey.of("latecomer", null);
            dispatcher.register(Waiter.forKey(late, null));
            dispatcher.tick();

            assertThat(source.isSubscribed(late)).isTrue();
            assertThat(answered(waiters)).isEqualTo(4);

            dispatcher.tick();
            assertThat(answered(waiters)).isEqualTo(8);

            dispatcher.tick();
            assertThat(answered(waiters)).isEqualTo(10);
            assertThat(dispatcher.registry().contains(late)).isTrue();
        }

        private long answered(List<Waiter> waiters) {
            return waiters.stream().filter(w -> w.sink().isDone()).count();
        }
    }

    @Nested
    @DisplayName("cancellation")
    class Cancellation {

        @Test
        void shouldUnsubscribeWhenLastWaiterIsCancelled() {
            Waiter waiter = Waiter.forKey(alice, null);
            dispatcher.register(waiter);
            dispatcher.tick();

            waiter.sink().abandon();
            dispatcher.cancel(waiter);
            dispatcher.tick();

            assertThat(source.isSubscribed(alice)).isFalse();
            assertThat(dispatcher.registry().isEmpty()).isTrue();
        }

        @Test
        void shouldKeepSubscriptionWhileOtherWaitersRemain() {
            Waiter leaving = Waiter.forKey(alice, null);
            Waiter staying = Waiter.forKey(alice, null);
            dispatcher.register(leaving);
            dispatcher.register(staying);
            dispatcher.tick();

            leaving.sink().abandon();
            dispatcher.cancel(leaving);
            dispatcher.tick();

            assertThat(source.isSubscribed(alice)).isTrue();
            assertThat(dispatcher.registry().waiterCount()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("lifecycle")
    class Lifecycle {

        @Test
        void shouldDeliverFromBackgroundThread() throws Exception {
            dispatcher.start();
            fetcher.answer(alice, 5L);
            Waiter waiter = Waiter.forKey(alice, null);

            dispatcher.register(waiter);
            await().alias("alice subscribed").atMost(Duration.ofSeconds(5)).until(() -> source.isSubscribed(alice));
            source.publish(alice);

            assertThat(waiter.sink().await(Duration.ofSeconds(5))).contains(fetcher.deltaFor(alice));
        }

        @Test
        void shouldReleaseWaitersOnStop() throws Exception {
            dispatcher.start();
            Waiter registered = Waiter.forKey(alice, null);
            dispatcher.register(registered);
            await().alias("alice subscribed").atMost(Duration.ofSeconds(5)).until(() -> source.isSubscribed(alice));

            dispatcher.stop();

            assertThat(dispatcher.isRunning()).isFalse();
            assertThat(registered.sink().await(Duration.ZERO)).contains(Delta.absent());
        }

        @Test
        void shouldAnswerRegistrationAfterStopImmediately() throws Exception {
            dispatcher.start();
            dispatcher.stop();

            Waiter late = Waiter.forKey(alice, 4L);
            dispatcher.register(late);

            assertThat(late.sink().await(Duration.ZERO)).contains(Delta.absent());
            assertThat(dispatcher.stats().pendingRegistrations()).isZero();
        }

        @Test
        @DisplayName("an interrupt from outside stops the loop and releases waiters")
        void shouldReleaseWaitersWhenThreadIsInterrupted() throws Exception {
            ChangeSource interrupting = mock(ChangeSource.class);
            when(interrupting.next(any())).thenAnswer(invocation -> {
                Thread.currentThread().interrupt();
                return Optional.empty();
            });
            LiveDispatcher interrupted = new LiveDispatcher(interrupting, fetcher, TICK, 4, 1);
            Waiter waiter = Waiter.forKey(alice, null);
            interrupted.register(waiter);

            interrupted.start();

            await().alias("dispatcher stopped").atMost(Duration.ofSeconds(5)).until(() -> !interrupted.isRunning());
            assertThat(interrupted.stats().running()).isFalse();
            assertThat(waiter.sink().await(Duration.ofSeconds(5))).contains(Delta.absent());

            Waiter late = Waiter.forKey(alice, null);
            interrupted.register(late);
            assertThat(late.sink().await(Duration.ZERO)).contains(Delta.absent());
        }

        @Test
        void shouldRejectInvalidSettings() {
            assertThatThrownBy(
                    () -> new LiveDispatcher(source, fetcher, Duration.ZERO, 4, 1))
                .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(
                    () -> new LiveDispatcher(source, fetcher, TICK, 0, 1))
                .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(
                    () -> new LiveDispatcher(source, fetcher, TICK, 4, 0))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }

    /**
     * Fetcher answering from a fixed table; unknown keys get {@link Delta#absent()}.
     */
    private static final class StubFetcher implements DeltaFetcher {

        private final Map<ChannelKey, Delta> answers = new ConcurrentHashMap<>();
        private final Map<ChannelKey, AtomicInteger> calls = new ConcurrentHashMap<>();
        private final Map<ChannelKey, Boolean> failing = new ConcurrentHashMap<>();

        void answer(ChannelKey key, long id) {
            Feature feature = new Feature(
                "Feature",
                new Properties(id, Instant.parse("2024-01-01T00:00:00Z"), null, null, null, null),
                Geometry.point(1.0, 2.0)
            );
            answers.put(key, Delta.of(GeoJsonFeatureCollection.of(List.of(feature)), id));
        }

        void failFor(ChannelKey key) {
            failing.put(key, Boolean.TRUE);
        }

        Delta deltaFor(ChannelKey key) {
            return answers.get(key);
        }

        int calls(ChannelKey key) {
            AtomicInteger count = calls.get(key);
            return count == null ? 0 : count.get();
        }

        @Override
        public Delta fetch(ChannelKey key, Long cursor, int limit) {
            calls.computeIfAbsent(key, k -> new AtomicInteger()).incrementAndGet();
            if (failing.containsKey(key)) {
                throw new IllegalStateException("database unavailable");
            }
            return answers.getOrDefault(key, Delta.absent());
        }
    }
}
