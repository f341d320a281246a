package com.geohub.tracker.live;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Background dispatcher that wakes blocked live-wait requests when new points
 * arrive for their session.
 *
 * Threading model:
 * - One dedicated thread ("live-dispatcher") owns the {@link ChangeSource} and
 *   the {@link SubscriptionRegistry}. Neither is touched by any other thread.
 * - Request threads talk to it only through two lock-free queues
 *   ({@link #register(Waiter)}, {@link #cancel(Waiter)}) and read the answer
 *   from their own {@link ReplySink}.
 *
 * One tick:
 * 1. Drain queued registrations; subscribe keys that get their first waiter.
 * 2. Drain queued cancellations; unsubscribe keys that lost their last waiter.
 * 3. Wait up to one tick interval for a change event.
 * 4. Handle at most {@code maxEventsPerTick} events, fetching follow-ups
 *    without blocking. The cap bounds how long a burst of events can delay
 *    the registrations queued behind it.
 *
 * Handling an event: take the key's whole waiter list out of the registry,
 * fetch the delta once, and send it to every waiter in registration order.
 * A waiter that already holds the delta's newest row stays registered and
 * the key stays subscribed while any waiter remains. A failed fetch still
 * produces a reply ({@link Delta#absent()}), so no request waits for its
 * own timeout because of a broken lookup.
 *
 * Once the loop has ended, for {@link #stop()} or any other reason, late
 * registrations are answered with {@link Delta#absent()} immediately.
 *
 * Nothing here throws to a caller. Failures are logged and counted.
 */
@Slf4j
public class LiveDispatcher implements Runnable {

    public static final Duration DEFAULT_TICK = Duration.ofMillis(500);
    public static final int DEFAULT_MAX_EVENTS_PER_TICK = 4;
    public static final int DEFAULT_FETCH_LIMIT = 1;

    private static final Duration ERROR_BACKOFF = Duration.ofSeconds(1);
    private static final String THREAD_NAME = "live-dispatcher";

    private final ChangeSource changeSource;
    private final DeltaFetcher deltaFetcher;
    private final Duration tick;
    private final int maxEventsPerTick;
    private final int fetchLimit;

    private final Queue<Waiter> registrations = new ConcurrentLinkedQueue<>();
    private final Queue<Waiter> cancellations = new ConcurrentLinkedQueue<>();
    private final SubscriptionRegistry registry = new SubscriptionRegistry();

    private final AtomicLong tickCount = new AtomicLong();
    private final AtomicLong eventCount = new AtomicLong();
    private final AtomicLong replyCount = new AtomicLong();
    private final AtomicLong subscribeFailures = new AtomicLong();
    private final AtomicLong fetchFailures = new AtomicLong();

    // Registry sizes as of the end of the last tick, for stats() readers
    private volatile int registeredKeys;
    private volatile int registeredWaiters;

    private volatile boolean running;
    // Set once the loop has exited; nothing drains the queues after that
    private volatile boolean terminated;
    private Thread thread;

    public LiveDispatcher(ChangeSource changeSource, DeltaFetcher deltaFetcher) {
        this(changeSource, deltaFetcher, DEFAULT_TICK, DEFAULT_MAX_EVENTS_PER_TICK, DEFAULT_FETCH_LIMIT);
    }

    public LiveDispatcher(
        ChangeSource changeSource,
        DeltaFetcher deltaFetcher,
        Duration tick,
        int maxEventsPerTick,
        int fetchLimit
    ) {
        if (tick.isNegative() || tick.isZero()) {
            throw new IllegalArgumentException("tick must be positive: " + tick);
        }
        if (maxEventsPerTick < 1) {
            throw new IllegalArgumentException("maxEventsPerTick must be >= 1: " + maxEventsPerTick);
        }
        if (fetchLimit < 1) {
            throw new IllegalArgumentException("fetchLimit must be >= 1: " + fetchLimit);
        }
        this.changeSource = changeSource;
        this.deltaFetcher = deltaFetcher;
        this.tick = tick;
        this.maxEventsPerTick = maxEventsPerTick;
        this.fetchLimit = fetchLimit;
    }

    /**
     * Queues a waiter for registration. Safe to call from any thread.
     */
    public void register(Waiter waiter) {
        registrations.offer(waiter);
        if (terminated) {
            releasePending();
        }
    }

    /**
     * Queues removal of a waiter whose request gave up. Safe to call from any thread.
     * The caller should abandon the waiter's sink first, so a registration that
     * has not been drained yet is skipped as well.
     */
    public void cancel(Waiter waiter) {
        cancellations.offer(waiter);
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        terminated = false;
        thread = new Thread(this, THREAD_NAME);
        thread.setDaemon(true);
        thread.start();
        log.info("Live dispatcher started: tick={}ms, maxEventsPerTick={}, fetchLimit={}",
            tick.toMillis(), maxEventsPerTick, fetchLimit);
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        Thread t = thread;
        thread = null;
        t.interrupt();
        try {
            t.join(tick.toMillis() * 4 + ERROR_BACKOFF.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (t.isAlive()) {
            log.warn("Live dispatcher thread did not stop in time");
        } else {
            log.info("Live dispatcher stopped");
        }
    }

    public boolean isRunning() {
        return running;
    }

    @Override
    public void run() {
        try {
            while (running && !Thread.currentThread().isInterrupted()) {
                try {
                    tick();
                } catch (ChangeSourceException e) {
                    log.warn("Change source failed, retrying in {}ms: {}", ERROR_BACKOFF.toMillis(), e.getMessage());
                    backOff();
                } catch (RuntimeException e) {
                    log.error("Unexpected error in live dispatcher tick", e);
                    backOff();
                }
            }
            if (running) {
                log.warn("Live dispatcher thread interrupted without stop(); releasing all waiters");
            }
        } finally {
            running = false;
            terminated = true;
            releaseAll();
        }
    }

    /**
     * Runs a single tick. Called in a loop by {@link #run()}; exposed to the
     * package so the tick semantics can be driven step by step.
     */
    void tick() {
        tickCount.incrementAndGet();
        drainRegistrations();
        drainCancellations();

        int processed = 0;
        Optional<ChannelKey> event = changeSource.next(tick);
        while (event.isPresent()) {
            dispatch(event.get());
            processed++;
            if (processed >= maxEventsPerTick) {
                break;
            }
            event = changeSource.next(Duration.ZERO);
        }

        registeredKeys = registry.keyCount();
        registeredWaiters = registry.waiterCount();
        if (processed > 0) {
            log.debug("Tick handled {} event(s); {} key(s) / {} waiter(s) still registered",
                processed, registeredKeys, registeredWaiters);
        }
    }

    private void drainRegistrations() {
        Waiter waiter;
        while ((waiter = registrations.poll()) != null) {
            if (waiter.sink().isDone()) {
                // Request already gave up before we saw it
                continue;
            }
            if (registry.add(waiter)) {
                subscribe(waiter.key());
            }
        }
    }

    private void drainCancellations() {
        Waiter waiter;
        while ((waiter = cancellations.poll()) != null) {
            if (registry.remove(waiter)) {
                unsubscribe(waiter.key());
            }
        }
    }

    private void subscribe(ChannelKey key) {
        try {
            changeSource.subscribe(key);
            log.debug("Subscribed {}", key);
        } catch (ChangeSourceException e) {
            subscribeFailures.incrementAndGet();
            log.warn("Subscribe failed for {}: {}", key, e.getMessage());
        } catch (IllegalArgumentException e) {
            // Codec rejected a key that validation should have stopped
            subscribeFailures.incrementAndGet();
            log.error("Refusing to subscribe invalid key {}", key, e);
            reply(registry.drain(key), Delta.absent());
        }
    }

    private void unsubscribe(ChannelKey key) {
        try {
            changeSource.unsubscribe(key);
            log.debug("Unsubscribed {}", key);
        } catch (ChangeSourceException e) {
            log.warn("Unsubscribe failed for {}: {}", key, e.getMessage());
        } catch (IllegalArgumentException e) {
            log.error("Refusing to unsubscribe invalid key {}", key, e);
        }
    }

    private void dispatch(ChannelKey key) {
        eventCount.incrementAndGet();
        List<Waiter> waiters = registry.drain(key);
        if (waiters.isEmpty()) {
            log.debug("Change event for {} without waiters", key);
            return;
        }
        Delta delta = fetchDelta(key);
        List<Waiter> answered = new ArrayList<>(waiters.size());
        for (Waiter waiter : waiters) {
            if (alreadySeen(waiter, delta) && !waiter.sink().isDone()) {
                registry.add(waiter);
            } else {
                answered.add(waiter);
            }
        }
        if (registry.contains(key)) {
            log.debug("Change event for {} has nothing newer for {} waiter(s); keeping them",
                key, waiters.size() - answered.size());
        } else {
            unsubscribe(key);
        }
        reply(answered, delta);
    }

    private static boolean alreadySeen(Waiter waiter, Delta delta) {
        return delta.isPresent() && waiter.lastSeen() != null && delta.last() <= waiter.lastSeen();
    }

    private Delta fetchDelta(ChannelKey key) {
        try {
            Delta delta = deltaFetcher.fetch(key, null, fetchLimit);
            return delta == null ? Delta.absent() : delta;
        } catch (IllegalArgumentException e) {
            fetchFailures.incrementAndGet();
            log.error("Delta fetch rejected key {}", key, e);
            return Delta.absent();
        } catch (RuntimeException e) {
            fetchFailures.incrementAndGet();
            log.warn("Delta fetch failed for {}: {}", key, e.getMessage());
            return Delta.absent();
        }
    }

    private void reply(List<Waiter> waiters, Delta delta) {
        for (Waiter waiter : waiters) {
            if (waiter.sink().send(delta)) {
                replyCount.incrementAndGet();
            } else {
                log.debug("Dropped reply to abandoned {}", waiter);
            }
        }
    }

    /**
     * Answers everything still pending with an absence reply so no request
     * thread outlives the dispatcher waiting for it.
     */
    private void releaseAll() {
        releasePending();
        cancellations.clear();
        for (ChannelKey key : registry.keys()) {
            reply(registry.drain(key), Delta.absent());
        }
        registeredKeys = 0;
        registeredWaiters = 0;
    }

    private void releasePending() {
        Waiter pending;
        while ((pending = registrations.poll()) != null) {
            pending.sink().send(Delta.absent());
        }
    }

    private void backOff() {
        try {
            Thread.sleep(ERROR_BACKOFF.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    SubscriptionRegistry registry() {
        return registry;
    }

    public Stats stats() {
        return new Stats(
            running,
            tickCount.get(),
            eventCount.get(),
            replyCount.get(),
            subscribeFailures.get(),
            fetchFailures.get(),
            registeredKeys,
            registeredWaiters,
            registrations.size()
        );
    }

    /**
     * Dispatcher counters for monitoring.
     */
    public record Stats(
        boolean running,
        long ticks,
        long events,
        long replies,
        long subscribeFailures,
        long fetchFailures,
        int registeredKeys,
        int registeredWaiters,
        int pendingRegistrations
    ) {
    }
}
