package com.geohub.tracker.live;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SubscriptionRegistryTest {

    private final SubscriptionRegistry registry = new SubscriptionRegistry();

    private final ChannelKey alice = ChannelKey.of("alice", null);
    private final ChannelKey bob = ChannelKey.of("bob", "xyz");

    @Test
    void shouldReportFirstWaiterPerKey() {
        assertThat(registry.add(Waiter.forKey(alice, null))).isTrue();
        assertThat(registry.add(Waiter.forKey(alice, null))).isFalse();
        assertThat(registry.add(Waiter.forKey(bob, null))).isTrue();

        assertThat(registry.keyCount()).isEqualTo(2);
        assertThat(registry.waiterCount()).isEqualTo(3);
    }

    @Test
    void shouldDrainInRegistrationOrder() {
        Waiter first = Waiter.forKey(alice, 1L);
        Waiter second = Waiter.forKey(alice, 2L);
        Waiter other = Waiter.forKey(bob, null);
        registry.add(first);
        registry.add(other);
        registry.add(second);

        assertThat(registry.drain(alice)).containsExactly(first, second);
        assertThat(registry.contains(alice)).isFalse();
        assertThat(registry.contains(bob)).isTrue();
        assertThat(registry.drain(alice)).isEmpty();
    }

    @Test
    void shouldReportWhenRemovalEmptiesKey() {
        Waiter first = Waiter.forKey(alice, null);
        Waiter second = Waiter.forKey(alice, null);
        registry.add(first);
        registry.add(second);

        assertThat(registry.remove(first)).isFalse();
        assertThat(registry.contains(alice)).isTrue();
        assertThat(registry.remove(second)).isTrue();
        assertThat(registry.contains(alice)).isFalse();
        assertThat(registry.isEmpty()).isTrue();
    }

    @Test
    void shouldIgnoreRemovalOfUnknownWaiter() {
        registry.add(Waiter.forKey(alice, null));

        assertThat(registry.remove(Waiter.forKey(alice, null))).isFalse();
        assertThat(registry.remove(Waiter.forKey(bob, null))).isFalse();
        assertThat(registry.waiterCount()).isEqualTo(1);
    }
}
