package com.geohub.tracker.live;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Waiters grouped by session, in registration order.
 *
 * Confined to the dispatcher thread: no method here is safe for concurrent
 * use, and none needs to be. Keys with an empty list are never kept, so
 * "key present" is the same as "key subscribed at the change source".
 */
public class SubscriptionRegistry {

    private final Map<ChannelKey, List<Waiter>> waiters = new LinkedHashMap<>();

    /**
     * Appends {@code waiter} to its session's list.
     *
     * @return true if it is the first waiter for that session (caller must subscribe)
     */
    public boolean add(Waiter waiter) {
        List<Waiter> list = waiters.get(waiter.key());
        if (list == null) {
            list = new ArrayList<>();
            waiters.put(waiter.key(), list);
            list.add(waiter);
            return true;
        }
        list.add(waiter);
        return false;
    }

    /**
     * Removes and returns every waiter of a session, oldest first.
     */
    public List<Waiter> drain(ChannelKey key) {
        List<Waiter> list = waiters.remove(key);
        return list == null ? List.of() : list;
    }

    /**
     * Removes a single waiter, e.g. after its request timed out.
     *
     * @return true if this emptied the session's list (caller must unsubscribe)
     */
    public boolean remove(Waiter waiter) {
        List<Waiter> list = waiters.get(waiter.key());
        if (list == null) {
            return false;
        }
        Iterator<Waiter> it = list.iterator();
        boolean removed = false;
        while (it.hasNext()) {
            if (it.next() == waiter) {
                it.remove();
                removed = true;
                break;
            }
        }
        if (removed && list.isEmpty()) {
            waiters.remove(waiter.key());
            return true;
        }
        return false;
    }

    public boolean contains(ChannelKey key) {
        return waiters.containsKey(key);
    }

    public Set<ChannelKey> keys() {
        return Set.copyOf(waiters.keySet());
    }

    public int keyCount() {
        return waiters.size();
    }

    public int waiterCount() {
        int count = 0;
        for (List<Waiter> list : waiters.values()) {
            count += list.size();
        }
        return count;
    }

    public boolean isEmpty() {
        return waiters.isEmpty();
    }
}
