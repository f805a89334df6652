package io.fullerstack.perf.core.monitor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Thread-safe map of subscriber ids to callbacks.
 * <p>
 * Ids come from a counter that starts at 1 and only increases, so an id is
 * never handed out twice, even after removal. The registry owns each callback
 * until it is removed.
 * <p>
 * Delivery runs under the registry lock: once {@link #remove(long)} returns,
 * the removed callback receives nothing further. A callback may remove itself
 * or others while being notified. A callback that throws is logged and skipped;
 * the others are still notified.
 *
 * @param <T> notification payload type
 */
public class SubscriberRegistry<T> {
    private static final Logger logger = LoggerFactory.getLogger(SubscriberRegistry.class);

    private final Object lock = new Object();
    private final Map<Long, Consumer<? super T>> subscribers = new LinkedHashMap<>();
    private final AtomicLong nextId = new AtomicLong(1);

    /**
     * Adds a callback.
     *
     * @param callback receives every notification until removed
     * @return new subscriber id, strictly greater than any previously returned
     */
    public long register(Consumer<? super T> callback) {
        Objects.requireNonNull(callback, "callback cannot be null");
        long id = nextId.getAndIncrement();
        synchronized (lock) {
            subscribers.put(id, callback);
        }
        return id;
    }

    /**
     * Removes a callback. Unknown ids are ignored.
     *
     * @param id subscriber id
     * @return true if a callback was removed
     */
    public boolean remove(long id) {
        synchronized (lock) {
            return subscribers.remove(id) != null;
        }
    }

    public boolean contains(long id) {
        synchronized (lock) {
            return subscribers.containsKey(id);
        }
    }

    public int size() {
        synchronized (lock) {
            return subscribers.size();
        }
    }

    /**
     * Delivers a payload to every registered callback in registration order.
     *
     * @param payload notification payload
     * @return number of callbacks that completed without throwing
     */
    public int notifyAll(T payload) {
        synchronized (lock) {
            if (subscribers.isEmpty()) {
                return 0;
            }
            // Iterate a copy so callbacks can unsubscribe re-entrantly
            List<Map.Entry<Long, Consumer<? super T>>> entries = new ArrayList<>(subscribers.entrySet());
            int delivered = 0;
            for (Map.Entry<Long, Consumer<? super T>> entry : entries) {
                if (!subscribers.containsKey(entry.getKey())) {
                    continue;
                }
                try {
                    entry.getValue().accept(payload);
                    delivered++;
                } catch (RuntimeException e) {
                    logger.error("Subscriber {} failed; continuing with remaining subscribers", entry.getKey(), e);
                }
            }
            return delivered;
        }
    }
}
