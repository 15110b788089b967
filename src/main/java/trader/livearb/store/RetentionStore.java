package trader.livearb.store;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiPredicate;
import java.util.function.Function;

/**
 * Bounded, keyed container that keeps the most recently written entries.
 * <p>
 * An upsert of an existing key replaces the entry and makes it the newest one. When the
 * capacity is exceeded the oldest entries are evicted. Readers get immutable copies and
 * never observe a write in progress.
 *
 * @param <K> identity key type
 * @param <T> stored value type
 */
public class RetentionStore<K, T> {

    private final String name;
    private final Function<T, K> keyFunction;
    private final RetentionOrder order;
    private final int capacity;
    private final BiPredicate<T, T> replacementPolicy;

    // insertion-ordered, head is the oldest entry
    private final LinkedHashMap<K, T> entries = new LinkedHashMap<>();

    public RetentionStore(String name, Function<T, K> keyFunction, RetentionOrder order, int capacity) {
        this(name, keyFunction, order, capacity, (existing, incoming) -> true);
    }

    /**
     * @param replacementPolicy decides whether {@code incoming} may replace {@code existing} for the same key
     */
    public RetentionStore(String name,
                          Function<T, K> keyFunction,
                          RetentionOrder order,
                          int capacity,
                          BiPredicate<T, T> replacementPolicy) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity of store " + name + " must be positive: " + capacity);
        }
        this.name = Objects.requireNonNull(name, "name");
        this.keyFunction = Objects.requireNonNull(keyFunction, "keyFunction");
        this.order = Objects.requireNonNull(order, "order");
        this.capacity = capacity;
        this.replacementPolicy = Objects.requireNonNull(replacementPolicy, "replacementPolicy");
    }

    /**
     * Inserts the item or replaces the entry with the same key.
     *
     * @return false when the replacement policy rejected the item
     */
    public synchronized boolean upsert(T item) {
        K key = Objects.requireNonNull(keyFunction.apply(item), () -> "Null key for item in store " + name);
        T existing = entries.get(key);
        if (existing != null) {
            if (!replacementPolicy.test(existing, item)) {
                return false;
            }
            entries.remove(key);
        }
        entries.put(key, item);
        evictOverflow();
        return true;
    }

    /**
     * Upserts every item in order and returns how many were accepted.
     */
    public synchronized int upsertAll(Iterable<T> items) {
        int accepted = 0;
        for (T item : items) {
            if (upsert(item)) {
                accepted++;
            }
        }
        return accepted;
    }

    public synchronized Optional<T> find(K key) {
        return Optional.ofNullable(entries.get(key));
    }

    public synchronized List<T> snapshot() {
        List<T> copy = new ArrayList<>(entries.values());
        if (order == RetentionOrder.NEWEST_FIRST) {
            Collections.reverse(copy);
        }
        return Collections.unmodifiableList(copy);
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized void clear() {
        entries.clear();
    }

    public String getName() {
        return name;
    }

    public int getCapacity() {
        return capacity;
    }

    private void evictOverflow() {
        Iterator<K> oldest = entries.keySet().iterator();
        while (entries.size() > capacity && oldest.hasNext()) {
            oldest.next();
            oldest.remove();
        }
    }
}
