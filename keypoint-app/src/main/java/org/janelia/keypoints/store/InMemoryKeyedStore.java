package org.janelia.keypoints.store;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link KeyedStore} backed by a concurrent map, for programmatic runs and tests.
 */
public class InMemoryKeyedStore<T>
        implements KeyedStore<T> {

    private final Map<String, T> keyToValue;

    public InMemoryKeyedStore() {
        this.keyToValue = new ConcurrentHashMap<>();
    }

    @Override
    public T load(final String key) {
        return keyToValue.get(key);
    }

    @Override
    public void save(final String key,
                     final T value) {
        if (value == null) {
            throw new IllegalArgumentException("cannot store null value for key " + key);
        }
        keyToValue.put(key, value);
    }

    @Override
    public boolean contains(final String key) {
        return keyToValue.containsKey(key);
    }

    @Override
    public Set<String> keys() {
        return Collections.unmodifiableSet(new TreeSet<>(keyToValue.keySet()));
    }

    public int size() {
        return keyToValue.size();
    }

}
