package com.trendwatch.core.store;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Heap-only {@link TrendStore}. Snapshots are immutable, so storing the
 * reference is a complete commit. Suited to embedding and tests; nothing
 * survives the process.
 *
 * @since 1.0.0
 */
public class InMemoryTrendStore implements TrendStore {

    private final Map<String, RegistrySnapshot> records = new ConcurrentHashMap<>();

    @Override
    public void commit(String subsystemName, RegistrySnapshot snapshot) {
        Objects.requireNonNull(subsystemName, "subsystemName must not be null");
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        records.put(subsystemName, snapshot);
    }

    @Override
    public Optional<RegistrySnapshot> load(String subsystemName) {
        return Optional.ofNullable(records.get(subsystemName));
    }
}
