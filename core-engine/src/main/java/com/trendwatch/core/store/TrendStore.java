package com.trendwatch.core.store;

import java.util.Optional;

/**
 * Transactional store of registry snapshots, one record per subsystem.
 *
 * <p>
 * Implementations must make {@link #commit} atomic across the whole
 * snapshot: after a crash, {@link #load} returns either the previous commit
 * or the new one, never a mixture.
 * </p>
 */
public interface TrendStore {

    /**
     * Durably replace the subsystem's record.
     *
     * @param subsystemName subsystem key
     * @param snapshot      the complete registry state
     * @throws PersistenceException if the commit did not happen
     */
    void commit(String subsystemName, RegistrySnapshot snapshot) throws PersistenceException;

    /**
     * @param subsystemName subsystem key
     * @return the last committed snapshot, or empty if none exists
     * @throws PersistenceException if the record exists but cannot be read
     */
    Optional<RegistrySnapshot> load(String subsystemName) throws PersistenceException;
}
