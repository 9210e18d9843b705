/**
 * Durable storage of trend registries.
 *
 * <p>
 * A registry is committed as one {@link com.trendwatch.core.store.RegistrySnapshot}
 * through the {@link com.trendwatch.core.store.TrendStore} contract.
 * {@link com.trendwatch.core.store.FileTrendStore} provides write-then-rename
 * atomicity on local disks.
 * </p>
 *
 * @since 1.0.0
 */
package com.trendwatch.core.store;
