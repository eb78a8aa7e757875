package com.codeheadsystems.tripstore.model;

import org.immutables.value.Value;

/**
 * Point-in-time counts over the cache tables.
 */
@Value.Immutable
public interface CacheStatistics {

  long liveEntries();

  long expiredEntries();

  long cachedItems();

  long ownedItems();

  long expiredItems();

  long totalHits();

}
