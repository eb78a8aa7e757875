package com.codeheadsystems.tripstore.model;

import java.util.List;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * Result of a cache check.
 */
@Value.Immutable
public interface CacheLookup {

  /**
   * A lookup that found nothing live.
   *
   * @return the cache lookup
   */
  static CacheLookup miss() {
    return ImmutableCacheLookup.builder().hit(false).needsRefresh(false).build();
  }

  /**
   * True when a live index entry exists.
   *
   * @return the boolean
   */
  boolean hit();

  /**
   * The cached results, empty on a miss.
   *
   * @return the list
   */
  List<TravelService> results();

  /**
   * True when the entry is still valid but inside its refresh window. The caller should repopulate in
   * the background while serving these results.
   *
   * @return the boolean
   */
  boolean needsRefresh();

  /**
   * The index entry behind a hit.
   *
   * @return the optional
   */
  Optional<CacheIndexEntry> entry();

}
