package com.codeheadsystems.tripstore.model;

import java.util.Optional;
import org.immutables.value.Value;

/**
 * Metadata about one cached search, unique per hash and category. All times are epoch millis.
 */
@Value.Immutable
public interface CacheIndexEntry {

  long id();

  String searchParamsHash();

  ServiceCategory category();

  String searchParamsJson();

  int resultCount();

  Optional<Long> searchDurationMs();

  String sourcePlatform();

  long createdAt();

  long expiresAt();

  long lastAccessed();

  /**
   * Number of hits served from this entry.
   *
   * @return the int
   */
  int accessCount();

}
