package com.codeheadsystems.tripstore.model;

import java.util.Optional;
import org.immutables.value.Value;

/**
 * A stored travel service row.
 */
@Value.Immutable
public interface CachedService {

  /**
   * Row id.
   *
   * @return the long
   */
  long id();

  /**
   * Service travel service.
   *
   * @return the travel service
   */
  TravelService service();

  /**
   * Hash of the search that produced it, if any.
   *
   * @return the optional
   */
  Optional<String> searchParamsHash();

  /**
   * Owning trip. Owned rows are never reclaimed by expiry.
   *
   * @return the optional
   */
  Optional<Long> tripId();

  /**
   * Created at, epoch millis.
   *
   * @return the long
   */
  long createdAt();

  /**
   * Updated at, epoch millis.
   *
   * @return the long
   */
  long updatedAt();

  /**
   * Cache expires at, epoch millis.
   *
   * @return the long
   */
  long cacheExpiresAt();

  /**
   * Owned boolean.
   *
   * @return the boolean
   */
  default boolean owned() {
    return tripId().isPresent();
  }
}
