package com.codeheadsystems.tripstore.model;

import org.immutables.value.Value;

/**
 * A signal that a trip's facts are stale.
 */
@Value.Immutable
public interface DirtyEntry {

  long id();

  long tripId();

  /**
   * Table and operation that caused it, for example {@code trip_days_update}.
   *
   * @return the string
   */
  String reason();

  long createdAt();

}
