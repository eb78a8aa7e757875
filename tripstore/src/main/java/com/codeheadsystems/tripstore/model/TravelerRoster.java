package com.codeheadsystems.tripstore.model;

import java.util.List;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * Who travels on a trip: assigned clients plus the primary client, each email and name listed once
 * regardless of case, in assignment order.
 */
@Value.Immutable
public interface TravelerRoster {

  List<String> emails();

  List<String> names();

  Optional<String> primaryClientEmail();

  Optional<String> primaryClientName();

  /**
   * Count int.
   *
   * @return the int
   */
  default int count() {
    return emails().size();
  }
}
