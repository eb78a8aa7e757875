package com.codeheadsystems.tripstore.model;

import java.time.Instant;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * Which cached items to drop. Present fields are combined with AND; with no field set, every unowned
 * item matches.
 */
@Value.Immutable
public interface InvalidationCriteria {

  Optional<ServiceCategory> category();

  Optional<String> sourcePlatform();

  /**
   * Case-insensitive substring of the city, state or country.
   *
   * @return the optional
   */
  Optional<String> locationContains();

  /**
   * Only items cached strictly before this instant.
   *
   * @return the optional
   */
  Optional<Instant> olderThan();

}
