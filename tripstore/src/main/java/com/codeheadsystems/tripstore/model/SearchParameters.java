package com.codeheadsystems.tripstore.model;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * What a caller searched for. Only the fields relevant to a category take part in its cache key.
 */
@Value.Immutable
public interface SearchParameters {

  /**
   * Destination as typed by the user.
   *
   * @return the string
   */
  String destination();

  /**
   * Start date local date.
   *
   * @return the local date
   */
  LocalDate startDate();

  /**
   * End date optional.
   *
   * @return the optional
   */
  Optional<LocalDate> endDate();

  /**
   * Adults int.
   *
   * @return the int
   */
  @Value.Default
  default int adults() {
    return 2;
  }

  /**
   * Children int.
   *
   * @return the int
   */
  @Value.Default
  default int children() {
    return 0;
  }

  /**
   * Rooms int.
   *
   * @return the int
   */
  @Value.Default
  default int rooms() {
    return 1;
  }

  // hotel filters

  Optional<Integer> starRating();

  Optional<Double> minRating();

  List<String> amenities();

  // flight filters

  Optional<String> origin();

  Optional<String> cabinClass();

  Optional<String> tripType();

  // rental car filters

  Optional<String> pickupLocation();

  Optional<String> carClass();

  /**
   * Validate.
   */
  @Value.Check
  default void validate() {
    if (destination().isBlank()) {
      throw new IllegalArgumentException("destination must not be blank");
    }
    if (adults() < 0 || children() < 0 || rooms() < 0) {
      throw new IllegalArgumentException("occupancy must not be negative");
    }
    endDate().ifPresent(end -> {
      if (end.isBefore(startDate())) {
        throw new IllegalArgumentException("endDate " + end + " is before startDate " + startDate());
      }
    });
  }
}
