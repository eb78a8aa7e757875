package com.codeheadsystems.tripstore.model;

import java.util.List;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * Precomputed figures for one trip. Rewritten whole on every refresh.
 */
@Value.Immutable
public interface TripFacts {

  long tripId();

  int totalNights();

  int totalHotels();

  int totalActivities();

  double totalCost();

  int transitMinutes();

  int travelerCount();

  List<String> travelerNames();

  List<String> travelerEmails();

  Optional<String> primaryClientEmail();

  Optional<String> primaryClientName();

  /**
   * Last computed, epoch millis.
   *
   * @return the long
   */
  long lastComputed();

  /**
   * Incremented on every recompute.
   *
   * @return the int
   */
  int version();

}
