package com.codeheadsystems.tripstore.model;

import java.util.Optional;
import org.immutables.value.Value;

/**
 * A client assigned to a trip.
 */
@Value.Immutable
public interface ClientAssignment {

  long tripId();

  String clientEmail();

  /**
   * Display name, when the client gave one.
   *
   * @return the optional
   */
  Optional<String> clientName();

  String clientRole();

}
