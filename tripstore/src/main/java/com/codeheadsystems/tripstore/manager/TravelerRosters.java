package com.codeheadsystems.tripstore.manager;

import com.codeheadsystems.tripstore.dao.TripDao;
import com.codeheadsystems.tripstore.model.ClientAssignment;
import com.codeheadsystems.tripstore.model.ImmutableTravelerRoster;
import com.codeheadsystems.tripstore.model.TravelerRoster;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves who travels on a trip from its client assignments and primary client. A client without a
 * name gets one made from the local part of their email: {@code jean-luc.picard@} is Jean Luc Picard.
 */
@Singleton
public class TravelerRosters {

  private static final Logger log = LoggerFactory.getLogger(TravelerRosters.class);
  private static final Pattern NAME_SEPARATORS = Pattern.compile("[._-]+");

  private final TripDao tripDao;

  /**
   * Instantiates a new Traveler rosters.
   *
   * @param tripDao the trip dao
   */
  @Inject
  public TravelerRosters(final TripDao tripDao) {
    log.info("TravelerRosters({})", tripDao);
    this.tripDao = tripDao;
  }

  /**
   * Name made from an email's local part, title-cased word by word.
   *
   * @param email the email
   * @return the optional, empty when the local part has no words
   */
  static Optional<String> nameFromEmail(final String email) {
    if (email == null) {
      return Optional.empty();
    }
    final int at = email.indexOf('@');
    final String local = at < 0 ? email : email.substring(0, at);
    final String name = NAME_SEPARATORS.splitAsStream(local)
        .filter(word -> !word.isEmpty())
        .map(TravelerRosters::titleCase)
        .collect(Collectors.joining(" "));
    return name.isEmpty() ? Optional.empty() : Optional.of(name);
  }

  private static String titleCase(final String word) {
    return word.substring(0, 1).toUpperCase(Locale.ROOT) + word.substring(1).toLowerCase(Locale.ROOT);
  }

  /**
   * The roster for a trip. Emails and names are each listed once, compared without case; the first
   * spelling seen wins.
   *
   * @param tripId the trip id
   * @return the traveler roster
   */
  public TravelerRoster forTrip(final long tripId) {
    log.trace("forTrip({})", tripId);
    final List<ClientAssignment> assignments = tripDao.clientAssignments(tripId);
    final Optional<String> primaryEmail = tripDao.primaryClientEmail(tripId).filter(e -> !e.isBlank());

    final Listing emails = new Listing();
    final Listing names = new Listing();
    for (ClientAssignment assignment : assignments) {
      emails.add(assignment.clientEmail());
      nameOf(assignment).ifPresent(names::add);
    }

    final Optional<String> primaryName = primaryEmail.flatMap(email -> assignments.stream()
        .filter(a -> a.clientEmail().equalsIgnoreCase(email))
        .map(TravelerRosters::nameOf)
        .flatMap(Optional::stream)
        .findFirst()
        .or(() -> nameFromEmail(email)));
    primaryEmail.ifPresent(emails::add);
    primaryName.ifPresent(names::add);

    return ImmutableTravelerRoster.builder()
        .emails(emails.values)
        .names(names.values)
        .primaryClientEmail(primaryEmail)
        .primaryClientName(primaryName)
        .build();
  }

  private static Optional<String> nameOf(final ClientAssignment assignment) {
    return assignment.clientName()
        .map(String::trim)
        .filter(name -> !name.isEmpty())
        .or(() -> nameFromEmail(assignment.clientEmail()));
  }

  private static class Listing {

    private final List<String> values = new ArrayList<>();
    private final Set<String> seen = new HashSet<>();

    void add(final String value) {
      if (seen.add(value.toLowerCase(Locale.ROOT))) {
        values.add(value);
      }
    }
  }
}
