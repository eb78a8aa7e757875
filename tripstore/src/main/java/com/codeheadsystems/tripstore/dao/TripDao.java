package com.codeheadsystems.tripstore.dao;

import com.codeheadsystems.tripstore.model.ClientAssignment;
import com.codeheadsystems.tripstore.model.ImmutableClientAssignment;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.Jdbi;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Plain reads and writes on the base trip tables. Every write here is picked up by the dirty
 * tracking triggers, so callers do not signal anything themselves.
 */
@Singleton
public class TripDao {

  private static final Logger log = LoggerFactory.getLogger(TripDao.class);

  private final Jdbi jdbi;

  /**
   * Instantiates a new Trip dao.
   *
   * @param jdbi the jdbi
   */
  @Inject
  public TripDao(final Jdbi jdbi) {
    log.info("TripDao({})", jdbi);
    this.jdbi = jdbi;
  }

  private static String date(final LocalDate date) {
    return date == null ? null : date.toString();
  }

  private static long insert(final Handle handle, final String sql, final Map<String, ?> bindings) {
    handle.createUpdate(sql).bindMap(bindings).execute();
    return handle.createQuery("select last_insert_rowid()").mapTo(Long.class).one();
  }

  /**
   * Insert trip.
   *
   * @param name      the name
   * @param startDate the start date, may be null
   * @param endDate   the end date, may be null
   * @param now       epoch millis
   * @return the trip id
   */
  public long insertTrip(final String name, final LocalDate startDate, final LocalDate endDate, final long now) {
    log.trace("insertTrip({}, {}, {})", name, startDate, endDate);
    final Map<String, Object> bindings = new HashMap<>();
    bindings.put("name", name);
    bindings.put("startDate", date(startDate));
    bindings.put("endDate", date(endDate));
    bindings.put("now", now);
    return jdbi.withHandle(handle -> insert(handle,
        "insert into trips (trip_name, start_date, end_date, created_at, updated_at) "
            + "values (:name, :startDate, :endDate, :now, :now)", bindings));
  }

  /**
   * Update trip dates.
   *
   * @param tripId    the trip id
   * @param startDate the start date
   * @param endDate   the end date
   * @param now       epoch millis
   * @return true if the trip exists
   */
  public boolean updateTripDates(final long tripId, final LocalDate startDate, final LocalDate endDate,
                                 final long now) {
    log.trace("updateTripDates({}, {}, {})", tripId, startDate, endDate);
    return jdbi.withHandle(handle -> handle.createUpdate(
            "update trips set start_date = :startDate, end_date = :endDate, updated_at = :now where trip_id = :tripId")
        .bind("tripId", tripId)
        .bind("startDate", date(startDate))
        .bind("endDate", date(endDate))
        .bind("now", now)
        .execute() > 0);
  }

  /**
   * Update trip status.
   *
   * @param tripId the trip id
   * @param status the status
   * @param now    epoch millis
   * @return true if the trip exists
   */
  public boolean updateTripStatus(final long tripId, final String status, final long now) {
    log.trace("updateTripStatus({}, {})", tripId, status);
    return jdbi.withHandle(handle -> handle.createUpdate(
            "update trips set status = :status, updated_at = :now where trip_id = :tripId")
        .bind("tripId", tripId)
        .bind("status", status)
        .bind("now", now)
        .execute() > 0);
  }

  /**
   * Delete a trip with its days, activities, legs and client assignments. Owned travel services are
   * released back to the cache rather than deleted.
   *
   * @param tripId the trip id
   * @return true if the trip existed
   */
  public boolean deleteTrip(final long tripId) {
    log.trace("deleteTrip({})", tripId);
    return jdbi.withHandle(handle -> {
      for (String table : List.of("trip_activities", "trip_days", "trip_legs", "trip_client_assignments")) {
        handle.createUpdate("delete from " + table + " where trip_id = :tripId").bind("tripId", tripId).execute();
      }
      handle.createUpdate("update travel_services set trip_id = null where trip_id = :tripId")
          .bind("tripId", tripId)
          .execute();
      return handle.createUpdate("delete from trips where trip_id = :tripId").bind("tripId", tripId).execute() > 0;
    });
  }

  /**
   * Trip exists boolean.
   *
   * @param tripId the trip id
   * @return the boolean
   */
  public boolean tripExists(final long tripId) {
    return jdbi.withHandle(handle -> handle.createQuery("select count(*) from trips where trip_id = :tripId")
        .bind("tripId", tripId)
        .mapTo(Integer.class)
        .one() > 0);
  }

  /**
   * Trip name optional.
   *
   * @param tripId the trip id
   * @return the optional
   */
  public Optional<String> tripName(final long tripId) {
    return jdbi.withHandle(handle -> handle.createQuery("select trip_name from trips where trip_id = :tripId")
        .bind("tripId", tripId)
        .mapTo(String.class)
        .findOne());
  }

  /**
   * Insert day.
   *
   * @param tripId    the trip id
   * @param dayNumber the day number, starting at 1
   * @param dayDate   the date, may be null
   * @param title     the title, may be null
   * @return the day id
   */
  public long insertDay(final long tripId, final int dayNumber, final LocalDate dayDate, final String title) {
    log.trace("insertDay({}, {})", tripId, dayNumber);
    final Map<String, Object> bindings = new HashMap<>();
    bindings.put("tripId", tripId);
    bindings.put("dayNumber", dayNumber);
    bindings.put("dayDate", date(dayDate));
    bindings.put("title", title);
    return jdbi.withHandle(handle -> insert(handle,
        "insert into trip_days (trip_id, day_number, day_date, title) values (:tripId, :dayNumber, :dayDate, :title)",
        bindings));
  }

  /**
   * Delete a day. Its activities stay with the trip, detached from any day.
   *
   * @param dayId the day id
   * @return the boolean
   */
  public boolean deleteDay(final long dayId) {
    log.trace("deleteDay({})", dayId);
    return jdbi.withHandle(handle -> {
      handle.createUpdate("update trip_activities set day_id = null where day_id = :dayId")
          .bind("dayId", dayId)
          .execute();
      return handle.createUpdate("delete from trip_days where day_id = :dayId")
          .bind("dayId", dayId)
          .execute() > 0;
    });
  }

  /**
   * Insert activity.
   *
   * @param tripId       the trip id
   * @param dayId        the day id, may be null
   * @param activityType hotel, lodging, tour, meal...
   * @param title        the title
   * @param cost         the cost
   * @return the activity id
   */
  public long insertActivity(final long tripId, final Long dayId, final String activityType, final String title,
                             final double cost) {
    log.trace("insertActivity({}, {}, {})", tripId, activityType, title);
    final Map<String, Object> bindings = new HashMap<>();
    bindings.put("tripId", tripId);
    bindings.put("dayId", dayId);
    bindings.put("activityType", activityType);
    bindings.put("title", title);
    bindings.put("cost", cost);
    return jdbi.withHandle(handle -> insert(handle,
        "insert into trip_activities (trip_id, day_id, activity_type, title, cost) "
            + "values (:tripId, :dayId, :activityType, :title, :cost)", bindings));
  }

  /**
   * Update activity cost.
   *
   * @param activityId the activity id
   * @param cost       the cost
   * @return the boolean
   */
  public boolean updateActivityCost(final long activityId, final double cost) {
    log.trace("updateActivityCost({}, {})", activityId, cost);
    return jdbi.withHandle(handle -> handle.createUpdate(
            "update trip_activities set cost = :cost where activity_id = :activityId")
        .bind("activityId", activityId)
        .bind("cost", cost)
        .execute() > 0);
  }

  /**
   * Move an activity to another trip.
   *
   * @param activityId the activity id
   * @param tripId     the new trip id
   * @return the boolean
   */
  public boolean moveActivity(final long activityId, final long tripId) {
    log.trace("moveActivity({}, {})", activityId, tripId);
    return jdbi.withHandle(handle -> handle.createUpdate(
            "update trip_activities set trip_id = :tripId, day_id = null where activity_id = :activityId")
        .bind("activityId", activityId)
        .bind("tripId", tripId)
        .execute() > 0);
  }

  /**
   * Delete activity.
   *
   * @param activityId the activity id
   * @return the boolean
   */
  public boolean deleteActivity(final long activityId) {
    log.trace("deleteActivity({})", activityId);
    return jdbi.withHandle(handle -> handle.createUpdate("delete from trip_activities where activity_id = :activityId")
        .bind("activityId", activityId)
        .execute() > 0);
  }

  /**
   * Insert leg.
   *
   * @param tripId          the trip id
   * @param origin          the origin
   * @param destination     the destination
   * @param transportMode   flight, train, car... may be null
   * @param durationMinutes the duration in minutes
   * @return the leg id
   */
  public long insertLeg(final long tripId, final String origin, final String destination, final String transportMode,
                        final int durationMinutes) {
    log.trace("insertLeg({}, {}, {})", tripId, origin, destination);
    final Map<String, Object> bindings = new HashMap<>();
    bindings.put("tripId", tripId);
    bindings.put("origin", origin);
    bindings.put("destination", destination);
    bindings.put("transportMode", transportMode);
    bindings.put("durationMinutes", durationMinutes);
    return jdbi.withHandle(handle -> insert(handle,
        "insert into trip_legs (trip_id, origin, destination, transport_mode, duration_minutes) "
            + "values (:tripId, :origin, :destination, :transportMode, :durationMinutes)", bindings));
  }

  /**
   * Delete leg.
   *
   * @param legId the leg id
   * @return the boolean
   */
  public boolean deleteLeg(final long legId) {
    log.trace("deleteLeg({})", legId);
    return jdbi.withHandle(handle -> handle.createUpdate("delete from trip_legs where leg_id = :legId")
        .bind("legId", legId)
        .execute() > 0);
  }

  /**
   * Assign a client to a trip. Assigning the same email twice is a no-op.
   *
   * @param tripId the trip id
   * @param email  the email
   * @param role   the role
   * @param now    epoch millis
   * @return true if a new assignment was made
   */
  public boolean assignClient(final long tripId, final String email, final String role, final long now) {
    return assignClient(tripId, email, Optional.empty(), role, now);
  }

  /**
   * Assign a named client to a trip. Assigning the same email twice is a no-op.
   *
   * @param tripId the trip id
   * @param email  the email
   * @param name   the client's display name
   * @param role   the role
   * @param now    epoch millis
   * @return true if a new assignment was made
   */
  public boolean assignClient(final long tripId,
                              final String email,
                              final Optional<String> name,
                              final String role,
                              final long now) {
    log.trace("assignClient({}, {}, {}, {})", tripId, email, name, role);
    return jdbi.withHandle(handle -> handle.createUpdate(
            "insert or ignore into trip_client_assignments "
                + "(trip_id, client_email, client_name, client_role, created_at) "
                + "values (:tripId, :email, :name, :role, :now)")
        .bind("tripId", tripId)
        .bind("email", email)
        .bind("name", name.orElse(null))
        .bind("role", role)
        .bind("now", now)
        .execute() > 0);
  }

  /**
   * Client assignments of a trip, in assignment order.
   *
   * @param tripId the trip id
   * @return the list
   */
  public List<ClientAssignment> clientAssignments(final long tripId) {
    log.trace("clientAssignments({})", tripId);
    return jdbi.withHandle(handle -> handle.createQuery(
            "select * from trip_client_assignments where trip_id = :tripId order by assignment_id")
        .bind("tripId", tripId)
        .map((rs, ctx) -> (ClientAssignment) ImmutableClientAssignment.builder()
            .tripId(rs.getLong("trip_id"))
            .clientEmail(rs.getString("client_email"))
            .clientName(Optional.ofNullable(rs.getString("client_name")))
            .clientRole(rs.getString("client_role"))
            .build())
        .list());
  }

  /**
   * Set or clear the trip's primary client.
   *
   * @param tripId the trip id
   * @param email  the email, empty to clear it
   * @param now    epoch millis
   * @return true if the trip exists
   */
  public boolean setPrimaryClient(final long tripId, final Optional<String> email, final long now) {
    log.trace("setPrimaryClient({}, {})", tripId, email);
    return jdbi.withHandle(handle -> handle.createUpdate(
            "update trips set primary_client_email = :email, updated_at = :now where trip_id = :tripId")
        .bind("tripId", tripId)
        .bind("email", email.orElse(null))
        .bind("now", now)
        .execute() > 0);
  }

  /**
   * Primary client email of a trip.
   *
   * @param tripId the trip id
   * @return the optional, empty when the trip has none or does not exist
   */
  public Optional<String> primaryClientEmail(final long tripId) {
    log.trace("primaryClientEmail({})", tripId);
    return jdbi.withHandle(handle -> handle.createQuery(
            "select primary_client_email from trips "
                + "where trip_id = :tripId and primary_client_email is not null")
        .bind("tripId", tripId)
        .mapTo(String.class)
        .findOne());
  }

  /**
   * Unassign client.
   *
   * @param tripId the trip id
   * @param email  the email
   * @return the boolean
   */
  public boolean unassignClient(final long tripId, final String email) {
    log.trace("unassignClient({}, {})", tripId, email);
    return jdbi.withHandle(handle -> handle.createUpdate(
            "delete from trip_client_assignments where trip_id = :tripId and client_email = :email")
        .bind("tripId", tripId)
        .bind("email", email)
        .execute() > 0);
  }
}
