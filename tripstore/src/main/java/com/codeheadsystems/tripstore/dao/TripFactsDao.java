package com.codeheadsystems.tripstore.dao;

import com.codeheadsystems.tripstore.model.TripFacts;
import java.util.List;
import java.util.Optional;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

/**
 * Per-trip facts. Recomputation reads the base tables and overwrites the row in one statement, so
 * readers never see a half-updated row.
 */
public interface TripFactsDao {

  /**
   * Get optional.
   *
   * @param tripId the trip id
   * @return the optional
   */
  @SqlQuery("select * from trip_facts where trip_id = :tripId")
  Optional<TripFacts> get(@Bind("tripId") long tripId);

  /**
   * Recompute the facts of a trip from its base tables.
   * Nights are the span of day numbers, falling back to the trip dates. Hotels and cost include the
   * travel services the trip owns. The traveler roster is resolved by the caller and written as given.
   *
   * @param tripId             the trip id
   * @param now                epoch millis
   * @param travelerCount      the traveler count
   * @param travelerNames      json array, may be null
   * @param travelerEmails     json array, may be null
   * @param primaryClientEmail may be null
   * @param primaryClientName  may be null
   * @return false when the trip does not exist
   */
  @SqlUpdate("insert into trip_facts (trip_id, total_nights, total_hotels, total_activities, total_cost, "
      + "transit_minutes, traveler_count, traveler_names, traveler_emails, primary_client_email, primary_client_name, "
      + "last_computed, version) "
      + "select t.trip_id, "
      + "coalesce("
      + "  (select max(d.day_number) - min(d.day_number) + 1 from trip_days d where d.trip_id = t.trip_id), "
      + "  case when julianday(t.end_date) >= julianday(t.start_date) "
      + "    then cast(julianday(t.end_date) - julianday(t.start_date) as integer) else 0 end, "
      + "  0), "
      + "(select count(*) from trip_activities a where a.trip_id = t.trip_id "
      + "    and lower(a.activity_type) in ('hotel', 'lodging')) "
      + "  + (select count(*) from travel_services s where s.trip_id = t.trip_id and s.service_category = 'hotel'), "
      + "(select count(*) from trip_activities a where a.trip_id = t.trip_id), "
      + "(select coalesce(sum(a.cost), 0) from trip_activities a where a.trip_id = t.trip_id) "
      + "  + (select coalesce(sum(s.total_price), 0) from travel_services s where s.trip_id = t.trip_id), "
      + "(select coalesce(sum(l.duration_minutes), 0) from trip_legs l where l.trip_id = t.trip_id), "
      + ":travelerCount, :travelerNames, :travelerEmails, :primaryClientEmail, :primaryClientName, "
      + ":now, "
      + "1 "
      + "from trips t where t.trip_id = :tripId "
      + "on conflict(trip_id) do update set "
      + "total_nights = excluded.total_nights, "
      + "total_hotels = excluded.total_hotels, "
      + "total_activities = excluded.total_activities, "
      + "total_cost = excluded.total_cost, "
      + "transit_minutes = excluded.transit_minutes, "
      + "traveler_count = excluded.traveler_count, "
      + "traveler_names = excluded.traveler_names, "
      + "traveler_emails = excluded.traveler_emails, "
      + "primary_client_email = excluded.primary_client_email, "
      + "primary_client_name = excluded.primary_client_name, "
      + "last_computed = excluded.last_computed, "
      + "version = trip_facts.version + 1")
  boolean recompute(@Bind("tripId") long tripId,
                    @Bind("now") long now,
                    @Bind("travelerCount") int travelerCount,
                    @Bind("travelerNames") String travelerNames,
                    @Bind("travelerEmails") String travelerEmails,
                    @Bind("primaryClientEmail") String primaryClientEmail,
                    @Bind("primaryClientName") String primaryClientName);

  /**
   * Delete boolean.
   *
   * @param tripId the trip id
   * @return the boolean
   */
  @SqlUpdate("delete from trip_facts where trip_id = :tripId")
  boolean delete(@Bind("tripId") long tripId);

  /**
   * Trips whose facts are missing or older than the trip's last update, most recently updated first.
   * Cancelled trips are left alone.
   *
   * @param limit the limit
   * @return the list
   */
  @SqlQuery("select t.trip_id from trips t left join trip_facts f on f.trip_id = t.trip_id "
      + "where t.status != 'cancelled' and (f.trip_id is null or f.last_computed < t.updated_at) "
      + "order by t.updated_at desc, t.trip_id limit :limit")
  List<Long> staleTripIds(@Bind("limit") int limit);

  /**
   * Count int.
   *
   * @return the int
   */
  @SqlQuery("select count(*) from trip_facts")
  int count();

}
