package com.codeheadsystems.tripstore.dao;

import com.codeheadsystems.tripstore.model.DirtyEntry;
import java.util.List;
import java.util.Optional;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

/**
 * The facts dirty queue. Rows are written by triggers and by {@code DirtyTracker}, and drained by
 * {@code FactTableManager}.
 */
public interface FactsDirtyDao {

  /**
   * Insert boolean.
   *
   * @param tripId    the trip id
   * @param reason    the reason
   * @param createdAt epoch millis
   * @return the boolean
   */
  @SqlUpdate("insert into facts_dirty (trip_id, reason, created_at) values (:tripId, :reason, :createdAt)")
  boolean insert(@Bind("tripId") long tripId,
                 @Bind("reason") String reason,
                 @Bind("createdAt") long createdAt);

  /**
   * One entry per existing trip.
   *
   * @param reason    the reason
   * @param createdAt epoch millis
   * @return rows inserted
   */
  @SqlUpdate("insert into facts_dirty (trip_id, reason, created_at) select trip_id, :reason, :createdAt from trips")
  int insertForAllTrips(@Bind("reason") String reason,
                        @Bind("createdAt") long createdAt);

  /**
   * Distinct dirty trips, oldest signal first.
   *
   * @param limit the limit
   * @return the list
   */
  @SqlQuery("select trip_id from facts_dirty group by trip_id order by min(id) limit :limit")
  List<Long> dirtyTripIds(@Bind("limit") int limit);

  /**
   * Highest entry id for a trip.
   *
   * @param tripId the trip id
   * @return the optional
   */
  @SqlQuery("select id from facts_dirty where trip_id = :tripId order by id desc limit 1")
  Optional<Long> latestId(@Bind("tripId") long tripId);

  /**
   * Delete a trip's entries up to and including an id.
   *
   * @param tripId the trip id
   * @param maxId  the max id
   * @return rows removed
   */
  @SqlUpdate("delete from facts_dirty where trip_id = :tripId and id <= :maxId")
  int deleteThrough(@Bind("tripId") long tripId,
                    @Bind("maxId") long maxId);

  /**
   * Oldest entries first.
   *
   * @param limit the limit
   * @return the list
   */
  @SqlQuery("select * from facts_dirty order by id limit :limit")
  List<DirtyEntry> list(@Bind("limit") int limit);

  /**
   * Entries for a trip.
   *
   * @param tripId the trip id
   * @return the list
   */
  @SqlQuery("select * from facts_dirty where trip_id = :tripId order by id")
  List<DirtyEntry> forTrip(@Bind("tripId") long tripId);

  /**
   * Count int.
   *
   * @return the int
   */
  @SqlQuery("select count(*) from facts_dirty")
  int count();

  /**
   * Delete entries created before the cutoff.
   *
   * @param cutoff epoch millis
   * @return rows removed
   */
  @SqlUpdate("delete from facts_dirty where created_at < :cutoff")
  int deleteOlderThan(@Bind("cutoff") long cutoff);

}
