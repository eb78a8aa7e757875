package com.codeheadsystems.tripstore.manager;

import com.codeheadsystems.tripstore.dao.FactsDirtyDao;
import com.codeheadsystems.tripstore.model.DirtyEntry;
import java.time.Clock;
import java.util.List;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Application-side entry into the facts dirty queue, for writes that do not go through the tracked
 * tables and for explicit refresh requests.
 */
@Singleton
public class DirtyTracker {

  private static final Logger log = LoggerFactory.getLogger(DirtyTracker.class);

  private final FactsDirtyDao factsDirtyDao;
  private final Clock clock;

  /**
   * Instantiates a new Dirty tracker.
   *
   * @param factsDirtyDao the facts dirty dao
   * @param clock         the clock
   */
  @Inject
  public DirtyTracker(final FactsDirtyDao factsDirtyDao, final Clock clock) {
    log.info("DirtyTracker({}, {})", factsDirtyDao, clock);
    this.factsDirtyDao = factsDirtyDao;
    this.clock = clock;
  }

  private static void checkReason(final String reason) {
    if (reason == null || reason.isBlank()) {
      throw new IllegalArgumentException("reason must not be blank");
    }
  }

  /**
   * Mark a trip's facts stale.
   *
   * @param tripId the trip id
   * @param reason what changed
   */
  public void markDirty(final long tripId, final String reason) {
    log.trace("markDirty({}, {})", tripId, reason);
    checkReason(reason);
    factsDirtyDao.insert(tripId, reason, clock.millis());
  }

  /**
   * Mark every trip stale, e.g. after the facts computation itself changed.
   *
   * @param reason what changed
   * @return the number of trips marked
   */
  public int markAllDirty(final String reason) {
    log.trace("markAllDirty({})", reason);
    checkReason(reason);
    final int marked = factsDirtyDao.insertForAllTrips(reason, clock.millis());
    log.info("Marked {} trips dirty: {}", marked, reason);
    return marked;
  }

  /**
   * Oldest pending entries.
   *
   * @param limit the limit
   * @return the list
   */
  public List<DirtyEntry> pending(final int limit) {
    return factsDirtyDao.list(limit);
  }

  /**
   * Pending entries for one trip.
   *
   * @param tripId the trip id
   * @return the list
   */
  public List<DirtyEntry> pendingFor(final long tripId) {
    return factsDirtyDao.forTrip(tripId);
  }

  /**
   * Pending count.
   *
   * @return the int
   */
  public int pendingCount() {
    return factsDirtyDao.count();
  }
}
