package com.codeheadsystems.tripstore.manager;

import com.codeheadsystems.tripstore.dao.FactsDirtyDao;
import com.codeheadsystems.tripstore.dao.StringListColumnMapper;
import com.codeheadsystems.tripstore.dao.TripFactsDao;
import com.codeheadsystems.tripstore.model.Configuration;
import com.codeheadsystems.tripstore.model.TravelerRoster;
import com.codeheadsystems.tripstore.model.TripFacts;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.jdbi.v3.core.JdbiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drains the facts dirty queue. Facts are always recomputed from the base tables, never patched, so
 * duplicate signals only cost a recompute.
 */
@Singleton
public class FactTableManager {

  private static final Logger log = LoggerFactory.getLogger(FactTableManager.class);

  /**
   * Reason recorded when a trip that failed to refresh is queued again.
   */
  public static final String RETRY_REASON = "facts_refresh_retry";

  private final FactsDirtyDao factsDirtyDao;
  private final TripFactsDao tripFactsDao;
  private final TravelerRosters travelerRosters;
  private final StringListColumnMapper listMapper;
  private final Clock clock;
  private final int batchSize;

  /**
   * Instantiates a new Fact table manager.
   *
   * @param factsDirtyDao   the facts dirty dao
   * @param tripFactsDao    the trip facts dao
   * @param travelerRosters the traveler rosters
   * @param listMapper      the list mapper
   * @param clock           the clock
   * @param configuration   the configuration
   */
  @Inject
  public FactTableManager(final FactsDirtyDao factsDirtyDao,
                          final TripFactsDao tripFactsDao,
                          final TravelerRosters travelerRosters,
                          final StringListColumnMapper listMapper,
                          final Clock clock,
                          final Configuration configuration) {
    log.info("FactTableManager({}, {}, {}, {}, {})",
        factsDirtyDao, tripFactsDao, travelerRosters, clock, configuration.factsRefreshBatchSize());
    this.factsDirtyDao = factsDirtyDao;
    this.tripFactsDao = tripFactsDao;
    this.travelerRosters = travelerRosters;
    this.listMapper = listMapper;
    this.clock = clock;
    this.batchSize = configuration.factsRefreshBatchSize();
  }

  /**
   * Refresh up to the configured batch size of dirty trips.
   *
   * @return the number of trips refreshed
   */
  public int refreshDirty() {
    return refreshDirty(batchSize);
  }

  /**
   * Refresh up to {@code limit} dirty trips, oldest signal first. Only the entries seen before a trip
   * is recomputed are consumed; entries that arrive meanwhile stay for the next round. A trip that
   * fails stays dirty but goes to the back of the queue, so it cannot hold up the others.
   *
   * @param limit the limit
   * @return the number of trips refreshed
   */
  public int refreshDirty(final int limit) {
    log.trace("refreshDirty({})", limit);
    final List<Long> tripIds = factsDirtyDao.dirtyTripIds(limit);
    int refreshed = 0;
    for (Long tripId : tripIds) {
      final Optional<Long> latest = factsDirtyDao.latestId(tripId);
      if (latest.isEmpty()) {
        continue;
      }
      try {
        refreshTripFacts(tripId);
        factsDirtyDao.deleteThrough(tripId, latest.get());
        refreshed++;
      } catch (JdbiException e) {
        log.error("Unable to refresh facts for trip {}, queueing it again", tripId, e);
        requeue(tripId, latest.get());
      }
    }
    if (refreshed > 0) {
      log.info("Refreshed facts for {} trips", refreshed);
    }
    return refreshed;
  }

  private void requeue(final long tripId, final long latestId) {
    try {
      // the new entry sorts after every other dirty trip and survives the delete
      factsDirtyDao.insert(tripId, RETRY_REASON, clock.millis());
      factsDirtyDao.deleteThrough(tripId, latestId);
    } catch (JdbiException e) {
      log.warn("Unable to requeue trip {}, it keeps its place", tripId, e);
    }
  }

  /**
   * Refresh up to the configured batch size of trips with missing or outdated facts.
   *
   * @return the number of trips refreshed
   */
  public int refreshStale() {
    return refreshStale(batchSize);
  }

  /**
   * Refresh trips whose facts are missing or were computed before the trip's last update, most
   * recently updated first. Catches trips the dirty queue missed, such as rows loaded before the
   * triggers existed. Dirty entries are left for {@link #refreshDirty(int)}.
   *
   * @param limit the limit
   * @return the number of trips refreshed
   */
  public int refreshStale(final int limit) {
    log.trace("refreshStale({})", limit);
    int refreshed = 0;
    for (Long tripId : tripFactsDao.staleTripIds(limit)) {
      try {
        refreshTripFacts(tripId);
        refreshed++;
      } catch (JdbiException e) {
        log.error("Unable to refresh stale facts for trip {}", tripId, e);
      }
    }
    if (refreshed > 0) {
      log.info("Refreshed stale facts for {} trips", refreshed);
    }
    return refreshed;
  }

  /**
   * Recompute a trip's facts now. A trip that no longer exists loses its facts row.
   *
   * @param tripId the trip id
   * @return the facts, empty when the trip is gone
   */
  public Optional<TripFacts> refreshTripFacts(final long tripId) {
    log.trace("refreshTripFacts({})", tripId);
    final TravelerRoster roster = travelerRosters.forTrip(tripId);
    final boolean exists = tripFactsDao.recompute(tripId, clock.millis(), roster.count(),
        listMapper.toColumn(roster.names()), listMapper.toColumn(roster.emails()),
        roster.primaryClientEmail().orElse(null), roster.primaryClientName().orElse(null));
    if (!exists) {
      log.debug("Trip {} is gone, dropping its facts", tripId);
      tripFactsDao.delete(tripId);
      return Optional.empty();
    }
    return tripFactsDao.get(tripId);
  }

  /**
   * Current facts, possibly stale.
   *
   * @param tripId the trip id
   * @return the optional
   */
  public Optional<TripFacts> getTripFacts(final long tripId) {
    log.trace("getTripFacts({})", tripId);
    return tripFactsDao.get(tripId);
  }
}
