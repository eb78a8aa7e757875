package com.codeheadsystems.tripstore.service;

import com.codeheadsystems.tripstore.dao.FactsDirtyDao;
import com.codeheadsystems.tripstore.dao.SearchCacheDao;
import com.codeheadsystems.tripstore.dao.TravelServiceDao;
import com.codeheadsystems.tripstore.model.Configuration;
import com.codeheadsystems.tripstore.model.ImmutableSweepResult;
import com.codeheadsystems.tripstore.model.SweepResult;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Background service removing expired cache index entries, expired unowned cached items and dirty
 * entries nobody consumed within the retention window. Items owned by a trip are never swept.
 */
@Singleton
public class CacheSweepService {

  private static final Logger log = LoggerFactory.getLogger(CacheSweepService.class);

  private final SearchCacheDao searchCacheDao;
  private final TravelServiceDao travelServiceDao;
  private final FactsDirtyDao factsDirtyDao;
  private final Clock clock;

  private final ScheduledExecutorService scheduler;
  private final AtomicBoolean running;
  private final long sweepIntervalSeconds;
  private final Duration dirtyRetention;

  /**
   * Instantiates a new Cache sweep service.
   *
   * @param searchCacheDao   the search cache dao
   * @param travelServiceDao the travel service dao
   * @param factsDirtyDao    the facts dirty dao
   * @param clock            the clock
   * @param configuration    the configuration
   */
  @Inject
  public CacheSweepService(final SearchCacheDao searchCacheDao,
                           final TravelServiceDao travelServiceDao,
                           final FactsDirtyDao factsDirtyDao,
                           final Clock clock,
                           final Configuration configuration) {
    this(searchCacheDao, travelServiceDao, factsDirtyDao, clock,
        configuration.cacheSweepIntervalSeconds(), Duration.ofHours(configuration.dirtyRetentionHours()));
  }

  /**
   * Instantiates a new Cache sweep service with custom settings.
   *
   * @param searchCacheDao       the search cache dao
   * @param travelServiceDao     the travel service dao
   * @param factsDirtyDao        the facts dirty dao
   * @param clock                the clock
   * @param sweepIntervalSeconds the sweep interval in seconds
   * @param dirtyRetention       how long an unconsumed dirty entry is kept
   */
  public CacheSweepService(final SearchCacheDao searchCacheDao,
                           final TravelServiceDao travelServiceDao,
                           final FactsDirtyDao factsDirtyDao,
                           final Clock clock,
                           final long sweepIntervalSeconds,
                           final Duration dirtyRetention) {
    log.info("CacheSweepService({}, {}, {}, {}, interval={}s, retention={})",
        searchCacheDao, travelServiceDao, factsDirtyDao, clock, sweepIntervalSeconds, dirtyRetention);
    this.searchCacheDao = searchCacheDao;
    this.travelServiceDao = travelServiceDao;
    this.factsDirtyDao = factsDirtyDao;
    this.clock = clock;
    this.sweepIntervalSeconds = sweepIntervalSeconds;
    this.dirtyRetention = dirtyRetention;
    this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
      final Thread thread = new Thread(r, "cache-sweep");
      thread.setDaemon(true);
      return thread;
    });
    this.running = new AtomicBoolean(false);
  }

  /**
   * Starts the background sweep.
   */
  public void start() {
    if (running.compareAndSet(false, true)) {
      log.info("Starting cache sweep service with interval {}s", sweepIntervalSeconds);
      scheduler.scheduleAtFixedRate(
          this::scheduledSweep,
          sweepIntervalSeconds,
          sweepIntervalSeconds,
          TimeUnit.SECONDS
      );
    } else {
      log.warn("Cache sweep service already running");
    }
  }

  /**
   * Stops the background sweep.
   */
  public void stop() {
    if (running.compareAndSet(true, false)) {
      log.info("Stopping cache sweep service");
      scheduler.shutdown();
      try {
        if (!scheduler.awaitTermination(30, TimeUnit.SECONDS)) {
          scheduler.shutdownNow();
        }
      } catch (InterruptedException e) {
        scheduler.shutdownNow();
        Thread.currentThread().interrupt();
      }
    } else {
      log.warn("Cache sweep service not running");
    }
  }

  /**
   * Checks if the sweep service is running.
   *
   * @return true if running
   */
  public boolean isRunning() {
    return running.get();
  }

  /**
   * Runs one sweep now.
   *
   * @return what was removed
   */
  public SweepResult runSweep() {
    log.debug("Starting cache sweep");
    final long now = clock.millis();
    final SweepResult result = ImmutableSweepResult.builder()
        .expiredEntries(searchCacheDao.deleteExpired(now))
        .expiredItems(travelServiceDao.deleteExpiredUnowned(now))
        .staleDirtyEntries(factsDirtyDao.deleteOlderThan(now - dirtyRetention.toMillis()))
        .build();
    if (result.total() > 0) {
      log.info("Cache sweep removed {} index entries, {} items, {} stale dirty entries",
          result.expiredEntries(), result.expiredItems(), result.staleDirtyEntries());
    }
    return result;
  }

  /**
   * Package-private for testing.
   */
  void scheduledSweep() {
    try {
      runSweep();
    } catch (Exception e) {
      log.error("Error during cache sweep", e);
    }
  }
}
