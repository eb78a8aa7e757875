package com.codeheadsystems.tripstore.manager;

import com.codeheadsystems.tripstore.dao.SearchCacheDao;
import com.codeheadsystems.tripstore.dao.TravelServiceDao;
import com.codeheadsystems.tripstore.model.CacheIndexEntry;
import com.codeheadsystems.tripstore.model.CacheLookup;
import com.codeheadsystems.tripstore.model.CachePolicy;
import com.codeheadsystems.tripstore.model.CacheStatistics;
import com.codeheadsystems.tripstore.model.CachedService;
import com.codeheadsystems.tripstore.model.ImmutableCacheLookup;
import com.codeheadsystems.tripstore.model.ImmutableCacheStatistics;
import com.codeheadsystems.tripstore.model.InvalidationCriteria;
import com.codeheadsystems.tripstore.model.SearchParameters;
import com.codeheadsystems.tripstore.model.ServiceCategory;
import com.codeheadsystems.tripstore.model.TravelService;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Front door of the search result cache, called by the search orchestrator before and after an
 * external fetch.
 *
 * <p>Cache reads and writes are best effort: a store failure is logged and reported as a miss or as
 * {@code false}, so the caller falls back to fresh, uncached data. There is no locking; two callers
 * that miss on the same key may both fetch and both write, and the second write replaces the first.
 */
@Singleton
public class CacheManager {

  private static final Logger log = LoggerFactory.getLogger(CacheManager.class);

  private final SearchCacheDao searchCacheDao;
  private final TravelServiceDao travelServiceDao;
  private final CacheKeyGenerator cacheKeyGenerator;
  private final CachePolicies cachePolicies;
  private final Clock clock;

  /**
   * Instantiates a new Cache manager.
   *
   * @param searchCacheDao    the search cache dao
   * @param travelServiceDao  the travel service dao
   * @param cacheKeyGenerator the cache key generator
   * @param cachePolicies     the cache policies
   * @param clock             the clock
   */
  @Inject
  public CacheManager(final SearchCacheDao searchCacheDao,
                      final TravelServiceDao travelServiceDao,
                      final CacheKeyGenerator cacheKeyGenerator,
                      final CachePolicies cachePolicies,
                      final Clock clock) {
    log.info("CacheManager({}, {}, {}, {}, {})",
        searchCacheDao, travelServiceDao, cacheKeyGenerator, cachePolicies, clock);
    this.searchCacheDao = searchCacheDao;
    this.travelServiceDao = travelServiceDao;
    this.cacheKeyGenerator = cacheKeyGenerator;
    this.cachePolicies = cachePolicies;
    this.clock = clock;
  }

  /**
   * Generate the cache key for a search.
   *
   * @param category   the category
   * @param parameters the parameters
   * @return the key
   */
  public String generateKey(final ServiceCategory category, final SearchParameters parameters) {
    return cacheKeyGenerator.generateKey(category, parameters);
  }

  /**
   * Look up a search. A hit needs a live index entry that still has every result it was cached with;
   * it is flagged for refresh once the entry is older than the category's ttl minus its refresh
   * threshold.
   *
   * @param hash     the key from {@link #generateKey(ServiceCategory, SearchParameters)}
   * @param category the category
   * @return the cache lookup
   */
  public CacheLookup checkCacheHit(final String hash, final ServiceCategory category) {
    log.trace("checkCacheHit({}, {})", hash, category);
    final long now = clock.millis();
    try {
      final Optional<CacheIndexEntry> found = searchCacheDao.find(hash, category);
      if (found.isEmpty()) {
        log.debug("Cache miss for {} {}", category, hash);
        return CacheLookup.miss();
      }
      final CacheIndexEntry entry = found.get();
      if (entry.expiresAt() <= now) {
        log.debug("Cache entry expired for {} {}", category, hash);
        return CacheLookup.miss();
      }
      final List<TravelService> results = travelServiceDao.findBySearch(hash, category, now).stream()
          .map(CachedService::service)
          .collect(Collectors.toList());
      if (results.size() < entry.resultCount()) {
        // items were invalidated or taken over by a later search
        log.debug("Cache entry for {} {} has {} of {} results, treating as a miss",
            category, hash, results.size(), entry.resultCount());
        return CacheLookup.miss();
      }
      searchCacheDao.recordHit(entry.id(), now);
      final CachePolicy policy = cachePolicies.policyFor(category);
      final boolean needsRefresh = now > entry.createdAt() + policy.refreshAfter().toMillis();
      log.debug("Cache hit for {} {}: {} results, needsRefresh={}", category, hash, results.size(), needsRefresh);
      return ImmutableCacheLookup.builder()
          .hit(true)
          .results(results)
          .needsRefresh(needsRefresh)
          .entry(entry)
          .build();
    } catch (RuntimeException e) {
      log.warn("Cache lookup failed for {} {}, treating as a miss", category, hash, e);
      return CacheLookup.miss();
    }
  }

  /**
   * Store the results of an external search, replacing any earlier entry for the same key.
   *
   * @param hash       the key
   * @param category   the category
   * @param parameters the parameters that were searched
   * @param results    the results
   * @param source     the platform searched
   * @param durationMs how long the search took
   * @return false if the results could not be cached
   */
  public boolean cacheSearchResults(final String hash,
                                    final ServiceCategory category,
                                    final SearchParameters parameters,
                                    final List<TravelService> results,
                                    final String source,
                                    final long durationMs) {
    log.trace("cacheSearchResults({}, {}, {} results, {})", hash, category, results.size(), source);
    final long now = clock.millis();
    final long expiresAt = now + cachePolicies.policyFor(category).ttl().toMillis();
    try {
      searchCacheDao.replace(hash, category, cacheKeyGenerator.canonicalJson(category, parameters),
          results.size(), durationMs, source, now, expiresAt);
      for (TravelService result : results) {
        if (result.category() != category) {
          log.warn("Result {} is a {} but was cached under {}", result.serviceId(), result.category(), category);
        }
        travelServiceDao.upsert(result, Optional.of(hash), Optional.empty(), now, expiresAt);
      }
      log.info("Cached {} {} results for {} from {}", results.size(), category, hash, source);
      return true;
    } catch (RuntimeException e) {
      log.error("Unable to cache {} results for {}", category, hash, e);
      return false;
    }
  }

  /**
   * Store a single item. An item with an owning trip keeps living after its cache expiry.
   *
   * @param item   the item
   * @param hash   the search that produced it
   * @param tripId the owning trip
   * @return false if the item could not be stored
   */
  public boolean cacheItem(final TravelService item, final Optional<String> hash, final Optional<Long> tripId) {
    log.trace("cacheItem({}, {}, {})", item.serviceId(), hash, tripId);
    final long now = clock.millis();
    final long expiresAt = now + cachePolicies.policyFor(item.category()).ttl().toMillis();
    try {
      return travelServiceDao.upsert(item, hash, tripId, now, expiresAt);
    } catch (RuntimeException e) {
      log.error("Unable to cache item {}", item.serviceId(), e);
      return false;
    }
  }

  /**
   * Drop cached items matching the criteria. Items owned by a trip are never removed. Index entries
   * matching the same criteria are dropped too, so the next lookup misses and refetches.
   *
   * @param criteria the criteria
   * @return the number of items removed, zero when nothing matched
   */
  public int invalidate(final InvalidationCriteria criteria) {
    log.trace("invalidate({})", criteria);
    final int items = travelServiceDao.invalidate(criteria);
    final int entries = searchCacheDao.invalidate(criteria);
    log.info("Invalidated {} items and {} index entries for {}", items, entries, criteria);
    return items;
  }

  /**
   * Statistics cache statistics.
   *
   * @return the cache statistics
   */
  public CacheStatistics statistics() {
    log.trace("statistics()");
    final long now = clock.millis();
    return ImmutableCacheStatistics.builder()
        .liveEntries(searchCacheDao.countLive(now))
        .expiredEntries(searchCacheDao.countExpired(now))
        .cachedItems(travelServiceDao.count())
        .ownedItems(travelServiceDao.countOwned())
        .expiredItems(travelServiceDao.countExpiredUnowned(now))
        .totalHits(searchCacheDao.totalHits())
        .build();
  }
}
