package com.codeheadsystems.tripstore.dao;

import com.codeheadsystems.tripstore.model.CacheIndexEntry;
import com.codeheadsystems.tripstore.model.InvalidationCriteria;
import com.codeheadsystems.tripstore.model.ServiceCategory;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.jdbi.v3.core.Jdbi;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Data access for the search cache index, one row per hash and category.
 */
@Singleton
public class SearchCacheDao {

  private static final Logger log = LoggerFactory.getLogger(SearchCacheDao.class);

  private final Jdbi jdbi;
  private final CacheIndexEntryRowMapper rowMapper;

  /**
   * Instantiates a new Search cache dao.
   *
   * @param jdbi the jdbi
   */
  @Inject
  public SearchCacheDao(final Jdbi jdbi) {
    log.info("SearchCacheDao({})", jdbi);
    this.jdbi = jdbi;
    this.rowMapper = new CacheIndexEntryRowMapper();
  }

  /**
   * Write a fresh entry. An existing entry for the same hash and category is replaced, not updated,
   * so its access statistics start over.
   *
   * @param hash             the hash
   * @param category         the category
   * @param searchParamsJson the canonical search parameters
   * @param resultCount      the result count
   * @param durationMs       how long the external search took
   * @param sourcePlatform   the source platform
   * @param now              epoch millis
   * @param expiresAt        epoch millis
   * @return true if written
   */
  public boolean replace(final String hash,
                         final ServiceCategory category,
                         final String searchParamsJson,
                         final int resultCount,
                         final long durationMs,
                         final String sourcePlatform,
                         final long now,
                         final long expiresAt) {
    log.trace("replace({}, {}, {})", hash, category, resultCount);
    return jdbi.withHandle(handle -> handle.createUpdate(
            "insert or replace into travel_search_cache (search_params_hash, service_category, search_params_json, "
                + "result_count, search_duration_ms, source_platform, created_at, expires_at, last_accessed, access_count) "
                + "values (:hash, :category, :json, :resultCount, :durationMs, :sourcePlatform, :now, :expiresAt, :now, 0)")
        .bind("hash", hash)
        .bind("category", category.code())
        .bind("json", searchParamsJson)
        .bind("resultCount", resultCount)
        .bind("durationMs", durationMs)
        .bind("sourcePlatform", sourcePlatform)
        .bind("now", now)
        .bind("expiresAt", expiresAt)
        .execute() > 0);
  }

  /**
   * Find the entry for a hash and category, expired or not.
   *
   * @param hash     the hash
   * @param category the category
   * @return the optional
   */
  public Optional<CacheIndexEntry> find(final String hash, final ServiceCategory category) {
    log.trace("find({}, {})", hash, category);
    return jdbi.withHandle(handle -> handle.createQuery(
            "select * from travel_search_cache where search_params_hash = :hash and service_category = :category")
        .bind("hash", hash)
        .bind("category", category.code())
        .map(rowMapper)
        .findOne());
  }

  /**
   * Access bookkeeping for a hit.
   *
   * @param id  the id
   * @param now epoch millis
   * @return true if the entry still exists
   */
  public boolean recordHit(final long id, final long now) {
    log.trace("recordHit({})", id);
    return jdbi.withHandle(handle -> handle.createUpdate(
            "update travel_search_cache set last_accessed = :now, access_count = access_count + 1 where id = :id")
        .bind("id", id)
        .bind("now", now)
        .execute() > 0);
  }

  /**
   * Delete the entries matching the criteria. The location is matched against the stored search
   * parameters since index rows carry no location columns.
   *
   * @param criteria the criteria
   * @return the number of entries removed
   */
  public int invalidate(final InvalidationCriteria criteria) {
    log.trace("invalidate({})", criteria);
    final SqlFilter filter = new SqlFilter();
    criteria.category().ifPresent(c -> filter.add("service_category = :category", "category", c.code()));
    criteria.sourcePlatform().ifPresent(p -> filter.add("source_platform = :sourcePlatform", "sourcePlatform", p));
    criteria.locationContains().ifPresent(l -> filter.add(
        "lower(search_params_json) like :location escape '!'", "location", SqlFilter.containsPattern(l)));
    criteria.olderThan().ifPresent(i -> filter.add("created_at < :olderThan", "olderThan", i.toEpochMilli()));
    return jdbi.withHandle(handle ->
        filter.bind(handle.createUpdate("delete from travel_search_cache" + filter.where())).execute());
  }

  /**
   * Delete entries whose expiry has passed.
   *
   * @param now epoch millis
   * @return the number removed
   */
  public int deleteExpired(final long now) {
    log.trace("deleteExpired({})", now);
    return jdbi.withHandle(handle -> handle.createUpdate("delete from travel_search_cache where expires_at <= :now")
        .bind("now", now)
        .execute());
  }

  /**
   * Count live entries.
   *
   * @param now epoch millis
   * @return the long
   */
  public long countLive(final long now) {
    return jdbi.withHandle(handle -> handle.createQuery(
            "select count(*) from travel_search_cache where expires_at > :now")
        .bind("now", now)
        .mapTo(Long.class)
        .one());
  }

  /**
   * Count expired entries.
   *
   * @param now epoch millis
   * @return the long
   */
  public long countExpired(final long now) {
    return jdbi.withHandle(handle -> handle.createQuery(
            "select count(*) from travel_search_cache where expires_at <= :now")
        .bind("now", now)
        .mapTo(Long.class)
        .one());
  }

  /**
   * Sum of hits over all entries.
   *
   * @return the long
   */
  public long totalHits() {
    return jdbi.withHandle(handle -> handle.createQuery(
            "select coalesce(sum(access_count), 0) from travel_search_cache")
        .mapTo(Long.class)
        .one());
  }
}
