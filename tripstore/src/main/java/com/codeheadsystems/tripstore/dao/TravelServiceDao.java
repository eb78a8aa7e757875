package com.codeheadsystems.tripstore.dao;

import com.codeheadsystems.tripstore.model.CachedService;
import com.codeheadsystems.tripstore.model.InvalidationCriteria;
import com.codeheadsystems.tripstore.model.ServiceCategory;
import com.codeheadsystems.tripstore.model.TravelService;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.jdbi.v3.core.Jdbi;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Data access for cached travel service rows.
 * Uses JDBI Handle directly since invalidation builds its where clause at runtime.
 */
@Singleton
public class TravelServiceDao {

  private static final Logger log = LoggerFactory.getLogger(TravelServiceDao.class);

  private static final String UPSERT = "insert into travel_services ("
      + "trip_id, search_params_hash, service_id, service_category, service_name, service_description, "
      + "base_price, total_price, currency, price_unit, is_available, start_date, end_date, "
      + "location_city, location_state, location_country, rating_overall, rating_count, "
      + "source_platform, source_url, booking_url, service_data_json, created_at, updated_at, cache_expires_at) "
      + "values (:tripId, :hash, :serviceId, :category, :name, :description, "
      + ":basePrice, :totalPrice, :currency, :priceUnit, :available, :startDate, :endDate, "
      + ":city, :state, :country, :rating, :ratingCount, "
      + ":sourcePlatform, :sourceUrl, :bookingUrl, :serviceDataJson, :now, :now, :expiresAt) "
      + "on conflict(service_id, source_platform, start_date, service_category) do update set "
      // ownership is never dropped by a later cache write
      + "trip_id = coalesce(excluded.trip_id, travel_services.trip_id), "
      + "search_params_hash = coalesce(excluded.search_params_hash, travel_services.search_params_hash), "
      + "service_name = excluded.service_name, "
      + "service_description = excluded.service_description, "
      + "base_price = excluded.base_price, "
      + "total_price = excluded.total_price, "
      + "currency = excluded.currency, "
      + "price_unit = excluded.price_unit, "
      + "is_available = excluded.is_available, "
      + "end_date = excluded.end_date, "
      + "location_city = excluded.location_city, "
      + "location_state = excluded.location_state, "
      + "location_country = excluded.location_country, "
      + "rating_overall = excluded.rating_overall, "
      + "rating_count = excluded.rating_count, "
      + "source_url = excluded.source_url, "
      + "booking_url = excluded.booking_url, "
      + "service_data_json = excluded.service_data_json, "
      // age is measured from the latest fetch, matching the index entry written with it
      + "created_at = excluded.created_at, "
      + "updated_at = excluded.updated_at, "
      + "cache_expires_at = excluded.cache_expires_at";

  private final Jdbi jdbi;
  private final CachedServiceRowMapper rowMapper;

  /**
   * Instantiates a new Travel service dao.
   *
   * @param jdbi the jdbi
   */
  @Inject
  public TravelServiceDao(final Jdbi jdbi) {
    log.info("TravelServiceDao({})", jdbi);
    this.jdbi = jdbi;
    this.rowMapper = new CachedServiceRowMapper();
  }

  /**
   * Insert the service, or refresh the existing row with the same source identity.
   *
   * @param service   the service
   * @param hash      the search hash that produced it
   * @param tripId    the owning trip
   * @param now       epoch millis
   * @param expiresAt epoch millis
   * @return true if a row was written
   */
  public boolean upsert(final TravelService service,
                        final Optional<String> hash,
                        final Optional<Long> tripId,
                        final long now,
                        final long expiresAt) {
    log.trace("upsert({}, {}, {})", service.serviceId(), hash, tripId);
    return jdbi.withHandle(handle -> handle.createUpdate(UPSERT)
        .bind("tripId", tripId.orElse(null))
        .bind("hash", hash.orElse(null))
        .bind("serviceId", service.serviceId())
        .bind("category", service.category().code())
        .bind("name", service.name())
        .bind("description", service.description().orElse(null))
        .bind("basePrice", service.basePrice())
        .bind("totalPrice", service.totalPrice())
        .bind("currency", service.currency())
        .bind("priceUnit", service.priceUnit().orElse(null))
        .bind("available", service.available())
        .bind("startDate", service.startDate().toString())
        .bind("endDate", service.endDate().map(LocalDate::toString).orElse(null))
        .bind("city", service.locationCity().orElse(null))
        .bind("state", service.locationState().orElse(null))
        .bind("country", service.locationCountry().orElse(null))
        .bind("rating", service.rating().orElse(null))
        .bind("ratingCount", service.ratingCount().orElse(null))
        .bind("sourcePlatform", service.sourcePlatform())
        .bind("sourceUrl", service.sourceUrl().orElse(null))
        .bind("bookingUrl", service.bookingUrl().orElse(null))
        .bind("serviceDataJson", service.serviceDataJson())
        .bind("now", now)
        .bind("expiresAt", expiresAt)
        .execute() > 0);
  }

  /**
   * Results stored for a search that are still usable: owned, or not yet expired.
   *
   * @param hash     the hash
   * @param category the category
   * @param now      epoch millis
   * @return the list
   */
  public List<CachedService> findBySearch(final String hash, final ServiceCategory category, final long now) {
    log.trace("findBySearch({}, {})", hash, category);
    return jdbi.withHandle(handle -> handle.createQuery(
            "select * from travel_services where search_params_hash = :hash and service_category = :category "
                + "and (trip_id is not null or cache_expires_at > :now) order by id")
        .bind("hash", hash)
        .bind("category", category.code())
        .bind("now", now)
        .map(rowMapper)
        .list());
  }

  /**
   * Find by id.
   *
   * @param id the id
   * @return the optional
   */
  public Optional<CachedService> findById(final long id) {
    log.trace("findById({})", id);
    return jdbi.withHandle(handle -> handle.createQuery("select * from travel_services where id = :id")
        .bind("id", id)
        .map(rowMapper)
        .findOne());
  }

  /**
   * Find a row by its source identity.
   *
   * @param serviceId      the service id
   * @param sourcePlatform the source platform
   * @param startDate      the start date
   * @param category       the category
   * @return the optional
   */
  public Optional<CachedService> findBySourceIdentity(final String serviceId,
                                                      final String sourcePlatform,
                                                      final LocalDate startDate,
                                                      final ServiceCategory category) {
    log.trace("findBySourceIdentity({}, {}, {}, {})", serviceId, sourcePlatform, startDate, category);
    return jdbi.withHandle(handle -> handle.createQuery(
            "select * from travel_services where service_id = :serviceId and source_platform = :sourcePlatform "
                + "and start_date = :startDate and service_category = :category")
        .bind("serviceId", serviceId)
        .bind("sourcePlatform", sourcePlatform)
        .bind("startDate", startDate.toString())
        .bind("category", category.code())
        .map(rowMapper)
        .findOne());
  }

  /**
   * Services owned by a trip.
   *
   * @param tripId the trip id
   * @return the list
   */
  public List<CachedService> findByTrip(final long tripId) {
    log.trace("findByTrip({})", tripId);
    return jdbi.withHandle(handle -> handle.createQuery(
            "select * from travel_services where trip_id = :tripId order by start_date, id")
        .bind("tripId", tripId)
        .map(rowMapper)
        .list());
  }

  /**
   * Delete the unowned rows matching the criteria.
   *
   * @param criteria the criteria
   * @return the number of rows removed
   */
  public int invalidate(final InvalidationCriteria criteria) {
    log.trace("invalidate({})", criteria);
    final SqlFilter filter = new SqlFilter().add("trip_id is null");
    criteria.category().ifPresent(c -> filter.add("service_category = :category", "category", c.code()));
    criteria.sourcePlatform().ifPresent(p -> filter.add("source_platform = :sourcePlatform", "sourcePlatform", p));
    criteria.locationContains().ifPresent(l -> filter.add(
        "(lower(location_city) like :location escape '!' "
            + "or lower(location_state) like :location escape '!' "
            + "or lower(location_country) like :location escape '!')",
        "location", SqlFilter.containsPattern(l)));
    criteria.olderThan().ifPresent(i -> filter.add("created_at < :olderThan", "olderThan", i.toEpochMilli()));
    return jdbi.withHandle(handle ->
        filter.bind(handle.createUpdate("delete from travel_services" + filter.where())).execute());
  }

  /**
   * Delete unowned rows whose cache expiry has passed.
   *
   * @param now epoch millis
   * @return the number of rows removed
   */
  public int deleteExpiredUnowned(final long now) {
    log.trace("deleteExpiredUnowned({})", now);
    return jdbi.withHandle(handle -> handle.createUpdate(
            "delete from travel_services where trip_id is null and cache_expires_at <= :now")
        .bind("now", now)
        .execute());
  }

  /**
   * Count all rows.
   *
   * @return the long
   */
  public long count() {
    return jdbi.withHandle(handle -> handle.createQuery("select count(*) from travel_services")
        .mapTo(Long.class)
        .one());
  }

  /**
   * Count rows owned by a trip.
   *
   * @return the long
   */
  public long countOwned() {
    return jdbi.withHandle(handle -> handle.createQuery(
            "select count(*) from travel_services where trip_id is not null")
        .mapTo(Long.class)
        .one());
  }

  /**
   * Count unowned rows past their expiry.
   *
   * @param now epoch millis
   * @return the long
   */
  public long countExpiredUnowned(final long now) {
    return jdbi.withHandle(handle -> handle.createQuery(
            "select count(*) from travel_services where trip_id is null and cache_expires_at <= :now")
        .bind("now", now)
        .mapTo(Long.class)
        .one());
  }
}
