package com.codeheadsystems.tripstore.model;

import com.codeheadsystems.dbu.model.Database;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.Map;
import org.immutables.value.Value;

/**
 * The interface Trip store configuration.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableConfiguration.class)
@JsonDeserialize(builder = ImmutableConfiguration.Builder.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface Configuration {

  /**
   * Database database.
   *
   * @return the database
   */
  Database database();

  /**
   * Apply pending migrations when the Jdbi instance is created.
   *
   * @return the boolean
   */
  @Value.Default
  default boolean runMigrations() {
    return true;
  }

  /**
   * Take the advisory migration lock around migration runs.
   *
   * @return the boolean
   */
  @Value.Default
  default boolean useMigrationLock() {
    return false;
  }

  /**
   * Migration lock ttl seconds.
   *
   * @return the long
   */
  @Value.Default
  default long migrationLockTtlSeconds() {
    return 300;
  }

  /**
   * Number of hex characters kept from the search parameter digest.
   *
   * @return the int
   */
  @Value.Default
  default int cacheKeyLength() {
    return 16;
  }

  /**
   * Cache sweep interval seconds.
   *
   * @return the long
   */
  @Value.Default
  default long cacheSweepIntervalSeconds() {
    return 3600;
  }

  /**
   * Unconsumed dirty entries older than this are dropped by the sweep. Only the scheduled sweep
   * reads this setting; the fallback sweep trigger {@code trg_travel_search_cache_sweep} is fixed at
   * seven days, the default here, and still drops entries past that age when this is set longer.
   *
   * @return the long
   */
  @Value.Default
  default long dirtyRetentionHours() {
    return 168;
  }

  /**
   * Facts refresh batch size.
   *
   * @return the int
   */
  @Value.Default
  default int factsRefreshBatchSize() {
    return 50;
  }

  /**
   * Cache policy overrides keyed by service category code, e.g. {@code rental_car}.
   *
   * @return the map
   */
  Map<String, CachePolicy> cachePolicies();

  /**
   * Validate.
   */
  @Value.Check
  default void validate() {
    if (cacheKeyLength() < 8 || cacheKeyLength() > 64) {
      throw new IllegalArgumentException("cacheKeyLength must be between 8 and 64: " + cacheKeyLength());
    }
    cachePolicies().keySet().forEach(ServiceCategory::fromCode);
  }
}
