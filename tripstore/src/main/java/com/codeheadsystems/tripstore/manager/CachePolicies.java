package com.codeheadsystems.tripstore.manager;

import com.codeheadsystems.tripstore.model.CachePolicy;
import com.codeheadsystems.tripstore.model.Configuration;
import com.codeheadsystems.tripstore.model.ServiceCategory;
import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cache policy per service category. Accommodation prices move slowly so hotels keep results for a
 * day; flights change by the hour.
 */
@Singleton
public class CachePolicies {

  /**
   * Policies used when the configuration does not override a category.
   */
  public static final Map<ServiceCategory, CachePolicy> DEFAULTS = Collections.unmodifiableMap(defaults());

  private static final Logger log = LoggerFactory.getLogger(CachePolicies.class);

  private final Map<ServiceCategory, CachePolicy> policies;

  /**
   * Instantiates a new Cache policies.
   *
   * @param configuration the configuration
   */
  @Inject
  public CachePolicies(final Configuration configuration) {
    this(overrides(configuration.cachePolicies()));
  }

  /**
   * Instantiates a new Cache policies.
   *
   * @param overrides replace the defaults for their categories
   */
  public CachePolicies(final Map<ServiceCategory, CachePolicy> overrides) {
    final EnumMap<ServiceCategory, CachePolicy> merged = new EnumMap<>(DEFAULTS);
    merged.putAll(overrides);
    this.policies = Collections.unmodifiableMap(merged);
    log.info("CachePolicies({})", policies);
  }

  private static EnumMap<ServiceCategory, CachePolicy> defaults() {
    final EnumMap<ServiceCategory, CachePolicy> map = new EnumMap<>(ServiceCategory.class);
    map.put(ServiceCategory.HOTEL, CachePolicy.of(Duration.ofHours(24), Duration.ofHours(4)));
    map.put(ServiceCategory.PACKAGE, CachePolicy.of(Duration.ofHours(12), Duration.ofHours(2)));
    map.put(ServiceCategory.EXCURSION, CachePolicy.of(Duration.ofHours(12), Duration.ofHours(2)));
    map.put(ServiceCategory.TRANSFER, CachePolicy.of(Duration.ofHours(12), Duration.ofHours(2)));
    map.put(ServiceCategory.RENTAL_CAR, CachePolicy.of(Duration.ofHours(6), Duration.ofHours(1)));
    map.put(ServiceCategory.FLIGHT, CachePolicy.of(Duration.ofHours(2), Duration.ofMinutes(30)));
    return map;
  }

  private static Map<ServiceCategory, CachePolicy> overrides(final Map<String, CachePolicy> byCode) {
    final EnumMap<ServiceCategory, CachePolicy> map = new EnumMap<>(ServiceCategory.class);
    byCode.forEach((code, policy) -> map.put(ServiceCategory.fromCode(code), policy));
    return map;
  }

  /**
   * Policy for cache policy.
   *
   * @param category the category
   * @return the cache policy
   */
  public CachePolicy policyFor(final ServiceCategory category) {
    return policies.get(category);
  }

  /**
   * All policies.
   *
   * @return the map
   */
  public Map<ServiceCategory, CachePolicy> policies() {
    return policies;
  }
}
