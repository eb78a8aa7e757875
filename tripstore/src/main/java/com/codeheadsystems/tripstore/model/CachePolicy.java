package com.codeheadsystems.tripstore.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.time.Duration;
import org.immutables.value.Value;

/**
 * How long a cached search stays valid, and how long before expiry it asks to be refreshed.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableCachePolicy.class)
@JsonDeserialize(builder = ImmutableCachePolicy.Builder.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface CachePolicy {

  /**
   * Of cache policy.
   *
   * @param ttl              the ttl
   * @param refreshThreshold the refresh threshold
   * @return the cache policy
   */
  static CachePolicy of(final Duration ttl, final Duration refreshThreshold) {
    return ImmutableCachePolicy.builder()
        .ttlMinutes(ttl.toMinutes())
        .refreshThresholdMinutes(refreshThreshold.toMinutes())
        .build();
  }

  /**
   * Ttl minutes long.
   *
   * @return the long
   */
  long ttlMinutes();

  /**
   * Lead time before expiry during which hits are flagged for refresh.
   *
   * @return the long
   */
  long refreshThresholdMinutes();

  /**
   * Ttl duration.
   *
   * @return the duration
   */
  default Duration ttl() {
    return Duration.ofMinutes(ttlMinutes());
  }

  /**
   * Refresh threshold duration.
   *
   * @return the duration
   */
  default Duration refreshThreshold() {
    return Duration.ofMinutes(refreshThresholdMinutes());
  }

  /**
   * Age after which a still-valid entry should be refreshed.
   *
   * @return the duration
   */
  default Duration refreshAfter() {
    return ttl().minus(refreshThreshold());
  }

  /**
   * Validate.
   */
  @Value.Check
  default void validate() {
    if (ttlMinutes() <= 0) {
      throw new IllegalArgumentException("ttlMinutes must be positive: " + ttlMinutes());
    }
    if (refreshThresholdMinutes() < 0 || refreshThresholdMinutes() >= ttlMinutes()) {
      throw new IllegalArgumentException("refreshThresholdMinutes must be in [0, ttlMinutes): "
          + refreshThresholdMinutes());
    }
  }
}
