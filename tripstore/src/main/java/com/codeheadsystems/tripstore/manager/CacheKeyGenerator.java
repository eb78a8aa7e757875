package com.codeheadsystems.tripstore.manager;

import com.codeheadsystems.tripstore.model.Configuration;
import com.codeheadsystems.tripstore.model.SearchParameters;
import com.codeheadsystems.tripstore.model.ServiceCategory;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.apache.commons.codec.digest.DigestUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns search parameters into a short, stable cache key. Logically identical searches get the same
 * key regardless of destination casing or spacing, and fields that do not apply to the category are
 * ignored.
 */
@Singleton
public class CacheKeyGenerator {

  private static final Logger log = LoggerFactory.getLogger(CacheKeyGenerator.class);
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private final ObjectWriter writer;
  private final int keyLength;

  /**
   * Instantiates a new Cache key generator.
   *
   * @param objectMapper  the object mapper
   * @param configuration the configuration
   */
  @Inject
  public CacheKeyGenerator(final ObjectMapper objectMapper, final Configuration configuration) {
    this(objectMapper, configuration.cacheKeyLength());
  }

  /**
   * Instantiates a new Cache key generator.
   *
   * @param objectMapper the object mapper
   * @param keyLength    hex characters kept from the sha-256 digest
   */
  public CacheKeyGenerator(final ObjectMapper objectMapper, final int keyLength) {
    log.info("CacheKeyGenerator({}, {})", objectMapper, keyLength);
    this.writer = objectMapper.writer().with(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
    this.keyLength = keyLength;
  }

  static String normalize(final String value) {
    return WHITESPACE.matcher(value.trim()).replaceAll(" ").toLowerCase(Locale.ROOT);
  }

  /**
   * The canonical, sorted form of the parameters that matter for the category.
   *
   * @param category   the category
   * @param parameters the parameters
   * @return the map
   */
  public Map<String, Object> canonicalize(final ServiceCategory category, final SearchParameters parameters) {
    final TreeMap<String, Object> canonical = new TreeMap<>();
    canonical.put("category", category.code());
    canonical.put("destination", normalize(parameters.destination()));
    canonical.put("startDate", parameters.startDate().toString());
    parameters.endDate().map(LocalDate::toString).ifPresent(end -> canonical.put("endDate", end));
    canonical.put("adults", parameters.adults());
    canonical.put("children", parameters.children());
    canonical.put("rooms", parameters.rooms());
    switch (category) {
      case HOTEL:
        parameters.starRating().ifPresent(v -> canonical.put("starRating", v));
        parameters.minRating().ifPresent(v -> canonical.put("minRating", v));
        final List<String> amenities = parameters.amenities().stream()
            .map(CacheKeyGenerator::normalize)
            .filter(a -> !a.isEmpty())
            .distinct()
            .sorted()
            .collect(Collectors.toList());
        if (!amenities.isEmpty()) {
          canonical.put("amenities", amenities);
        }
        break;
      case FLIGHT:
        putNormalized(canonical, "origin", parameters.origin());
        putNormalized(canonical, "cabinClass", parameters.cabinClass());
        putNormalized(canonical, "tripType", parameters.tripType());
        break;
      case RENTAL_CAR:
        putNormalized(canonical, "pickupLocation", parameters.pickupLocation());
        putNormalized(canonical, "carClass", parameters.carClass());
        break;
      default:
        break;
    }
    return canonical;
  }

  private void putNormalized(final Map<String, Object> canonical, final String key, final Optional<String> value) {
    value.map(CacheKeyGenerator::normalize)
        .filter(v -> !v.isEmpty())
        .ifPresent(v -> canonical.put(key, v));
  }

  /**
   * Canonical json string.
   *
   * @param category   the category
   * @param parameters the parameters
   * @return the string
   */
  public String canonicalJson(final ServiceCategory category, final SearchParameters parameters) {
    final Map<String, Object> canonical = canonicalize(category, parameters);
    try {
      return writer.writeValueAsString(canonical);
    } catch (JsonProcessingException e) {
      log.error("Failed to serialize search parameters: {}", canonical, e);
      throw new IllegalStateException("Failed to serialize search parameters", e);
    }
  }

  /**
   * Generate key string.
   *
   * @param category   the category
   * @param parameters the parameters
   * @return the hex key
   */
  public String generateKey(final ServiceCategory category, final SearchParameters parameters) {
    log.trace("generateKey({}, {})", category, parameters);
    return DigestUtils.sha256Hex(canonicalJson(category, parameters)).substring(0, keyLength);
  }
}
