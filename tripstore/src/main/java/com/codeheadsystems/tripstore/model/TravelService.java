package com.codeheadsystems.tripstore.model;

import java.time.LocalDate;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * One result of an external search: the filterable fields plus the full payload as json.
 */
@Value.Immutable
public interface TravelService {

  /**
   * Identifier assigned by the source platform.
   *
   * @return the string
   */
  String serviceId();

  /**
   * Category service category.
   *
   * @return the service category
   */
  ServiceCategory category();

  /**
   * Name string.
   *
   * @return the string
   */
  String name();

  /**
   * Description optional.
   *
   * @return the optional
   */
  Optional<String> description();

  /**
   * Base price double.
   *
   * @return the double
   */
  double basePrice();

  /**
   * Total price double.
   *
   * @return the double
   */
  double totalPrice();

  /**
   * Currency string.
   *
   * @return the string
   */
  @Value.Default
  default String currency() {
    return "USD";
  }

  /**
   * Per night, per day, per person.
   *
   * @return the optional
   */
  Optional<String> priceUnit();

  /**
   * Available boolean.
   *
   * @return the boolean
   */
  @Value.Default
  default boolean available() {
    return true;
  }

  /**
   * Start date local date.
   *
   * @return the local date
   */
  LocalDate startDate();

  /**
   * End date, empty for single-day services.
   *
   * @return the optional
   */
  Optional<LocalDate> endDate();

  Optional<String> locationCity();

  Optional<String> locationState();

  Optional<String> locationCountry();

  Optional<Double> rating();

  Optional<Integer> ratingCount();

  /**
   * Platform the result was fetched from.
   *
   * @return the string
   */
  String sourcePlatform();

  Optional<String> sourceUrl();

  Optional<String> bookingUrl();

  /**
   * Full service object as returned by the source, serialized as json.
   *
   * @return the string
   */
  @Value.Default
  default String serviceDataJson() {
    return "{}";
  }

}
