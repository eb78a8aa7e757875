package com.codeheadsystems.tripstore.model;

import java.util.Arrays;
import java.util.Locale;

/**
 * Kinds of travel service that can be searched and cached. The code is what the store keeps.
 */
public enum ServiceCategory {

  HOTEL("hotel"),
  FLIGHT("flight"),
  RENTAL_CAR("rental_car"),
  TRANSFER("transfer"),
  EXCURSION("excursion"),
  PACKAGE("package");

  private final String code;

  ServiceCategory(final String code) {
    this.code = code;
  }

  /**
   * From code service category.
   *
   * @param code the stored code, case insensitive
   * @return the service category
   * @throws IllegalArgumentException for an unknown code
   */
  public static ServiceCategory fromCode(final String code) {
    if (code == null) {
      throw new IllegalArgumentException("Service category code is null");
    }
    final String normalized = code.trim().toLowerCase(Locale.ROOT);
    return Arrays.stream(values())
        .filter(category -> category.code.equals(normalized))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown service category: " + code));
  }

  /**
   * Code string.
   *
   * @return the string
   */
  public String code() {
    return code;
  }
}
