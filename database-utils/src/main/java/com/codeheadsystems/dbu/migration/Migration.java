package com.codeheadsystems.dbu.migration;

import org.immutables.value.Value;

/**
 * A named unit of schema evolution. Once published, neither the name nor the text may change.
 */
@Value.Immutable
public interface Migration {

  /**
   * Unique name. Numeric prefixes are for humans; the registry order is what counts.
   *
   * @return the name
   */
  @Value.Parameter
  String name();

  /**
   * Raw schema-definition text, possibly holding many statements.
   *
   * @return the sql
   */
  @Value.Parameter
  @Value.Redacted
  String sql();

  /**
   * Validate.
   */
  @Value.Check
  default void validate() {
    if (name().isBlank()) {
      throw new IllegalArgumentException("Migration name must not be blank");
    }
  }

}
