package com.codeheadsystems.dbu.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

/**
 * Connection settings for the backing relational store.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableDatabase.class)
@JsonDeserialize(builder = ImmutableDatabase.Builder.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface Database {

  /**
   * Jdbc url, e.g. {@code jdbc:sqlite:/var/lib/tripstore/trips.db}.
   *
   * @return the string
   */
  String url();

  /**
   * Database username string. SQLite ignores it.
   *
   * @return the string
   */
  @Value.Default
  default String username() {
    return "";
  }

  /**
   * Database password string.
   *
   * @return the string
   */
  @Value.Redacted
  @Value.Default
  default String password() {
    return "";
  }

  /**
   * Enforce foreign keys on every SQLite connection. SQLite leaves them off unless asked.
   *
   * @return the boolean
   */
  @Value.Default
  default boolean foreignKeys() {
    return true;
  }

  /**
   * How long a SQLite connection waits on a locked database before failing.
   *
   * @return the int
   */
  @Value.Default
  default int busyTimeoutMillis() {
    return 5000;
  }

  /**
   * Use sqlite boolean.
   *
   * @return the boolean
   */
  @Value.Derived
  default boolean useSqlite() {
    return url().startsWith("jdbc:sqlite");
  }

}
