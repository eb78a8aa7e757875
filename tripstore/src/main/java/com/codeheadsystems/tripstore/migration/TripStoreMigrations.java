package com.codeheadsystems.tripstore.migration;

import com.codeheadsystems.dbu.migration.MigrationRegistry;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The schema history of the trip store. Append new names at the end; never edit or reorder
 * existing ones, since stores that already applied them will not run them again.
 */
public final class TripStoreMigrations {

  /**
   * Classpath folder holding the migration files.
   */
  public static final String RESOURCE_PATH = "migrations/";

  /**
   * Migration names in apply order. Each maps to {@code migrations/<name>.sql}.
   */
  public static final List<String> NAMES = List.of(
      "001_core_trip_tables",
      "002_trip_facts_system",
      "003_travel_services_core",
      "004_travel_services_triggers",
      "005_facts_dirty_indexes"
  );

  private static final Logger log = LoggerFactory.getLogger(TripStoreMigrations.class);

  private TripStoreMigrations() {
  }

  /**
   * Registry of every trip store migration.
   *
   * @return the migration registry
   */
  public static MigrationRegistry registry() {
    final MigrationRegistry.Builder builder = MigrationRegistry.builder();
    for (String name : NAMES) {
      builder.add(name, load(name));
    }
    final MigrationRegistry registry = builder.build();
    log.debug("Loaded {}", registry);
    return registry;
  }

  /**
   * Read one migration file from the classpath.
   *
   * @param name the migration name
   * @return the sql text
   */
  static String load(final String name) {
    final String resource = RESOURCE_PATH + name + ".sql";
    try (InputStream stream = TripStoreMigrations.class.getClassLoader().getResourceAsStream(resource)) {
      if (stream == null) {
        throw new IllegalStateException("Missing migration resource: " + resource);
      }
      return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to read " + resource, e);
    }
  }
}
