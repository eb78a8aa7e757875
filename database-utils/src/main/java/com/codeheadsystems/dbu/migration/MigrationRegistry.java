package com.codeheadsystems.dbu.migration;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered, immutable catalog of migrations. Built once at startup and handed to the
 * {@link MigrationRunner}. Registration order is apply order; names are never re-sorted.
 * Entries may be appended in later releases but existing ones are never edited or reordered.
 */
public final class MigrationRegistry {

  private final Map<String, Migration> migrations;

  private MigrationRegistry(final Map<String, Migration> migrations) {
    this.migrations = migrations;
  }

  /**
   * Builder builder.
   *
   * @return the builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Migrations in apply order.
   *
   * @return the list
   */
  public List<Migration> migrations() {
    return List.copyOf(migrations.values());
  }

  /**
   * Names in apply order.
   *
   * @return the list
   */
  public List<String> names() {
    return List.copyOf(migrations.keySet());
  }

  /**
   * Find a migration by name.
   *
   * @param name the name
   * @return the migration
   */
  public Optional<Migration> get(final String name) {
    return Optional.ofNullable(migrations.get(name));
  }

  /**
   * Size int.
   *
   * @return the int
   */
  public int size() {
    return migrations.size();
  }

  @Override
  public String toString() {
    return "MigrationRegistry" + migrations.keySet();
  }

  /**
   * Collects migrations in the order they are added.
   */
  public static final class Builder {

    private final List<Migration> entries = new ArrayList<>();

    private Builder() {
    }

    /**
     * Add builder.
     *
     * @param name the name
     * @param sql  the sql
     * @return the builder
     */
    public Builder add(final String name, final String sql) {
      return add(ImmutableMigration.of(name, sql));
    }

    /**
     * Add builder.
     *
     * @param migration the migration
     * @return the builder
     */
    public Builder add(final Migration migration) {
      entries.add(migration);
      return this;
    }

    /**
     * Build migration registry.
     *
     * @return the migration registry
     * @throws IllegalArgumentException if two migrations share a name
     */
    public MigrationRegistry build() {
      final Map<String, Migration> ordered = new LinkedHashMap<>();
      for (Migration migration : entries) {
        if (ordered.putIfAbsent(migration.name(), migration) != null) {
          throw new IllegalArgumentException("Duplicate migration name: " + migration.name());
        }
      }
      return new MigrationRegistry(ordered);
    }
  }
}
