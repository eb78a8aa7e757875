package com.codeheadsystems.tripstore.dagger;

import com.codeheadsystems.dbu.factory.JdbiFactory;
import com.codeheadsystems.dbu.migration.MigrationLock;
import com.codeheadsystems.dbu.migration.MigrationRegistry;
import com.codeheadsystems.dbu.migration.MigrationRunner;
import com.codeheadsystems.dbu.migration.StatementSplitter;
import com.codeheadsystems.tripstore.dao.FactsDirtyDao;
import com.codeheadsystems.tripstore.dao.StringListColumnMapper;
import com.codeheadsystems.tripstore.dao.TripFactsDao;
import com.codeheadsystems.tripstore.dao.TripFactsRowMapper;
import com.codeheadsystems.tripstore.migration.TripStoreMigrations;
import com.codeheadsystems.tripstore.model.Configuration;
import com.codeheadsystems.tripstore.model.DirtyEntry;
import com.codeheadsystems.tripstore.model.TripFacts;
import com.fasterxml.jackson.databind.ObjectMapper;
import dagger.Module;
import dagger.Provides;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import javax.inject.Named;
import javax.inject.Singleton;
import org.jdbi.v3.core.Jdbi;

/**
 * The type Trip store module.
 */
@Module
public class TripStoreModule {

  /**
   * Instantiates a new Trip store module.
   */
  public TripStoreModule() {
    // Default constructor
  }

  /**
   * Registers the row mappers for types JdbiImmutables cannot build on its own.
   *
   * @param jdbi       the jdbi
   * @param listMapper the list mapper
   */
  public static void registerMappers(final Jdbi jdbi, final StringListColumnMapper listMapper) {
    jdbi.registerRowMapper(TripFacts.class, new TripFactsRowMapper(listMapper));
  }

  /**
   * Jdbi, with pending migrations applied when configured to.
   *
   * @param factory       the factory
   * @param configuration the configuration
   * @param registry      the registry
   * @param splitter      the splitter
   * @param clock         the clock
   * @param listMapper    the list mapper
   * @return the jdbi
   */
  @Provides
  @Singleton
  public Jdbi jdbi(final JdbiFactory factory,
                   final Configuration configuration,
                   final MigrationRegistry registry,
                   final StatementSplitter splitter,
                   final Clock clock,
                   final StringListColumnMapper listMapper) {
    final Jdbi jdbi = factory.createJdbi();
    registerMappers(jdbi, listMapper);
    if (configuration.runMigrations()) {
      migrationRunner(jdbi, configuration, registry, splitter, clock).applyPending();
    }
    return jdbi;
  }

  /**
   * Migration runner.
   *
   * @param jdbi          the jdbi
   * @param configuration the configuration
   * @param registry      the registry
   * @param splitter      the splitter
   * @param clock         the clock
   * @return the migration runner
   */
  @Provides
  @Singleton
  public MigrationRunner migrationRunner(final Jdbi jdbi,
                                         final Configuration configuration,
                                         final MigrationRegistry registry,
                                         final StatementSplitter splitter,
                                         final Clock clock) {
    final Optional<MigrationLock> lock = configuration.useMigrationLock()
        ? Optional.of(new MigrationLock(jdbi, clock, Duration.ofSeconds(configuration.migrationLockTtlSeconds())))
        : Optional.empty();
    return new MigrationRunner(jdbi, registry, splitter, clock, lock);
  }

  /**
   * Clock, in UTC. Every stored timestamp is epoch millis from it.
   *
   * @return the clock
   */
  @Provides
  @Singleton
  public Clock clock() {
    return Clock.systemUTC();
  }

  /**
   * Migration registry.
   *
   * @return the migration registry
   */
  @Provides
  @Singleton
  public MigrationRegistry migrationRegistry() {
    return TripStoreMigrations.registry();
  }

  /**
   * Immutable classes set.
   *
   * @return the set
   */
  @Provides
  @Singleton
  @Named(JdbiFactory.IMMUTABLES)
  public Set<Class<?>> immutableClasses() {
    return Set.of(DirtyEntry.class);
  }

  /**
   * Object mapper for JSON serialization.
   *
   * @return the object mapper
   */
  @Provides
  @Singleton
  public ObjectMapper objectMapper() {
    return new ObjectMapper();
  }

  /**
   * Mapper for JSON string list columns.
   *
   * @param objectMapper the object mapper
   * @return the string list column mapper
   */
  @Provides
  @Singleton
  public StringListColumnMapper stringListColumnMapper(final ObjectMapper objectMapper) {
    return new StringListColumnMapper(objectMapper);
  }

  /**
   * Facts dirty dao.
   *
   * @param jdbi the jdbi
   * @return the facts dirty dao
   */
  @Provides
  @Singleton
  public FactsDirtyDao factsDirtyDao(final Jdbi jdbi) {
    return jdbi.onDemand(FactsDirtyDao.class);
  }

  /**
   * Trip facts dao.
   *
   * @param jdbi the jdbi
   * @return the trip facts dao
   */
  @Provides
  @Singleton
  public TripFactsDao tripFactsDao(final Jdbi jdbi) {
    return jdbi.onDemand(TripFactsDao.class);
  }
}
