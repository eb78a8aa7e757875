package com.codeheadsystems.tripstore.dagger;

import com.codeheadsystems.dbu.migration.MigrationRunner;
import com.codeheadsystems.tripstore.dao.TripDao;
import com.codeheadsystems.tripstore.manager.CacheManager;
import com.codeheadsystems.tripstore.manager.DirtyTracker;
import com.codeheadsystems.tripstore.manager.FactTableManager;
import com.codeheadsystems.tripstore.model.Configuration;
import com.codeheadsystems.tripstore.service.CacheSweepService;
import dagger.Component;
import javax.inject.Singleton;
import org.jdbi.v3.core.Jdbi;

/**
 * The interface Trip store component.
 */
@Singleton
@Component(modules = {TripStoreModule.class, ConfigurationModule.class})
public interface TripStoreComponent {

  /**
   * Instance trip store component.
   *
   * @param configuration the configuration
   * @return the trip store component
   */
  static TripStoreComponent instance(final Configuration configuration) {
    return DaggerTripStoreComponent.builder().configurationModule(new ConfigurationModule(configuration)).build();
  }

  /**
   * Cache manager.
   *
   * @return the cache manager
   */
  CacheManager cacheManager();

  /**
   * Fact table manager.
   *
   * @return the fact table manager
   */
  FactTableManager factTableManager();

  /**
   * Dirty tracker.
   *
   * @return the dirty tracker
   */
  DirtyTracker dirtyTracker();

  /**
   * Cache sweep service.
   *
   * @return the cache sweep service
   */
  CacheSweepService cacheSweepService();

  /**
   * Trip dao.
   *
   * @return the trip dao
   */
  TripDao tripDao();

  /**
   * Migration runner.
   *
   * @return the migration runner
   */
  MigrationRunner migrationRunner();

  /**
   * Jdbi.
   *
   * @return the jdbi
   */
  Jdbi jdbi();
}
