package com.codeheadsystems.tripstore.dagger;

import com.codeheadsystems.dbu.model.Database;
import com.codeheadsystems.tripstore.model.Configuration;
import dagger.Module;
import dagger.Provides;
import javax.inject.Singleton;

/**
 * The type Configuration module.
 */
@Module
public class ConfigurationModule {

  private final Configuration configuration;

  /**
   * Instantiates a new Configuration module.
   *
   * @param configuration the configuration
   */
  public ConfigurationModule(final Configuration configuration) {
    this.configuration = configuration;
  }

  /**
   * Configuration configuration.
   *
   * @return the configuration
   */
  @Provides
  @Singleton
  public Configuration configuration() {
    return configuration;
  }

  /**
   * Database database.
   *
   * @return the database
   */
  @Provides
  @Singleton
  public Database database() {
    return configuration.database();
  }
}
