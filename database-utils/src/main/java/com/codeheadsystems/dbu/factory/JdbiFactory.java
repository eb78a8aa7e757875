package com.codeheadsystems.dbu.factory;

import static org.slf4j.LoggerFactory.getLogger;

import com.codeheadsystems.dbu.model.Database;
import java.util.Properties;
import java.util.Set;
import javax.inject.Inject;
import javax.inject.Named;
import javax.inject.Singleton;
import org.jdbi.v3.cache.caffeine.CaffeineCachePlugin;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.mapper.immutables.JdbiImmutables;
import org.jdbi.v3.core.statement.Slf4JSqlLogger;
import org.jdbi.v3.sqlite3.SQLitePlugin;
import org.jdbi.v3.sqlobject.SqlObjectPlugin;
import org.slf4j.Logger;
import org.sqlite.SQLiteConfig;

/**
 * Builds the Jdbi instance for the configured store. SQLite connections get their pragmas from the
 * driver, and the SQLite plugin for its column types.
 */
@Singleton
public class JdbiFactory {

  public static final String IMMUTABLES = "JdbiImmutableClasses";
  private static final Logger log = getLogger(JdbiFactory.class);

  private final Database database;
  private final Set<Class<?>> immutableClasses;

  /**
   * Instantiates a new Jdbi factory.
   *
   * @param database         the configuration
   * @param immutableClasses the immutable classes
   */
  @Inject
  public JdbiFactory(final Database database,
                     @Named(IMMUTABLES) final Set<Class<?>> immutableClasses) {
    this.database = database;
    this.immutableClasses = immutableClasses;
    log.info("JdbiFactory({})", database);
  }

  /**
   * Create jdbi jdbi.
   *
   * @return the jdbi
   */
  public Jdbi createJdbi() {
    log.trace("createJdbi()");
    final Jdbi jdbi = database.useSqlite()
        ? Jdbi.create(database.url(), sqliteProperties())
        : Jdbi.create(database.url(), database.username(), database.password());
    setup(jdbi);
    return jdbi;
  }

  /**
   * Pragmas the driver applies to each connection it opens, since each JDBI handle gets a fresh one.
   *
   * @return the properties
   */
  Properties sqliteProperties() {
    final SQLiteConfig config = new SQLiteConfig();
    config.enforceForeignKeys(database.foreignKeys());
    config.setBusyTimeout(database.busyTimeoutMillis());
    log.info("sqliteProperties(foreignKeys={}, busyTimeout={})", database.foreignKeys(), database.busyTimeoutMillis());
    return config.toProperties();
  }

  /**
   * Setup so it can be used even if we do not create the JDBI resource.
   *
   * @param jdbi the jdbi
   */
  public void setup(final Jdbi jdbi) {
    log.info("setup({})", jdbi);
    final JdbiImmutables immutablesConfig = jdbi.getConfig(JdbiImmutables.class);
    immutableClasses.forEach(immutablesConfig::registerImmutable);
    jdbi.installPlugin(new SqlObjectPlugin())
        .installPlugin(new CaffeineCachePlugin());
    if (database.useSqlite()) {
      jdbi.installPlugin(new SQLitePlugin());
    }
    jdbi.setSqlLogger(new Slf4JSqlLogger());
  }
}
