package com.codeheadsystems.dbu.migration;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.JdbiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies pending migrations from a {@link MigrationRegistry}, one statement per round trip.
 *
 * <p>The store offers no multi-statement transaction, so nothing is rolled back: a failing
 * statement stops the run, earlier statements of that migration stay applied, and the migration is
 * not recorded. Re-running retries the whole migration from its first statement, which is safe as
 * long as its statements are written to be re-runnable ({@code IF NOT EXISTS} and friends).
 */
public class MigrationRunner {

  private static final Logger log = LoggerFactory.getLogger(MigrationRunner.class);

  private final Jdbi jdbi;
  private final MigrationRegistry registry;
  private final StatementSplitter splitter;
  private final Clock clock;
  private final Optional<MigrationLock> lock;
  private final MigrationDao migrationDao;

  /**
   * Instantiates a new Migration runner without an advisory lock.
   *
   * @param jdbi     the jdbi
   * @param registry the registry
   * @param splitter the splitter
   * @param clock    the clock
   */
  public MigrationRunner(final Jdbi jdbi,
                         final MigrationRegistry registry,
                         final StatementSplitter splitter,
                         final Clock clock) {
    this(jdbi, registry, splitter, clock, Optional.empty());
  }

  /**
   * Instantiates a new Migration runner.
   *
   * @param jdbi     the jdbi
   * @param registry the registry
   * @param splitter the splitter
   * @param clock    the clock
   * @param lock     taken for the duration of {@link #applyPending()} when present
   */
  public MigrationRunner(final Jdbi jdbi,
                         final MigrationRegistry registry,
                         final StatementSplitter splitter,
                         final Clock clock,
                         final Optional<MigrationLock> lock) {
    log.info("MigrationRunner({}, {}, {}, {})", jdbi, registry, clock, lock.isPresent());
    this.jdbi = jdbi;
    this.registry = registry;
    this.splitter = splitter;
    this.clock = clock;
    this.lock = lock;
    this.migrationDao = jdbi.onDemand(MigrationDao.class);
  }

  /**
   * Create the bookkeeping table if it is absent. No-op otherwise.
   */
  public void ensureBookkeeping() {
    log.trace("ensureBookkeeping()");
    migrationDao.createTable();
  }

  /**
   * Names of migrations already applied. An absent bookkeeping table means nothing is applied yet.
   *
   * @return the set
   * @throws MigrationException if the table exists but cannot be read
   */
  public Set<String> listApplied() {
    log.trace("listApplied()");
    if (!bookkeepingTableExists()) {
      log.info("No {} table yet, treating as a fresh store", MigrationDao.TABLE);
      return Set.of();
    }
    try {
      return Set.copyOf(migrationDao.appliedNames());
    } catch (JdbiException e) {
      log.error("Unable to read applied migrations", e);
      throw new MigrationException("Unable to read " + MigrationDao.TABLE + ": " + e.getMessage());
    }
  }

  /**
   * Registered migrations not yet applied, in registry order.
   *
   * @return the list
   */
  public List<String> listPending() {
    log.trace("listPending()");
    final Set<String> applied = listApplied();
    final List<String> pending = new ArrayList<>();
    for (String name : registry.names()) {
      if (!applied.contains(name)) {
        pending.add(name);
      }
    }
    return pending;
  }

  /**
   * Apply every pending migration in registry order.
   *
   * @return the names applied by this call, empty when already up to date
   * @throws MigrationException on the first failing statement, or if the lock is held elsewhere
   */
  public List<String> applyPending() {
    log.trace("applyPending()");
    final String owner = "migration-runner-" + UUID.randomUUID();
    if (lock.isPresent() && !lock.get().tryAcquire(owner)) {
      throw new MigrationException("Migration lock is held by "
          + lock.get().holder().orElse("another runner"));
    }
    try {
      ensureBookkeeping();
      final Set<String> applied = listApplied();
      log.info("Applied migrations: {}, registered: {}", applied.size(), registry.size());
      final List<String> did = new ArrayList<>();
      for (Migration migration : registry.migrations()) {
        if (applied.contains(migration.name())) {
          log.debug("Migration {} already applied, skipping", migration.name());
          continue;
        }
        apply(migration);
        did.add(migration.name());
      }
      if (did.isEmpty()) {
        log.info("Schema is up to date");
      }
      return did;
    } finally {
      lock.ifPresent(l -> l.release(owner));
    }
  }

  private void apply(final Migration migration) {
    final List<String> statements = splitter.split(migration.sql());
    log.info("Applying migration {} ({} statements)", migration.name(), statements.size());
    jdbi.useHandle(handle -> {
      for (String statement : statements) {
        execute(handle, migration, statement);
      }
    });
    migrationDao.insert(migration.name(), clock.millis());
    log.info("Applied migration {}", migration.name());
  }

  private void execute(final Handle handle, final Migration migration, final String statement) {
    log.debug("Executing: {}...", MigrationException.abbreviate(statement));
    try (Statement jdbcStatement = handle.getConnection().createStatement()) {
      jdbcStatement.execute(statement);
    } catch (SQLException e) {
      log.error("Migration {} failed on statement: {}", migration.name(), statement, e);
      throw new MigrationException(migration.name(), statement, e);
    }
  }

  private boolean bookkeepingTableExists() {
    try {
      return jdbi.withHandle(handle -> {
        final Connection connection = handle.getConnection();
        final DatabaseMetaData metaData = connection.getMetaData();
        try (ResultSet tables = metaData.getTables(null, null, MigrationDao.TABLE, null)) {
          return tables.next();
        }
      });
    } catch (JdbiException | SQLException e) {
      log.warn("Unable to check for {}, assuming none: {}", MigrationDao.TABLE, e.getMessage());
      return false;
    }
  }
}
