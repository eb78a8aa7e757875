package com.codeheadsystems.dbu.migration;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import org.jdbi.v3.core.Jdbi;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Advisory lock with a ttl so two deploys do not run migrations at the same time. A holder that
 * dies leaves a row that any caller may take over once it expires.
 */
public class MigrationLock {

  /**
   * The constant LOCK_NAME.
   */
  public static final String LOCK_NAME = "schema_migrations";
  private static final Logger log = LoggerFactory.getLogger(MigrationLock.class);

  private final MigrationLockDao dao;
  private final Clock clock;
  private final Duration ttl;

  /**
   * Instantiates a new Migration lock.
   *
   * @param jdbi  the jdbi
   * @param clock the clock
   * @param ttl   how long a holder keeps the lock without releasing it
   */
  public MigrationLock(final Jdbi jdbi, final Clock clock, final Duration ttl) {
    this(jdbi.onDemand(MigrationLockDao.class), clock, ttl);
  }

  /**
   * Instantiates a new Migration lock.
   *
   * @param dao   the dao
   * @param clock the clock
   * @param ttl   the ttl
   */
  public MigrationLock(final MigrationLockDao dao, final Clock clock, final Duration ttl) {
    log.info("MigrationLock({}, {})", clock, ttl);
    this.dao = dao;
    this.clock = clock;
    this.ttl = ttl;
  }

  /**
   * Try to take the lock.
   *
   * @param owner identifies the caller
   * @return true if the caller holds the lock afterwards
   */
  public boolean tryAcquire(final String owner) {
    log.trace("tryAcquire({})", owner);
    dao.createTable();
    final long now = clock.millis();
    if (dao.deleteExpired(LOCK_NAME, now)) {
      log.warn("Took over an expired migration lock");
    }
    final boolean acquired = dao.insert(LOCK_NAME, owner, now, now + ttl.toMillis());
    if (!acquired) {
      log.warn("Migration lock held by {}", dao.owner(LOCK_NAME).orElse("<unknown>"));
    }
    return acquired;
  }

  /**
   * Release the lock if the owner holds it.
   *
   * @param owner the owner
   * @return true if a lock row was removed
   */
  public boolean release(final String owner) {
    log.trace("release({})", owner);
    return dao.delete(LOCK_NAME, owner);
  }

  /**
   * Current holder.
   *
   * @return the optional
   */
  public Optional<String> holder() {
    dao.createTable();
    return dao.owner(LOCK_NAME);
  }
}
