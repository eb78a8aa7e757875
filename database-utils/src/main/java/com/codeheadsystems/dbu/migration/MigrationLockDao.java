package com.codeheadsystems.dbu.migration;

import java.util.Optional;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

/**
 * Single-row advisory lock table guarding migration runs.
 */
public interface MigrationLockDao {

  /**
   * Create table.
   */
  @SqlUpdate("CREATE TABLE IF NOT EXISTS schema_migration_lock ("
      + "lock_name TEXT PRIMARY KEY, "
      + "owner TEXT NOT NULL, "
      + "acquired_at INTEGER NOT NULL, "
      + "expires_at INTEGER NOT NULL)")
  void createTable();

  /**
   * Insert the lock row unless one already exists.
   *
   * @param lockName   the lock name
   * @param owner      the owner
   * @param acquiredAt the acquired at
   * @param expiresAt  the expires at
   * @return true if this caller now holds the lock
   */
  @SqlUpdate("insert or ignore into schema_migration_lock (lock_name, owner, acquired_at, expires_at) "
      + "values (:lockName, :owner, :acquiredAt, :expiresAt)")
  boolean insert(@Bind("lockName") String lockName,
                 @Bind("owner") String owner,
                 @Bind("acquiredAt") long acquiredAt,
                 @Bind("expiresAt") long expiresAt);

  /**
   * Remove a lock whose ttl passed.
   *
   * @param lockName the lock name
   * @param now      the now
   * @return the boolean
   */
  @SqlUpdate("delete from schema_migration_lock where lock_name = :lockName and expires_at < :now")
  boolean deleteExpired(@Bind("lockName") String lockName,
                        @Bind("now") long now);

  /**
   * Delete the lock if held by the owner.
   *
   * @param lockName the lock name
   * @param owner    the owner
   * @return the boolean
   */
  @SqlUpdate("delete from schema_migration_lock where lock_name = :lockName and owner = :owner")
  boolean delete(@Bind("lockName") String lockName,
                 @Bind("owner") String owner);

  /**
   * Current holder.
   *
   * @param lockName the lock name
   * @return the optional
   */
  @SqlQuery("select owner from schema_migration_lock where lock_name = :lockName")
  Optional<String> owner(@Bind("lockName") String lockName);
}
