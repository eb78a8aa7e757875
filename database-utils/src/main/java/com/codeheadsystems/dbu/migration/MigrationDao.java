package com.codeheadsystems.dbu.migration;

import java.util.Set;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

/**
 * Bookkeeping for applied migrations. The table is append-only and used as a membership set.
 */
public interface MigrationDao {

  /**
   * The constant TABLE.
   */
  String TABLE = "schema_migrations";

  /**
   * Create the bookkeeping table when absent.
   */
  @SqlUpdate("CREATE TABLE IF NOT EXISTS schema_migrations ("
      + "id INTEGER PRIMARY KEY AUTOINCREMENT, "
      + "name TEXT UNIQUE NOT NULL, "
      + "applied_at INTEGER NOT NULL)")
  void createTable();

  /**
   * Names of applied migrations.
   *
   * @return the set
   */
  @SqlQuery("select name from schema_migrations")
  Set<String> appliedNames();

  /**
   * Record a migration as applied.
   *
   * @param name      the name
   * @param appliedAt epoch millis
   * @return the boolean
   */
  @SqlUpdate("insert into schema_migrations (name, applied_at) values (:name, :appliedAt)")
  boolean insert(@Bind("name") String name,
                 @Bind("appliedAt") long appliedAt);

}
