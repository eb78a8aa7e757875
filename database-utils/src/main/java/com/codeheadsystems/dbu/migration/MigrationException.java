package com.codeheadsystems.dbu.migration;

import java.util.Optional;

/**
 * Raised when a migration cannot be applied. The migration is not recorded as applied.
 */
public class MigrationException extends RuntimeException {

  /**
   * Longest statement prefix kept for diagnostics.
   */
  public static final int STATEMENT_PREFIX_LENGTH = 100;

  private final String migrationName;
  private final String statement;

  /**
   * Instantiates a new Migration exception.
   *
   * @param migrationName the migration name
   * @param statement     the failing statement, may be null
   * @param cause         the cause
   */
  public MigrationException(final String migrationName, final String statement, final Throwable cause) {
    super(message(migrationName, statement, cause), cause);
    this.migrationName = migrationName;
    this.statement = statement == null ? null : abbreviate(statement);
  }

  /**
   * Instantiates a new Migration exception without a statement.
   *
   * @param message the message
   */
  public MigrationException(final String message) {
    super(message);
    this.migrationName = null;
    this.statement = null;
  }

  /**
   * Abbreviate a statement for logs and error messages: single line, at most 100 characters.
   *
   * @param statement the statement
   * @return the string
   */
  public static String abbreviate(final String statement) {
    final String flat = statement.replaceAll("\\s+", " ").trim();
    return flat.length() <= STATEMENT_PREFIX_LENGTH ? flat : flat.substring(0, STATEMENT_PREFIX_LENGTH);
  }

  private static String message(final String migrationName, final String statement, final Throwable cause) {
    final StringBuilder sb = new StringBuilder("Migration ").append(migrationName).append(" failed");
    if (statement != null) {
      sb.append(" at statement [").append(abbreviate(statement)).append(']');
    }
    if (cause != null && cause.getMessage() != null) {
      sb.append(": ").append(cause.getMessage());
    }
    return sb.toString();
  }

  /**
   * Migration name optional.
   *
   * @return the optional
   */
  public Optional<String> migrationName() {
    return Optional.ofNullable(migrationName);
  }

  /**
   * First characters of the failing statement.
   *
   * @return the optional
   */
  public Optional<String> statement() {
    return Optional.ofNullable(statement);
  }
}
