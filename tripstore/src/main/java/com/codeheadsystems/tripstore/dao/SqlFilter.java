package com.codeheadsystems.tripstore.dao;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.jdbi.v3.core.statement.SqlStatement;

/**
 * Collects AND-ed where clauses and their bindings for the dynamic delete statements.
 */
class SqlFilter {

  private final List<String> clauses = new ArrayList<>();
  private final Map<String, Object> bindings = new HashMap<>();

  /**
   * Escape the LIKE wildcards in a user supplied fragment, using {@code !} as the escape character,
   * and wrap it for a contains match.
   */
  static String containsPattern(final String fragment) {
    final String escaped = fragment.toLowerCase(Locale.ROOT)
        .replace("!", "!!")
        .replace("%", "!%")
        .replace("_", "!_");
    return "%" + escaped + "%";
  }

  SqlFilter add(final String clause) {
    clauses.add(clause);
    return this;
  }

  SqlFilter add(final String clause, final String name, final Object value) {
    clauses.add(clause);
    bindings.put(name, value);
    return this;
  }

  String where() {
    return clauses.isEmpty() ? "" : " where " + String.join(" and ", clauses);
  }

  <T extends SqlStatement<T>> T bind(final T statement) {
    return statement.bindMap(bindings);
  }

  @Override
  public String toString() {
    return where() + " " + bindings;
  }
}
