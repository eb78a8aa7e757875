package com.codeheadsystems.tripstore.dao;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import org.jdbi.v3.core.mapper.ColumnMapper;
import org.jdbi.v3.core.statement.StatementContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JDBI ColumnMapper for a list of strings stored as a JSON array. Null and blank columns are empty lists.
 */
public class StringListColumnMapper implements ColumnMapper<List<String>> {

  private static final Logger log = LoggerFactory.getLogger(StringListColumnMapper.class);
  private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
  };

  private final ObjectMapper objectMapper;

  /**
   * Instantiates a new String list column mapper.
   *
   * @param objectMapper the object mapper
   */
  public StringListColumnMapper(final ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  @Override
  public List<String> map(final ResultSet rs, final int columnNumber, final StatementContext ctx)
      throws SQLException {
    final String json = rs.getString(columnNumber);
    if (json == null || json.isBlank()) {
      return List.of();
    }
    try {
      return objectMapper.readValue(json, STRING_LIST);
    } catch (JsonProcessingException e) {
      log.error("Failed to deserialize string list from JSON: {}", json, e);
      return List.of();
    }
  }

  /**
   * The column value for a list: a JSON array, or null when the list is empty.
   *
   * @param values the values
   * @return the string, null for an empty list
   */
  public String toColumn(final List<String> values) {
    if (values.isEmpty()) {
      return null;
    }
    try {
      return objectMapper.writeValueAsString(values);
    } catch (JsonProcessingException e) {
      log.error("Failed to serialize string list {}", values, e);
      throw new IllegalArgumentException("Unable to serialize " + values, e);
    }
  }
}
