package com.codeheadsystems.tripstore.dao;

import com.codeheadsystems.tripstore.model.CacheIndexEntry;
import com.codeheadsystems.tripstore.model.ImmutableCacheIndexEntry;
import com.codeheadsystems.tripstore.model.ServiceCategory;
import java.sql.ResultSet;
import java.sql.SQLException;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;

/**
 * Maps a travel_search_cache row.
 */
public class CacheIndexEntryRowMapper implements RowMapper<CacheIndexEntry> {

  @Override
  public CacheIndexEntry map(final ResultSet rs, final StatementContext ctx) throws SQLException {
    return ImmutableCacheIndexEntry.builder()
        .id(rs.getLong("id"))
        .searchParamsHash(rs.getString("search_params_hash"))
        .category(ServiceCategory.fromCode(rs.getString("service_category")))
        .searchParamsJson(rs.getString("search_params_json"))
        .resultCount(rs.getInt("result_count"))
        .searchDurationMs(CachedServiceRowMapper.optionalLong(rs, "search_duration_ms"))
        .sourcePlatform(rs.getString("source_platform"))
        .createdAt(rs.getLong("created_at"))
        .expiresAt(rs.getLong("expires_at"))
        .lastAccessed(rs.getLong("last_accessed"))
        .accessCount(rs.getInt("access_count"))
        .build();
  }
}
