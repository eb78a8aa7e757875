package com.codeheadsystems.tripstore.dao;

import com.codeheadsystems.tripstore.model.CachedService;
import com.codeheadsystems.tripstore.model.ImmutableCachedService;
import com.codeheadsystems.tripstore.model.ImmutableTravelService;
import com.codeheadsystems.tripstore.model.ServiceCategory;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.Optional;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;

/**
 * Maps a travel_services row. Category codes and dates are stored as text.
 */
public class CachedServiceRowMapper implements RowMapper<CachedService> {

  static Optional<Long> optionalLong(final ResultSet rs, final String column) throws SQLException {
    final long value = rs.getLong(column);
    return rs.wasNull() ? Optional.empty() : Optional.of(value);
  }

  static Optional<Double> optionalDouble(final ResultSet rs, final String column) throws SQLException {
    final double value = rs.getDouble(column);
    return rs.wasNull() ? Optional.empty() : Optional.of(value);
  }

  static Optional<LocalDate> optionalDate(final ResultSet rs, final String column) throws SQLException {
    return Optional.ofNullable(rs.getString(column)).map(LocalDate::parse);
  }

  @Override
  public CachedService map(final ResultSet rs, final StatementContext ctx) throws SQLException {
    final ImmutableTravelService service = ImmutableTravelService.builder()
        .serviceId(rs.getString("service_id"))
        .category(ServiceCategory.fromCode(rs.getString("service_category")))
        .name(rs.getString("service_name"))
        .description(Optional.ofNullable(rs.getString("service_description")))
        .basePrice(rs.getDouble("base_price"))
        .totalPrice(rs.getDouble("total_price"))
        .currency(rs.getString("currency"))
        .priceUnit(Optional.ofNullable(rs.getString("price_unit")))
        .available(rs.getBoolean("is_available"))
        .startDate(LocalDate.parse(rs.getString("start_date")))
        .endDate(optionalDate(rs, "end_date"))
        .locationCity(Optional.ofNullable(rs.getString("location_city")))
        .locationState(Optional.ofNullable(rs.getString("location_state")))
        .locationCountry(Optional.ofNullable(rs.getString("location_country")))
        .rating(optionalDouble(rs, "rating_overall"))
        .ratingCount(optionalLong(rs, "rating_count").map(Long::intValue))
        .sourcePlatform(rs.getString("source_platform"))
        .sourceUrl(Optional.ofNullable(rs.getString("source_url")))
        .bookingUrl(Optional.ofNullable(rs.getString("booking_url")))
        .serviceDataJson(rs.getString("service_data_json"))
        .build();
    return ImmutableCachedService.builder()
        .id(rs.getLong("id"))
        .service(service)
        .searchParamsHash(Optional.ofNullable(rs.getString("search_params_hash")))
        .tripId(optionalLong(rs, "trip_id"))
        .createdAt(rs.getLong("created_at"))
        .updatedAt(rs.getLong("updated_at"))
        .cacheExpiresAt(rs.getLong("cache_expires_at"))
        .build();
  }
}
