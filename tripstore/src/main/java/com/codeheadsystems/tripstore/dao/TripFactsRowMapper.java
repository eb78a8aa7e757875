package com.codeheadsystems.tripstore.dao;

import com.codeheadsystems.tripstore.model.ImmutableTripFacts;
import com.codeheadsystems.tripstore.model.TripFacts;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;

/**
 * Maps a trip_facts row. Traveler lists are JSON arrays.
 */
public class TripFactsRowMapper implements RowMapper<TripFacts> {

  private final StringListColumnMapper listMapper;

  /**
   * Instantiates a new Trip facts row mapper.
   *
   * @param listMapper the list mapper
   */
  public TripFactsRowMapper(final StringListColumnMapper listMapper) {
    this.listMapper = listMapper;
  }

  @Override
  public TripFacts map(final ResultSet rs, final StatementContext ctx) throws SQLException {
    return ImmutableTripFacts.builder()
        .tripId(rs.getLong("trip_id"))
        .totalNights(rs.getInt("total_nights"))
        .totalHotels(rs.getInt("total_hotels"))
        .totalActivities(rs.getInt("total_activities"))
        .totalCost(rs.getDouble("total_cost"))
        .transitMinutes(rs.getInt("transit_minutes"))
        .travelerCount(rs.getInt("traveler_count"))
        .travelerNames(listMapper.map(rs, "traveler_names", ctx))
        .travelerEmails(listMapper.map(rs, "traveler_emails", ctx))
        .primaryClientEmail(Optional.ofNullable(rs.getString("primary_client_email")))
        .primaryClientName(Optional.ofNullable(rs.getString("primary_client_name")))
        .lastComputed(rs.getLong("last_computed"))
        .version(rs.getInt("version"))
        .build();
  }
}
