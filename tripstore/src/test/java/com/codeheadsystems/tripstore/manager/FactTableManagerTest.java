package com.codeheadsystems.tripstore.manager;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.codeheadsystems.dbu.model.ImmutableDatabase;
import com.codeheadsystems.tripstore.dao.FactsDirtyDao;
import com.codeheadsystems.tripstore.dao.StringListColumnMapper;
import com.codeheadsystems.tripstore.dao.TripFactsDao;
import com.codeheadsystems.tripstore.model.ImmutableConfiguration;
import com.codeheadsystems.tripstore.model.ImmutableTravelerRoster;
import com.codeheadsystems.tripstore.model.ImmutableTripFacts;
import com.codeheadsystems.tripstore.model.TripFacts;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;
import org.jdbi.v3.core.ConnectionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class FactTableManagerTest {

  private static final Instant NOW = Instant.parse("2025-12-30T12:00:00Z");
  private static final long NOW_MILLIS = NOW.toEpochMilli();

  @Mock private FactsDirtyDao factsDirtyDao;
  @Mock private TripFactsDao tripFactsDao;
  @Mock private TravelerRosters travelerRosters;

  private FactTableManager manager;

  @BeforeEach
  void setup() {
    manager = new FactTableManager(factsDirtyDao, tripFactsDao, travelerRosters,
        new StringListColumnMapper(new ObjectMapper()), Clock.fixed(NOW, ZoneId.of("UTC")),
        ImmutableConfiguration.builder()
            .database(ImmutableDatabase.builder().url("jdbc:sqlite:/tmp/unused.db").build())
            .factsRefreshBatchSize(7)
            .build());
  }

  private TripFacts facts(final long tripId) {
    return ImmutableTripFacts.builder()
        .tripId(tripId)
        .totalNights(3)
        .totalHotels(1)
        .totalActivities(2)
        .totalCost(10.0)
        .transitMinutes(0)
        .travelerCount(0)
        .lastComputed(NOW_MILLIS)
        .version(1)
        .build();
  }

  private void noTravelers(final long tripId) {
    when(travelerRosters.forTrip(tripId)).thenReturn(ImmutableTravelerRoster.builder().build());
  }

  @Test
  void refreshDirty_usesConfiguredBatchSize() {
    when(factsDirtyDao.dirtyTripIds(7)).thenReturn(List.of());

    assertThat(manager.refreshDirty()).isZero();
  }

  @Test
  void refreshDirty_consumesOnlyEntriesSeenBeforeRecompute() {
    when(factsDirtyDao.dirtyTripIds(10)).thenReturn(List.of(4L));
    when(factsDirtyDao.latestId(4L)).thenReturn(Optional.of(55L));
    noTravelers(4L);
    when(tripFactsDao.recompute(4L, NOW_MILLIS, 0, null, null, null, null)).thenReturn(true);
    when(tripFactsDao.get(4L)).thenReturn(Optional.of(facts(4L)));

    assertThat(manager.refreshDirty(10)).isEqualTo(1);

    final InOrder order = inOrder(factsDirtyDao, tripFactsDao);
    order.verify(factsDirtyDao).latestId(4L);
    order.verify(tripFactsDao).recompute(4L, NOW_MILLIS, 0, null, null, null, null);
    order.verify(factsDirtyDao).deleteThrough(4L, 55L);
  }

  @Test
  void refreshDirty_failedTripMovesToTheBackOfTheQueue() {
    when(factsDirtyDao.dirtyTripIds(10)).thenReturn(List.of(1L, 2L));
    when(factsDirtyDao.latestId(1L)).thenReturn(Optional.of(5L));
    when(factsDirtyDao.latestId(2L)).thenReturn(Optional.of(6L));
    noTravelers(1L);
    noTravelers(2L);
    when(tripFactsDao.recompute(1L, NOW_MILLIS, 0, null, null, null, null))
        .thenThrow(new ConnectionException(new SQLException("busy")));
    when(tripFactsDao.recompute(2L, NOW_MILLIS, 0, null, null, null, null)).thenReturn(true);
    when(tripFactsDao.get(2L)).thenReturn(Optional.of(facts(2L)));

    assertThat(manager.refreshDirty(10)).isEqualTo(1);

    final InOrder order = inOrder(factsDirtyDao);
    order.verify(factsDirtyDao).insert(1L, FactTableManager.RETRY_REASON, NOW_MILLIS);
    order.verify(factsDirtyDao).deleteThrough(1L, 5L);
    verify(factsDirtyDao).deleteThrough(2L, 6L);
  }

  @Test
  void refreshDirty_failedRequeueKeepsTheEntries() {
    when(factsDirtyDao.dirtyTripIds(10)).thenReturn(List.of(1L));
    when(factsDirtyDao.latestId(1L)).thenReturn(Optional.of(5L));
    noTravelers(1L);
    when(tripFactsDao.recompute(1L, NOW_MILLIS, 0, null, null, null, null))
        .thenThrow(new ConnectionException(new SQLException("busy")));
    when(factsDirtyDao.insert(1L, FactTableManager.RETRY_REASON, NOW_MILLIS))
        .thenThrow(new ConnectionException(new SQLException("busy")));

    assertThat(manager.refreshDirty(10)).isZero();

    verify(factsDirtyDao, never()).deleteThrough(anyLong(), anyLong());
  }

  @Test
  void refreshDirty_skipsTripAlreadyDrained() {
    when(factsDirtyDao.dirtyTripIds(10)).thenReturn(List.of(3L));
    when(factsDirtyDao.latestId(3L)).thenReturn(Optional.empty());

    assertThat(manager.refreshDirty(10)).isZero();

    verify(tripFactsDao, never()).recompute(anyLong(), anyLong(), anyInt(), any(), any(), any(), any());
  }

  @Test
  void refreshTripFacts_missingTripDropsFacts() {
    noTravelers(9L);
    when(tripFactsDao.recompute(9L, NOW_MILLIS, 0, null, null, null, null)).thenReturn(false);

    assertThat(manager.refreshTripFacts(9L)).isEmpty();

    verify(tripFactsDao).delete(9L);
  }

  @Test
  void refreshTripFacts_writesTheRoster() {
    when(travelerRosters.forTrip(9L)).thenReturn(ImmutableTravelerRoster.builder()
        .addEmails("ann@example.com", "bob@example.com")
        .addNames("Ann", "Bob")
        .primaryClientEmail("bob@example.com")
        .primaryClientName("Bob")
        .build());
    when(tripFactsDao.recompute(9L, NOW_MILLIS, 2, "[\"Ann\",\"Bob\"]", "[\"ann@example.com\",\"bob@example.com\"]",
        "bob@example.com", "Bob")).thenReturn(true);
    when(tripFactsDao.get(9L)).thenReturn(Optional.of(facts(9L)));

    assertThat(manager.refreshTripFacts(9L)).contains(facts(9L));
  }

  @Test
  void refreshStale_usesConfiguredBatchSizeAndSkipsFailures() {
    when(tripFactsDao.staleTripIds(7)).thenReturn(List.of(1L, 2L));
    noTravelers(1L);
    noTravelers(2L);
    when(tripFactsDao.recompute(1L, NOW_MILLIS, 0, null, null, null, null))
        .thenThrow(new ConnectionException(new SQLException("busy")));
    when(tripFactsDao.recompute(2L, NOW_MILLIS, 0, null, null, null, null)).thenReturn(true);
    when(tripFactsDao.get(2L)).thenReturn(Optional.of(facts(2L)));

    assertThat(manager.refreshStale()).isEqualTo(1);

    verifyNoInteractions(factsDirtyDao);
  }
}
