package com.codeheadsystems.tripstore.manager;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.codeheadsystems.tripstore.dao.FactsDirtyDao;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class DirtyTrackerTest {

  private static final Instant NOW = Instant.parse("2025-12-30T12:00:00Z");

  @Mock private FactsDirtyDao factsDirtyDao;

  private DirtyTracker dirtyTracker;

  @BeforeEach
  void setup() {
    dirtyTracker = new DirtyTracker(factsDirtyDao, Clock.fixed(NOW, ZoneId.of("UTC")));
  }

  @Test
  void markDirty() {
    dirtyTracker.markDirty(5L, "supplier_price_change");

    verify(factsDirtyDao).insert(5L, "supplier_price_change", NOW.toEpochMilli());
  }

  @Test
  void markDirty_blankReason() {
    assertThatThrownBy(() -> dirtyTracker.markDirty(5L, " "))
        .isInstanceOf(IllegalArgumentException.class);
    verifyNoInteractions(factsDirtyDao);
  }

  @Test
  void markAllDirty() {
    when(factsDirtyDao.insertForAllTrips("recompute", NOW.toEpochMilli())).thenReturn(12);

    assertThat(dirtyTracker.markAllDirty("recompute")).isEqualTo(12);
  }

  @Test
  void pendingCount() {
    when(factsDirtyDao.count()).thenReturn(3);

    assertThat(dirtyTracker.pendingCount()).isEqualTo(3);
  }
}
