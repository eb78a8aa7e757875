package com.codeheadsystems.tripstore.manager;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.codeheadsystems.tripstore.dao.SearchCacheDao;
import com.codeheadsystems.tripstore.dao.TravelServiceDao;
import com.codeheadsystems.tripstore.model.CacheLookup;
import com.codeheadsystems.tripstore.model.CachedService;
import com.codeheadsystems.tripstore.model.ImmutableCacheIndexEntry;
import com.codeheadsystems.tripstore.model.ImmutableCachedService;
import com.codeheadsystems.tripstore.model.ImmutableInvalidationCriteria;
import com.codeheadsystems.tripstore.model.ImmutableSearchParameters;
import com.codeheadsystems.tripstore.model.ImmutableTravelService;
import com.codeheadsystems.tripstore.model.InvalidationCriteria;
import com.codeheadsystems.tripstore.model.SearchParameters;
import com.codeheadsystems.tripstore.model.ServiceCategory;
import com.codeheadsystems.tripstore.model.TravelService;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.jdbi.v3.core.ConnectionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class CacheManagerTest {

  private static final Instant NOW = Instant.parse("2025-12-30T12:00:00Z");
  private static final String HASH = "0123456789abcdef";
  private static final SearchParameters PARAMETERS = ImmutableSearchParameters.builder()
      .destination("Rome")
      .startDate(LocalDate.of(2026, 3, 1))
      .build();
  private static final TravelService CAR = ImmutableTravelService.builder()
      .serviceId("c1")
      .category(ServiceCategory.RENTAL_CAR)
      .name("Compact")
      .basePrice(40.0)
      .totalPrice(45.0)
      .startDate(LocalDate.of(2026, 3, 1))
      .sourcePlatform("hertz")
      .build();

  @Mock private SearchCacheDao searchCacheDao;
  @Mock private TravelServiceDao travelServiceDao;

  private CacheManager cacheManager;

  @BeforeEach
  void setup() {
    cacheManager = new CacheManager(searchCacheDao, travelServiceDao,
        new CacheKeyGenerator(new ObjectMapper(), 16), new CachePolicies(Map.of()),
        Clock.fixed(NOW, ZoneId.of("UTC")));
  }

  private ImmutableCacheIndexEntry entry(final Instant createdAt, final Instant expiresAt) {
    return ImmutableCacheIndexEntry.builder()
        .id(3L)
        .searchParamsHash(HASH)
        .category(ServiceCategory.RENTAL_CAR)
        .searchParamsJson("{}")
        .resultCount(1)
        .sourcePlatform("hertz")
        .createdAt(createdAt.toEpochMilli())
        .expiresAt(expiresAt.toEpochMilli())
        .lastAccessed(createdAt.toEpochMilli())
        .accessCount(0)
        .build();
  }

  private CachedService cached(final TravelService service) {
    return ImmutableCachedService.builder()
        .id(9L)
        .service(service)
        .searchParamsHash(HASH)
        .createdAt(NOW.toEpochMilli())
        .updatedAt(NOW.toEpochMilli())
        .cacheExpiresAt(NOW.plus(Duration.ofHours(5)).toEpochMilli())
        .build();
  }

  @Test
  void checkCacheHit_expiredAtExactlyNowIsAMiss() {
    when(searchCacheDao.find(HASH, ServiceCategory.RENTAL_CAR))
        .thenReturn(Optional.of(entry(NOW.minus(Duration.ofHours(6)), NOW)));

    assertThat(cacheManager.checkCacheHit(HASH, ServiceCategory.RENTAL_CAR).hit()).isFalse();

    verify(searchCacheDao, never()).recordHit(anyLong(), anyLong());
    verifyNoInteractions(travelServiceDao);
  }

  @Test
  void checkCacheHit_refreshWindowUsesCategoryPolicy() {
    // rental cars: 6h ttl, refresh in the last hour
    when(searchCacheDao.find(HASH, ServiceCategory.RENTAL_CAR))
        .thenReturn(Optional.of(entry(NOW.minus(Duration.ofMinutes(301)), NOW.plus(Duration.ofMinutes(59)))));
    when(travelServiceDao.findBySearch(HASH, ServiceCategory.RENTAL_CAR, NOW.toEpochMilli()))
        .thenReturn(List.of(cached(CAR)));

    final CacheLookup lookup = cacheManager.checkCacheHit(HASH, ServiceCategory.RENTAL_CAR);

    assertThat(lookup.hit()).isTrue();
    assertThat(lookup.needsRefresh()).isTrue();
    assertThat(lookup.results()).containsExactly(CAR);
    verify(searchCacheDao).recordHit(3L, NOW.toEpochMilli());
  }

  @Test
  void checkCacheHit_fewerItemsThanCachedIsAMiss() {
    when(searchCacheDao.find(HASH, ServiceCategory.RENTAL_CAR))
        .thenReturn(Optional.of(entry(NOW.minus(Duration.ofHours(1)), NOW.plus(Duration.ofHours(5)))
            .withResultCount(2)));
    when(travelServiceDao.findBySearch(HASH, ServiceCategory.RENTAL_CAR, NOW.toEpochMilli()))
        .thenReturn(List.of(cached(CAR)));

    assertThat(cacheManager.checkCacheHit(HASH, ServiceCategory.RENTAL_CAR)).isEqualTo(CacheLookup.miss());

    verify(searchCacheDao, never()).recordHit(anyLong(), anyLong());
  }

  @Test
  void checkCacheHit_storeFailureIsAMiss() {
    when(searchCacheDao.find(HASH, ServiceCategory.RENTAL_CAR))
        .thenThrow(new ConnectionException(new SQLException("database is locked")));

    assertThat(cacheManager.checkCacheHit(HASH, ServiceCategory.RENTAL_CAR)).isEqualTo(CacheLookup.miss());
  }

  @Test
  void cacheSearchResults_usesPolicyTtl() {
    assertThat(cacheManager.cacheSearchResults(HASH, ServiceCategory.RENTAL_CAR, PARAMETERS, List.of(CAR),
        "hertz", 120L)).isTrue();

    final long expiresAt = NOW.plus(Duration.ofHours(6)).toEpochMilli();
    verify(searchCacheDao).replace(eq(HASH), eq(ServiceCategory.RENTAL_CAR), anyString(), eq(1), eq(120L),
        eq("hertz"), eq(NOW.toEpochMilli()), eq(expiresAt));
    verify(travelServiceDao).upsert(CAR, Optional.of(HASH), Optional.empty(), NOW.toEpochMilli(), expiresAt);
  }

  @Test
  void cacheSearchResults_failedWriteReturnsFalse() {
    when(searchCacheDao.replace(anyString(), any(), anyString(), anyInt(), anyLong(), anyString(), anyLong(),
        anyLong())).thenThrow(new ConnectionException(new SQLException("disk I/O error")));

    assertThat(cacheManager.cacheSearchResults(HASH, ServiceCategory.RENTAL_CAR, PARAMETERS, List.of(CAR),
        "hertz", 120L)).isFalse();

    verifyNoInteractions(travelServiceDao);
  }

  @Test
  void cacheItem_failedWriteReturnsFalse() {
    when(travelServiceDao.upsert(any(), any(), any(), anyLong(), anyLong()))
        .thenThrow(new ConnectionException(new SQLException("disk I/O error")));

    assertThat(cacheManager.cacheItem(CAR, Optional.empty(), Optional.of(12L))).isFalse();
  }

  @Test
  void invalidate_returnsItemCount() {
    final InvalidationCriteria criteria = ImmutableInvalidationCriteria.builder()
        .category(ServiceCategory.RENTAL_CAR)
        .build();
    when(travelServiceDao.invalidate(criteria)).thenReturn(4);
    when(searchCacheDao.invalidate(criteria)).thenReturn(2);

    assertThat(cacheManager.invalidate(criteria)).isEqualTo(4);
  }

  @Test
  void invalidate_propagatesStoreFailure() {
    final InvalidationCriteria criteria = ImmutableInvalidationCriteria.builder().build();
    when(travelServiceDao.invalidate(criteria)).thenThrow(new ConnectionException(new SQLException("locked")));

    assertThatThrownBy(() -> cacheManager.invalidate(criteria)).isInstanceOf(ConnectionException.class);
  }
}
