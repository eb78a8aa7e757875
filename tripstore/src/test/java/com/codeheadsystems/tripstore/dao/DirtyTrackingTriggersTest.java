package com.codeheadsystems.tripstore.dao;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.tripstore.BaseTripStoreTest;
import com.codeheadsystems.tripstore.model.DirtyEntry;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class DirtyTrackingTriggersTest extends BaseTripStoreTest {

  private List<String> reasons(final long tripId) {
    return factsDirtyDao.forTrip(tripId).stream().map(DirtyEntry::reason).collect(Collectors.toList());
  }

  @Test
  void insertTrip_marksTrip() {
    final long tripId = newTrip("Paris");

    assertThat(reasons(tripId)).containsExactly("trips_insert");
  }

  @Test
  void childTables_markTheirTrip() {
    final long tripId = newTrip("Paris");
    final long dayId = tripDao.insertDay(tripId, 1, CHECK_IN, "Arrival");
    final long activityId = tripDao.insertActivity(tripId, dayId, "tour", "Louvre", 25.0);
    final long legId = tripDao.insertLeg(tripId, "CDG", "Paris", "train", 35);
    tripDao.assignClient(tripId, "ann@example.com", "traveler", NOW.toEpochMilli());
    tripDao.updateActivityCost(activityId, 30.0);
    tripDao.deleteLeg(legId);
    tripDao.unassignClient(tripId, "ann@example.com");
    tripDao.deleteDay(dayId);

    assertThat(reasons(tripId)).containsExactly(
        "trips_insert",
        "trip_days_insert",
        "trip_activities_insert",
        "trip_legs_insert",
        "trip_client_assignments_insert",
        "trip_activities_update",
        "trip_legs_delete",
        "trip_client_assignments_delete",
        "trip_activities_update",
        "trip_days_delete");
  }

  @Test
  void everyWriteLeavesAnEntry() {
    final long tripId = newTrip("Paris");
    final long activityId = tripDao.insertActivity(tripId, null, "meal", "Dinner", 80.0);
    tripDao.updateActivityCost(activityId, 90.0);
    tripDao.updateActivityCost(activityId, 100.0);

    assertThat(factsDirtyDao.forTrip(tripId)).hasSizeGreaterThanOrEqualTo(4);
    assertThat(factsDirtyDao.forTrip(tripId))
        .allSatisfy(entry -> assertThat(entry.createdAt()).isPositive());
  }

  @Test
  void moveActivity_marksBothTrips() {
    final long from = newTrip("Paris");
    final long to = newTrip("Rome");
    final long activityId = tripDao.insertActivity(from, null, "tour", "Colosseum", 40.0);

    tripDao.moveActivity(activityId, to);

    assertThat(reasons(from)).endsWith("trip_activities_update");
    assertThat(reasons(to)).endsWith("trip_activities_update");
  }

  @Test
  void updateWithoutMove_marksOnlyItsTrip() {
    final long tripId = newTrip("Paris");
    final long other = newTrip("Rome");
    final long activityId = tripDao.insertActivity(tripId, null, "tour", "Louvre", 25.0);

    tripDao.updateActivityCost(activityId, 20.0);

    assertThat(reasons(other)).containsExactly("trips_insert");
    assertThat(reasons(tripId)).filteredOn("trip_activities_update"::equals).hasSize(1);
  }

  @Test
  void unownedServices_areNotTracked() {
    final int before = factsDirtyDao.count();

    travelServiceDao.upsert(hotel("h1", "Paris", 300.0), Optional.of("hash"), Optional.empty(),
        NOW.toEpochMilli(), NOW.toEpochMilli() + 1000);

    assertThat(factsDirtyDao.count()).isEqualTo(before);
  }

  @Test
  void ownedServices_markTheirTrip() {
    final long tripId = newTrip("Paris");

    travelServiceDao.upsert(hotel("h1", "Paris", 300.0), Optional.empty(), Optional.of(tripId),
        NOW.toEpochMilli(), NOW.toEpochMilli() + 1000);

    assertThat(reasons(tripId)).contains("travel_services_insert");
  }

  @Test
  void claimingACachedService_marksTheTrip() {
    final long tripId = newTrip("Paris");
    travelServiceDao.upsert(hotel("h1", "Paris", 300.0), Optional.of("hash"), Optional.empty(),
        NOW.toEpochMilli(), NOW.toEpochMilli() + 1000);

    travelServiceDao.upsert(hotel("h1", "Paris", 300.0), Optional.empty(), Optional.of(tripId),
        NOW.toEpochMilli() + 1, NOW.toEpochMilli() + 1000);

    assertThat(reasons(tripId)).contains("travel_services_update");
  }

  @Test
  void deleteTrip_marksTripAndReleasesServices() {
    final long tripId = newTrip("Paris");
    travelServiceDao.upsert(hotel("h1", "Paris", 300.0), Optional.empty(), Optional.of(tripId),
        NOW.toEpochMilli(), NOW.toEpochMilli() + 1000);

    assertThat(tripDao.deleteTrip(tripId)).isTrue();

    assertThat(reasons(tripId)).contains("travel_services_update", "trips_delete");
    assertThat(travelServiceDao.findByTrip(tripId)).isEmpty();
    assertThat(travelServiceDao.count()).isEqualTo(1);
  }

  @Test
  void deleteThrough_keepsLaterEntries() {
    final long tripId = newTrip("Paris");
    tripDao.insertLeg(tripId, "CDG", "Paris", "train", 35);
    final long seen = factsDirtyDao.latestId(tripId).orElseThrow();
    tripDao.insertLeg(tripId, "Paris", "Lyon", "train", 120);

    assertThat(factsDirtyDao.deleteThrough(tripId, seen)).isEqualTo(2);

    assertThat(reasons(tripId)).containsExactly("trip_legs_insert");
  }

  @Test
  void dirtyTripIds_oldestFirst() {
    final long first = newTrip("Paris");
    final long second = newTrip("Rome");
    tripDao.insertLeg(first, "CDG", "Paris", "train", 35);

    assertThat(factsDirtyDao.dirtyTripIds(10)).containsExactly(first, second);
    assertThat(factsDirtyDao.dirtyTripIds(1)).containsExactly(first);
  }
}
