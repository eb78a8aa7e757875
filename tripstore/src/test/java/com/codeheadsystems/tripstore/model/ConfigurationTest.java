package com.codeheadsystems.tripstore.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.dbu.model.ImmutableDatabase;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class ConfigurationTest {

  private final ObjectMapper objectMapper = new ObjectMapper();

  @Test
  void defaultsFromJson() throws Exception {
    final Configuration configuration = objectMapper.readValue(
        "{\"database\":{\"url\":\"jdbc:sqlite:/tmp/trips.db\"}}", Configuration.class);

    assertThat(configuration.database().useSqlite()).isTrue();
    assertThat(configuration.runMigrations()).isTrue();
    assertThat(configuration.useMigrationLock()).isFalse();
    assertThat(configuration.migrationLockTtlSeconds()).isEqualTo(300);
    assertThat(configuration.cacheKeyLength()).isEqualTo(16);
    assertThat(configuration.cacheSweepIntervalSeconds()).isEqualTo(3600);
    assertThat(configuration.dirtyRetentionHours()).isEqualTo(168);
    assertThat(configuration.factsRefreshBatchSize()).isEqualTo(50);
    assertThat(configuration.cachePolicies()).isEmpty();
  }

  @Test
  void overridesFromJson() throws Exception {
    final Configuration configuration = objectMapper.readValue("{"
        + "\"database\":{\"url\":\"jdbc:sqlite:/tmp/trips.db\"},"
        + "\"useMigrationLock\":true,"
        + "\"cacheKeyLength\":24,"
        + "\"cachePolicies\":{\"flight\":{\"ttlMinutes\":60,\"refreshThresholdMinutes\":10}},"
        + "\"somethingNew\":\"ignored\""
        + "}", Configuration.class);

    assertThat(configuration.useMigrationLock()).isTrue();
    assertThat(configuration.cacheKeyLength()).isEqualTo(24);
    assertThat(configuration.cachePolicies().get("flight").ttl()).isEqualTo(Duration.ofHours(1));
  }

  @Test
  void unknownCategoryCode() {
    assertThatThrownBy(() -> objectMapper.readValue("{"
        + "\"database\":{\"url\":\"jdbc:sqlite:/tmp/trips.db\"},"
        + "\"cachePolicies\":{\"cruise\":{\"ttlMinutes\":60,\"refreshThresholdMinutes\":10}}"
        + "}", Configuration.class))
        .isInstanceOf(JsonMappingException.class)
        .hasRootCauseInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void keyLengthOutOfRange() {
    assertThatThrownBy(() -> ImmutableConfiguration.builder()
        .database(ImmutableDatabase.builder().url("jdbc:sqlite:/tmp/trips.db").build())
        .cacheKeyLength(4)
        .build())
        .isInstanceOf(IllegalArgumentException.class);
  }
}
