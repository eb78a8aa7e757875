package com.codeheadsystems.dbu.model;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

class DatabaseTest {

  @Test
  void testPasswordHidden() {
    Database database = ImmutableDatabase.builder()
        .url("jdbc:sqlite:/tmp/DatabaseTest.db")
        .username("SA")
        .password("password")
        .build();
    assertThat(database.password()).isEqualTo("password");
    assertThat(database.toString()).doesNotContain("password");
  }

  @Test
  void testUseSqlite() {
    assertThat(ImmutableDatabase.builder().url("jdbc:sqlite:/tmp/x.db").build().useSqlite()).isTrue();
    assertThat(ImmutableDatabase.builder().url("jdbc:hsqldb:mem:x").build().useSqlite()).isFalse();
  }

  @Test
  void testDefaultsFromJson() throws Exception {
    final Database database = new ObjectMapper()
        .readValue("{\"url\":\"jdbc:sqlite:/tmp/json.db\",\"extra\":1}", Database.class);
    assertThat(database.url()).isEqualTo("jdbc:sqlite:/tmp/json.db");
    assertThat(database.username()).isEmpty();
    assertThat(database.password()).isEmpty();
    assertThat(database.foreignKeys()).isTrue();
    assertThat(database.busyTimeoutMillis()).isEqualTo(5000);
  }

}
