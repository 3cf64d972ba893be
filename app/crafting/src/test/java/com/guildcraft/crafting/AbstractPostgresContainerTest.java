/*
 * Where: crafting test support
 * What: Shared Testcontainers Postgres plus the datasource and Flyway settings pointing at it
 * Why: Every integration test runs against the real dialect (advisory locks, jsonb, RETURNING)
 */
package com.guildcraft.crafting;

import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Testcontainers;

@Testcontainers(disabledWithoutDocker = true)
public abstract class AbstractPostgresContainerTest {

  // One container per JVM; Spring caches contexts across test classes.
  static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16-alpine");

  static {
    // @DynamicPropertySource can be evaluated before the Testcontainers extension starts
    // anything, so the container is started explicitly here.
    POSTGRES.start();
  }

  @DynamicPropertySource
  static void registerProperties(DynamicPropertyRegistry registry) {
    registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
    registry.add("spring.datasource.username", POSTGRES::getUsername);
    registry.add("spring.datasource.password", POSTGRES::getPassword);

    registry.add("spring.datasource.hikari.schema", () -> "crafting");

    registry.add("spring.flyway.enabled", () -> "true");
    registry.add("spring.flyway.locations", () -> "classpath:db/migration");
    registry.add("spring.flyway.default-schema", () -> "crafting");
    registry.add("spring.flyway.schemas", () -> "crafting");
    registry.add("spring.flyway.create-schemas", () -> "true");
    registry.add("spring.flyway.table", () -> "flyway_schema_history_crafting");
  }

  protected static void truncateAll(NamedParameterJdbcTemplate jdbcTemplate) {
    jdbcTemplate.update(
        "TRUNCATE request_audit, craft_requests, characters RESTART IDENTITY",
        new MapSqlParameterSource());
  }

  protected static int countTable(NamedParameterJdbcTemplate jdbcTemplate, String table) {
    final Integer count =
        jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM " + table, new MapSqlParameterSource(), Integer.class);
    return count == null ? 0 : count;
  }
}
