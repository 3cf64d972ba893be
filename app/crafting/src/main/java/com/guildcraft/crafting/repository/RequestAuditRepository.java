/*
 * Where: crafting data access
 * What: Appends to and reads request_audit
 * Why: The trail is append-only; rows are never updated or deleted from here
 */
package com.guildcraft.crafting.repository;

import static com.guildcraft.common.JdbcTimestampUtils.toTimestamp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.guildcraft.crafting.model.AuditEntry;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class RequestAuditRepository {

  private static final TypeReference<Map<String, Object>> DETAIL_TYPE = new TypeReference<>() {};

  private final NamedParameterJdbcTemplate jdbcTemplate;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "ObjectMapper is a Spring-managed shared component and cannot be copied")
  private final ObjectMapper objectMapper;

  public RequestAuditRepository(NamedParameterJdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
    this.jdbcTemplate = jdbcTemplate;
    this.objectMapper = objectMapper;
  }

  /**
   * Appends one entry for an existing request.
   *
   * @return 1 when the entry was written, 0 when the request does not exist
   */
  public int append(
      long requestId, String action, String actorId, Instant occurredAt, Map<String, ?> details) {
    final String sql =
        """
        INSERT INTO request_audit (request_id, action, actor_id, occurred_at, detail)
        SELECT request_id, :action, :actorId, :occurredAt, :detail::jsonb
        FROM craft_requests
        WHERE request_id = :requestId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("requestId", requestId)
            .addValue("action", action)
            .addValue("actorId", actorId)
            .addValue("occurredAt", toTimestamp(occurredAt))
            .addValue("detail", writeDetail(details));
    return jdbcTemplate.update(sql, params);
  }

  public List<AuditEntry> findByRequestId(long requestId) {
    final String sql =
        """
        SELECT sequence, request_id, action, actor_id, occurred_at, detail::text AS detail_text
        FROM request_audit
        WHERE request_id = :requestId
        ORDER BY sequence
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("requestId", requestId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  /** Loads the trails of several requests in one round trip, each in insertion order. */
  public Map<Long, List<AuditEntry>> findByRequestIds(Collection<Long> requestIds) {
    final Map<Long, List<AuditEntry>> trails = new LinkedHashMap<>();
    if (requestIds.isEmpty()) {
      return trails;
    }
    final String sql =
        """
        SELECT sequence, request_id, action, actor_id, occurred_at, detail::text AS detail_text
        FROM request_audit
        WHERE request_id IN (:requestIds)
        ORDER BY request_id, sequence
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("requestIds", requestIds);
    jdbcTemplate.query(
        sql,
        params,
        rs -> {
          final long requestId = rs.getLong("request_id");
          trails.computeIfAbsent(requestId, ignored -> new ArrayList<>()).add(mapRow(rs, 0));
        });
    return trails;
  }

  private String writeDetail(Map<String, ?> details) {
    try {
      return objectMapper.writeValueAsString(details == null ? Map.of() : details);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize audit detail", ex);
    }
  }

  private Map<String, Object> readDetail(String json) {
    if (json == null || json.isBlank()) {
      return Map.of();
    }
    try {
      return objectMapper.readValue(json, DETAIL_TYPE);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("corrupt audit detail", ex);
    }
  }

  private AuditEntry mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new AuditEntry(
        rs.getLong("sequence"),
        rs.getString("action"),
        rs.getString("actor_id"),
        rs.getTimestamp("occurred_at").toInstant(),
        readDetail(rs.getString("detail_text")));
  }
}
