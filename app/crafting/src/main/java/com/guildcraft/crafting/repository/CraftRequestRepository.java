/*
 * Where: crafting data access
 * What: Reads and conditionally updates rows of craft_requests
 * Why: Every status change is a single UPDATE guarded by the current status, so concurrent
 *      callers can never both win the same transition
 */
package com.guildcraft.crafting.repository;

import static com.guildcraft.common.JdbcTimestampUtils.toInstant;
import static com.guildcraft.common.JdbcTimestampUtils.toTimestamp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.guildcraft.crafting.model.CrafterActivity;
import com.guildcraft.crafting.model.CraftRequest;
import com.guildcraft.crafting.model.DuplicateKey;
import com.guildcraft.crafting.model.NewCraftRequest;
import com.guildcraft.crafting.model.ProfessionStatusCount;
import com.guildcraft.crafting.model.RequestStatus;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.sql.Array;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Repository
public class CraftRequestRepository {

  private static final TypeReference<Map<String, Integer>> MATERIALS_TYPE =
      new TypeReference<>() {};

  private static final String COLUMNS =
      """
      request_id, requester_id, character_name, profession, gear_slot, item_id, item_label,
      quantity_requested, quantity_completed,
      materials_required::text AS materials_required_text,
      materials_provided::text AS materials_provided_text,
      requester_provides_materials, status,
      claimed_by, claimed_by_display_name, claimed_at, completed_by, deny_reason,
      created_at, updated_at
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "ObjectMapper is a Spring-managed shared component and cannot be copied")
  private final ObjectMapper objectMapper;

  public CraftRequestRepository(NamedParameterJdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
    this.jdbcTemplate = jdbcTemplate;
    this.objectMapper = objectMapper;
  }

  public CraftRequest insert(NewCraftRequest request, int quantityRequested, Instant now) {
    final String sql =
        """
        INSERT INTO craft_requests (
          requester_id,
          character_name,
          profession,
          gear_slot,
          item_id,
          item_label,
          quantity_requested,
          quantity_completed,
          materials_required,
          materials_provided,
          requester_provides_materials,
          status,
          created_at,
          updated_at
        ) VALUES (
          :requesterId,
          :characterName,
          :profession,
          :gearSlot,
          :itemId,
          :itemLabel,
          :quantityRequested,
          0,
          :materialsRequired::jsonb,
          :materialsProvided::jsonb,
          :providesMaterials,
          'open',
          :now,
          :now
        )
        RETURNING %s
        """
            .formatted(COLUMNS);
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("requesterId", request.requesterId())
            .addValue("characterName", request.characterName())
            .addValue("profession", request.profession())
            .addValue("gearSlot", request.gearSlot())
            .addValue("itemId", request.itemId())
            .addValue("itemLabel", request.itemLabel())
            .addValue("quantityRequested", quantityRequested)
            .addValue("materialsRequired", writeMaterials(request.materialsRequired()))
            .addValue("materialsProvided", writeMaterials(request.materialsProvidedByRequester()))
            .addValue("providesMaterials", request.requesterProvidesMaterials())
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.queryForObject(sql, params, this::mapRow);
  }

  @Transactional(propagation = Propagation.MANDATORY)
  public void lockSubmission(long lockKey) {
    // Serializes concurrent submissions of the same tuple until the surrounding transaction ends.
    final String sql = "SELECT pg_advisory_xact_lock(:lockKey)";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("lockKey", lockKey);
    jdbcTemplate.query(sql, params, rs -> null);
  }

  public boolean existsCreatedSince(DuplicateKey key, Instant since) {
    final String sql =
        """
        SELECT EXISTS (
          SELECT 1
          FROM craft_requests
          WHERE requester_id = :requesterId
            AND character_name = :characterName
            AND profession = :profession
            AND gear_slot = :gearSlot
            AND item_id = :itemId
            AND created_at > :since
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("requesterId", key.requesterId())
            .addValue("characterName", key.characterName())
            .addValue("profession", key.profession())
            .addValue("gearSlot", key.gearSlot())
            .addValue("itemId", key.itemId())
            .addValue("since", toTimestamp(since));
    return Boolean.TRUE.equals(jdbcTemplate.queryForObject(sql, params, Boolean.class));
  }

  public Optional<CraftRequest> findById(long requestId) {
    final String sql =
        """
        SELECT %s
        FROM craft_requests
        WHERE request_id = :requestId
        """
            .formatted(COLUMNS);
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("requestId", requestId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  @Transactional(propagation = Propagation.MANDATORY)
  public Optional<CraftRequest> lockById(long requestId) {
    final String sql =
        """
        SELECT %s
        FROM craft_requests
        WHERE request_id = :requestId
        FOR UPDATE
        """
            .formatted(COLUMNS);
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("requestId", requestId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public Optional<CraftRequest> claimIfOpen(
      long requestId, String crafterId, String crafterDisplayName, Instant now) {
    // Assumption: only an open row matches, so of two racing claims exactly one gets a row back.
    // Trade-off: the loser learns nothing from the UPDATE and needs a second read to classify.
    final String sql =
        """
        UPDATE craft_requests
        SET status = 'claimed',
            claimed_by = :crafterId,
            claimed_by_display_name = :displayName,
            claimed_at = :now,
            updated_at = :now
        WHERE request_id = :requestId
          AND status = 'open'
        RETURNING %s
        """
            .formatted(COLUMNS);
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("requestId", requestId)
            .addValue("crafterId", crafterId)
            .addValue("displayName", crafterDisplayName)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public Optional<CraftRequest> releaseIfClaimed(long requestId, Instant now) {
    final String sql =
        """
        UPDATE craft_requests
        SET status = 'open',
            claimed_by = NULL,
            claimed_by_display_name = NULL,
            claimed_at = NULL,
            updated_at = :now
        WHERE request_id = :requestId
          AND status IN ('claimed', 'in_progress')
        RETURNING %s
        """
            .formatted(COLUMNS);
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("requestId", requestId)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public Optional<CraftRequest> startIfClaimed(long requestId, Instant now) {
    final String sql =
        """
        UPDATE craft_requests
        SET status = 'in_progress',
            updated_at = :now
        WHERE request_id = :requestId
          AND status = 'claimed'
        RETURNING %s
        """
            .formatted(COLUMNS);
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("requestId", requestId)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public Optional<CraftRequest> denyIfActive(long requestId, String reason, Instant now) {
    final String sql =
        """
        UPDATE craft_requests
        SET status = 'denied',
            deny_reason = :reason,
            claimed_by = NULL,
            claimed_by_display_name = NULL,
            claimed_at = NULL,
            updated_at = :now
        WHERE request_id = :requestId
          AND status IN ('open', 'claimed', 'in_progress')
        RETURNING %s
        """
            .formatted(COLUMNS);
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("requestId", requestId)
            .addValue("reason", reason)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public List<CraftRequest> denyActiveForCharacter(
      String requesterId, String characterName, String reason, Instant now) {
    final String sql =
        """
        UPDATE craft_requests
        SET status = 'denied',
            deny_reason = :reason,
            claimed_by = NULL,
            claimed_by_display_name = NULL,
            claimed_at = NULL,
            updated_at = :now
        WHERE requester_id = :requesterId
          AND character_name = :characterName
          AND status IN ('open', 'claimed', 'in_progress')
        RETURNING %s
        """
            .formatted(COLUMNS);
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("requesterId", requesterId)
            .addValue("characterName", characterName)
            .addValue("reason", reason)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public Optional<CraftRequest> applyProgress(
      long requestId,
      int expectedCompleted,
      int newCompleted,
      RequestStatus newStatus,
      String completedBy,
      Instant now) {
    // Caller holds the row lock; the guard on quantity_completed still rejects a stale snapshot.
    final String sql =
        """
        UPDATE craft_requests
        SET quantity_completed = :newCompleted,
            status = :status,
            completed_by = :completedBy,
            claimed_by = CASE WHEN :status = 'complete' THEN NULL ELSE claimed_by END,
            claimed_by_display_name =
              CASE WHEN :status = 'complete' THEN NULL ELSE claimed_by_display_name END,
            claimed_at = CASE WHEN :status = 'complete' THEN NULL ELSE claimed_at END,
            updated_at = :now
        WHERE request_id = :requestId
          AND status = 'in_progress'
          AND quantity_completed = :expectedCompleted
        RETURNING %s
        """
            .formatted(COLUMNS);
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("requestId", requestId)
            .addValue("expectedCompleted", expectedCompleted)
            .addValue("newCompleted", newCompleted)
            .addValue("status", newStatus.value())
            .addValue("completedBy", completedBy)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public Optional<CraftRequest> reopen(long requestId, Instant now) {
    final String sql =
        """
        UPDATE craft_requests
        SET status = 'open',
            claimed_by = NULL,
            claimed_by_display_name = NULL,
            claimed_at = NULL,
            completed_by = NULL,
            deny_reason = NULL,
            updated_at = :now
        WHERE request_id = :requestId
        RETURNING %s
        """
            .formatted(COLUMNS);
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("requestId", requestId)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public Optional<CraftRequest> reassignIfActive(
      long requestId, String crafterId, String crafterDisplayName, Instant now) {
    final String sql =
        """
        UPDATE craft_requests
        SET status = 'claimed',
            claimed_by = :crafterId,
            claimed_by_display_name = :displayName,
            claimed_at = :now,
            updated_at = :now
        WHERE request_id = :requestId
          AND status IN ('open', 'claimed', 'in_progress')
        RETURNING %s
        """
            .formatted(COLUMNS);
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("requestId", requestId)
            .addValue("crafterId", crafterId)
            .addValue("displayName", crafterDisplayName)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public int touch(long requestId, Instant now) {
    final String sql =
        """
        UPDATE craft_requests
        SET updated_at = :now
        WHERE request_id = :requestId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("requestId", requestId)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  public List<CraftRequest> findByRequester(
      String requesterId, Collection<RequestStatus> statuses, int limit) {
    final String sql =
        """
        SELECT %s
        FROM craft_requests
        WHERE requester_id = :requesterId
          AND status IN (:statuses)
        ORDER BY updated_at DESC, request_id DESC
        LIMIT :limit
        """
            .formatted(COLUMNS);
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("requesterId", requesterId)
            .addValue("statuses", statusValues(statuses))
            .addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public List<CraftRequest> findByProfession(
      String profession, Collection<RequestStatus> statuses) {
    final String sql =
        """
        SELECT %s
        FROM craft_requests
        WHERE profession = :profession
          AND status IN (:statuses)
        ORDER BY updated_at DESC, request_id DESC
        """
            .formatted(COLUMNS);
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("profession", profession)
            .addValue("statuses", statusValues(statuses));
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public List<CraftRequest> findOpenByProfessionOldestFirst(String profession) {
    final String sql =
        """
        SELECT %s
        FROM craft_requests
        WHERE profession = :profession
          AND status = 'open'
        ORDER BY created_at ASC, request_id ASC
        """
            .formatted(COLUMNS);
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("profession", profession);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public List<CraftRequest> findClaimedBy(String crafterId) {
    final String sql =
        """
        SELECT %s
        FROM craft_requests
        WHERE claimed_by = :crafterId
          AND status IN ('claimed', 'in_progress')
        ORDER BY CASE status WHEN 'in_progress' THEN 1 ELSE 2 END,
                 claimed_at ASC,
                 request_id ASC
        """
            .formatted(COLUMNS);
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("crafterId", crafterId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public List<CraftRequest> findByCharacter(String characterName) {
    final String sql =
        """
        SELECT %s
        FROM craft_requests
        WHERE character_name = :characterName
        ORDER BY created_at DESC, request_id DESC
        """
            .formatted(COLUMNS);
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("characterName", characterName);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public List<ProfessionStatusCount> summarizeActive() {
    final String sql =
        """
        SELECT profession, status, COUNT(*) AS request_count
        FROM craft_requests
        WHERE status IN ('open', 'claimed', 'in_progress')
        GROUP BY profession, status
        ORDER BY profession, status
        """;
    return jdbcTemplate.query(
        sql,
        new MapSqlParameterSource(),
        (rs, rowNum) ->
            new ProfessionStatusCount(
                rs.getString("profession"),
                readStatus(rs.getString("status")),
                rs.getLong("request_count")));
  }

  public List<CrafterActivity> crafterActivity() {
    // Active work is keyed by claimed_by, finished work by completed_by.
    final String sql =
        """
        WITH work AS (
          SELECT claimed_by AS crafter_id, claimed_by_display_name AS display_name,
                 profession, status, updated_at
          FROM craft_requests
          WHERE status IN ('claimed', 'in_progress')
          UNION ALL
          SELECT completed_by, NULL, profession, status, updated_at
          FROM craft_requests
          WHERE status = 'complete' AND completed_by IS NOT NULL
        )
        SELECT crafter_id,
               MAX(display_name) AS display_name,
               ARRAY_AGG(DISTINCT profession ORDER BY profession) AS professions,
               COUNT(*) FILTER (WHERE status IN ('claimed', 'in_progress')) AS active_count,
               COUNT(*) FILTER (WHERE status = 'complete') AS completed_count,
               MAX(updated_at) AS last_activity
        FROM work
        GROUP BY crafter_id
        ORDER BY last_activity DESC
        """;
    return jdbcTemplate.query(sql, new MapSqlParameterSource(), this::mapActivity);
  }

  private List<String> statusValues(Collection<RequestStatus> statuses) {
    return statuses.stream().map(RequestStatus::value).toList();
  }

  private String writeMaterials(Map<String, Integer> materials) {
    try {
      return objectMapper.writeValueAsString(materials == null ? Map.of() : materials);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize materials", ex);
    }
  }

  private Map<String, Integer> readMaterials(String json) {
    if (json == null || json.isBlank()) {
      return Map.of();
    }
    try {
      return objectMapper.readValue(json, MATERIALS_TYPE);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("corrupt materials column", ex);
    }
  }

  private RequestStatus readStatus(String raw) {
    return RequestStatus.parse(raw)
        .orElseThrow(() -> new IllegalStateException("unrecognized request status in store: " + raw));
  }

  private CraftRequest mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new CraftRequest(
        rs.getLong("request_id"),
        rs.getString("requester_id"),
        rs.getString("character_name"),
        rs.getString("profession"),
        rs.getString("gear_slot"),
        rs.getString("item_id"),
        rs.getString("item_label"),
        rs.getInt("quantity_requested"),
        rs.getInt("quantity_completed"),
        readMaterials(rs.getString("materials_required_text")),
        readMaterials(rs.getString("materials_provided_text")),
        rs.getBoolean("requester_provides_materials"),
        readStatus(rs.getString("status")),
        rs.getString("claimed_by"),
        rs.getString("claimed_by_display_name"),
        toInstant(rs.getTimestamp("claimed_at")),
        rs.getString("completed_by"),
        rs.getString("deny_reason"),
        List.of(),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("updated_at")));
  }

  private CrafterActivity mapActivity(ResultSet rs, int rowNum) throws SQLException {
    final Array professions = rs.getArray("professions");
    final List<String> professionList =
        professions == null ? List.of() : Arrays.asList((String[]) professions.getArray());
    return new CrafterActivity(
        rs.getString("crafter_id"),
        rs.getString("display_name"),
        professionList,
        rs.getLong("active_count"),
        rs.getLong("completed_count"),
        toInstant(rs.getTimestamp("last_activity")));
  }
}
