/*
 * Where: crafting data access
 * What: Registers, lists and deletes rows of characters
 */
package com.guildcraft.crafting.repository;

import static com.guildcraft.common.JdbcTimestampUtils.toTimestamp;

import com.guildcraft.crafting.model.CharacterKind;
import com.guildcraft.crafting.model.CharacterRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class CharacterRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public CharacterRecord insert(String ownerId, String name, CharacterKind kind, Instant now) {
    final String sql =
        """
        INSERT INTO characters (owner_id, name, kind, created_at)
        VALUES (:ownerId, :name, :kind, :createdAt)
        RETURNING character_id, owner_id, name, kind, created_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("ownerId", ownerId)
            .addValue("name", name)
            .addValue("kind", kind.value())
            .addValue("createdAt", toTimestamp(now));
    return jdbcTemplate.queryForObject(sql, params, this::mapRow);
  }

  public List<CharacterRecord> findByOwner(String ownerId) {
    final String sql =
        """
        SELECT character_id, owner_id, name, kind, created_at
        FROM characters
        WHERE owner_id = :ownerId
        ORDER BY character_id
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("ownerId", ownerId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public Optional<CharacterRecord> findOwned(String ownerId, long characterId) {
    final String sql =
        """
        SELECT character_id, owner_id, name, kind, created_at
        FROM characters
        WHERE character_id = :characterId
          AND owner_id = :ownerId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("characterId", characterId)
            .addValue("ownerId", ownerId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public int delete(String ownerId, long characterId) {
    final String sql =
        """
        DELETE FROM characters
        WHERE character_id = :characterId
          AND owner_id = :ownerId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("characterId", characterId)
            .addValue("ownerId", ownerId);
    return jdbcTemplate.update(sql, params);
  }

  private CharacterRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new CharacterRecord(
        rs.getLong("character_id"),
        rs.getString("owner_id"),
        rs.getString("name"),
        CharacterKind.fromValue(rs.getString("kind")),
        rs.getTimestamp("created_at").toInstant());
  }
}
