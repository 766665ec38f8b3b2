package com.example.identity.repository;

import static com.example.common.JdbcTimestampUtils.readInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.identity.model.ContactRecord;
import com.example.identity.model.LinkPrecedence;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@SuppressWarnings("EI_EXPOSE_REP2")
@RequiredArgsConstructor
public class JdbcContactRepository implements ContactRepository {

  private static final String COLUMNS =
      "id, email, phone_number, linked_id, link_precedence, created_at, updated_at, deleted_at";

  private final NamedParameterJdbcTemplate jdbcTemplate;

  @Override
  public List<ContactRecord> findByMatch(String email, String phoneNumber) {
    final List<String> conditions = new ArrayList<>(2);
    final MapSqlParameterSource params = new MapSqlParameterSource();
    if (email != null) {
      conditions.add("email = :email");
      params.addValue("email", email);
    }
    if (phoneNumber != null) {
      conditions.add("phone_number = :phoneNumber");
      params.addValue("phoneNumber", phoneNumber);
    }
    if (conditions.isEmpty()) {
      return List.of();
    }
    final String sql =
        "SELECT "
            + COLUMNS
            + " FROM contacts WHERE deleted_at IS NULL AND ("
            + String.join(" OR ", conditions)
            + ") ORDER BY created_at, id";
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  @Override
  public List<ContactRecord> findByGroupIds(Collection<Long> primaryIds) {
    if (primaryIds.isEmpty()) {
      return List.of();
    }
    final String sql =
        """
        SELECT id, email, phone_number, linked_id, link_precedence, created_at, updated_at, deleted_at
        FROM contacts
        WHERE deleted_at IS NULL
          AND (id IN (:ids) OR linked_id IN (:ids))
        ORDER BY created_at, id
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("ids", primaryIds);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  @Override
  public List<ContactRecord> lockByIds(Collection<Long> ids) {
    if (ids.isEmpty()) {
      return List.of();
    }
    // id 昇順でロックし、逆順に取り合う merge 同士のデッドロックを避ける
    final String sql =
        """
        SELECT id, email, phone_number, linked_id, link_precedence, created_at, updated_at, deleted_at
        FROM contacts
        WHERE deleted_at IS NULL
          AND id IN (:ids)
        ORDER BY id
        FOR UPDATE
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("ids", ids);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  @Override
  public ContactRecord insert(
      String email,
      String phoneNumber,
      Long linkedId,
      LinkPrecedence linkPrecedence,
      Instant createdAt) {
    final String sql =
        """
        INSERT INTO contacts (email, phone_number, linked_id, link_precedence, created_at, updated_at)
        VALUES (:email, :phoneNumber, :linkedId, :linkPrecedence, :createdAt, :createdAt)
        RETURNING id, email, phone_number, linked_id, link_precedence, created_at, updated_at, deleted_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("email", email)
            .addValue("phoneNumber", phoneNumber)
            .addValue("linkedId", linkedId)
            .addValue("linkPrecedence", linkPrecedence.dbValue())
            .addValue("createdAt", toTimestamp(createdAt));
    return jdbcTemplate.queryForObject(sql, params, this::mapRow);
  }

  @Override
  public int demoteToSecondary(long contactId, long primaryId, Instant updatedAt) {
    final String sql =
        """
        UPDATE contacts
        SET link_precedence = 'secondary',
            linked_id = :primaryId,
            updated_at = :updatedAt
        WHERE id = :contactId
          AND link_precedence = 'primary'
          AND deleted_at IS NULL
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("contactId", contactId)
            .addValue("primaryId", primaryId)
            .addValue("updatedAt", toTimestamp(updatedAt));
    return jdbcTemplate.update(sql, params);
  }

  @Override
  public int relinkSecondaries(long fromPrimaryId, long toPrimaryId, Instant updatedAt) {
    final String sql =
        """
        UPDATE contacts
        SET linked_id = :toPrimaryId,
            updated_at = :updatedAt
        WHERE linked_id = :fromPrimaryId
          AND deleted_at IS NULL
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("fromPrimaryId", fromPrimaryId)
            .addValue("toPrimaryId", toPrimaryId)
            .addValue("updatedAt", toTimestamp(updatedAt));
    return jdbcTemplate.update(sql, params);
  }

  private ContactRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    final long rawLinkedId = rs.getLong("linked_id");
    final Long linkedId = rs.wasNull() ? null : rawLinkedId;
    return new ContactRecord(
        rs.getLong("id"),
        rs.getString("email"),
        rs.getString("phone_number"),
        linkedId,
        LinkPrecedence.fromDbValue(rs.getString("link_precedence")),
        readInstant(rs, "created_at"),
        readInstant(rs, "updated_at"),
        readInstant(rs, "deleted_at"));
  }
}
