package com.seatgate.tenant.repository;

import com.seatgate.common.JdbcTimestampUtils;
import com.seatgate.tenant.model.UserRecord;
import com.seatgate.tenant.model.UserRole;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@SuppressWarnings("EI_EXPOSE_REP2")
@RequiredArgsConstructor
public class UserRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<UserRecord> findByExternalId(String externalId) {
    final String sql =
        """
        SELECT user_id, external_id, email, display_name, role, team_id, created_at
        FROM users
        WHERE external_id = :externalId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("externalId", externalId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public Optional<UserRecord> findByUserId(String userId) {
    final String sql =
        """
        SELECT user_id, external_id, email, display_name, role, team_id, created_at
        FROM users
        WHERE user_id = :userId
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("userId", userId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  // external_id の一意制約違反は DataIntegrityViolationException として呼び出し元へ伝播する
  public UserRecord insert(UserRecord user) {
    final String sql =
        """
        INSERT INTO users (user_id, external_id, email, display_name, role, team_id, created_at)
        VALUES (:userId, :externalId, :email, :displayName, :role, :teamId, :createdAt)
        RETURNING user_id, external_id, email, display_name, role, team_id, created_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("userId", user.userId())
            .addValue("externalId", user.externalId())
            .addValue("email", user.email())
            .addValue("displayName", user.displayName())
            .addValue("role", user.role().dbValue())
            .addValue("teamId", user.teamId())
            .addValue("createdAt", JdbcTimestampUtils.toTimestamp(user.createdAt()));
    return jdbcTemplate.queryForObject(sql, params, this::mapRow);
  }

  public int countByTeamId(String teamId) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM users
        WHERE team_id = :teamId
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("teamId", teamId);
    final Integer count = jdbcTemplate.queryForObject(sql, params, Integer.class);
    return count == null ? 0 : count;
  }

  private UserRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new UserRecord(
        rs.getString("user_id"),
        rs.getString("external_id"),
        rs.getString("email"),
        rs.getString("display_name"),
        UserRole.fromDbValue(rs.getString("role")),
        rs.getString("team_id"),
        JdbcTimestampUtils.toInstant(rs.getTimestamp("created_at")));
  }
}
