package com.seatgate.tenant.repository;

import com.seatgate.common.JdbcTimestampUtils;
import com.seatgate.tenant.model.TeamRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@SuppressWarnings("EI_EXPOSE_REP2")
@RequiredArgsConstructor
public class TeamRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<TeamRecord> findByTeamId(String teamId) {
    final String sql =
        """
        SELECT team_id, name, plan, created_at, updated_at
        FROM teams
        WHERE team_id = :teamId
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("teamId", teamId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public TeamRecord insert(TeamRecord team) {
    final String sql =
        """
        INSERT INTO teams (team_id, name, plan, created_at, updated_at)
        VALUES (:teamId, :name, :plan, :createdAt, :updatedAt)
        RETURNING team_id, name, plan, created_at, updated_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("teamId", team.teamId())
            .addValue("name", team.name())
            .addValue("plan", team.plan())
            .addValue("createdAt", JdbcTimestampUtils.toTimestamp(team.createdAt()))
            .addValue("updatedAt", JdbcTimestampUtils.toTimestamp(team.updatedAt()));
    return jdbcTemplate.queryForObject(sql, params, this::mapRow);
  }

  public Optional<TeamRecord> updateName(String teamId, String name, Instant updatedAt) {
    final String sql =
        """
        UPDATE teams
        SET name = :name,
            updated_at = :updatedAt
        WHERE team_id = :teamId
        RETURNING team_id, name, plan, created_at, updated_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("teamId", teamId)
            .addValue("name", name)
            .addValue("updatedAt", JdbcTimestampUtils.toTimestamp(updatedAt));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public Optional<TeamRecord> updatePlan(String teamId, String plan, Instant updatedAt) {
    final String sql =
        """
        UPDATE teams
        SET plan = :plan,
            updated_at = :updatedAt
        WHERE team_id = :teamId
        RETURNING team_id, name, plan, created_at, updated_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("teamId", teamId)
            .addValue("plan", plan)
            .addValue("updatedAt", JdbcTimestampUtils.toTimestamp(updatedAt));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  private TeamRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new TeamRecord(
        rs.getString("team_id"),
        rs.getString("name"),
        rs.getString("plan"),
        JdbcTimestampUtils.toInstant(rs.getTimestamp("created_at")),
        JdbcTimestampUtils.toInstant(rs.getTimestamp("updated_at")));
  }
}
