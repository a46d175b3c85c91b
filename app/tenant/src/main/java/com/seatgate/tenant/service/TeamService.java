/*
 * どこで: Tenant サービス層
 * 何を: チームの参照・名前変更・プラン更新を扱う
 * なぜ: チーム作成後に変更できる項目をここに限定するため
 */
package com.seatgate.tenant.service;

import com.seatgate.tenant.model.TeamRecord;
import com.seatgate.tenant.repository.TeamRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class TeamService {

  private static final Logger logger = LoggerFactory.getLogger(TeamService.class);
  private static final int MAX_NAME_LENGTH = 200;
  private static final int MAX_PLAN_LENGTH = 64;

  private final TeamRepository teamRepository;
  private final TenantMetrics metrics;
  private final Clock clock;

  public TeamRecord getTeam(String teamId) {
    requireTeamId(teamId);
    return guard("get_team", () -> teamRepository.findByTeamId(teamId))
        .orElseThrow(() -> new TeamNotFoundException(teamId));
  }

  public TeamRecord rename(String teamId, String name) {
    requireTeamId(teamId);
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("name is required");
    }
    final String normalized = name.trim();
    if (normalized.length() > MAX_NAME_LENGTH) {
      throw new IllegalArgumentException("name is too long");
    }
    final TeamRecord updated =
        guard(
                "rename_team",
                () -> teamRepository.updateName(teamId, normalized, Instant.now(clock)))
            .orElseThrow(() -> new TeamNotFoundException(teamId));
    logger.info("team renamed teamId={}", teamId);
    return updated;
  }

  public TeamRecord updatePlan(String teamId, String plan) {
    requireTeamId(teamId);
    if (plan == null || plan.isBlank()) {
      throw new IllegalArgumentException("plan is required");
    }
    final String normalized = plan.trim();
    if (normalized.length() > MAX_PLAN_LENGTH) {
      throw new IllegalArgumentException("plan is too long");
    }
    final TeamRecord updated =
        guard(
                "update_team_plan",
                () -> teamRepository.updatePlan(teamId, normalized, Instant.now(clock)))
            .orElseThrow(() -> new TeamNotFoundException(teamId));
    logger.info("team plan updated teamId={} plan={}", teamId, normalized);
    return updated;
  }

  private Optional<TeamRecord> guard(String operation, Supplier<Optional<TeamRecord>> action) {
    try {
      return action.get();
    } catch (RuntimeException ex) {
      if (!TenantStoreFailures.isUnavailable(ex)) {
        throw ex;
      }
      logger.warn("tenant store unavailable operation={}", operation, ex);
      metrics.recordStoreUnavailable(operation);
      throw new TenantStoreUnavailableException(operation, "tenant store is unavailable", ex);
    }
  }

  private void requireTeamId(String teamId) {
    if (teamId == null || teamId.isBlank()) {
      throw new IllegalArgumentException("teamId is required");
    }
  }
}
