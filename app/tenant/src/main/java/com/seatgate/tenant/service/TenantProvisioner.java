package com.seatgate.tenant.service;

import com.seatgate.tenant.api.request.EnsureTenantRequest;
import com.seatgate.tenant.config.TenantProvisioningProperties;
import com.seatgate.tenant.model.TeamRecord;
import com.seatgate.tenant.model.UserRecord;
import com.seatgate.tenant.model.UserRole;
import com.seatgate.tenant.repository.TeamRepository;
import com.seatgate.tenant.repository.UserRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * 外部 ID に対応するチームとユーザーを一度だけ作成する。
 *
 * <p>作成はチームと管理者ユーザーを同一トランザクションで挿入する。users.external_id の一意制約に
 * 負けた場合はトランザクションをロールバックし、勝者の行を読み直して返す。
 */
@Service
@RequiredArgsConstructor
public class TenantProvisioner {

  private static final Logger logger = LoggerFactory.getLogger(TenantProvisioner.class);

  static final String OPERATION = "ensure_tenant";
  static final String FALLBACK_TEAM_NAME = "My Team";
  static final int MAX_EXTERNAL_ID_LENGTH = 255;
  static final int MAX_EMAIL_LENGTH = 320;
  static final int MAX_NAME_LENGTH = 200;

  private final TeamRepository teamRepository;
  private final UserRepository userRepository;
  private final TransactionTemplate transactionTemplate;
  private final TenantProvisioningProperties properties;
  private final TenantMetrics metrics;
  private final Clock clock;

  public ProvisioningResult ensureTenant(@NonNull EnsureTenantRequest request) {
    validateRequest(request);

    final String externalId = request.externalId();
    boolean conflicted = false;
    for (int attempt = 1; attempt <= properties.maxAttempts(); attempt++) {
      final Optional<UserRecord> existing = findExisting(externalId);
      if (existing.isPresent()) {
        final UserRecord user = existing.get();
        if (conflicted) {
          logger.info(
              "tenant provisioning conflict resolved teamId={} userId={} attempt={}",
              user.teamId(),
              user.userId(),
              attempt);
          metrics.recordProvision(TenantMetrics.RESULT_CONFLICT_RESOLVED);
        } else {
          metrics.recordProvision(TenantMetrics.RESULT_EXISTING);
        }
        return new ProvisioningResult(user.teamId(), user.userId(), false);
      }

      try {
        final UserRecord created = transactionTemplate.execute(status -> createTenant(request));
        logger.info(
            "tenant provisioned teamId={} userId={}", created.teamId(), created.userId());
        metrics.recordProvision(TenantMetrics.RESULT_CREATED);
        return new ProvisioningResult(created.teamId(), created.userId(), true);
      } catch (DataIntegrityViolationException ex) {
        // 同じ外部 ID を別の呼び出しが先に確定させた。次の周回で勝者を読む
        conflicted = true;
        logger.debug("tenant provisioning lost insert race attempt={}", attempt, ex);
      } catch (RuntimeException ex) {
        throw translate(ex);
      }
    }

    logger.warn(
        "tenant provisioning did not converge maxAttempts={}", properties.maxAttempts());
    metrics.recordStoreUnavailable(OPERATION);
    throw new TenantStoreUnavailableException(
        OPERATION, "tenant provisioning did not converge, retry later");
  }

  private Optional<UserRecord> findExisting(String externalId) {
    try {
      return userRepository.findByExternalId(externalId);
    } catch (RuntimeException ex) {
      throw translate(ex);
    }
  }

  private UserRecord createTenant(EnsureTenantRequest request) {
    final Instant now = Instant.now(clock);
    final TeamRecord team =
        teamRepository.insert(
            new TeamRecord(
                UUID.randomUUID().toString(),
                resolveTeamName(request.teamNameHint(), request.displayName()),
                properties.defaultPlan(),
                now,
                now));
    return userRepository.insert(
        new UserRecord(
            UUID.randomUUID().toString(),
            request.externalId(),
            request.email().trim(),
            truncateName(blankToNull(request.displayName())),
            UserRole.ADMIN,
            team.teamId(),
            now));
  }

  static String resolveTeamName(String teamNameHint, String displayName) {
    final String name;
    if (!isBlank(teamNameHint)) {
      name = teamNameHint.trim();
    } else if (!isBlank(displayName)) {
      name = displayName.trim() + "'s Team";
    } else {
      name = FALLBACK_TEAM_NAME;
    }
    return truncateName(name);
  }

  // IdP 由来の名前は拒否せず列幅に合わせて切り詰める
  static String truncateName(String name) {
    if (name == null || name.length() <= MAX_NAME_LENGTH) {
      return name;
    }
    return name.substring(0, MAX_NAME_LENGTH);
  }

  private RuntimeException translate(RuntimeException ex) {
    if (ex instanceof TenantStoreUnavailableException) {
      return ex;
    }
    if (TenantStoreFailures.isUnavailable(ex)) {
      logger.warn("tenant store unavailable operation={}", OPERATION, ex);
      metrics.recordStoreUnavailable(OPERATION);
      return new TenantStoreUnavailableException(OPERATION, "tenant store is unavailable", ex);
    }
    return ex;
  }

  private void validateRequest(EnsureTenantRequest request) {
    if (isBlank(request.externalId())) {
      throw new IllegalArgumentException("externalId is required");
    }
    if (request.externalId().length() > MAX_EXTERNAL_ID_LENGTH) {
      throw new IllegalArgumentException("externalId is too long");
    }
    if (isBlank(request.email())) {
      throw new IllegalArgumentException("email is required");
    }
    if (!request.email().contains("@")) {
      throw new IllegalArgumentException("email is invalid");
    }
    if (request.email().trim().length() > MAX_EMAIL_LENGTH) {
      throw new IllegalArgumentException("email is too long");
    }
  }

  private static String blankToNull(String value) {
    return isBlank(value) ? null : value.trim();
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
