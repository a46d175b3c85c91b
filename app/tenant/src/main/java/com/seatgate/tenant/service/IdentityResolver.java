package com.seatgate.tenant.service;

import com.seatgate.tenant.model.UserRecord;
import com.seatgate.tenant.repository.UserRepository;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class IdentityResolver {

  private static final Logger logger = LoggerFactory.getLogger(IdentityResolver.class);
  private static final String OPERATION = "resolve_identity";

  private final UserRepository userRepository;
  private final TenantMetrics metrics;

  /**
   * 役割:
   * - 外部 ID から内部ユーザーを読み取る。書き込みは行わない。
   *
   * 期待動作:
   * - 未登録なら空を返す。
   * - ストアに到達できない場合は空ではなく TenantStoreUnavailableException を投げる。
   */
  public Optional<UserRecord> resolve(String externalId) {
    if (externalId == null || externalId.isBlank()) {
      throw new IllegalArgumentException("externalId is required");
    }
    try {
      return userRepository.findByExternalId(externalId);
    } catch (RuntimeException ex) {
      if (!TenantStoreFailures.isUnavailable(ex)) {
        throw ex;
      }
      logger.warn("tenant store unavailable operation={}", OPERATION, ex);
      metrics.recordStoreUnavailable(OPERATION);
      throw new TenantStoreUnavailableException(OPERATION, "tenant store is unavailable", ex);
    }
  }
}
