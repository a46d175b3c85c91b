/*
 * どこで: Gateway-BFF サービス層
 * 何を: リクエストごとに AccessGate を組み立て、本人解決と課金状態を流し込む
 * なぜ: 保護ルートと /v1/access で同じ判定を使うため
 */
package com.seatgate.gateway_bff.service;

import com.seatgate.gateway_bff.config.AccessGateProperties;
import com.seatgate.gateway_bff.model.AccessDecision;
import com.seatgate.gateway_bff.model.IdentityState;
import com.seatgate.gateway_bff.model.SnapshotState;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.core.Authentication;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class AccessDecisionService {

  private static final Logger logger = LoggerFactory.getLogger(AccessDecisionService.class);

  private final IdentityResolutionService identityResolutionService;
  private final BillingSnapshotService billingSnapshotService;
  private final AccessGateProperties properties;
  private final GatewayMetrics gatewayMetrics;

  public AccessDecision decide(Authentication authentication) {
    final AccessGate gate =
        new AccessGate(properties.subscribePath(), properties.missingTenantPath());
    final IdentityState identity = identityResolutionService.resolve(authentication);
    gate.onIdentity(identity);
    switch (identity.kind()) {
      case FOUND -> gate.onSnapshot(
          billingSnapshotService
              .getBillingSnapshot(identity.user().teamId())
              .map(SnapshotState::present)
              .orElseGet(SnapshotState::loading));
      case NOT_FOUND -> gate.onSnapshot(SnapshotState.none());
      default -> {
        // 本人未確定のまま課金状態は参照しない
      }
    }
    final AccessDecision decision = gate.current();
    gatewayMetrics.recordAccessDecision(decision);
    logger.debug(
        "access decision state={} reason={} stale={}",
        decision.state(),
        decision.reason(),
        decision.stale());
    return decision;
  }
}
