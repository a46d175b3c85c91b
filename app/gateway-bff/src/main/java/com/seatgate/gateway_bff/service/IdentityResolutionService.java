package com.seatgate.gateway_bff.service;

import com.seatgate.gateway_bff.model.ExternalIdentity;
import com.seatgate.gateway_bff.model.IdentityState;
import com.seatgate.gateway_bff.model.TenantUser;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.core.Authentication;
import org.springframework.stereotype.Service;

// 認証 principal を tenant 側のユーザーと所属チームへ解決する。
@Service
@RequiredArgsConstructor
public class IdentityResolutionService {

  private static final Logger logger = LoggerFactory.getLogger(IdentityResolutionService.class);

  private final OidcPrincipalMapper oidcPrincipalMapper;
  private final TenantClient tenantClient;
  private final GatewayMetrics gatewayMetrics;

  /** アクセス判定用。tenant に届かない場合は例外ではなく UNAVAILABLE を返す。 */
  public IdentityState resolve(Authentication authentication) {
    final ExternalIdentity identity = oidcPrincipalMapper.map(authentication);
    try {
      return tenantClient
          .findUserByExternalId(identity.externalId())
          .map(IdentityState::found)
          .orElseGet(IdentityState::notFound);
    } catch (TenantIntegrationException ex) {
      logger.warn("identity resolution unavailable reason={}", ex.reason());
      gatewayMetrics.recordTenantIntegrationError("TENANT_" + ex.reason().name());
      return IdentityState.unavailable();
    }
  }

  /** API 用。未登録は TenantNotProvisionedException、連携エラーはそのまま伝える。 */
  public TenantUser requireUser(Authentication authentication) {
    final ExternalIdentity identity = oidcPrincipalMapper.map(authentication);
    return tenantClient
        .findUserByExternalId(identity.externalId())
        .orElseThrow(() -> new TenantNotProvisionedException("tenant is not provisioned"));
  }
}
