/*
 * どこで: Gateway-BFF 認証フロー
 * 何を: OIDC ログイン成功直後にテナント (チームとユーザー) を保証する
 * なぜ: 初回ログインの利用者が必ず 1 つのチームに所属した状態で保護ルートへ進めるようにするため
 */
package com.seatgate.gateway_bff.service;

import com.seatgate.gateway_bff.config.AccessGateProperties;
import com.seatgate.gateway_bff.model.ExternalIdentity;
import com.seatgate.gateway_bff.service.dto.TenantEnsureResponse;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.core.Authentication;
import org.springframework.security.web.authentication.SavedRequestAwareAuthenticationSuccessHandler;
import org.springframework.stereotype.Component;

@Component
public class TenantLoginSuccessHandler extends SavedRequestAwareAuthenticationSuccessHandler {

  private static final Logger logger = LoggerFactory.getLogger(TenantLoginSuccessHandler.class);

  private final OidcPrincipalMapper oidcPrincipalMapper;
  private final TenantClient tenantClient;
  private final GatewayMetrics gatewayMetrics;

  public TenantLoginSuccessHandler(
      OidcPrincipalMapper oidcPrincipalMapper,
      TenantClient tenantClient,
      GatewayMetrics gatewayMetrics,
      AccessGateProperties accessGateProperties) {
    this.oidcPrincipalMapper = oidcPrincipalMapper;
    this.tenantClient = tenantClient;
    this.gatewayMetrics = gatewayMetrics;
    setDefaultTargetUrl(accessGateProperties.postLoginPath());
  }

  /**
   * 役割:
   * - ログインした利用者のチームとユーザーを tenant に保証させる。
   *
   * 期待動作:
   * - 失敗してもログイン自体は継続する。保護ルート側のゲートが未所属を検出して誘導する。
   */
  @Override
  public void onAuthenticationSuccess(
      HttpServletRequest request, HttpServletResponse response, Authentication authentication)
      throws IOException, ServletException {
    ensureTenant(authentication);
    super.onAuthenticationSuccess(request, response, authentication);
  }

  void ensureTenant(Authentication authentication) {
    final ExternalIdentity identity = oidcPrincipalMapper.map(authentication);
    try {
      final TenantEnsureResponse result = tenantClient.ensureTenant(identity, null);
      gatewayMetrics.recordLoginResult(result.created() ? "provisioned" : "existing");
      logger.info(
          "login tenant ensured teamId={} userId={} created={}",
          result.teamId(),
          result.userId(),
          result.created());
    } catch (TenantIntegrationException ex) {
      logger.warn("login tenant provisioning failed reason={}", ex.reason(), ex);
      gatewayMetrics.recordLoginResult("provision_failed");
      gatewayMetrics.recordTenantIntegrationError("TENANT_" + ex.reason().name());
    }
  }
}
