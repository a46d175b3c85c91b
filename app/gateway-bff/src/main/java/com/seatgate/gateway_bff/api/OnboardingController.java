/*
 * どこで: Gateway-BFF API
 * 何を: ログイン中の利用者のチームを作成 (または既存を返す) する
 * なぜ: ログイン時のプロビジョニングが失敗した利用者が missing-tenant 画面から復帰できるようにするため
 */
package com.seatgate.gateway_bff.api;

import com.seatgate.gateway_bff.api.request.OnboardingRequest;
import com.seatgate.gateway_bff.api.response.OnboardingResponse;
import com.seatgate.gateway_bff.service.OidcPrincipalMapper;
import com.seatgate.gateway_bff.service.TenantClient;
import com.seatgate.gateway_bff.service.dto.TenantEnsureResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class OnboardingController {

  private final OidcPrincipalMapper oidcPrincipalMapper;
  private final TenantClient tenantClient;

  @PostMapping("/v1/onboarding")
  public ResponseEntity<OnboardingResponse> onboard(
      @RequestBody(required = false) OnboardingRequest request, Authentication authentication) {
    final String teamName = request == null ? null : request.teamName();
    final TenantEnsureResponse result =
        tenantClient.ensureTenant(oidcPrincipalMapper.map(authentication), teamName);
    final HttpStatus status = result.created() ? HttpStatus.CREATED : HttpStatus.OK;
    return ResponseEntity.status(status).body(OnboardingResponse.from(result));
  }
}
