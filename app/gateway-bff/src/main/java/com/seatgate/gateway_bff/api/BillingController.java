package com.seatgate.gateway_bff.api;

import com.seatgate.gateway_bff.api.response.BillingSnapshotResponse;
import com.seatgate.gateway_bff.model.TenantUser;
import com.seatgate.gateway_bff.service.BillingSnapshotService;
import com.seatgate.gateway_bff.service.IdentityResolutionService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class BillingController {

  private final IdentityResolutionService identityResolutionService;
  private final BillingSnapshotService billingSnapshotService;

  /**
   * 役割:
   * - ログイン中の利用者が所属するチームの課金状態を返す。
   *
   * 期待動作:
   * - 課金状態が未確定なら 503 BILLING_PENDING を返す。
   * - 前回値で応答した場合は stale=true を付ける。
   */
  @GetMapping("/v1/billing")
  public ResponseEntity<BillingSnapshotResponse> billing(Authentication authentication) {
    final TenantUser user = identityResolutionService.requireUser(authentication);
    return billingSnapshotService
        .getBillingSnapshot(user.teamId())
        .map(BillingSnapshotResponse::from)
        .map(ResponseEntity::ok)
        .orElseThrow(() -> new BillingPendingException("billing state is not yet determined"));
  }
}
