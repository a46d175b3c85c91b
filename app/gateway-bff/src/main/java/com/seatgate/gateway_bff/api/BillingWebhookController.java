package com.seatgate.gateway_bff.api;

import com.seatgate.gateway_bff.api.request.BillingWebhookRequest;
import com.seatgate.gateway_bff.config.BillingClientProperties;
import com.seatgate.gateway_bff.service.BillingSnapshotService;
import jakarta.servlet.http.HttpServletRequest;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

// 課金基盤からの変更通知。ペイロードは解釈せず、該当チームのキャッシュを無効化するだけ。
@RestController
@RequiredArgsConstructor
public class BillingWebhookController {

  private final BillingClientProperties properties;
  private final BillingSnapshotService billingSnapshotService;

  @PostMapping("/api/webhooks/billing")
  public ResponseEntity<Void> billingChanged(
      @RequestBody BillingWebhookRequest request, HttpServletRequest httpRequest) {
    verifyToken(httpRequest.getHeader(properties.webhookTokenHeaderName()));
    if (request == null || request.teamId() == null || request.teamId().isBlank()) {
      throw new IllegalArgumentException("teamId is required");
    }
    billingSnapshotService.invalidate(request.teamId());
    return ResponseEntity.noContent().build();
  }

  // トークン未設定の環境では常に拒否する
  private void verifyToken(String provided) {
    final String expected = properties.webhookToken();
    if (expected.isBlank() || provided == null) {
      throw new WebhookUnauthorizedException("webhook token is missing");
    }
    if (!MessageDigest.isEqual(
        expected.getBytes(StandardCharsets.UTF_8), provided.getBytes(StandardCharsets.UTF_8))) {
      throw new WebhookUnauthorizedException("webhook token is invalid");
    }
  }
}
