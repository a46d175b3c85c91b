/*
 * どこで: Gateway-BFF API 応答
 * 何を: GET /v1/billing の出力 DTO
 * なぜ: 画面が請求問題バナーと席数超過バナーを出し分けられるようにするため
 */
package com.seatgate.gateway_bff.api.response;

import com.seatgate.gateway_bff.model.BillingSnapshot;
import com.seatgate.gateway_bff.model.BillingSnapshotView;
import com.seatgate.gateway_bff.model.SubscriptionStatus;
import java.time.Instant;

public record BillingSnapshotResponse(
    String teamId,
    String subscriptionStatus,
    int seatCount,
    int activeMemberCount,
    boolean hasBillingIssue,
    boolean exceedsSeats,
    boolean stale,
    Instant fetchedAt) {

  public static BillingSnapshotResponse from(BillingSnapshotView view) {
    final BillingSnapshot snapshot = view.snapshot();
    return new BillingSnapshotResponse(
        view.teamId(),
        snapshot.status().map(SubscriptionStatus::wireValue).orElse(null),
        snapshot.seatCount(),
        snapshot.activeMemberCount(),
        snapshot.hasBillingIssue(),
        snapshot.exceedsSeats(),
        view.stale(),
        view.fetchedAt());
  }
}
