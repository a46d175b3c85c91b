/*
 * どこで: Gateway-BFF モデル
 * 何を: アクセスゲートの判定結果
 * なぜ: 表示・リダイレクト・バナー表示の判断材料を一つの値で返すため
 */
package com.seatgate.gateway_bff.model;

public record AccessDecision(
    AccessState state,
    AccessReason reason,
    String redirectPath,
    boolean hasBillingIssue,
    boolean exceedsSeats,
    boolean stale) {

  public AccessDecision {
    if (state == null || reason == null) {
      throw new IllegalArgumentException("state and reason are required");
    }
    if ((state == AccessState.DENIED) != (redirectPath != null)) {
      throw new IllegalArgumentException("redirectPath must be present exactly when DENIED");
    }
  }

  public static AccessDecision loading(AccessReason reason) {
    return new AccessDecision(AccessState.LOADING, reason, null, false, false, false);
  }

  public static AccessDecision denied(AccessReason reason, String redirectPath) {
    return new AccessDecision(AccessState.DENIED, reason, redirectPath, false, false, false);
  }

  public static AccessDecision granted() {
    return new AccessDecision(AccessState.GRANTED, AccessReason.NONE, null, false, false, false);
  }

  public AccessDecision withBillingFlags(BillingSnapshotView view) {
    final BillingSnapshot snapshot = view.snapshot();
    return new AccessDecision(
        state,
        reason,
        redirectPath,
        snapshot.hasBillingIssue(),
        snapshot.exceedsSeats(),
        view.stale());
  }
}
