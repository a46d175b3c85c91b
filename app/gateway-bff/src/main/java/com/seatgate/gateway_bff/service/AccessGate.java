/*
 * どこで: Gateway-BFF サービス層
 * 何を: 本人解決と課金状態の入力からアクセス可否を決める状態機械
 * なぜ: 入力が揃うまでは拒否せず、揃った後も入力が変わるたびに判定し直すため
 */
package com.seatgate.gateway_bff.service;

import com.seatgate.gateway_bff.model.AccessDecision;
import com.seatgate.gateway_bff.model.AccessReason;
import com.seatgate.gateway_bff.model.BillingSnapshotView;
import com.seatgate.gateway_bff.model.IdentityState;
import com.seatgate.gateway_bff.model.SnapshotState;

/**
 * 1 リクエスト (1 利用者) 単位で生成して使う。スレッドセーフではない。
 *
 * <p>本人解決または課金状態が LOADING の間は DENIED を返さない。
 */
public final class AccessGate {

  private final String subscribePath;
  private final String missingTenantPath;
  private IdentityState identity = IdentityState.loading();
  private SnapshotState snapshot = SnapshotState.loading();
  private AccessDecision decision = AccessDecision.loading(AccessReason.IDENTITY_PENDING);

  public AccessGate(String subscribePath, String missingTenantPath) {
    if (subscribePath == null || missingTenantPath == null) {
      throw new IllegalArgumentException("redirect paths are required");
    }
    this.subscribePath = subscribePath;
    this.missingTenantPath = missingTenantPath;
  }

  public AccessDecision onIdentity(IdentityState identityState) {
    if (identityState == null) {
      throw new IllegalArgumentException("identityState is required");
    }
    this.identity = identityState;
    return evaluate();
  }

  public AccessDecision onSnapshot(SnapshotState snapshotState) {
    if (snapshotState == null) {
      throw new IllegalArgumentException("snapshotState is required");
    }
    this.snapshot = snapshotState;
    return evaluate();
  }

  public AccessDecision current() {
    return decision;
  }

  private AccessDecision evaluate() {
    decision =
        switch (identity.kind()) {
          case LOADING -> AccessDecision.loading(AccessReason.IDENTITY_PENDING);
          case UNAVAILABLE -> AccessDecision.loading(AccessReason.IDENTITY_UNAVAILABLE);
          case NOT_FOUND -> AccessDecision.denied(AccessReason.MISSING_TENANT, missingTenantPath);
          case FOUND -> evaluateSnapshot();
        };
    return decision;
  }

  private AccessDecision evaluateSnapshot() {
    return switch (snapshot.kind()) {
      case LOADING -> AccessDecision.loading(AccessReason.BILLING_PENDING);
      case NONE -> AccessDecision.denied(AccessReason.MISSING_TENANT, missingTenantPath);
      case PRESENT -> evaluatePresent(snapshot.view());
    };
  }

  private AccessDecision evaluatePresent(BillingSnapshotView view) {
    if (view.snapshot().grantsAccess()) {
      return AccessDecision.granted().withBillingFlags(view);
    }
    return AccessDecision.denied(AccessReason.SUBSCRIPTION_INACTIVE, subscribePath)
        .withBillingFlags(view);
  }
}
