/*
 * どこで: Gateway-BFF サービス層テスト
 * 何を: アクセスゲートの状態遷移を検証する
 * なぜ: 入力が揃う前に DENIED を返して有料ユーザーを購読画面へ飛ばす退行を防ぐため
 */
package com.seatgate.gateway_bff.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.seatgate.gateway_bff.model.AccessDecision;
import com.seatgate.gateway_bff.model.AccessReason;
import com.seatgate.gateway_bff.model.AccessState;
import com.seatgate.gateway_bff.model.BillingSnapshot;
import com.seatgate.gateway_bff.model.BillingSnapshotView;
import com.seatgate.gateway_bff.model.IdentityState;
import com.seatgate.gateway_bff.model.SnapshotState;
import com.seatgate.gateway_bff.model.SubscriptionStatus;
import com.seatgate.gateway_bff.model.TenantUser;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class AccessGateTest {

  private static final TenantUser USER =
      new TenantUser("user-1", "u1", "a@x.com", null, "admin", "team-1");

  private final AccessGate gate = new AccessGate("/subscribe", "/onboarding?reason=missing-tenant");

  @Test
  void startsInLoading() {
    assertThat(gate.current().state()).isEqualTo(AccessState.LOADING);
    assertThat(gate.current().redirectPath()).isNull();
  }

  @Test
  void neverDeniesWhileIdentityIsLoadingOrUnavailable() {
    assertThat(gate.onSnapshot(present(SubscriptionStatus.CANCELED, false)).state())
        .isEqualTo(AccessState.LOADING);

    final AccessDecision unavailable = gate.onIdentity(IdentityState.unavailable());

    assertThat(unavailable.state()).isEqualTo(AccessState.LOADING);
    assertThat(unavailable.reason()).isEqualTo(AccessReason.IDENTITY_UNAVAILABLE);
  }

  @Test
  void neverDeniesWhileSnapshotIsLoading() {
    final AccessDecision decision = gate.onIdentity(IdentityState.found(USER));

    assertThat(decision.state()).isEqualTo(AccessState.LOADING);
    assertThat(decision.reason()).isEqualTo(AccessReason.BILLING_PENDING);
  }

  @Test
  void activeSubscriptionGrantsAccess() {
    gate.onIdentity(IdentityState.found(USER));

    final AccessDecision decision = gate.onSnapshot(present(SubscriptionStatus.ACTIVE, false));

    assertThat(decision.state()).isEqualTo(AccessState.GRANTED);
    assertThat(decision.reason()).isEqualTo(AccessReason.NONE);
  }

  @Test
  void staleTrialingSnapshotStillGrantsAccessAndCarriesStaleFlag() {
    gate.onIdentity(IdentityState.found(USER));

    final AccessDecision decision = gate.onSnapshot(present(SubscriptionStatus.TRIALING, true));

    assertThat(decision.state()).isEqualTo(AccessState.GRANTED);
    assertThat(decision.stale()).isTrue();
  }

  @Test
  void pastDueIsDeniedWithBillingIssueFlag() {
    gate.onIdentity(IdentityState.found(USER));

    final AccessDecision decision = gate.onSnapshot(present(SubscriptionStatus.PAST_DUE, false));

    assertThat(decision.state()).isEqualTo(AccessState.DENIED);
    assertThat(decision.redirectPath()).isEqualTo("/subscribe");
    assertThat(decision.reason()).isEqualTo(AccessReason.SUBSCRIPTION_INACTIVE);
    assertThat(decision.hasBillingIssue()).isTrue();
  }

  @Test
  void missingBillingRecordIsDenied() {
    gate.onIdentity(IdentityState.found(USER));

    final AccessDecision decision =
        gate.onSnapshot(
            SnapshotState.present(
                new BillingSnapshotView(
                    "team-1", BillingSnapshot.noBillingRecord(), Instant.EPOCH, false)));

    assertThat(decision.state()).isEqualTo(AccessState.DENIED);
    assertThat(decision.redirectPath()).isEqualTo("/subscribe");
  }

  @Test
  void identityWithoutTenantRedirectsToMissingTenant() {
    gate.onIdentity(IdentityState.notFound());

    final AccessDecision decision = gate.onSnapshot(SnapshotState.none());

    assertThat(decision.state()).isEqualTo(AccessState.DENIED);
    assertThat(decision.reason()).isEqualTo(AccessReason.MISSING_TENANT);
    assertThat(decision.redirectPath()).isEqualTo("/onboarding?reason=missing-tenant");
  }

  @Test
  void laterSnapshotFlipsDecisionBothWays() {
    gate.onIdentity(IdentityState.found(USER));

    assertThat(gate.onSnapshot(present(SubscriptionStatus.ACTIVE, false)).state())
        .isEqualTo(AccessState.GRANTED);
    assertThat(gate.onSnapshot(present(SubscriptionStatus.CANCELED, false)).state())
        .isEqualTo(AccessState.DENIED);
    assertThat(gate.onSnapshot(present(SubscriptionStatus.ACTIVE, false)).state())
        .isEqualTo(AccessState.GRANTED);
    assertThat(gate.current().state()).isEqualTo(AccessState.GRANTED);
  }

  @Test
  void seatOverageIsReportedWithoutBlockingAccess() {
    gate.onIdentity(IdentityState.found(USER));

    final AccessDecision decision =
        gate.onSnapshot(
            SnapshotState.present(
                new BillingSnapshotView(
                    "team-1",
                    new BillingSnapshot(SubscriptionStatus.ACTIVE, 5, 7),
                    Instant.EPOCH,
                    false)));

    assertThat(decision.state()).isEqualTo(AccessState.GRANTED);
    assertThat(decision.exceedsSeats()).isTrue();
  }

  private static SnapshotState present(SubscriptionStatus status, boolean stale) {
    return SnapshotState.present(
        new BillingSnapshotView(
            "team-1", new BillingSnapshot(status, 5, 5), Instant.EPOCH, stale));
  }
}
