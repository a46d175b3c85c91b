package com.seatgate.gateway_bff.model;

import java.util.Optional;

/**
 * チーム単位の課金状態。subscriptionStatus が null のときは課金記録が存在しない。
 *
 * <p>席数超過は active のときだけ判定し、1 席分の猶予を残す。
 */
public record BillingSnapshot(
    SubscriptionStatus subscriptionStatus, int seatCount, int activeMemberCount) {

  private static final int SEAT_TOLERANCE = 1;

  public BillingSnapshot {
    if (seatCount < 0) {
      throw new IllegalArgumentException("seatCount must be >= 0");
    }
    if (activeMemberCount < 0) {
      throw new IllegalArgumentException("activeMemberCount must be >= 0");
    }
  }

  public static BillingSnapshot noBillingRecord() {
    return new BillingSnapshot(null, 0, 0);
  }

  public Optional<SubscriptionStatus> status() {
    return Optional.ofNullable(subscriptionStatus);
  }

  public boolean grantsAccess() {
    return subscriptionStatus != null && subscriptionStatus.grantsAccess();
  }

  public boolean hasBillingIssue() {
    return subscriptionStatus != null && subscriptionStatus.isBillingIssue();
  }

  public boolean exceedsSeats() {
    return subscriptionStatus == SubscriptionStatus.ACTIVE
        && activeMemberCount > (long) seatCount + SEAT_TOLERANCE;
  }
}
