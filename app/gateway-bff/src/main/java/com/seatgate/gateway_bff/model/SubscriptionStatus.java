/*
 * どこで: Gateway-BFF モデル
 * 何を: 課金基盤が返すサブスクリプション状態を表す
 * なぜ: 文字列比較を散らさず、アクセス可否と請求問題の判定を一か所にまとめるため
 */
package com.seatgate.gateway_bff.model;

import java.util.Locale;

public enum SubscriptionStatus {
  ACTIVE,
  TRIALING,
  PAST_DUE,
  UNPAID,
  CANCELED;

  public String wireValue() {
    return name().toLowerCase(Locale.ROOT);
  }

  public boolean grantsAccess() {
    return this == ACTIVE || this == TRIALING;
  }

  public boolean isBillingIssue() {
    return this == PAST_DUE || this == UNPAID;
  }

  public static SubscriptionStatus fromWireValue(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("subscription status is required");
    }
    for (SubscriptionStatus status : values()) {
      if (status.wireValue().equals(value.trim())) {
        return status;
      }
    }
    throw new IllegalArgumentException("unknown subscription status: " + value);
  }
}
