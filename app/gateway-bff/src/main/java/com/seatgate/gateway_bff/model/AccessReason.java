package com.seatgate.gateway_bff.model;

// メトリクスのタグと API 応答の両方で使う
public enum AccessReason {
  NONE,
  IDENTITY_PENDING,
  IDENTITY_UNAVAILABLE,
  BILLING_PENDING,
  MISSING_TENANT,
  SUBSCRIPTION_INACTIVE
}
