package com.seatgate.gateway_bff.service;

// 認証済みだが tenant 側にユーザー (所属チーム) が存在しない。
public class TenantNotProvisionedException extends RuntimeException {

  public TenantNotProvisionedException(String message) {
    super(message);
  }
}
