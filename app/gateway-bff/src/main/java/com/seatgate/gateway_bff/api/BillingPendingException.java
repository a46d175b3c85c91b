package com.seatgate.gateway_bff.api;

// 課金状態がまだ確定していない (取得失敗かつ使える前回値が無い)。
public class BillingPendingException extends RuntimeException {

  public BillingPendingException(String message) {
    super(message);
  }
}
