package com.seatgate.gateway_bff.service;

// 課金基盤から状態を得られなかったことを表す。呼び出し側は前回値へフォールバックする。
public class BillingIntegrationException extends RuntimeException {

  public enum Reason {
    UNAUTHORIZED,
    BAD_GATEWAY,
    TIMEOUT,
    INVALID_RESPONSE
  }

  private final Reason reason;

  public BillingIntegrationException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public BillingIntegrationException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
