package com.seatgate.gateway_bff.service;

public class TenantIntegrationException extends RuntimeException {

  public enum Reason {
    UNAUTHORIZED,
    BAD_REQUEST,
    UNAVAILABLE,
    BAD_GATEWAY,
    TIMEOUT,
    INVALID_RESPONSE
  }

  private final Reason reason;

  public TenantIntegrationException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public TenantIntegrationException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
