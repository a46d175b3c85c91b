package com.seatgate.gateway_bff.api;

public class WebhookUnauthorizedException extends RuntimeException {

  public WebhookUnauthorizedException(String message) {
    super(message);
  }
}
