package com.seatgate.gateway_bff.api;

import com.seatgate.gateway_bff.service.GatewayMetrics;
import com.seatgate.gateway_bff.service.TenantIntegrationException;
import com.seatgate.gateway_bff.service.TenantNotProvisionedException;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
@RequiredArgsConstructor
public class GatewayApiExceptionHandler {

  private final GatewayMetrics gatewayMetrics;

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ApiErrorResponse> handleBadRequest(IllegalArgumentException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("BAD_REQUEST", ex.getMessage()));
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("BAD_REQUEST", "request body is invalid"));
  }

  @ExceptionHandler(TenantNotProvisionedException.class)
  public ResponseEntity<ApiErrorResponse> handleNotProvisioned(TenantNotProvisionedException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ApiErrorResponse("TENANT_NOT_FOUND", ex.getMessage()));
  }

  @ExceptionHandler(BillingPendingException.class)
  public ResponseEntity<ApiErrorResponse> handleBillingPending(BillingPendingException ex) {
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .header(HttpHeaders.RETRY_AFTER, "2")
        .body(new ApiErrorResponse("BILLING_PENDING", ex.getMessage()));
  }

  @ExceptionHandler(WebhookUnauthorizedException.class)
  public ResponseEntity<ApiErrorResponse> handleWebhookUnauthorized(
      WebhookUnauthorizedException ex) {
    return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
        .body(new ApiErrorResponse("WEBHOOK_UNAUTHORIZED", ex.getMessage()));
  }

  @ExceptionHandler(TenantIntegrationException.class)
  public ResponseEntity<ApiErrorResponse> handleTenantIntegration(TenantIntegrationException ex) {
    final String code =
        switch (ex.reason()) {
          case UNAUTHORIZED -> "TENANT_UNAUTHORIZED";
          case BAD_REQUEST -> "TENANT_BAD_REQUEST";
          case UNAVAILABLE -> "TENANT_UNAVAILABLE";
          case TIMEOUT -> "TENANT_TIMEOUT";
          case INVALID_RESPONSE -> "TENANT_INVALID_RESPONSE";
          case BAD_GATEWAY -> "TENANT_BAD_GATEWAY";
        };
    final HttpStatus status =
        switch (ex.reason()) {
          case UNAUTHORIZED, INVALID_RESPONSE, BAD_GATEWAY -> HttpStatus.BAD_GATEWAY;
          case BAD_REQUEST -> HttpStatus.BAD_REQUEST;
          case UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
          case TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
        };
    gatewayMetrics.recordTenantIntegrationError(code);
    return ResponseEntity.status(status).body(new ApiErrorResponse(code, ex.getMessage()));
  }
}
