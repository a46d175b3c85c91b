/*
 * どこで: Tenant API
 * 何を: 例外を HTTP レスポンスへ変換する
 * なぜ: 未登録とストア停止を BFF が取り違えないよう、失敗時の契約を一定に保つため
 */
package com.seatgate.tenant.api;

import com.seatgate.tenant.service.TeamNotFoundException;
import com.seatgate.tenant.service.TenantStoreUnavailableException;
import java.util.Optional;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class TenantApiExceptionHandler {

  private static final String RETRY_AFTER_SECONDS = "1";

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ApiErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
    return badRequest(ex.getMessage());
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
    // JSONパーサの内部文言は露出しない
    final String rawMessage = Optional.ofNullable(ex.getMessage()).orElse("");
    if (rawMessage.contains("Required request body is missing")) {
      return badRequest("request body is required");
    }
    return badRequest("request body is invalid");
  }

  @ExceptionHandler(UserNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleUserNotFound(UserNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ApiErrorResponse(ApiErrorCode.USER_NOT_FOUND, ex.getMessage()));
  }

  @ExceptionHandler(TeamNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleTeamNotFound(TeamNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ApiErrorResponse(ApiErrorCode.TEAM_NOT_FOUND, ex.getMessage()));
  }

  @ExceptionHandler(TenantStoreUnavailableException.class)
  public ResponseEntity<ApiErrorResponse> handleStoreUnavailable(
      TenantStoreUnavailableException ex) {
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .header(HttpHeaders.RETRY_AFTER, RETRY_AFTER_SECONDS)
        .body(new ApiErrorResponse(ApiErrorCode.STORE_UNAVAILABLE, ex.getMessage()));
  }

  private ResponseEntity<ApiErrorResponse> badRequest(String message) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse(ApiErrorCode.BAD_REQUEST, message));
  }
}
