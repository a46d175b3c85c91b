/*
 * どこで: Tenant サービス層
 * 何を: テナントストアへ到達できない/一時的に失敗したことを表す
 * なぜ: 「存在しない」と「確認できない」を呼び出し側で取り違えないようにするため
 */
package com.seatgate.tenant.service;

public class TenantStoreUnavailableException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  private final String operation;

  public TenantStoreUnavailableException(String operation, String message) {
    super(message);
    this.operation = operation;
  }

  public TenantStoreUnavailableException(String operation, String message, Throwable cause) {
    super(message, cause);
    this.operation = operation;
  }

  public String operation() {
    return operation;
  }
}
