/*
 * どこで: 共通ユーティリティ
 * 何を: gateway-bff と tenant 間の内部 API で使うヘッダ名を定義する
 * なぜ: 送信側と受信側で同じ名前を参照するため
 */
package com.seatgate.common;

public final class InternalApiHeaders {
  private InternalApiHeaders() {}

  public static final String INTERNAL_TOKEN = "X-Internal-Token";
  public static final String REQUEST_ID = "X-Request-Id";
}
