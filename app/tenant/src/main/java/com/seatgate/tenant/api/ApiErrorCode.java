/*
 * どこで: Tenant API
 * 何を: エラー応答のコードを定義する
 * なぜ: 同じ HTTP ステータスでも原因を区別できるようにするため
 */
package com.seatgate.tenant.api;

public enum ApiErrorCode {
    BAD_REQUEST,
    USER_NOT_FOUND,
    TEAM_NOT_FOUND,
    STORE_UNAVAILABLE
}
