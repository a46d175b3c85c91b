/*
 * どこで: app/tenant/src/main/java/com/seatgate/tenant/api/ApiErrorResponse.java
 * 何を: API エラー応答の共通 DTO
 * なぜ: エラー形式を統一し、BFF 側で機械的に処理できるようにするため
 */
package com.seatgate.tenant.api;

public record ApiErrorResponse(
        ApiErrorCode code,
        String message) {
}
