/*
 * どこで: app/tenant/src/main/java/com/seatgate/tenant/api/request/EnsureTenantRequest.java
 * 何を: POST /tenants:ensure の入力 DTO
 * なぜ: BFF がログイン時に受け取った OIDC claims を API 境界で明示するため
 */
package com.seatgate.tenant.api.request;

public record EnsureTenantRequest(
        String externalId,
        String email,
        String displayName,
        String teamNameHint) {
}
