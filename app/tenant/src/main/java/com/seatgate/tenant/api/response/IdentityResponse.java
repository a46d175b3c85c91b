/*
 * どこで: app/tenant/src/main/java/com/seatgate/tenant/api/response/IdentityResponse.java
 * 何を: GET /identities/{externalId} の出力 DTO
 * なぜ: BFF が所属チームと役割を一度の呼び出しで得られるようにするため
 */
package com.seatgate.tenant.api.response;

import com.seatgate.tenant.model.UserRecord;

public record IdentityResponse(
        String userId,
        String externalId,
        String email,
        String displayName,
        String role,
        String teamId) {

    public static IdentityResponse from(UserRecord user) {
        return new IdentityResponse(
                user.userId(),
                user.externalId(),
                user.email(),
                user.displayName(),
                user.role().dbValue(),
                user.teamId());
    }
}
