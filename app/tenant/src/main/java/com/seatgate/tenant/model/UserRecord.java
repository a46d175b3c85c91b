/*
 * どこで: app/tenant/src/main/java/com/seatgate/tenant/model/UserRecord.java
 * 何を: users テーブル相当のドメインレコード
 * なぜ: externalId と所属チームの対応を一つの値で扱うため
 */
package com.seatgate.tenant.model;

import java.time.Instant;

public record UserRecord(
        String userId,
        String externalId,
        String email,
        String displayName,
        UserRole role,
        String teamId,
        Instant createdAt) {
}
