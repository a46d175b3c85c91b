/*
 * どこで: app/tenant/src/main/java/com/seatgate/tenant/model/TeamRecord.java
 * 何を: teams テーブル相当のドメインレコード
 * なぜ: Service/Repository 間でチーム情報の受け渡しを明確にするため
 */
package com.seatgate.tenant.model;

import java.time.Instant;

public record TeamRecord(
        String teamId,
        String name,
        String plan,
        Instant createdAt,
        Instant updatedAt) {
}
