package com.seatgate.gateway_bff.model;

import java.time.Instant;

/** キャッシュから返す課金状態。stale は取得失敗により前回値を返していることを示す。 */
public record BillingSnapshotView(
    String teamId, BillingSnapshot snapshot, Instant fetchedAt, boolean stale) {}
