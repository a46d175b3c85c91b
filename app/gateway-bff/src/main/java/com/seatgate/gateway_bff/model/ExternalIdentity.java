/*
 * どこで: app/gateway-bff/src/main/java/com/seatgate/gateway_bff/model/ExternalIdentity.java
 * 何を: IdP が検証済みの利用者情報のうち、テナント解決に使う項目だけを保持する
 * なぜ: OIDC の型を業務処理へ持ち込まずにテストできるようにするため
 */
package com.seatgate.gateway_bff.model;

public record ExternalIdentity(
        String externalId,
        String email,
        String displayName) {
}
