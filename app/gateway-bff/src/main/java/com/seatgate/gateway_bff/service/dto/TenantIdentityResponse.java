/*
 * どこで: Gateway-BFF サービス DTO
 * 何を: tenant の GET /identities/{externalId} 応答
 * なぜ: 下流の JSON 形をアプリ内モデル TenantUser と分離するため
 */
package com.seatgate.gateway_bff.service.dto;

public record TenantIdentityResponse(
    String userId,
    String externalId,
    String email,
    String displayName,
    String role,
    String teamId) {}
