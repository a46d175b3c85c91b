package com.seatgate.gateway_bff.model;

/** tenant サービスで解決済みのユーザーと所属チーム。 */
public record TenantUser(
    String userId, String externalId, String email, String displayName, String role, String teamId) {}
