package com.seatgate.gateway_bff.service.dto;

public record TenantEnsureRequest(
    String externalId, String email, String displayName, String teamNameHint) {}
