package com.seatgate.gateway_bff.service.dto;

public record TenantEnsureResponse(String teamId, String userId, boolean created) {}
