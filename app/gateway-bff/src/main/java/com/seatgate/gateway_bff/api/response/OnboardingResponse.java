package com.seatgate.gateway_bff.api.response;

import com.seatgate.gateway_bff.service.dto.TenantEnsureResponse;

public record OnboardingResponse(String teamId, String userId, boolean created) {

  public static OnboardingResponse from(TenantEnsureResponse result) {
    return new OnboardingResponse(result.teamId(), result.userId(), result.created());
  }
}
