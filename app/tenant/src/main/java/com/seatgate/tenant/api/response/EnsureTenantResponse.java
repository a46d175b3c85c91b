package com.seatgate.tenant.api.response;

import com.seatgate.tenant.service.ProvisioningResult;

public record EnsureTenantResponse(String teamId, String userId, boolean created) {

  public static EnsureTenantResponse from(ProvisioningResult result) {
    return new EnsureTenantResponse(result.teamId(), result.userId(), result.created());
  }
}
