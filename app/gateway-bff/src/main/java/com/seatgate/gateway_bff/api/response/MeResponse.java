package com.seatgate.gateway_bff.api.response;

import com.seatgate.gateway_bff.model.TenantUser;

public record MeResponse(
    String userId, String email, String displayName, String role, String teamId) {

  public static MeResponse from(TenantUser user) {
    return new MeResponse(
        user.userId(), user.email(), user.displayName(), user.role(), user.teamId());
  }
}
