package com.seatgate.tenant.api.response;

import com.seatgate.tenant.model.TeamRecord;
import java.time.Instant;

public record TeamResponse(
    String teamId, String name, String plan, Instant createdAt, Instant updatedAt) {

  public static TeamResponse from(TeamRecord team) {
    return new TeamResponse(
        team.teamId(), team.name(), team.plan(), team.createdAt(), team.updatedAt());
  }
}
