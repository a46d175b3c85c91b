package com.seatgate.gateway_bff.api.response;

import com.seatgate.gateway_bff.model.AccessDecision;

public record AccessDecisionResponse(
    String state,
    String reason,
    String redirectPath,
    boolean hasBillingIssue,
    boolean exceedsSeats,
    boolean stale) {

  public static AccessDecisionResponse from(AccessDecision decision) {
    return new AccessDecisionResponse(
        decision.state().name(),
        decision.reason().name(),
        decision.redirectPath(),
        decision.hasBillingIssue(),
        decision.exceedsSeats(),
        decision.stale());
  }
}
