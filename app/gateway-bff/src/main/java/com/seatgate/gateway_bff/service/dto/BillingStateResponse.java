package com.seatgate.gateway_bff.service.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/** 課金基盤の応答。件数が省略された場合は 0 とみなす。 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record BillingStateResponse(
    String subscriptionStatus, Integer seatCount, Integer activeMemberCount) {}
