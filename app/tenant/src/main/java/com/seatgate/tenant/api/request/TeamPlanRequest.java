package com.seatgate.tenant.api.request;

public record TeamPlanRequest(String plan) {}
