package com.seatgate.gateway_bff.api.request;

public record BillingWebhookRequest(String teamId) {}
