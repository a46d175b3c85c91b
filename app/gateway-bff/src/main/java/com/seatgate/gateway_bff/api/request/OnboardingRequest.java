package com.seatgate.gateway_bff.api.request;

public record OnboardingRequest(String teamName) {}
