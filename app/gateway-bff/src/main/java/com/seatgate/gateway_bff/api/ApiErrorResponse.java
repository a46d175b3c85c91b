package com.seatgate.gateway_bff.api;

public record ApiErrorResponse(String code, String message) {}
