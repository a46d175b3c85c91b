package com.seatgate.tenant.api.request;

public record TeamRenameRequest(String name) {}
