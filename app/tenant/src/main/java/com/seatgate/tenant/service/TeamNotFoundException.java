package com.seatgate.tenant.service;

public class TeamNotFoundException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public TeamNotFoundException(String teamId) {
    super("team not found: " + teamId);
  }
}
