package com.seatgate.tenant.api;

public class UserNotFoundException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public UserNotFoundException() {
    super("user not found");
  }
}
