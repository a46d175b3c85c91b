package com.seatgate.gateway_bff.model;

public enum AccessState {
  LOADING,
  DENIED,
  GRANTED
}
