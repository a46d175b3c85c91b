package com.seatgate.tenant.model;

import java.util.Locale;

/** チーム内でのユーザーの役割。DB には小文字の値で保存する。 */
public enum UserRole {
  ADMIN,
  MEMBER;

  public String dbValue() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static UserRole fromDbValue(String value) {
    if (value == null) {
      throw new IllegalArgumentException("role is required");
    }
    return valueOf(value.toUpperCase(Locale.ROOT));
  }
}
