/*
 * どこで: Gateway-BFF モデル
 * 何を: アクセスゲートへ渡す本人解決の状態
 * なぜ: 「未登録」と「確認できない」を別の状態として扱うため
 */
package com.seatgate.gateway_bff.model;

public record IdentityState(Kind kind, TenantUser user) {

  public enum Kind {
    LOADING,
    FOUND,
    NOT_FOUND,
    UNAVAILABLE
  }

  public IdentityState {
    if (kind == null) {
      throw new IllegalArgumentException("kind is required");
    }
    if ((kind == Kind.FOUND) != (user != null)) {
      throw new IllegalArgumentException("user must be present exactly when kind is FOUND");
    }
  }

  public static IdentityState loading() {
    return new IdentityState(Kind.LOADING, null);
  }

  public static IdentityState found(TenantUser user) {
    return new IdentityState(Kind.FOUND, user);
  }

  public static IdentityState notFound() {
    return new IdentityState(Kind.NOT_FOUND, null);
  }

  public static IdentityState unavailable() {
    return new IdentityState(Kind.UNAVAILABLE, null);
  }
}
