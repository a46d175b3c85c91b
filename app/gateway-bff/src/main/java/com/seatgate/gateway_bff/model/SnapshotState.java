package com.seatgate.gateway_bff.model;

/**
 * アクセスゲートへ渡す課金状態。
 *
 * <p>NONE はチームが存在せず、参照すべき課金状態が無いことを表す。
 */
public record SnapshotState(Kind kind, BillingSnapshotView view) {

  public enum Kind {
    LOADING,
    PRESENT,
    NONE
  }

  public SnapshotState {
    if (kind == null) {
      throw new IllegalArgumentException("kind is required");
    }
    if ((kind == Kind.PRESENT) != (view != null)) {
      throw new IllegalArgumentException("view must be present exactly when kind is PRESENT");
    }
  }

  public static SnapshotState loading() {
    return new SnapshotState(Kind.LOADING, null);
  }

  public static SnapshotState present(BillingSnapshotView view) {
    return new SnapshotState(Kind.PRESENT, view);
  }

  public static SnapshotState none() {
    return new SnapshotState(Kind.NONE, null);
  }
}
