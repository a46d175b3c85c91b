/*
 * どこで: Gateway-BFF サービス層
 * 何を: チームごとの課金状態をキャッシュし、取得失敗時は前回値を古い値として返す
 * なぜ: 課金基盤の一時障害で有料ユーザーを締め出さず、かつ古さに上限を設けるため
 */
package com.seatgate.gateway_bff.service;

import com.google.common.annotations.VisibleForTesting;
import com.seatgate.gateway_bff.config.BillingClientProperties;
import com.seatgate.gateway_bff.model.BillingSnapshot;
import com.seatgate.gateway_bff.model.BillingSnapshotView;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "Clock と下流クライアントは Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class BillingSnapshotService {

  private static final Logger logger = LoggerFactory.getLogger(BillingSnapshotService.class);

  private final BillingAuthorityClient billingAuthorityClient;
  private final BillingClientProperties properties;
  private final GatewayMetrics gatewayMetrics;
  private final Clock clock;
  private final ConcurrentMap<String, CacheEntry> entries = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Object> teamLocks = new ConcurrentHashMap<>();
  // 取得中に届いた無効化を取りこぼさないための世代番号
  private final ConcurrentMap<String, Long> invalidationGenerations = new ConcurrentHashMap<>();

  public BillingSnapshotService(
      BillingAuthorityClient billingAuthorityClient,
      BillingClientProperties properties,
      GatewayMetrics gatewayMetrics,
      Clock clock) {
    this.billingAuthorityClient = billingAuthorityClient;
    this.properties = properties;
    this.gatewayMetrics = gatewayMetrics;
    this.clock = clock;
  }

  /**
   * 役割:
   * - チームの課金状態を返す。
   *
   * 期待動作:
   * - 再利用期間内のエントリは課金基盤へ問い合わせずに返す。
   * - 同一チームの同時ミスは 1 回の取得にまとめる。
   * - 取得に失敗した場合、古さの上限内の前回値があれば stale=true で返す。
   * - 前回値が無い、または上限を超えている場合は empty (未確定) を返す。
   */
  public Optional<BillingSnapshotView> getBillingSnapshot(String teamId) {
    if (teamId == null || teamId.isBlank()) {
      throw new IllegalArgumentException("teamId is required");
    }
    final CacheEntry cached = entries.get(teamId);
    if (isReusable(cached, clock.instant())) {
      gatewayMetrics.recordBillingFetch("cached");
      return Optional.of(cached.toView(teamId));
    }
    synchronized (lockFor(teamId)) {
      final CacheEntry current = entries.get(teamId);
      final Instant now = clock.instant();
      if (isReusable(current, now)) {
        gatewayMetrics.recordBillingFetch("cached");
        return Optional.of(current.toView(teamId));
      }
      return fetch(teamId, current, now);
    }
  }

  /** 次回の参照で必ず再取得させる。前回値はフォールバック用に残し、取得中の結果も無効扱いにする。 */
  public void invalidate(String teamId) {
    if (teamId == null || teamId.isBlank()) {
      throw new IllegalArgumentException("teamId is required");
    }
    invalidationGenerations.merge(teamId, 1L, Long::sum);
    entries.computeIfPresent(teamId, (key, entry) -> entry.markInvalidated());
    logger.info("billing snapshot invalidated teamId={}", teamId);
  }

  /** キャッシュ済みの全チームを再取得する。戻り値は試行したチーム数。 */
  public int refreshKnownTeams() {
    final List<String> teamIds = List.copyOf(entries.keySet());
    for (String teamId : teamIds) {
      synchronized (lockFor(teamId)) {
        final CacheEntry current = entries.get(teamId);
        if (current != null) {
          fetch(teamId, current, clock.instant());
        }
      }
    }
    if (!teamIds.isEmpty()) {
      logger.debug("billing snapshots refreshed count={}", teamIds.size());
    }
    return teamIds.size();
  }

  @VisibleForTesting
  int cachedTeamCount() {
    return entries.size();
  }

  private Optional<BillingSnapshotView> fetch(String teamId, CacheEntry previous, Instant now) {
    final long generation = invalidationGenerations.getOrDefault(teamId, 0L);
    try {
      final BillingSnapshot snapshot = billingAuthorityClient.fetchSnapshot(teamId);
      final boolean invalidatedMeanwhile =
          invalidationGenerations.getOrDefault(teamId, 0L) != generation;
      final CacheEntry entry = new CacheEntry(snapshot, now, now, false, invalidatedMeanwhile);
      entries.put(teamId, entry);
      gatewayMetrics.recordBillingFetch(snapshot.status().isPresent() ? "fresh" : "not_found");
      return Optional.of(entry.toView(teamId));
    } catch (BillingIntegrationException ex) {
      if (previous != null && withinMaxStaleness(previous, now)) {
        logger.warn(
            "billing fetch failed, serving last known snapshot teamId={} reason={} fetchedAt={}",
            teamId,
            ex.reason(),
            previous.fetchedAt());
        final CacheEntry stale =
            new CacheEntry(
                previous.snapshot(),
                previous.fetchedAt(),
                now,
                true,
                invalidationGenerations.getOrDefault(teamId, 0L) != generation);
        entries.put(teamId, stale);
        gatewayMetrics.recordBillingFetch("stale");
        return Optional.of(stale.toView(teamId));
      }
      logger.warn(
          "billing fetch failed without usable snapshot teamId={} reason={}", teamId, ex.reason());
      evict(teamId);
      gatewayMetrics.recordBillingFetch("unavailable");
      return Optional.empty();
    }
  }

  private boolean isReusable(CacheEntry entry, Instant now) {
    return entry != null
        && !entry.invalidated()
        && !now.isAfter(entry.checkedAt().plus(properties.reuseWindow()))
        && withinMaxStaleness(entry, now);
  }

  private boolean withinMaxStaleness(CacheEntry entry, Instant now) {
    return !now.isAfter(entry.fetchedAt().plus(properties.maxStaleness()));
  }

  // 古さの上限を超えて取得にも失敗したチームは定期再取得の対象から外す
  private void evict(String teamId) {
    if (entries.remove(teamId) != null) {
      logger.info("billing snapshot evicted teamId={}", teamId);
    }
    invalidationGenerations.remove(teamId);
    teamLocks.remove(teamId);
  }

  private Object lockFor(String teamId) {
    return teamLocks.computeIfAbsent(teamId, ignored -> new Object());
  }

  // fetchedAt: 最後に取得に成功した時刻 / checkedAt: 最後に取得を試みた時刻
  private record CacheEntry(
      BillingSnapshot snapshot,
      Instant fetchedAt,
      Instant checkedAt,
      boolean stale,
      boolean invalidated) {

    CacheEntry markInvalidated() {
      return new CacheEntry(snapshot, fetchedAt, checkedAt, stale, true);
    }

    BillingSnapshotView toView(String teamId) {
      return new BillingSnapshotView(teamId, snapshot, fetchedAt, stale);
    }
  }
}
