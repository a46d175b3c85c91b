/*
 * どこで: Tenant サービス層
 * 何を: テナント作成結果とストア障害のメトリクスを記録する
 * なぜ: 競合解決の頻度とストア停止を運用で監視できるようにするため
 */
package com.seatgate.tenant.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class TenantMetrics {

  static final String RESULT_CREATED = "created";
  static final String RESULT_EXISTING = "existing";
  static final String RESULT_CONFLICT_RESOLVED = "conflict_resolved";

  private static final String METRIC_PROVISION_TOTAL = "tenant.provision.total";
  private static final String METRIC_STORE_UNAVAILABLE_TOTAL = "tenant.store.unavailable.total";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> provisionCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> unavailableCounters = new ConcurrentHashMap<>();

  public TenantMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  public void recordProvision(String result) {
    provisionCounters
        .computeIfAbsent(
            result,
            ignored ->
                Counter.builder(METRIC_PROVISION_TOTAL)
                    .description("Tenant provisioning outcomes")
                    .tags(Tags.of("result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void recordStoreUnavailable(String operation) {
    unavailableCounters
        .computeIfAbsent(
            operation,
            ignored ->
                Counter.builder(METRIC_STORE_UNAVAILABLE_TOTAL)
                    .description("Tenant store operations that failed as unavailable")
                    .tags(Tags.of("operation", operation))
                    .register(meterRegistry))
        .increment();
  }
}
