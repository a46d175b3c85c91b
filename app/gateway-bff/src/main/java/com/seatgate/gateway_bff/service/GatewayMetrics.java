/*
 * どこで: Gateway-BFF サービス層
 * 何を: ログイン導線、下流連携エラー、課金取得、アクセス判定のメトリクスを記録する
 * なぜ: 保護ルートの LOADING 増加や課金基盤の劣化を Prometheus から直接観測できるようにするため
 */
package com.seatgate.gateway_bff.service;

import com.seatgate.gateway_bff.model.AccessDecision;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class GatewayMetrics {

  private static final String METRIC_LOGIN_TOTAL = "gateway.login.total";
  private static final String METRIC_TENANT_INTEGRATION_ERROR_TOTAL =
      "gateway.tenant.integration.error.total";
  private static final String METRIC_BILLING_FETCH_TOTAL = "gateway.billing.fetch.total";
  private static final String METRIC_ACCESS_DECISION_TOTAL = "gateway.access.decision.total";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> loginCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> tenantErrorCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> billingFetchCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> accessDecisionCounters = new ConcurrentHashMap<>();

  public GatewayMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  public void recordLoginResult(String result) {
    loginCounters
        .computeIfAbsent(
            result,
            ignored ->
                Counter.builder(METRIC_LOGIN_TOTAL)
                    .description("Gateway login outcomes")
                    .tags(Tags.of("result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void recordTenantIntegrationError(String code) {
    tenantErrorCounters
        .computeIfAbsent(
            code,
            ignored ->
                Counter.builder(METRIC_TENANT_INTEGRATION_ERROR_TOTAL)
                    .description("Gateway tenant integration errors by code")
                    .tags(Tags.of("code", code))
                    .register(meterRegistry))
        .increment();
  }

  /** result: fresh / cached / stale / unavailable / not_found */
  public void recordBillingFetch(String result) {
    billingFetchCounters
        .computeIfAbsent(
            result,
            ignored ->
                Counter.builder(METRIC_BILLING_FETCH_TOTAL)
                    .description("Gateway billing snapshot lookups by result")
                    .tags(Tags.of("result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void recordAccessDecision(AccessDecision decision) {
    final String state = decision.state().name().toLowerCase(Locale.ROOT);
    final String reason = decision.reason().name().toLowerCase(Locale.ROOT);
    final String key = state + "|" + reason;
    accessDecisionCounters
        .computeIfAbsent(
            key,
            ignored ->
                Counter.builder(METRIC_ACCESS_DECISION_TOTAL)
                    .description("Gateway access gate decisions")
                    .tags(Tags.of("state", state, "reason", reason))
                    .register(meterRegistry))
        .increment();
  }
}
