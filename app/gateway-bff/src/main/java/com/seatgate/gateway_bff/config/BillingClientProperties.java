/*
 * どこで: Gateway-BFF 設定
 * 何を: 課金基盤の呼び出し先とキャッシュ鮮度の設定を保持する
 * なぜ: 再利用期間と古さの上限を環境ごとに調整するため
 */
package com.seatgate.gateway_bff.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "billing")
public record BillingClientProperties(
    String baseUrl,
    String snapshotPath,
    String apiToken,
    Duration connectTimeout,
    Duration readTimeout,
    Duration reuseWindow,
    Duration maxStaleness,
    Boolean refreshEnabled,
    Duration refreshInterval,
    String webhookToken,
    String webhookTokenHeaderName) {

  public BillingClientProperties {
    baseUrl = baseUrl == null ? "http://billing:80" : baseUrl;
    snapshotPath =
        snapshotPath == null || snapshotPath.isBlank()
            ? "/v1/teams/{teamId}/billing"
            : snapshotPath;
    apiToken = apiToken == null ? "" : apiToken;
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(2) : connectTimeout;
    readTimeout = readTimeout == null ? Duration.ofSeconds(3) : readTimeout;
    reuseWindow = reuseWindow == null ? Duration.ofSeconds(30) : reuseWindow;
    maxStaleness = maxStaleness == null ? Duration.ofMinutes(15) : maxStaleness;
    refreshEnabled = refreshEnabled != null && refreshEnabled;
    refreshInterval = refreshInterval == null ? Duration.ofMinutes(5) : refreshInterval;
    webhookToken = webhookToken == null ? "" : webhookToken;
    webhookTokenHeaderName =
        webhookTokenHeaderName == null || webhookTokenHeaderName.isBlank()
            ? "X-Webhook-Token"
            : webhookTokenHeaderName;
  }
}
