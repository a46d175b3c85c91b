/*
 * どこで: Gateway-BFF 設定
 * 何を: tenant サービス呼び出し設定を保持する
 * なぜ: BFF からの下流 URL・パス・内部トークンを外部化するため
 */
package com.seatgate.gateway_bff.config;

import com.seatgate.common.InternalApiHeaders;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "tenant")
public record TenantClientProperties(
    String baseUrl,
    String internalApiToken,
    String internalApiHeaderName,
    String ensureTenantPath,
    String getIdentityPath,
    Duration connectTimeout,
    Duration readTimeout) {

  public TenantClientProperties {
    baseUrl = baseUrl == null ? "http://tenant:80" : baseUrl;
    internalApiToken = internalApiToken == null ? "" : internalApiToken;
    internalApiHeaderName =
        internalApiHeaderName == null || internalApiHeaderName.isBlank()
            ? InternalApiHeaders.INTERNAL_TOKEN
            : internalApiHeaderName;
    ensureTenantPath =
        ensureTenantPath == null || ensureTenantPath.isBlank()
            ? "/tenants:ensure"
            : ensureTenantPath;
    getIdentityPath =
        getIdentityPath == null || getIdentityPath.isBlank()
            ? "/identities/{externalId}"
            : getIdentityPath;
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(2) : connectTimeout;
    readTimeout = readTimeout == null ? Duration.ofSeconds(3) : readTimeout;
  }
}
