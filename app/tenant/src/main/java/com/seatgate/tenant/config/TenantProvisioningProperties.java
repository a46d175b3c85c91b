/*
 * どこで: Tenant 設定
 * 何を: テナント作成の再試行上限と初期プランを保持する
 * なぜ: 競合時の再読込回数と課金前の仮プランを環境ごとに調整するため
 */
package com.seatgate.tenant.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "tenant.provisioning")
public record TenantProvisioningProperties(Integer maxAttempts, String defaultPlan) {

  public TenantProvisioningProperties {
    maxAttempts = maxAttempts == null || maxAttempts < 1 ? 3 : maxAttempts;
    defaultPlan = defaultPlan == null || defaultPlan.isBlank() ? "active" : defaultPlan;
  }
}
