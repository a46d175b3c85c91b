package com.seatgate.tenant.config;

import com.seatgate.common.InternalApiHeaders;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "tenant.internal-api")
public record TenantInternalApiProperties(String headerName, String token) {

  public TenantInternalApiProperties {
    headerName =
        headerName == null || headerName.isBlank() ? InternalApiHeaders.INTERNAL_TOKEN : headerName;
    token = token == null ? "" : token;
  }
}
