/*
 * どこで: Gateway-BFF 設定
 * 何を: tenant 呼び出し専用 RestClient を提供する
 * なぜ: 下流サービスごとに baseUrl とタイムアウトの設定責務を分離するため
 */
package com.seatgate.gateway_bff.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
@EnableConfigurationProperties(TenantClientProperties.class)
public class TenantClientConfig {

  @Bean
  RestClient tenantRestClient(RestClient.Builder builder, TenantClientProperties properties) {
    final SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(properties.connectTimeout());
    requestFactory.setReadTimeout(properties.readTimeout());
    return builder.baseUrl(properties.baseUrl()).requestFactory(requestFactory).build();
  }
}
