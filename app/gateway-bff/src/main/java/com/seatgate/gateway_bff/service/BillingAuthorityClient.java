package com.seatgate.gateway_bff.service;

import com.seatgate.gateway_bff.config.BillingClientProperties;
import com.seatgate.gateway_bff.model.BillingSnapshot;
import com.seatgate.gateway_bff.model.SubscriptionStatus;
import com.seatgate.gateway_bff.service.dto.BillingStateResponse;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.SocketTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

// 課金基盤からチームの課金状態を読み取る。書き込みは行わない。
@Service
public class BillingAuthorityClient {

  private static final Logger logger = LoggerFactory.getLogger(BillingAuthorityClient.class);

  private final RestClient billingRestClient;
  private final BillingClientProperties properties;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  public BillingAuthorityClient(
      RestClient billingRestClient, BillingClientProperties properties) {
    this.billingRestClient = billingRestClient;
    this.properties = properties;
  }

  public BillingSnapshot fetchSnapshot(String teamId) {
    if (isBlank(teamId)) {
      throw new IllegalArgumentException("teamId is required");
    }
    try {
      final BillingStateResponse response =
          billingRestClient
              .get()
              .uri(properties.snapshotPath(), teamId)
              .headers(this::applyAuthorization)
              .retrieve()
              .body(BillingStateResponse.class);
      return toSnapshot(response);
    } catch (RestClientResponseException ex) {
      if (ex.getStatusCode().value() == 404) {
        logger.debug("billing record not found teamId={}", teamId);
        return BillingSnapshot.noBillingRecord();
      }
      throw mapResponseException(ex);
    } catch (ResourceAccessException ex) {
      throw mapResourceException(ex);
    } catch (BillingIntegrationException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      logger.warn("billing response parse failed", ex);
      throw new BillingIntegrationException(
          BillingIntegrationException.Reason.INVALID_RESPONSE, "billing response parse failed", ex);
    }
  }

  private BillingSnapshot toSnapshot(BillingStateResponse response) {
    if (response == null) {
      throw new BillingIntegrationException(
          BillingIntegrationException.Reason.INVALID_RESPONSE, "billing response is empty");
    }
    final int seatCount = response.seatCount() == null ? 0 : response.seatCount();
    final int activeMemberCount =
        response.activeMemberCount() == null ? 0 : response.activeMemberCount();
    if (seatCount < 0 || activeMemberCount < 0) {
      throw new BillingIntegrationException(
          BillingIntegrationException.Reason.INVALID_RESPONSE, "billing counts are negative");
    }
    final SubscriptionStatus status;
    try {
      status = SubscriptionStatus.fromWireValue(response.subscriptionStatus());
    } catch (IllegalArgumentException ex) {
      logger.warn("billing returned unsupported status={}", response.subscriptionStatus());
      throw new BillingIntegrationException(
          BillingIntegrationException.Reason.INVALID_RESPONSE, ex.getMessage(), ex);
    }
    return new BillingSnapshot(status, seatCount, activeMemberCount);
  }

  private void applyAuthorization(HttpHeaders headers) {
    if (!isBlank(properties.apiToken())) {
      headers.setBearerAuth(properties.apiToken());
    }
  }

  private BillingIntegrationException mapResponseException(RestClientResponseException ex) {
    logger.warn(
        "billing fetchSnapshot failed with http status={} statusText={}",
        ex.getStatusCode().value(),
        ex.getStatusText());
    final int status = ex.getStatusCode().value();
    if (status == 401 || status == 403) {
      return new BillingIntegrationException(
          BillingIntegrationException.Reason.UNAUTHORIZED, "billing rejected credentials", ex);
    }
    if (ex.getStatusCode().is5xxServerError()) {
      return new BillingIntegrationException(
          BillingIntegrationException.Reason.BAD_GATEWAY, "billing server error", ex);
    }
    return new BillingIntegrationException(
        BillingIntegrationException.Reason.BAD_GATEWAY, "billing request failed", ex);
  }

  private BillingIntegrationException mapResourceException(ResourceAccessException ex) {
    if (isTimeout(ex)) {
      logger.warn("billing fetchSnapshot timed out");
      return new BillingIntegrationException(
          BillingIntegrationException.Reason.TIMEOUT, "billing request timeout", ex);
    }
    logger.warn("billing fetchSnapshot connection failed", ex);
    return new BillingIntegrationException(
        BillingIntegrationException.Reason.BAD_GATEWAY, "billing connection failed", ex);
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }

  private boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
