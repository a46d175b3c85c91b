/*
 * どこで: Gateway-BFF サービス層
 * 何を: tenant サービスの内部 API (プロビジョニングと本人解決) を呼び出す
 * なぜ: ログイン時のチーム作成とアクセス判定時のユーザー解決を BFF から行うため
 */
package com.seatgate.gateway_bff.service;

import com.seatgate.common.InternalApiHeaders;
import com.seatgate.gateway_bff.config.TenantClientProperties;
import com.seatgate.gateway_bff.model.ExternalIdentity;
import com.seatgate.gateway_bff.model.TenantUser;
import com.seatgate.gateway_bff.service.dto.TenantEnsureRequest;
import com.seatgate.gateway_bff.service.dto.TenantEnsureResponse;
import com.seatgate.gateway_bff.service.dto.TenantIdentityResponse;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.SocketTimeoutException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

@Service
public class TenantClient {

  private static final Logger logger = LoggerFactory.getLogger(TenantClient.class);

  private final RestClient tenantRestClient;
  private final TenantClientProperties properties;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  public TenantClient(RestClient tenantRestClient, TenantClientProperties properties) {
    this.tenantRestClient = tenantRestClient;
    this.properties = properties;
  }

  /**
   * 役割:
   * - 外部 ID に対応するチームとユーザーを保証する (無ければ作成)。
   *
   * 期待動作:
   * - 同じ外部 ID で何度呼んでも同じ組を返す。
   * - tenant 側の 503 は UNAVAILABLE として呼び出し元へ伝える。
   */
  public TenantEnsureResponse ensureTenant(ExternalIdentity identity, String teamNameHint) {
    if (identity == null || isBlank(identity.externalId())) {
      throw new IllegalArgumentException("externalId is required");
    }
    final TenantEnsureRequest request =
        new TenantEnsureRequest(
            identity.externalId(), identity.email(), identity.displayName(), teamNameHint);
    try {
      final TenantEnsureResponse response =
          tenantRestClient
              .post()
              .uri(properties.ensureTenantPath())
              .headers(this::applyInternalHeaders)
              .body(request)
              .retrieve()
              .body(TenantEnsureResponse.class);
      if (response == null || isBlank(response.teamId()) || isBlank(response.userId())) {
        logger.warn("tenant ensureTenant response validation failed");
        throw new TenantIntegrationException(
            TenantIntegrationException.Reason.INVALID_RESPONSE, "tenant response is invalid");
      }
      return response;
    } catch (RestClientResponseException ex) {
      throw mapResponseException("ensureTenant", ex);
    } catch (ResourceAccessException ex) {
      throw mapResourceException("ensureTenant", ex);
    } catch (TenantIntegrationException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      logger.warn("tenant ensureTenant response parse failed", ex);
      throw new TenantIntegrationException(
          TenantIntegrationException.Reason.INVALID_RESPONSE, "tenant response parse failed", ex);
    }
  }

  /** 外部 ID からユーザーを引く。未登録 (404) は empty。 */
  public Optional<TenantUser> findUserByExternalId(String externalId) {
    if (isBlank(externalId)) {
      throw new IllegalArgumentException("externalId is required");
    }
    try {
      final TenantIdentityResponse response =
          tenantRestClient
              .get()
              .uri(properties.getIdentityPath(), externalId)
              .headers(this::applyInternalHeaders)
              .retrieve()
              .body(TenantIdentityResponse.class);
      if (response == null || isBlank(response.userId()) || isBlank(response.teamId())) {
        logger.warn("tenant findUser response validation failed");
        throw new TenantIntegrationException(
            TenantIntegrationException.Reason.INVALID_RESPONSE, "tenant response is invalid");
      }
      return Optional.of(
          new TenantUser(
              response.userId(),
              response.externalId(),
              response.email(),
              response.displayName(),
              response.role(),
              response.teamId()));
    } catch (RestClientResponseException ex) {
      if (ex.getStatusCode().value() == 404) {
        return Optional.empty();
      }
      throw mapResponseException("findUser", ex);
    } catch (ResourceAccessException ex) {
      throw mapResourceException("findUser", ex);
    } catch (TenantIntegrationException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      logger.warn("tenant findUser response parse failed", ex);
      throw new TenantIntegrationException(
          TenantIntegrationException.Reason.INVALID_RESPONSE, "tenant response parse failed", ex);
    }
  }

  private void applyInternalHeaders(HttpHeaders headers) {
    headers.set(properties.internalApiHeaderName(), properties.internalApiToken());
    final String requestId = MDC.get("request_id");
    if (!isBlank(requestId)) {
      headers.set(InternalApiHeaders.REQUEST_ID, requestId);
    }
  }

  private TenantIntegrationException mapResponseException(
      String operation, RestClientResponseException ex) {
    logger.warn(
        "tenant {} failed with http status={} statusText={}",
        operation,
        ex.getStatusCode().value(),
        ex.getStatusText());
    final int status = ex.getStatusCode().value();
    if (status == 401 || status == 403) {
      return new TenantIntegrationException(
          TenantIntegrationException.Reason.UNAUTHORIZED, "tenant rejected internal auth", ex);
    }
    if (status == 400) {
      return new TenantIntegrationException(
          TenantIntegrationException.Reason.BAD_REQUEST, "tenant rejected request", ex);
    }
    if (status == 503) {
      return new TenantIntegrationException(
          TenantIntegrationException.Reason.UNAVAILABLE, "tenant store unavailable", ex);
    }
    if (ex.getStatusCode().is5xxServerError()) {
      return new TenantIntegrationException(
          TenantIntegrationException.Reason.BAD_GATEWAY, "tenant server error", ex);
    }
    return new TenantIntegrationException(
        TenantIntegrationException.Reason.BAD_GATEWAY, "tenant request failed", ex);
  }

  private TenantIntegrationException mapResourceException(
      String operation, ResourceAccessException ex) {
    if (isTimeout(ex)) {
      logger.warn("tenant {} timed out", operation);
      return new TenantIntegrationException(
          TenantIntegrationException.Reason.TIMEOUT, "tenant request timeout", ex);
    }
    logger.warn("tenant {} connection failed", operation, ex);
    return new TenantIntegrationException(
        TenantIntegrationException.Reason.BAD_GATEWAY, "tenant connection failed", ex);
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
