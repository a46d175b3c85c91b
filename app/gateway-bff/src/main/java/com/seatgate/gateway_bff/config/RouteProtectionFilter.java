/*
 * どこで: Gateway-BFF セキュリティフィルタ
 * 何を: 保護ルートへのリクエストをアクセスゲートの判定に従って通過・リダイレクト・保留させる
 * なぜ: 課金状態が確定する前に利用者を購読画面へ飛ばさないため
 */
package com.seatgate.gateway_bff.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.seatgate.gateway_bff.api.ApiErrorResponse;
import com.seatgate.gateway_bff.model.AccessDecision;
import com.seatgate.gateway_bff.service.AccessDecisionService;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

/** Bean 登録せず、セキュリティフィルタチェーンの認可フィルタの後ろにだけ組み込む。 */
public class RouteProtectionFilter extends OncePerRequestFilter {

  private static final Logger logger = LoggerFactory.getLogger(RouteProtectionFilter.class);

  private final AccessGateProperties properties;
  private final AccessDecisionService accessDecisionService;
  private final ObjectMapper objectMapper;

  public RouteProtectionFilter(
      AccessGateProperties properties,
      AccessDecisionService accessDecisionService,
      ObjectMapper objectMapper) {
    this.properties = properties;
    this.accessDecisionService = accessDecisionService;
    this.objectMapper = objectMapper;
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    return !properties.isProtected(pathWithinApplication(request));
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    final Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
    if (authentication == null
        || !authentication.isAuthenticated()
        || authentication instanceof AnonymousAuthenticationToken) {
      // 未認証は認可フィルタが既に弾いている
      filterChain.doFilter(request, response);
      return;
    }
    final AccessDecision decision = accessDecisionService.decide(authentication);
    switch (decision.state()) {
      case GRANTED -> filterChain.doFilter(request, response);
      case DENIED -> {
        logger.info(
            "protected route denied path={} reason={} redirect={}",
            pathWithinApplication(request),
            decision.reason(),
            decision.redirectPath());
        response.sendRedirect(request.getContextPath() + decision.redirectPath());
      }
      case LOADING -> writePending(response, decision);
    }
  }

  private void writePending(HttpServletResponse response, AccessDecision decision)
      throws IOException {
    response.setStatus(HttpStatus.SERVICE_UNAVAILABLE.value());
    response.setHeader(
        HttpHeaders.RETRY_AFTER, Long.toString(properties.loadingRetryAfter().toSeconds()));
    response.setContentType(MediaType.APPLICATION_JSON_VALUE);
    objectMapper.writeValue(
        response.getOutputStream(),
        new ApiErrorResponse("ACCESS_PENDING", "access decision is pending: " + decision.reason()));
  }

  private String pathWithinApplication(HttpServletRequest request) {
    final String uri = request.getRequestURI();
    final String contextPath = request.getContextPath();
    if (contextPath != null && !contextPath.isEmpty() && uri.startsWith(contextPath)) {
      return uri.substring(contextPath.length());
    }
    return uri;
  }
}
