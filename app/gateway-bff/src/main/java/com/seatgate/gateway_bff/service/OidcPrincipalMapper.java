package com.seatgate.gateway_bff.service;

import com.seatgate.gateway_bff.model.ExternalIdentity;
import org.springframework.security.core.Authentication;
import org.springframework.security.oauth2.client.authentication.OAuth2AuthenticationToken;
import org.springframework.security.oauth2.core.oidc.user.OidcUser;
import org.springframework.stereotype.Component;

// Authentication を ExternalIdentity へ正規化する。sub / email / name 以外は参照しない。
@Component
public class OidcPrincipalMapper {

  public ExternalIdentity map(Authentication authentication) {
    if (!(authentication instanceof OAuth2AuthenticationToken oauth2Auth)) {
      throw new IllegalArgumentException("authentication must be OAuth2AuthenticationToken");
    }
    if (!(oauth2Auth.getPrincipal() instanceof OidcUser oidcUser)) {
      throw new IllegalArgumentException("principal must be OidcUser");
    }
    final String subject = oidcUser.getSubject();
    if (isBlank(subject)) {
      throw new IllegalArgumentException("sub is required");
    }
    return new ExternalIdentity(
        subject, blankToNull(oidcUser.getEmail()), blankToNull(oidcUser.getFullName()));
  }

  private String blankToNull(String value) {
    return isBlank(value) ? null : value.trim();
  }

  private boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
