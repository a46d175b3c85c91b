package com.seatgate.gateway_bff.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.seatgate.gateway_bff.model.ExternalIdentity;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.security.authentication.TestingAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.oauth2.client.authentication.OAuth2AuthenticationToken;
import org.springframework.security.oauth2.core.oidc.OidcIdToken;
import org.springframework.security.oauth2.core.oidc.user.DefaultOidcUser;

class OidcPrincipalMapperTest {

  private final OidcPrincipalMapper mapper = new OidcPrincipalMapper();

  @Test
  void mapRejectsNonOAuth2Authentication() {
    final TestingAuthenticationToken auth = new TestingAuthenticationToken("u", "p");

    assertThatThrownBy(() -> mapper.map(auth))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("authentication must be OAuth2AuthenticationToken");
  }

  @Test
  void mapRejectsMissingSubject() {
    final OAuth2AuthenticationToken auth = token(Map.of("sub", " "));

    assertThatThrownBy(() -> mapper.map(auth))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("sub is required");
  }

  @Test
  void mapExtractsSubjectEmailAndName() {
    final OAuth2AuthenticationToken auth =
        token(Map.of("sub", "ユーザー-1", "email", "tést+1@example.com", "name", "山田 太郎"));

    final ExternalIdentity identity = mapper.map(auth);

    assertThat(identity.externalId()).isEqualTo("ユーザー-1");
    assertThat(identity.email()).isEqualTo("tést+1@example.com");
    assertThat(identity.displayName()).isEqualTo("山田 太郎");
  }

  @Test
  void mapLeavesMissingOptionalClaimsNull() {
    final ExternalIdentity identity = mapper.map(token(Map.of("sub", "u1", "name", " ")));

    assertThat(identity.externalId()).isEqualTo("u1");
    assertThat(identity.email()).isNull();
    assertThat(identity.displayName()).isNull();
  }

  private static OAuth2AuthenticationToken token(Map<String, Object> extraClaims) {
    final Instant now = Instant.now();
    final Map<String, Object> claims = new HashMap<>(extraClaims);
    claims.put("iss", "http://keycloak.localhost/realms/seatgate");
    claims.put("aud", List.of("gateway-bff"));
    final OidcIdToken idToken = new OidcIdToken("id-token", now, now.plusSeconds(600), claims);
    final DefaultOidcUser principal =
        new DefaultOidcUser(List.of(new SimpleGrantedAuthority("ROLE_USER")), idToken);
    return new OAuth2AuthenticationToken(principal, principal.getAuthorities(), "keycloak");
  }
}
