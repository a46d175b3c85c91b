package com.seatgate.tenant.api;

import com.seatgate.tenant.api.response.IdentityResponse;
import com.seatgate.tenant.service.IdentityResolver;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class IdentityController {

  private final IdentityResolver identityResolver;

  @GetMapping("/identities/{externalId}")
  public IdentityResponse getIdentity(@PathVariable String externalId) {
    return identityResolver
        .resolve(externalId)
        .map(IdentityResponse::from)
        .orElseThrow(UserNotFoundException::new);
  }
}
