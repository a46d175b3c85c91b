package com.seatgate.gateway_bff.api;

import com.seatgate.gateway_bff.api.response.MeResponse;
import com.seatgate.gateway_bff.service.IdentityResolutionService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class MeController {

  private final IdentityResolutionService identityResolutionService;

  @GetMapping("/v1/me")
  public ResponseEntity<MeResponse> me(Authentication authentication) {
    return ResponseEntity.ok(MeResponse.from(identityResolutionService.requireUser(authentication)));
  }
}
