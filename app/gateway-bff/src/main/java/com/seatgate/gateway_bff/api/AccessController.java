package com.seatgate.gateway_bff.api;

import com.seatgate.gateway_bff.api.response.AccessDecisionResponse;
import com.seatgate.gateway_bff.service.AccessDecisionService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

// 画面側がゲートの判定 (LOADING 含む) をポーリングするための API。
@RestController
@RequiredArgsConstructor
public class AccessController {

  private final AccessDecisionService accessDecisionService;

  @GetMapping("/v1/access")
  public ResponseEntity<AccessDecisionResponse> access(Authentication authentication) {
    return ResponseEntity.ok(
        AccessDecisionResponse.from(accessDecisionService.decide(authentication)));
  }
}
