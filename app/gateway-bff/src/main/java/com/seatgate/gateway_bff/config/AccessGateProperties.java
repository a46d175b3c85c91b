package com.seatgate.gateway_bff.config;

import java.time.Duration;
import java.util.List;
import java.util.stream.Stream;
import org.springframework.boot.context.properties.ConfigurationProperties;

/** 保護対象パス、除外パス、ログイン後と拒否時の遷移先。 */
@ConfigurationProperties(prefix = "gate")
public record AccessGateProperties(
    List<String> protectedPaths,
    List<String> exemptPaths,
    String subscribePath,
    String missingTenantPath,
    String postLoginPath,
    Duration loadingRetryAfter) {

  public AccessGateProperties {
    protectedPaths =
        protectedPaths == null || protectedPaths.isEmpty()
            ? List.of("/dashboard", "/team", "/billing", "/settings", "/calls")
            : List.copyOf(protectedPaths);
    exemptPaths =
        exemptPaths == null || exemptPaths.isEmpty()
            ? List.of("/api/webhooks")
            : List.copyOf(exemptPaths);
    subscribePath =
        subscribePath == null || subscribePath.isBlank() ? "/subscribe" : subscribePath;
    missingTenantPath =
        missingTenantPath == null || missingTenantPath.isBlank()
            ? "/onboarding?reason=missing-tenant"
            : missingTenantPath;
    postLoginPath =
        postLoginPath == null || postLoginPath.isBlank() ? "/dashboard" : postLoginPath;
    loadingRetryAfter = loadingRetryAfter == null ? Duration.ofSeconds(2) : loadingRetryAfter;
  }

  public boolean isProtected(String path) {
    return !isExempt(path) && matchesAny(protectedPaths, path);
  }

  public boolean isExempt(String path) {
    return matchesAny(exemptPaths, path);
  }

  // 前方一致はパス区切り単位で判定する (/team は /teams に一致しない)
  private static boolean matchesAny(List<String> prefixes, String path) {
    if (path == null) {
      return false;
    }
    for (String prefix : prefixes) {
      if (path.equals(prefix) || path.startsWith(prefix + "/")) {
        return true;
      }
    }
    return false;
  }

  public String[] exemptPatterns() {
    return exemptPaths.stream()
        .flatMap(prefix -> Stream.of(prefix, prefix + "/**"))
        .toArray(String[]::new);
  }
}
