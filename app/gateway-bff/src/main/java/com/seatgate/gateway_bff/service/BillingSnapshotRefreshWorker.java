package com.seatgate.gateway_bff.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

// キャッシュ済みチームの課金状態を定期的に取り直す。
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "billing.refresh-enabled", havingValue = "true")
public class BillingSnapshotRefreshWorker {

  private final BillingSnapshotService billingSnapshotService;

  @Scheduled(fixedDelayString = "${billing.refresh-interval}")
  public void run() {
    billingSnapshotService.refreshKnownTeams();
  }
}
