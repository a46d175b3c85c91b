package com.seatgate.tenant.service;

/** ensureTenant の結果。created は今回の呼び出しでチームを作成したときだけ true。 */
public record ProvisioningResult(String teamId, String userId, boolean created) {}
