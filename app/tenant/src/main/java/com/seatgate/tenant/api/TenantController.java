/*
 * どこで: app/tenant/src/main/java/com/seatgate/tenant/api/TenantController.java
 * 何を: テナント確保 API を提供するコントローラー
 * なぜ: BFF のログイン処理からの作成要求の入口を一つにするため
 */
package com.seatgate.tenant.api;

import com.seatgate.tenant.api.request.EnsureTenantRequest;
import com.seatgate.tenant.api.response.EnsureTenantResponse;
import com.seatgate.tenant.service.ProvisioningResult;
import com.seatgate.tenant.service.TenantProvisioner;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class TenantController {

    private final TenantProvisioner tenantProvisioner;

    public TenantController(TenantProvisioner tenantProvisioner) {
        this.tenantProvisioner = tenantProvisioner;
    }

    /**
     * 役割:
     * - 外部 ID に対応するチームとユーザーを確保する。
     *
     * 期待動作:
     * - 今回作成した場合は 201、既存を返した場合は 200 を返す。
     * - 同じ外部 ID で何度呼ばれても同じ teamId/userId を返す。
     */
    @PostMapping("/tenants:ensure")
    public ResponseEntity<EnsureTenantResponse> ensureTenant(@RequestBody EnsureTenantRequest request) {
        ProvisioningResult result = tenantProvisioner.ensureTenant(request);
        HttpStatus status = result.created() ? HttpStatus.CREATED : HttpStatus.OK;
        return ResponseEntity.status(status).body(EnsureTenantResponse.from(result));
    }
}
