package com.seatgate.tenant.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.seatgate.tenant.api.request.EnsureTenantRequest;
import com.seatgate.tenant.service.ProvisioningResult;
import com.seatgate.tenant.service.TenantProvisioner;
import com.seatgate.tenant.service.TenantStoreUnavailableException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(TenantController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import(TenantApiExceptionHandler.class)
class TenantControllerTest {

  @Autowired private MockMvc mockMvc;

  @Autowired private ObjectMapper objectMapper;

  @MockitoBean private TenantProvisioner tenantProvisioner;

  @Test
  void ensureReturnsCreatedWhenTeamWasCreated() throws Exception {
    when(tenantProvisioner.ensureTenant(any(EnsureTenantRequest.class)))
        .thenReturn(new ProvisioningResult("team-1", "user-1", true));

    mockMvc
        .perform(
            post("/tenants:ensure")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body(new EnsureTenantRequest("u1", "a@x.com", null, null))))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.teamId").value("team-1"))
        .andExpect(jsonPath("$.userId").value("user-1"))
        .andExpect(jsonPath("$.created").value(true));
  }

  @Test
  void ensureReturnsOkWhenTeamAlreadyExisted() throws Exception {
    when(tenantProvisioner.ensureTenant(any(EnsureTenantRequest.class)))
        .thenReturn(new ProvisioningResult("team-1", "user-1", false));

    mockMvc
        .perform(
            post("/tenants:ensure")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body(new EnsureTenantRequest("u1", "a@x.com", null, null))))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.created").value(false));
  }

  @Test
  void ensureMapsInvalidInputToBadRequest() throws Exception {
    when(tenantProvisioner.ensureTenant(any(EnsureTenantRequest.class)))
        .thenThrow(new IllegalArgumentException("email is invalid"));

    mockMvc
        .perform(
            post("/tenants:ensure")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body(new EnsureTenantRequest("u1", "nope", null, null))))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("BAD_REQUEST"))
        .andExpect(jsonPath("$.message").value("email is invalid"));
  }

  @Test
  void ensureMapsStoreOutageToServiceUnavailable() throws Exception {
    when(tenantProvisioner.ensureTenant(any(EnsureTenantRequest.class)))
        .thenThrow(new TenantStoreUnavailableException("ensure_tenant", "tenant store is unavailable"));

    mockMvc
        .perform(
            post("/tenants:ensure")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body(new EnsureTenantRequest("u1", "a@x.com", null, null))))
        .andExpect(status().isServiceUnavailable())
        .andExpect(header().string("Retry-After", "1"))
        .andExpect(jsonPath("$.code").value("STORE_UNAVAILABLE"));
  }

  @Test
  void ensureRejectsMissingBody() throws Exception {
    mockMvc
        .perform(post("/tenants:ensure").contentType(MediaType.APPLICATION_JSON))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("request body is required"));
  }

  private String body(EnsureTenantRequest request) throws Exception {
    return objectMapper.writeValueAsString(request);
  }
}
