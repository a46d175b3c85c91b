package com.seatgate.tenant.api;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.seatgate.tenant.model.UserRecord;
import com.seatgate.tenant.model.UserRole;
import com.seatgate.tenant.service.IdentityResolver;
import com.seatgate.tenant.service.TenantStoreUnavailableException;
import java.time.Instant;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(IdentityController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import(TenantApiExceptionHandler.class)
class IdentityControllerTest {

  @Autowired private MockMvc mockMvc;

  @MockitoBean private IdentityResolver identityResolver;

  @Test
  void getIdentityReturnsUserAndTeam() throws Exception {
    when(identityResolver.resolve("u1"))
        .thenReturn(
            Optional.of(
                new UserRecord(
                    "user-1", "u1", "a@x.com", null, UserRole.ADMIN, "team-1", Instant.EPOCH)));

    mockMvc
        .perform(get("/identities/u1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.userId").value("user-1"))
        .andExpect(jsonPath("$.teamId").value("team-1"))
        .andExpect(jsonPath("$.role").value("admin"));
  }

  @Test
  void getIdentityReturnsNotFoundWhenUnknown() throws Exception {
    when(identityResolver.resolve("u1")).thenReturn(Optional.empty());

    mockMvc
        .perform(get("/identities/u1"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("USER_NOT_FOUND"));
  }

  @Test
  void getIdentityReturnsServiceUnavailableWhenStoreIsDown() throws Exception {
    when(identityResolver.resolve("u1"))
        .thenThrow(new TenantStoreUnavailableException("resolve_identity", "down"));

    mockMvc
        .perform(get("/identities/u1"))
        .andExpect(status().isServiceUnavailable())
        .andExpect(jsonPath("$.code").value("STORE_UNAVAILABLE"));
  }
}
