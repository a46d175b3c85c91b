package com.seatgate.tenant.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.seatgate.tenant.api.request.EnsureTenantRequest;
import com.seatgate.tenant.config.TenantProvisioningProperties;
import com.seatgate.tenant.model.TeamRecord;
import com.seatgate.tenant.model.UserRecord;
import com.seatgate.tenant.model.UserRole;
import com.seatgate.tenant.repository.TeamRepository;
import com.seatgate.tenant.repository.UserRepository;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@ExtendWith(MockitoExtension.class)
class TenantProvisionerTest {

  private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

  @Mock private TeamRepository teamRepository;
  @Mock private UserRepository userRepository;
  @Mock private PlatformTransactionManager transactionManager;
  @Mock private TenantMetrics metrics;

  private TenantProvisioner provisioner;

  @BeforeEach
  void setUp() {
    provisioner =
        new TenantProvisioner(
            teamRepository,
            userRepository,
            new TransactionTemplate(transactionManager),
            new TenantProvisioningProperties(3, "active"),
            metrics,
            Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void overlongDisplayNameIsTruncatedInsteadOfRejected() {
    final String longName = "n".repeat(TenantProvisioner.MAX_NAME_LENGTH + 50);
    when(userRepository.findByExternalId("u1")).thenReturn(Optional.empty());
    final ArgumentCaptor<TeamRecord> teamCaptor = ArgumentCaptor.forClass(TeamRecord.class);
    when(teamRepository.insert(teamCaptor.capture()))
        .thenAnswer(invocation -> invocation.getArgument(0));
    final ArgumentCaptor<UserRecord> userCaptor = ArgumentCaptor.forClass(UserRecord.class);
    when(userRepository.insert(userCaptor.capture()))
        .thenAnswer(invocation -> invocation.getArgument(0));

    final ProvisioningResult result =
        provisioner.ensureTenant(new EnsureTenantRequest("u1", "a@x.com", longName, null));

    assertThat(result.created()).isTrue();
    assertThat(userCaptor.getValue().displayName())
        .hasSize(TenantProvisioner.MAX_NAME_LENGTH)
        .isEqualTo(longName.substring(0, TenantProvisioner.MAX_NAME_LENGTH));
    assertThat(teamCaptor.getValue().name()).hasSize(TenantProvisioner.MAX_NAME_LENGTH);
  }

  @Test
  void ensureCreatesTeamAndAdminWhenIdentityIsNew() {
    when(userRepository.findByExternalId("u1")).thenReturn(Optional.empty());
    final ArgumentCaptor<TeamRecord> teamCaptor = ArgumentCaptor.forClass(TeamRecord.class);
    when(teamRepository.insert(teamCaptor.capture()))
        .thenAnswer(invocation -> invocation.getArgument(0));
    final ArgumentCaptor<UserRecord> userCaptor = ArgumentCaptor.forClass(UserRecord.class);
    when(userRepository.insert(userCaptor.capture()))
        .thenAnswer(invocation -> invocation.getArgument(0));

    final ProvisioningResult result =
        provisioner.ensureTenant(new EnsureTenantRequest("u1", "a@x.com", null, null));

    assertThat(result.created()).isTrue();
    assertThat(teamCaptor.getValue().name()).isEqualTo("My Team");
    assertThat(teamCaptor.getValue().plan()).isEqualTo("active");
    assertThat(teamCaptor.getValue().createdAt()).isEqualTo(NOW);
    assertThat(userCaptor.getValue().role()).isEqualTo(UserRole.ADMIN);
    assertThat(userCaptor.getValue().teamId()).isEqualTo(teamCaptor.getValue().teamId());
    assertThat(result.teamId()).isEqualTo(teamCaptor.getValue().teamId());
    assertThat(result.userId()).isEqualTo(userCaptor.getValue().userId());
    verify(transactionManager).commit(any());
    verify(metrics).recordProvision(TenantMetrics.RESULT_CREATED);
  }

  @Test
  void ensureReturnsExistingPairWithoutWriting() {
    when(userRepository.findByExternalId("u1"))
        .thenReturn(Optional.of(user("user-1", "u1", "team-1")));

    final ProvisioningResult result =
        provisioner.ensureTenant(new EnsureTenantRequest("u1", "a@x.com", null, null));

    assertThat(result).isEqualTo(new ProvisioningResult("team-1", "user-1", false));
    verifyNoInteractions(teamRepository);
    verify(metrics).recordProvision(TenantMetrics.RESULT_EXISTING);
  }

  @Test
  void ensureRereadsWinnerAfterUniqueConflict() {
    when(userRepository.findByExternalId("u1"))
        .thenReturn(Optional.empty(), Optional.of(user("user-9", "u1", "team-9")));
    when(teamRepository.insert(any())).thenAnswer(invocation -> invocation.getArgument(0));
    when(userRepository.insert(any())).thenThrow(new DataIntegrityViolationException("dup"));

    final ProvisioningResult result =
        provisioner.ensureTenant(new EnsureTenantRequest("u1", "a@x.com", null, null));

    assertThat(result).isEqualTo(new ProvisioningResult("team-9", "user-9", false));
    verify(transactionManager).rollback(any());
    verify(transactionManager, never()).commit(any());
    verify(metrics).recordProvision(TenantMetrics.RESULT_CONFLICT_RESOLVED);
  }

  @Test
  void ensureFailsAsUnavailableWhenConflictNeverConverges() {
    when(userRepository.findByExternalId("u1")).thenReturn(Optional.empty());
    when(teamRepository.insert(any())).thenAnswer(invocation -> invocation.getArgument(0));
    when(userRepository.insert(any())).thenThrow(new DataIntegrityViolationException("dup"));

    assertThatThrownBy(
            () -> provisioner.ensureTenant(new EnsureTenantRequest("u1", "a@x.com", null, null)))
        .isInstanceOf(TenantStoreUnavailableException.class);
    verify(userRepository, times(3)).insert(any());
    verify(metrics).recordStoreUnavailable(TenantProvisioner.OPERATION);
  }

  @Test
  void ensureTranslatesStoreOutageToUnavailable() {
    when(userRepository.findByExternalId("u1"))
        .thenThrow(new DataAccessResourceFailureException("connection refused"));

    assertThatThrownBy(
            () -> provisioner.ensureTenant(new EnsureTenantRequest("u1", "a@x.com", null, null)))
        .isInstanceOf(TenantStoreUnavailableException.class)
        .hasCauseInstanceOf(DataAccessResourceFailureException.class);
    verify(metrics).recordStoreUnavailable(TenantProvisioner.OPERATION);
  }

  @Test
  void ensureRejectsInvalidInputWithoutTouchingStore() {
    assertThatThrownBy(
            () -> provisioner.ensureTenant(new EnsureTenantRequest(" ", "a@x.com", null, null)))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("externalId is required");
    assertThatThrownBy(
            () -> provisioner.ensureTenant(new EnsureTenantRequest("u1", "", null, null)))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("email is required");
    assertThatThrownBy(
            () -> provisioner.ensureTenant(new EnsureTenantRequest("u1", "no-at-sign", null, null)))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("email is invalid");
    verifyNoInteractions(userRepository, teamRepository, transactionManager);
  }

  @Test
  void teamNamePrefersHintThenDisplayNameThenFallback() {
    assertThat(TenantProvisioner.resolveTeamName("  Closers  ", "Ann")).isEqualTo("Closers");
    assertThat(TenantProvisioner.resolveTeamName(null, "Ann")).isEqualTo("Ann's Team");
    assertThat(TenantProvisioner.resolveTeamName(" ", " ")).isEqualTo("My Team");
    assertThat(TenantProvisioner.resolveTeamName("x".repeat(250), null)).hasSize(200);
  }

  private UserRecord user(String userId, String externalId, String teamId) {
    return new UserRecord(userId, externalId, "a@x.com", null, UserRole.ADMIN, teamId, NOW);
  }
}
