package com.seatgate.tenant.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.seatgate.tenant.AbstractPostgresContainerTest;
import com.seatgate.tenant.model.TeamRecord;
import com.seatgate.tenant.model.UserRecord;
import com.seatgate.tenant.model.UserRole;
import java.time.Instant;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class TenantRepositoryTest extends AbstractPostgresContainerTest {

  private static final Instant BASE_TIME = Instant.parse("2026-01-01T00:00:00Z");

  @Autowired private TeamRepository teamRepository;
  @Autowired private UserRepository userRepository;
  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanup() {
    jdbcTemplate.update("DELETE FROM tenant.users", new MapSqlParameterSource());
    jdbcTemplate.update("DELETE FROM tenant.teams", new MapSqlParameterSource());
  }

  @Test
  void insertAndFindUserByExternalId() {
    teamRepository.insert(new TeamRecord("team-1", "My Team", "active", BASE_TIME, BASE_TIME));
    userRepository.insert(
        new UserRecord("user-1", "u1", "a@x.com", null, UserRole.ADMIN, "team-1", BASE_TIME));

    final Optional<UserRecord> found = userRepository.findByExternalId("u1");

    assertThat(found).isPresent();
    assertThat(found.get().teamId()).isEqualTo("team-1");
    assertThat(found.get().role()).isEqualTo(UserRole.ADMIN);
    assertThat(found.get().displayName()).isNull();
    assertThat(found.get().createdAt()).isEqualTo(BASE_TIME);
    assertThat(userRepository.countByTeamId("team-1")).isEqualTo(1);
  }

  @Test
  void secondUserWithSameExternalIdViolatesUniqueConstraint() {
    teamRepository.insert(new TeamRecord("team-1", "A", "active", BASE_TIME, BASE_TIME));
    teamRepository.insert(new TeamRecord("team-2", "B", "active", BASE_TIME, BASE_TIME));
    userRepository.insert(
        new UserRecord("user-1", "u1", "a@x.com", null, UserRole.ADMIN, "team-1", BASE_TIME));

    assertThatThrownBy(
            () ->
                userRepository.insert(
                    new UserRecord(
                        "user-2", "u1", "a@x.com", null, UserRole.ADMIN, "team-2", BASE_TIME)))
        .isInstanceOf(DataIntegrityViolationException.class);
  }

  @Test
  void userMustReferenceExistingTeam() {
    assertThatThrownBy(
            () ->
                userRepository.insert(
                    new UserRecord(
                        "user-1", "u1", "a@x.com", null, UserRole.ADMIN, "missing", BASE_TIME)))
        .isInstanceOf(DataIntegrityViolationException.class);
  }

  @Test
  void updateNameAndPlanChangeOnlyTargetColumns() {
    teamRepository.insert(new TeamRecord("team-1", "My Team", "active", BASE_TIME, BASE_TIME));
    final Instant later = BASE_TIME.plusSeconds(60);

    final Optional<TeamRecord> renamed = teamRepository.updateName("team-1", "Closers", later);
    final Optional<TeamRecord> replanned = teamRepository.updatePlan("team-1", "pro", later);

    assertThat(renamed).isPresent();
    assertThat(renamed.get().name()).isEqualTo("Closers");
    assertThat(replanned).isPresent();
    assertThat(replanned.get().name()).isEqualTo("Closers");
    assertThat(replanned.get().plan()).isEqualTo("pro");
    assertThat(replanned.get().createdAt()).isEqualTo(BASE_TIME);
    assertThat(replanned.get().updatedAt()).isEqualTo(later);
  }

  @Test
  void updateOnMissingTeamReturnsEmpty() {
    assertThat(teamRepository.updateName("missing", "x", BASE_TIME)).isEmpty();
    assertThat(teamRepository.updatePlan("missing", "x", BASE_TIME)).isEmpty();
    assertThat(teamRepository.findByTeamId("missing")).isEmpty();
  }
}
