package io.crisisintel.coordination.victim;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.crisisintel.coordination.audit.AuditService;
import io.crisisintel.coordination.crisis.Crisis;
import io.crisisintel.coordination.directory.OrganizationDirectory;
import io.crisisintel.coordination.directory.OrganizationDirectory.Account;
import io.crisisintel.coordination.exception.ForbiddenException;
import io.crisisintel.coordination.exception.InvalidRequestException;
import io.crisisintel.coordination.exception.InvalidStateException;
import io.crisisintel.coordination.exception.ResourceConflictException;
import io.crisisintel.coordination.location.LocationProvider;
import io.crisisintel.coordination.location.LocationSnapshot;
import io.crisisintel.coordination.participation.CrisisAccessService;
import io.crisisintel.coordination.security.ActorRole;
import io.crisisintel.coordination.security.CallerContext;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class VictimServiceTest {

  private static final Instant NOW = Instant.parse("2026-03-18T21:00:00Z");
  private static final UUID CRISIS_ID = UUID.randomUUID();
  private static final UUID ADMIN_ID = UUID.randomUUID();
  private static final UUID USER_ID = UUID.randomUUID();

  @Mock private CrisisAccessService crisisAccessService;
  @Mock private CrisisVictimRepository victimRepository;
  @Mock private LocationProvider locationProvider;
  @Mock private OrganizationDirectory organizationDirectory;
  @Mock private AuditService auditService;

  private VictimService service;
  private Crisis crisis;
  private CallerContext admin;
  private CallerContext user;

  @BeforeEach
  void setUp() {
    service =
        new VictimService(
            crisisAccessService,
            victimRepository,
            locationProvider,
            organizationDirectory,
            auditService,
            Clock.fixed(NOW, ZoneOffset.UTC));
    crisis = new Crisis(UUID.randomUUID(), "Landslide", null, 27.7, 85.3, 8, ADMIN_ID, NOW);
    admin = CallerContext.of(ADMIN_ID, ActorRole.REGULAR);
    user = CallerContext.of(USER_ID, ActorRole.REGULAR);
  }

  @Test
  void enroll_copiesLatestKnownLocation() {
    when(crisisAccessService.requireActiveCrisis(CRISIS_ID)).thenReturn(crisis);
    when(victimRepository.existsByCrisisIdAndUserId(CRISIS_ID, USER_ID)).thenReturn(false);
    when(locationProvider.latestFor(USER_ID))
        .thenReturn(Optional.of(new LocationSnapshot(USER_ID, 27.71, 85.32, NOW)));
    when(victimRepository.save(any(CrisisVictim.class)))
        .thenAnswer(invocation -> invocation.getArgument(0));

    var victim = service.enroll(user, CRISIS_ID, "trapped on roof");

    assertThat(victim.getStatus()).isEqualTo(VictimStatus.PENDING);
    assertThat(victim.getLastLat()).isEqualTo(27.71);
    assertThat(victim.getLastLng()).isEqualTo(85.32);
    assertThat(victim.getCreatedBy()).isEqualTo(USER_ID);
  }

  @Test
  void enroll_twice_isConflict() {
    when(crisisAccessService.requireActiveCrisis(CRISIS_ID)).thenReturn(crisis);
    when(victimRepository.existsByCrisisIdAndUserId(CRISIS_ID, USER_ID)).thenReturn(true);

    assertThatThrownBy(() -> service.enroll(user, CRISIS_ID, null))
        .isInstanceOf(ResourceConflictException.class);
    verify(victimRepository, never()).save(any());
  }

  @Test
  void adminCreate_resolvesUserByEmail() {
    when(crisisAccessService.requireActiveCrisis(CRISIS_ID)).thenReturn(crisis);
    when(organizationDirectory.findAccountByEmail("rahim@example.org"))
        .thenReturn(Optional.of(new Account(USER_ID, "rahim@example.org", ActorRole.REGULAR)));
    when(victimRepository.existsByCrisisIdAndUserId(CRISIS_ID, USER_ID)).thenReturn(false);
    when(locationProvider.latestFor(USER_ID)).thenReturn(Optional.empty());
    when(victimRepository.save(any(CrisisVictim.class)))
        .thenAnswer(invocation -> invocation.getArgument(0));

    var victim = service.adminCreate(admin, CRISIS_ID, null, "rahim@example.org", null);

    assertThat(victim.getUserId()).isEqualTo(USER_ID);
    assertThat(victim.getCreatedBy()).isEqualTo(ADMIN_ID);
    assertThat(victim.getLastLat()).isNull();
  }

  @Test
  void adminCreate_withoutUserOrEmail_isRejected() {
    when(crisisAccessService.requireActiveCrisis(CRISIS_ID)).thenReturn(crisis);

    assertThatThrownBy(() -> service.adminCreate(admin, CRISIS_ID, null, " ", null))
        .isInstanceOf(InvalidRequestException.class);
  }

  @Test
  void triage_confirmByParticipant_changesStatus() {
    var victimId = UUID.randomUUID();
    var victim = victim();
    when(victimRepository.findById(victimId)).thenReturn(Optional.of(victim));
    when(crisisAccessService.requireActiveCrisis(CRISIS_ID)).thenReturn(crisis);

    var updated = service.triage(user, victimId, VictimStatus.CONFIRMED);

    assertThat(updated.getStatus()).isEqualTo(VictimStatus.CONFIRMED);
    assertThat(updated.getUpdatedAt()).isEqualTo(NOW);
    verify(crisisAccessService).requireParticipantOrAdministrator(user, crisis);
  }

  @Test
  void triage_toCurrentStatus_isInvalidStatus() {
    var victimId = UUID.randomUUID();
    when(victimRepository.findById(victimId)).thenReturn(Optional.of(victim()));
    when(crisisAccessService.requireActiveCrisis(CRISIS_ID)).thenReturn(crisis);

    assertThatThrownBy(() -> service.triage(user, victimId, VictimStatus.PENDING))
        .isInstanceOf(InvalidStateException.class);
  }

  @Test
  void triage_dismissByParticipant_requiresAdministrator() {
    var victimId = UUID.randomUUID();
    var victim = victim();
    when(victimRepository.findById(victimId)).thenReturn(Optional.of(victim));
    when(crisisAccessService.requireActiveCrisis(CRISIS_ID)).thenReturn(crisis);
    doThrow(new ForbiddenException("Not a crisis administrator", "no"))
        .when(crisisAccessService)
        .requireAdministrator(user, crisis);

    assertThatThrownBy(() -> service.triage(user, victimId, VictimStatus.DISMISSED))
        .isInstanceOf(ForbiddenException.class);
    assertThat(victim.getStatus()).isEqualTo(VictimStatus.PENDING);
  }

  @Test
  void edit_withHalfALocation_isRejected() {
    var victimId = UUID.randomUUID();
    when(victimRepository.findById(victimId)).thenReturn(Optional.of(victim()));
    when(crisisAccessService.requireActiveCrisis(CRISIS_ID)).thenReturn(crisis);

    assertThatThrownBy(() -> service.edit(admin, victimId, "moved", 27.0, null))
        .isInstanceOf(InvalidRequestException.class);
  }

  private static CrisisVictim victim() {
    return new CrisisVictim(CRISIS_ID, USER_ID, null, null, null, USER_ID, NOW.minusSeconds(600));
  }
}
