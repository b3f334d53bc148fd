package io.crisisintel.coordination.deployment;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.crisisintel.coordination.audit.AuditService;
import io.crisisintel.coordination.crisis.Crisis;
import io.crisisintel.coordination.crisis.CrisisRepository;
import io.crisisintel.coordination.crisis.Incident;
import io.crisisintel.coordination.crisis.IncidentRepository;
import io.crisisintel.coordination.deployment.DeploymentService.DeployCommand;
import io.crisisintel.coordination.directory.OrganizationDirectory;
import io.crisisintel.coordination.directory.OrganizationDirectory.FireTeam;
import io.crisisintel.coordination.directory.OrganizationDirectory.SocialOrganization;
import io.crisisintel.coordination.exception.ErrorCode;
import io.crisisintel.coordination.exception.ForbiddenException;
import io.crisisintel.coordination.exception.InvalidRequestException;
import io.crisisintel.coordination.exception.InvalidStateException;
import io.crisisintel.coordination.participation.CrisisAccessService;
import io.crisisintel.coordination.security.ActorRole;
import io.crisisintel.coordination.security.CallerContext;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class DeploymentServiceTest {

  private static final Instant NOW = Instant.parse("2026-09-02T13:00:00Z");
  private static final UUID INCIDENT_ID = UUID.randomUUID();
  private static final UUID CRISIS_ID = UUID.randomUUID();
  private static final UUID CRISIS_ADMIN_ID = UUID.randomUUID();
  private static final UUID FIRE_SERVICE_ID = UUID.randomUUID();
  private static final UUID SOCIAL_ORG_OWNER_ID = UUID.randomUUID();
  private static final UUID TEAM_ID = UUID.randomUUID();
  private static final UUID ORG_ID = UUID.randomUUID();

  @Mock private DeploymentRepository deploymentRepository;
  @Mock private IncidentRepository incidentRepository;
  @Mock private CrisisRepository crisisRepository;
  @Mock private CrisisAccessService crisisAccessService;
  @Mock private OrganizationDirectory organizationDirectory;
  @Mock private AuditService auditService;

  private DeploymentService service;
  private Incident incident;
  private Crisis crisis;
  private CallerContext fireService;

  @BeforeEach
  void setUp() {
    service =
        new DeploymentService(
            deploymentRepository,
            incidentRepository,
            crisisRepository,
            crisisAccessService,
            organizationDirectory,
            auditService,
            Clock.fixed(NOW, ZoneOffset.UTC));
    incident =
        withId(
            new Incident("Warehouse fire", null, "fire", "high", 23.7, 90.4, CRISIS_ADMIN_ID, NOW),
            INCIDENT_ID);
    crisis =
        withId(
            new Crisis(INCIDENT_ID, "Warehouse fire", null, 23.7, 90.4, 3, CRISIS_ADMIN_ID, NOW),
            CRISIS_ID);
    fireService = CallerContext.of(FIRE_SERVICE_ID, ActorRole.FIRE_SERVICE);
  }

  @Test
  void deploy_availableFireTeamByOwner_isActiveWithOptionalMembers() {
    givenIncidentWithCrisis();
    when(organizationDirectory.findFireTeam(TEAM_ID))
        .thenReturn(Optional.of(new FireTeam(TEAM_ID, FIRE_SERVICE_ID, "Ladder 4", "available")));
    when(crisisAccessService.isAdministrator(fireService, crisis)).thenReturn(false);
    when(deploymentRepository.save(any(Deployment.class)))
        .thenAnswer(invocation -> invocation.getArgument(0));

    var deployment =
        service.deploy(
            fireService,
            INCIDENT_ID,
            new DeployCommand(UnitType.FIRE_TEAM, TEAM_ID, 6, null, "rescue", null));

    assertThat(deployment.getStatus()).isEqualTo(DeploymentStatus.ACTIVE);
    assertThat(deployment.getOwnerUserId()).isEqualTo(FIRE_SERVICE_ID);
    assertThat(deployment.getHeadcount()).isEqualTo(6);
    assertThat(deployment.getMembers()).isEmpty();
    verify(crisisAccessService).requireMayAct(fireService, crisis);
  }

  @Test
  void deploy_unavailableFireTeam_isRejected() {
    givenIncidentWithCrisis();
    when(organizationDirectory.findFireTeam(TEAM_ID))
        .thenReturn(Optional.of(new FireTeam(TEAM_ID, FIRE_SERVICE_ID, "Ladder 4", "busy")));

    assertThatThrownBy(
            () ->
                service.deploy(
                    fireService,
                    INCIDENT_ID,
                    new DeployCommand(UnitType.FIRE_TEAM, TEAM_ID, 4, null, null, null)))
        .isInstanceOf(InvalidRequestException.class)
        .hasMessageContaining("not available");
    verify(deploymentRepository, never()).save(any());
  }

  @Test
  void deploy_fireTeamOfAnotherService_isForbidden() {
    givenIncidentWithCrisis();
    var otherService = CallerContext.of(UUID.randomUUID(), ActorRole.FIRE_SERVICE);
    when(organizationDirectory.findFireTeam(TEAM_ID))
        .thenReturn(Optional.of(new FireTeam(TEAM_ID, FIRE_SERVICE_ID, "Ladder 4", "available")));
    when(crisisAccessService.isAdministrator(otherService, crisis)).thenReturn(false);

    assertThatThrownBy(
            () ->
                service.deploy(
                    otherService,
                    INCIDENT_ID,
                    new DeployCommand(UnitType.FIRE_TEAM, TEAM_ID, 4, null, null, null)))
        .isInstanceOf(ForbiddenException.class);
  }

  @Test
  void deploy_volunteerGroupWithoutHeadcount_isRejected() {
    givenIncidentWithCrisis();
    when(organizationDirectory.findSocialOrganization(ORG_ID))
        .thenReturn(Optional.of(new SocialOrganization(ORG_ID, SOCIAL_ORG_OWNER_ID, "Relief")));
    var owner = CallerContext.of(SOCIAL_ORG_OWNER_ID, ActorRole.SOCIAL_ORG);

    assertThatThrownBy(
            () ->
                service.deploy(
                    owner,
                    INCIDENT_ID,
                    new DeployCommand(UnitType.VOLUNTEER_GROUP, ORG_ID, 0, null, null, null)))
        .isInstanceOf(InvalidRequestException.class)
        .hasMessageContaining("at least 1");
  }

  @Test
  void deploy_volunteerGroupWithNonVolunteerMember_isRejected() {
    givenIncidentWithCrisis();
    var volunteer = UUID.randomUUID();
    var outsider = UUID.randomUUID();
    when(organizationDirectory.findSocialOrganization(ORG_ID))
        .thenReturn(Optional.of(new SocialOrganization(ORG_ID, SOCIAL_ORG_OWNER_ID, "Relief")));
    when(organizationDirectory.findAcceptedVolunteers(eq(ORG_ID), anyCollection()))
        .thenReturn(Set.of(volunteer));
    var owner = CallerContext.of(SOCIAL_ORG_OWNER_ID, ActorRole.SOCIAL_ORG);

    assertThatThrownBy(
            () ->
                service.deploy(
                    owner,
                    INCIDENT_ID,
                    new DeployCommand(
                        UnitType.VOLUNTEER_GROUP,
                        ORG_ID,
                        2,
                        List.of(volunteer, outsider),
                        null,
                        null)))
        .isInstanceOf(InvalidRequestException.class)
        .hasMessageContaining(outsider.toString());
  }

  @Test
  void deploy_volunteerGroup_deduplicatesMembers() {
    givenIncidentWithCrisis();
    var volunteer = UUID.randomUUID();
    when(organizationDirectory.findSocialOrganization(ORG_ID))
        .thenReturn(Optional.of(new SocialOrganization(ORG_ID, SOCIAL_ORG_OWNER_ID, "Relief")));
    when(organizationDirectory.findAcceptedVolunteers(eq(ORG_ID), anyCollection()))
        .thenReturn(Set.of(volunteer));
    var owner = CallerContext.of(SOCIAL_ORG_OWNER_ID, ActorRole.SOCIAL_ORG);
    when(crisisAccessService.isAdministrator(owner, crisis)).thenReturn(false);
    when(deploymentRepository.save(any(Deployment.class)))
        .thenAnswer(invocation -> invocation.getArgument(0));

    var deployment =
        service.deploy(
            owner,
            INCIDENT_ID,
            new DeployCommand(
                UnitType.VOLUNTEER_GROUP, ORG_ID, 3, List.of(volunteer, volunteer), null, null));

    assertThat(deployment.getMembers()).containsExactly(volunteer);
    assertThat(deployment.getHeadcount()).isEqualTo(3);
  }

  @Test
  void deploy_toClosedIncident_isImmutable() {
    crisis.close(incident, NOW);
    when(incidentRepository.findById(INCIDENT_ID)).thenReturn(Optional.of(incident));

    assertThatThrownBy(
            () ->
                service.deploy(
                    fireService,
                    INCIDENT_ID,
                    new DeployCommand(UnitType.FIRE_TEAM, TEAM_ID, 1, null, null, null)))
        .isInstanceOf(InvalidStateException.class)
        .extracting(e -> ((InvalidStateException) e).getErrorCode())
        .isEqualTo(ErrorCode.IMMUTABLE);
  }

  @Test
  void transition_finishedDeployment_isImmutable() {
    var deploymentId = UUID.randomUUID();
    var deployment = fireTeamDeployment();
    deployment.finish(DeploymentStatus.COMPLETED, NOW);
    when(deploymentRepository.findById(deploymentId)).thenReturn(Optional.of(deployment));
    givenIncidentWithCrisis();
    when(crisisAccessService.isAdministrator(fireService, crisis)).thenReturn(false);

    assertThatThrownBy(
            () -> service.transition(fireService, deploymentId, DeploymentStatus.WITHDRAWN))
        .isInstanceOf(InvalidStateException.class)
        .extracting(e -> ((InvalidStateException) e).getErrorCode())
        .isEqualTo(ErrorCode.IMMUTABLE);
  }

  @Test
  void transition_byOwner_withdrawsActiveDeployment() {
    var deploymentId = UUID.randomUUID();
    var deployment = fireTeamDeployment();
    when(deploymentRepository.findById(deploymentId)).thenReturn(Optional.of(deployment));
    givenIncidentWithCrisis();
    when(crisisAccessService.isAdministrator(fireService, crisis)).thenReturn(false);
    when(deploymentRepository.saveAndFlush(deployment)).thenReturn(deployment);

    var updated = service.transition(fireService, deploymentId, DeploymentStatus.WITHDRAWN);

    assertThat(updated.getStatus()).isEqualTo(DeploymentStatus.WITHDRAWN);
    assertThat(updated.getEndedAt()).isEqualTo(NOW);
  }

  @Test
  void transition_byUnrelatedUser_isForbidden() {
    var deploymentId = UUID.randomUUID();
    var stranger = CallerContext.of(UUID.randomUUID(), ActorRole.REGULAR);
    when(deploymentRepository.findById(deploymentId))
        .thenReturn(Optional.of(fireTeamDeployment()));
    givenIncidentWithCrisis();
    when(crisisAccessService.isAdministrator(stranger, crisis)).thenReturn(false);

    assertThatThrownBy(
            () -> service.transition(stranger, deploymentId, DeploymentStatus.COMPLETED))
        .isInstanceOf(ForbiddenException.class);
  }

  private void givenIncidentWithCrisis() {
    when(incidentRepository.findById(INCIDENT_ID)).thenReturn(Optional.of(incident));
    when(crisisRepository.findByIncidentId(INCIDENT_ID)).thenReturn(Optional.of(crisis));
  }

  private Deployment fireTeamDeployment() {
    return new Deployment(
        INCIDENT_ID,
        UnitType.FIRE_TEAM,
        TEAM_ID,
        FIRE_SERVICE_ID,
        5,
        List.of(),
        null,
        null,
        FIRE_SERVICE_ID,
        NOW.minusSeconds(3600));
  }

  private static <T> T withId(T entity, UUID id) {
    try {
      var idField = entity.getClass().getDeclaredField("id");
      idField.setAccessible(true);
      idField.set(entity, id);
    } catch (ReflectiveOperationException e) {
      throw new RuntimeException("Failed to set ID", e);
    }
    return entity;
  }
}
