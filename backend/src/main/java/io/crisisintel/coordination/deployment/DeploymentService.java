package io.crisisintel.coordination.deployment;

import io.crisisintel.coordination.audit.AuditEventBuilder;
import io.crisisintel.coordination.audit.AuditService;
import io.crisisintel.coordination.crisis.Crisis;
import io.crisisintel.coordination.crisis.CrisisRepository;
import io.crisisintel.coordination.crisis.Incident;
import io.crisisintel.coordination.crisis.IncidentRepository;
import io.crisisintel.coordination.directory.OrganizationDirectory;
import io.crisisintel.coordination.exception.ForbiddenException;
import io.crisisintel.coordination.exception.InvalidRequestException;
import io.crisisintel.coordination.exception.InvalidStateException;
import io.crisisintel.coordination.exception.ResourceNotFoundException;
import io.crisisintel.coordination.participation.CrisisAccessService;
import io.crisisintel.coordination.security.CallerContext;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Tracks fire teams and volunteer groups sent to incidents. Eligibility is checked once at deploy
 * time against the organization directory; rosters are not locked afterwards.
 */
@Service
public class DeploymentService {

  private static final Logger log = LoggerFactory.getLogger(DeploymentService.class);

  private final DeploymentRepository deploymentRepository;
  private final IncidentRepository incidentRepository;
  private final CrisisRepository crisisRepository;
  private final CrisisAccessService crisisAccessService;
  private final OrganizationDirectory organizationDirectory;
  private final AuditService auditService;
  private final Clock clock;

  public DeploymentService(
      DeploymentRepository deploymentRepository,
      IncidentRepository incidentRepository,
      CrisisRepository crisisRepository,
      CrisisAccessService crisisAccessService,
      OrganizationDirectory organizationDirectory,
      AuditService auditService,
      Clock clock) {
    this.deploymentRepository = deploymentRepository;
    this.incidentRepository = incidentRepository;
    this.crisisRepository = crisisRepository;
    this.crisisAccessService = crisisAccessService;
    this.organizationDirectory = organizationDirectory;
    this.auditService = auditService;
    this.clock = clock;
  }

  @Transactional
  public Deployment deploy(CallerContext caller, UUID incidentId, DeployCommand command) {
    var incident = requireIncident(incidentId);
    if (!incident.isOpen()) {
      throw InvalidStateException.immutable("Incident", incident.getStatus());
    }
    var crisis = crisisFor(incident);
    crisis.ifPresent(Crisis::requireActive);
    if (command.unitType() == null || command.unitId() == null) {
      throw new InvalidRequestException("Missing unit", "unitType and unitId are required");
    }

    var eligible =
        switch (command.unitType()) {
          case FIRE_TEAM -> requireEligibleFireTeam(command);
          case VOLUNTEER_GROUP -> requireEligibleVolunteerGroup(command);
        };

    if (!isAdministrator(caller, crisis) && !caller.is(eligible.ownerUserId())) {
      throw new ForbiddenException(
          "Not the unit owner", "Only the owning organization or an administrator may deploy");
    }
    crisis.ifPresent(c -> crisisAccessService.requireMayAct(caller, c));

    var deployment =
        deploymentRepository.save(
            new Deployment(
                incidentId,
                command.unitType(),
                command.unitId(),
                eligible.ownerUserId(),
                eligible.headcount(),
                eligible.members(),
                command.capabilities(),
                command.note(),
                caller.userId(),
                Instant.now(clock)));
    log.info(
        "Deployed {} {} to incident {} (headcount {})",
        command.unitType().value(),
        command.unitId(),
        incidentId,
        eligible.headcount());
    audit(caller, "deployment.created", deployment, crisis.orElse(null));
    return deployment;
  }

  /** Moves an active deployment to completed or withdrawn. */
  @Transactional
  public Deployment transition(CallerContext caller, UUID deploymentId, DeploymentStatus target) {
    var deployment = requireDeployment(deploymentId);
    var crisis = incidentRepository.findById(deployment.getIncidentId()).flatMap(this::crisisFor);
    if (!isAdministrator(caller, crisis)
        && !caller.is(deployment.getDeployedBy())
        && !caller.is(deployment.getOwnerUserId())) {
      throw new ForbiddenException(
          "Not permitted",
          "Only the deployer, the owning organization or an administrator may update a deployment");
    }
    if (target == null || target == DeploymentStatus.ACTIVE) {
      throw new InvalidRequestException(
          "Invalid status", "status must be completed or withdrawn");
    }
    var previous = deployment.getStatus();
    deployment.finish(target, Instant.now(clock));
    deployment = deploymentRepository.saveAndFlush(deployment);
    log.info("Deployment {} moved {} -> {} by {}", deploymentId, previous, target, caller.userId());
    audit(
        caller,
        "deployment." + target.name().toLowerCase(Locale.ROOT),
        deployment,
        crisis.orElse(null));
    return deployment;
  }

  @Transactional(readOnly = true)
  public Deployment get(UUID deploymentId) {
    return requireDeployment(deploymentId);
  }

  @Transactional(readOnly = true)
  public Page<Deployment> list(
      UUID incidentId, DeploymentStatus status, UnitType unitType, Pageable pageable) {
    requireIncident(incidentId);
    return deploymentRepository.findByIncident(incidentId, status, unitType, pageable);
  }

  private EligibleUnit requireEligibleFireTeam(DeployCommand command) {
    var team =
        organizationDirectory
            .findFireTeam(command.unitId())
            .orElseThrow(
                () ->
                    new InvalidRequestException(
                        "Unknown fire team", "No fire team with id " + command.unitId()));
    if (!team.isAvailable()) {
      throw new InvalidRequestException(
          "Fire team unavailable",
          "Fire team " + team.name() + " is " + team.status() + ", not available");
    }
    int headcount = command.headcount() != null ? command.headcount() : 0;
    if (headcount < 0) {
      throw new InvalidRequestException("Invalid headcount", "headcount must not be negative");
    }
    return new EligibleUnit(team.ownerUserId(), headcount, distinct(command.members()));
  }

  private EligibleUnit requireEligibleVolunteerGroup(DeployCommand command) {
    var organization =
        organizationDirectory
            .findSocialOrganization(command.unitId())
            .orElseThrow(
                () ->
                    new InvalidRequestException(
                        "Unknown organization",
                        "No social organization with id " + command.unitId()));
    if (command.headcount() == null || command.headcount() < 1) {
      throw new InvalidRequestException(
          "Invalid headcount", "A volunteer group needs a headcount of at least 1");
    }
    var members = distinct(command.members());
    if (!members.isEmpty()) {
      var accepted =
          organizationDirectory.findAcceptedVolunteers(organization.organizationId(), members);
      var rejected =
          members.stream().filter(m -> !accepted.contains(m)).toList();
      if (!rejected.isEmpty()) {
        throw new InvalidRequestException(
            "Ineligible members",
            "Not accepted volunteers of " + organization.name() + ": " + rejected);
      }
    }
    return new EligibleUnit(organization.ownerUserId(), command.headcount(), members);
  }

  private boolean isAdministrator(CallerContext caller, Optional<Crisis> crisis) {
    return crisis.map(c -> crisisAccessService.isAdministrator(caller, c)).orElse(caller.admin());
  }

  private Optional<Crisis> crisisFor(Incident incident) {
    return crisisRepository.findByIncidentId(incident.getId());
  }

  private Incident requireIncident(UUID incidentId) {
    return incidentRepository
        .findById(incidentId)
        .orElseThrow(() -> new ResourceNotFoundException("Incident", incidentId));
  }

  private Deployment requireDeployment(UUID deploymentId) {
    return deploymentRepository
        .findById(deploymentId)
        .orElseThrow(() -> new ResourceNotFoundException("Deployment", deploymentId));
  }

  private static List<UUID> distinct(List<UUID> members) {
    return members == null ? List.of() : List.copyOf(new LinkedHashSet<>(members));
  }

  private void audit(CallerContext caller, String eventType, Deployment deployment, Crisis crisis) {
    var details = new LinkedHashMap<String, Object>();
    details.put("incident_id", deployment.getIncidentId().toString());
    details.put("unit_type", deployment.getUnitType().value());
    details.put("unit_id", deployment.getUnitId().toString());
    details.put("status", deployment.getStatus().name());
    if (crisis != null) {
      details.put("crisis_id", crisis.getId().toString());
    }
    auditService.log(
        AuditEventBuilder.builder()
            .eventType(eventType)
            .entityType("deployment")
            .entityId(deployment.getId())
            .actor(caller)
            .details(details)
            .build());
  }

  /** Deploy input. {@code members} is optional for fire teams. */
  public record DeployCommand(
      UnitType unitType,
      UUID unitId,
      Integer headcount,
      List<UUID> members,
      String capabilities,
      String note) {}

  private record EligibleUnit(UUID ownerUserId, int headcount, List<UUID> members) {}
}
