package io.crisisintel.coordination.victim;

import io.crisisintel.coordination.audit.AuditEventBuilder;
import io.crisisintel.coordination.audit.AuditService;
import io.crisisintel.coordination.directory.OrganizationDirectory;
import io.crisisintel.coordination.exception.InvalidRequestException;
import io.crisisintel.coordination.exception.ResourceConflictException;
import io.crisisintel.coordination.exception.ResourceNotFoundException;
import io.crisisintel.coordination.location.LocationProvider;
import io.crisisintel.coordination.participation.CrisisAccessService;
import io.crisisintel.coordination.security.CallerContext;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Victim enrollment, administrator registration and triage. */
@Service
public class VictimService {

  private static final Logger log = LoggerFactory.getLogger(VictimService.class);

  private final CrisisAccessService crisisAccessService;
  private final CrisisVictimRepository victimRepository;
  private final LocationProvider locationProvider;
  private final OrganizationDirectory organizationDirectory;
  private final AuditService auditService;
  private final Clock clock;

  public VictimService(
      CrisisAccessService crisisAccessService,
      CrisisVictimRepository victimRepository,
      LocationProvider locationProvider,
      OrganizationDirectory organizationDirectory,
      AuditService auditService,
      Clock clock) {
    this.crisisAccessService = crisisAccessService;
    this.victimRepository = victimRepository;
    this.locationProvider = locationProvider;
    this.organizationDirectory = organizationDirectory;
    this.auditService = auditService;
    this.clock = clock;
  }

  /** The caller registers themselves as a victim of the crisis. */
  @Transactional
  public CrisisVictim enroll(CallerContext caller, UUID crisisId, String note) {
    var crisis = crisisAccessService.requireActiveCrisis(crisisId);
    crisisAccessService.requireMayAct(caller, crisis);
    var victim = register(crisisId, caller.userId(), note, caller.userId());

    log.info("User {} enrolled as victim of crisis {}", caller.userId(), crisisId);
    audit(caller, "victim.enrolled", victim, Map.of());
    return victim;
  }

  @Transactional
  public void unenroll(CallerContext caller, UUID crisisId) {
    crisisAccessService.requireActiveCrisis(crisisId);
    var victim =
        victimRepository
            .findByCrisisIdAndUserId(crisisId, caller.userId())
            .orElseThrow(
                () ->
                    ResourceNotFoundException.withDetail(
                        "Not enrolled",
                        "User " + caller.userId() + " is not a victim of crisis " + crisisId));
    victimRepository.delete(victim);

    log.info("User {} unenrolled from crisis {}", caller.userId(), crisisId);
    audit(caller, "victim.unenrolled", victim, Map.of());
  }

  /** Administrator registers a victim by user id or by account email. */
  @Transactional
  public CrisisVictim adminCreate(
      CallerContext caller, UUID crisisId, UUID userId, String email, String note) {
    var crisis = crisisAccessService.requireActiveCrisis(crisisId);
    crisisAccessService.requireAdministrator(caller, crisis);

    UUID victimUserId = resolveUser(userId, email);
    var victim = register(crisisId, victimUserId, note, caller.userId());

    log.info(
        "User {} registered as victim of crisis {} by {}", victimUserId, crisisId, caller.userId());
    audit(caller, "victim.created", victim, Map.of("user_id", victimUserId));
    return victim;
  }

  /** Confirm or mark pending: open to administrators and participants. */
  @Transactional
  public CrisisVictim triage(CallerContext caller, UUID victimId, VictimStatus target) {
    if (target == VictimStatus.DISMISSED) {
      return dismiss(caller, victimId);
    }
    var victim = requireVictim(victimId);
    var crisis = crisisAccessService.requireActiveCrisis(victim.getCrisisId());
    crisisAccessService.requireParticipantOrAdministrator(caller, crisis);
    return applyStatus(caller, victim, target);
  }

  @Transactional
  public CrisisVictim dismiss(CallerContext caller, UUID victimId) {
    var victim = requireVictim(victimId);
    var crisis = crisisAccessService.requireActiveCrisis(victim.getCrisisId());
    crisisAccessService.requireAdministrator(caller, crisis);
    return applyStatus(caller, victim, VictimStatus.DISMISSED);
  }

  @Transactional
  public CrisisVictim edit(
      CallerContext caller, UUID victimId, String note, Double lastLat, Double lastLng) {
    var victim = requireVictim(victimId);
    var crisis = crisisAccessService.requireActiveCrisis(victim.getCrisisId());
    crisisAccessService.requireAdministrator(caller, crisis);
    if ((lastLat == null) != (lastLng == null)) {
      throw new InvalidRequestException(
          "Incomplete location", "lastLat and lastLng must be given together");
    }

    victim.edit(note, lastLat, lastLng, Instant.now(clock));
    victimRepository.saveAndFlush(victim);
    log.info("Victim {} edited by {}", victimId, caller.userId());
    audit(caller, "victim.updated", victim, Map.of());
    return victim;
  }

  @Transactional
  public void delete(CallerContext caller, UUID victimId) {
    var victim = requireVictim(victimId);
    var crisis = crisisAccessService.requireActiveCrisis(victim.getCrisisId());
    crisisAccessService.requireAdministrator(caller, crisis);

    victimRepository.delete(victim);
    log.info("Victim {} deleted by {}", victimId, caller.userId());
    audit(caller, "victim.deleted", victim, Map.of("user_id", victim.getUserId()));
  }

  @Transactional(readOnly = true)
  public Page<CrisisVictim> list(
      CallerContext caller, UUID crisisId, VictimStatus status, Pageable pageable) {
    var crisis = crisisAccessService.requireCrisis(crisisId);
    crisisAccessService.requireParticipantOrAdministrator(caller, crisis);
    return victimRepository.findByCrisis(crisisId, status, pageable);
  }

  private CrisisVictim register(UUID crisisId, UUID userId, String note, UUID createdBy) {
    if (victimRepository.existsByCrisisIdAndUserId(crisisId, userId)) {
      throw new ResourceConflictException(
          "Already registered", "User " + userId + " is already a victim of crisis " + crisisId);
    }
    var location = locationProvider.latestFor(userId);
    return victimRepository.save(
        new CrisisVictim(
            crisisId,
            userId,
            note,
            location.map(l -> l.lat()).orElse(null),
            location.map(l -> l.lng()).orElse(null),
            createdBy,
            Instant.now(clock)));
  }

  private CrisisVictim applyStatus(CallerContext caller, CrisisVictim victim, VictimStatus target) {
    var previous = victim.getStatus();
    victim.changeStatus(target, Instant.now(clock));
    victimRepository.saveAndFlush(victim);

    log.info("Victim {} moved {} -> {} by {}", victim.getId(), previous, target, caller.userId());
    audit(
        caller,
        "victim.status_changed",
        victim,
        Map.of("from", previous.name(), "to", target.name()));
    return victim;
  }

  private UUID resolveUser(UUID userId, String email) {
    if (userId != null) {
      return organizationDirectory
          .findAccount(userId)
          .map(OrganizationDirectory.Account::userId)
          .orElseThrow(
              () -> new InvalidRequestException("Unknown user", "No account with id " + userId));
    }
    if (email != null && !email.isBlank()) {
      return organizationDirectory
          .findAccountByEmail(email)
          .map(OrganizationDirectory.Account::userId)
          .orElseThrow(
              () -> new InvalidRequestException("Unknown user", "No account with email " + email));
    }
    throw new InvalidRequestException("Missing user", "Either userId or email is required");
  }

  private CrisisVictim requireVictim(UUID victimId) {
    return victimRepository
        .findById(victimId)
        .orElseThrow(() -> new ResourceNotFoundException("Victim", victimId));
  }

  private void audit(
      CallerContext caller, String eventType, CrisisVictim victim, Map<String, Object> extra) {
    var details = new LinkedHashMap<String, Object>(extra);
    details.put("crisis_id", victim.getCrisisId().toString());
    auditService.log(
        AuditEventBuilder.builder()
            .eventType(eventType)
            .entityType("victim")
            .entityId(victim.getId())
            .actor(caller)
            .details(details)
            .build());
  }
}
