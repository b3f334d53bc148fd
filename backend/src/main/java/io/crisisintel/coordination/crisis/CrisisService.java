package io.crisisintel.coordination.crisis;

import io.crisisintel.coordination.audit.AuditEvent;
import io.crisisintel.coordination.audit.AuditEventBuilder;
import io.crisisintel.coordination.audit.AuditService;
import io.crisisintel.coordination.config.CoordinationProperties;
import io.crisisintel.coordination.exception.ForbiddenException;
import io.crisisintel.coordination.exception.InvalidRequestException;
import io.crisisintel.coordination.exception.ResourceNotFoundException;
import io.crisisintel.coordination.participation.CrisisAccessService;
import io.crisisintel.coordination.participation.CrisisParticipant;
import io.crisisintel.coordination.participation.CrisisParticipantRepository;
import io.crisisintel.coordination.participation.ParticipationService;
import io.crisisintel.coordination.security.CallerContext;
import io.crisisintel.coordination.victim.CrisisVictimRepository;
import io.crisisintel.coordination.victim.VictimDetectionService;
import java.math.BigDecimal;
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

/**
 * Crisis and incident lifecycle. A crisis is created together with its incident, by a platform
 * administrator who then administers the crisis. Closing or cancelling ends both, after which the
 * crisis and everything under it is read-only.
 */
@Service
public class CrisisService {

  private static final Logger log = LoggerFactory.getLogger(CrisisService.class);

  static final String DEFAULT_INCIDENT_TYPE = "other";
  static final String DEFAULT_SEVERITY = "medium";

  private final CrisisRepository crisisRepository;
  private final IncidentRepository incidentRepository;
  private final CrisisAccessService crisisAccessService;
  private final ParticipationService participationService;
  private final CrisisParticipantRepository participantRepository;
  private final CrisisVictimRepository victimRepository;
  private final CrisisDonationRepository donationRepository;
  private final CrisisExpenseRepository expenseRepository;
  private final VictimDetectionService victimDetectionService;
  private final AuditService auditService;
  private final CoordinationProperties properties;
  private final Clock clock;

  public CrisisService(
      CrisisRepository crisisRepository,
      IncidentRepository incidentRepository,
      CrisisAccessService crisisAccessService,
      ParticipationService participationService,
      CrisisParticipantRepository participantRepository,
      CrisisVictimRepository victimRepository,
      CrisisDonationRepository donationRepository,
      CrisisExpenseRepository expenseRepository,
      VictimDetectionService victimDetectionService,
      AuditService auditService,
      CoordinationProperties properties,
      Clock clock) {
    this.crisisRepository = crisisRepository;
    this.incidentRepository = incidentRepository;
    this.crisisAccessService = crisisAccessService;
    this.participationService = participationService;
    this.participantRepository = participantRepository;
    this.victimRepository = victimRepository;
    this.donationRepository = donationRepository;
    this.expenseRepository = expenseRepository;
    this.victimDetectionService = victimDetectionService;
    this.auditService = auditService;
    this.properties = properties;
    this.clock = clock;
  }

  /**
   * Opens an incident and its crisis, makes the creator the crisis administrator and announces
   * every user already inside the radius as a potential victim.
   */
  @Transactional
  public Crisis createCrisis(CallerContext caller, CreateCrisisCommand command) {
    if (!caller.admin()) {
      throw new ForbiddenException(
          "Not a platform administrator", "Only platform administrators may declare a crisis");
    }
    if (command.title() == null || command.title().isBlank()) {
      throw new InvalidRequestException("Missing title", "title is required");
    }
    if (command.lat() == null || command.lng() == null) {
      throw new InvalidRequestException("Missing location", "lat and lng are required");
    }
    if (command.lat() < -90 || command.lat() > 90 || command.lng() < -180 || command.lng() > 180) {
      throw new InvalidRequestException(
          "Invalid location", "lat must be within [-90, 90] and lng within [-180, 180]");
    }
    double radiusKm =
        command.radiusKm() != null ? command.radiusKm() : properties.defaultRadiusKm();
    if (radiusKm <= 0) {
      throw new InvalidRequestException("Invalid radius", "radiusKm must be greater than 0");
    }

    Instant now = Instant.now(clock);
    var incident =
        incidentRepository.save(
            new Incident(
                command.title().trim(),
                command.description(),
                orDefault(command.incidentType(), DEFAULT_INCIDENT_TYPE),
                orDefault(command.severity(), DEFAULT_SEVERITY),
                command.lat(),
                command.lng(),
                caller.userId(),
                now));
    var crisis =
        crisisRepository.save(
            new Crisis(
                incident.getId(),
                command.title().trim(),
                command.description(),
                command.lat(),
                command.lng(),
                radiusKm,
                caller.userId(),
                now));
    participationService.addParticipant(
        crisis.getId(), caller.userId(), CrisisParticipant.ROLE_ADMIN);

    log.info(
        "Crisis {} '{}' declared by {} (incident {}, radius {} km)",
        crisis.getId(),
        crisis.getTitle(),
        caller.userId(),
        incident.getId(),
        radiusKm);
    var details = new LinkedHashMap<String, Object>();
    details.put("crisis_id", crisis.getId().toString());
    details.put("incident_id", incident.getId().toString());
    details.put("title", crisis.getTitle());
    details.put("radius_km", radiusKm);
    audit(caller, "crisis.created", "crisis", crisis.getId(), details);

    victimDetectionService.announceForCrisis(crisis, caller.userId());
    return crisis;
  }

  @Transactional(readOnly = true)
  public CrisisDetail getCrisis(UUID crisisId) {
    var crisis = crisisAccessService.requireCrisis(crisisId);
    var incident = requireIncident(crisis.getIncidentId());
    BigDecimal donations = donationRepository.sumByCrisisId(crisisId);
    BigDecimal expenses = expenseRepository.sumByCrisisId(crisisId);
    return new CrisisDetail(
        crisis,
        incident,
        participantRepository.countByCrisisId(crisisId),
        victimRepository.countByCrisisId(crisisId),
        donations,
        expenses);
  }

  @Transactional(readOnly = true)
  public Page<Crisis> listCrises(CrisisStatus status, Pageable pageable) {
    return crisisRepository.findByOptionalStatus(status, pageable);
  }

  @Transactional
  public Crisis closeCrisis(CallerContext caller, UUID crisisId) {
    return end(caller, crisisId, CrisisStatus.CLOSED);
  }

  @Transactional
  public Crisis cancelCrisis(CallerContext caller, UUID crisisId) {
    return end(caller, crisisId, CrisisStatus.CANCELLED);
  }

  /** Appends a free-text note to the crisis timeline. */
  @Transactional
  public IncidentNote addIncidentNote(CallerContext caller, UUID crisisId, String note) {
    var crisis = crisisAccessService.requireActiveCrisis(crisisId);
    crisisAccessService.requireParticipantOrAdministrator(caller, crisis);
    if (note == null || note.isBlank()) {
      throw new InvalidRequestException("Missing note", "note is required");
    }

    Instant now = Instant.now(clock);
    var details = new LinkedHashMap<String, Object>();
    details.put("crisis_id", crisisId.toString());
    details.put("note", note.trim());
    audit(caller, "incident.note_added", "incident", crisis.getIncidentId(), details);
    log.info(
        "Note added to incident {} of crisis {} by {}",
        crisis.getIncidentId(),
        crisisId,
        caller.userId());
    return new IncidentNote(crisis.getIncidentId(), crisisId, note.trim(), caller.userId(), now);
  }

  /** Audit events of the crisis and everything under it, newest first. */
  @Transactional(readOnly = true)
  public Page<AuditEvent> timeline(CallerContext caller, UUID crisisId, Pageable pageable) {
    var crisis = crisisAccessService.requireCrisis(crisisId);
    crisisAccessService.requireParticipantOrAdministrator(caller, crisis);
    return auditService.findCrisisTimeline(crisisId, pageable);
  }

  private Crisis end(CallerContext caller, UUID crisisId, CrisisStatus target) {
    var crisis = crisisAccessService.requireCrisis(crisisId);
    crisisAccessService.requireAdministrator(caller, crisis);
    var incident = requireIncident(crisis.getIncidentId());

    Instant now = Instant.now(clock);
    var previous = crisis.getStatus();
    if (target == CrisisStatus.CLOSED) {
      crisis.close(incident, now);
    } else {
      crisis.cancel(incident, now);
    }
    incidentRepository.saveAndFlush(incident);
    crisis = crisisRepository.saveAndFlush(crisis);

    log.info("Crisis {} moved {} -> {} by {}", crisisId, previous, target, caller.userId());
    audit(
        caller,
        target == CrisisStatus.CLOSED ? "crisis.closed" : "crisis.cancelled",
        "crisis",
        crisisId,
        Map.of("crisis_id", crisisId.toString(), "previous_status", previous.name()));
    return crisis;
  }

  private Incident requireIncident(UUID incidentId) {
    return incidentRepository
        .findById(incidentId)
        .orElseThrow(() -> new ResourceNotFoundException("Incident", incidentId));
  }

  private void audit(
      CallerContext caller,
      String eventType,
      String entityType,
      UUID entityId,
      Map<String, Object> details) {
    auditService.log(
        AuditEventBuilder.builder()
            .eventType(eventType)
            .entityType(entityType)
            .entityId(entityId)
            .actor(caller)
            .details(details)
            .build());
  }

  private static String orDefault(String value, String fallback) {
    return value == null || value.isBlank() ? fallback : value.trim();
  }

  public record CreateCrisisCommand(
      String title,
      String description,
      String incidentType,
      String severity,
      Double lat,
      Double lng,
      Double radiusKm) {}

  public record CrisisDetail(
      Crisis crisis,
      Incident incident,
      long participantCount,
      long victimCount,
      BigDecimal donationsTotal,
      BigDecimal expensesTotal) {

    public BigDecimal balance() {
      return donationsTotal.subtract(expensesTotal);
    }
  }

  public record IncidentNote(
      UUID incidentId, UUID crisisId, String note, UUID authorId, Instant createdAt) {}
}
