package io.crisisintel.coordination.participation;

import io.crisisintel.coordination.audit.AuditEventBuilder;
import io.crisisintel.coordination.audit.AuditService;
import io.crisisintel.coordination.crisis.Crisis;
import io.crisisintel.coordination.event.ParticipationDecidedEvent;
import io.crisisintel.coordination.exception.InvalidRequestException;
import io.crisisintel.coordination.exception.ResourceConflictException;
import io.crisisintel.coordination.exception.ResourceNotFoundException;
import io.crisisintel.coordination.security.CallerContext;
import io.crisisintel.coordination.victim.CrisisVictimRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Direct join, participation requests, leave and removal. */
@Service
public class ParticipationService {

  private static final Logger log = LoggerFactory.getLogger(ParticipationService.class);

  static final String DEFAULT_ROLE_LABEL = "volunteer";

  private final CrisisAccessService crisisAccessService;
  private final CrisisParticipantRepository participantRepository;
  private final ParticipationRequestRepository participationRequestRepository;
  private final CrisisVictimRepository victimRepository;
  private final AuditService auditService;
  private final ApplicationEventPublisher eventPublisher;
  private final Clock clock;

  public ParticipationService(
      CrisisAccessService crisisAccessService,
      CrisisParticipantRepository participantRepository,
      ParticipationRequestRepository participationRequestRepository,
      CrisisVictimRepository victimRepository,
      AuditService auditService,
      ApplicationEventPublisher eventPublisher,
      Clock clock) {
    this.crisisAccessService = crisisAccessService;
    this.participantRepository = participantRepository;
    this.participationRequestRepository = participationRequestRepository;
    this.victimRepository = victimRepository;
    this.auditService = auditService;
    this.eventPublisher = eventPublisher;
    this.clock = clock;
  }

  /** Administrator adds a user directly, bypassing approval. */
  @Transactional
  public CrisisParticipant join(
      CallerContext caller, UUID crisisId, UUID userId, String roleLabel) {
    var crisis = crisisAccessService.requireActiveCrisis(crisisId);
    crisisAccessService.requireAdministrator(caller, crisis);
    if (userId == null) {
      throw new InvalidRequestException("Missing user", "userId is required");
    }
    if (participantRepository.existsByCrisisIdAndUserId(crisisId, userId)) {
      throw alreadyParticipating(crisisId, userId);
    }

    var participant = addParticipant(crisisId, userId, roleLabel);
    log.info("User {} joined crisis {} directly (by {})", userId, crisisId, caller.userId());
    audit(caller, "participant.joined", participant.getId(), crisisId, Map.of("user_id", userId));
    return participant;
  }

  /**
   * Files a request to participate. A second filing while the first is still pending returns the
   * existing row flagged as duplicate.
   */
  @Transactional
  public ParticipationFiling requestToParticipate(
      CallerContext caller, UUID crisisId, String roleLabel, String note) {
    crisisAccessService.requireActiveCrisis(crisisId);
    if (participantRepository.existsByCrisisIdAndUserId(crisisId, caller.userId())) {
      throw alreadyParticipating(crisisId, caller.userId());
    }

    var existing =
        participationRequestRepository.findByCrisisIdAndUserIdAndStatus(
            crisisId, caller.userId(), ParticipationRequestStatus.PENDING);
    if (existing.isPresent()) {
      log.info(
          "Duplicate participation request by {} for crisis {}; returning {}",
          caller.userId(),
          crisisId,
          existing.get().getId());
      return new ParticipationFiling(existing.get(), true);
    }

    var request =
        participationRequestRepository.save(
            new ParticipationRequest(
                crisisId, caller.userId(), labelOrDefault(roleLabel), note, Instant.now(clock)));
    log.info("User {} requested to participate in crisis {}", caller.userId(), crisisId);
    audit(
        caller,
        "participation_request.created",
        request.getId(),
        crisisId,
        Map.of("role_label", request.getRoleLabel()));
    return new ParticipationFiling(request, false);
  }

  @Transactional
  public ParticipationRequest approve(CallerContext caller, UUID requestId) {
    var request = requireRequest(requestId);
    var crisis = crisisAccessService.requireActiveCrisis(request.getCrisisId());
    crisisAccessService.requireAdministrator(caller, crisis);

    request.approve(caller.userId(), Instant.now(clock));
    participationRequestRepository.saveAndFlush(request);
    if (!participantRepository.existsByCrisisIdAndUserId(
        request.getCrisisId(), request.getUserId())) {
      addParticipant(request.getCrisisId(), request.getUserId(), request.getRoleLabel());
    }

    log.info("Participation request {} approved by {}", requestId, caller.userId());
    audit(
        caller,
        "participation_request.approved",
        requestId,
        crisis.getId(),
        Map.of("user_id", request.getUserId()));
    publishDecision(caller, crisis, request, true);
    return request;
  }

  @Transactional
  public ParticipationRequest reject(CallerContext caller, UUID requestId) {
    var request = requireRequest(requestId);
    var crisis = crisisAccessService.requireActiveCrisis(request.getCrisisId());
    crisisAccessService.requireAdministrator(caller, crisis);

    request.reject(caller.userId(), Instant.now(clock));
    participationRequestRepository.saveAndFlush(request);

    log.info("Participation request {} rejected by {}", requestId, caller.userId());
    audit(
        caller,
        "participation_request.rejected",
        requestId,
        crisis.getId(),
        Map.of("user_id", request.getUserId()));
    publishDecision(caller, crisis, request, false);
    return request;
  }

  /**
   * Removes the caller's membership and their victim record for the crisis, whichever exist. Fails
   * with not found only when the caller has neither.
   */
  @Transactional
  public void leave(CallerContext caller, UUID crisisId) {
    crisisAccessService.requireActiveCrisis(crisisId);
    var participant = participantRepository.findByCrisisIdAndUserId(crisisId, caller.userId());
    var victim = victimRepository.findByCrisisIdAndUserId(crisisId, caller.userId());
    if (participant.isEmpty() && victim.isEmpty()) {
      throw ResourceNotFoundException.withDetail(
          "Not in crisis",
          "User "
              + caller.userId()
              + " neither participates in nor is enrolled as a victim of crisis "
              + crisisId);
    }

    participant.ifPresent(participantRepository::delete);
    victim.ifPresent(victimRepository::delete);

    log.info(
        "User {} left crisis {} (participant: {}, victim: {})",
        caller.userId(),
        crisisId,
        participant.isPresent(),
        victim.isPresent());
    if (participant.isPresent()) {
      audit(
          caller,
          "participant.left",
          participant.get().getId(),
          crisisId,
          Map.of("user_id", caller.userId(), "victim_removed", victim.isPresent()));
    } else {
      audit(
          caller,
          "victim.left",
          victim.get().getId(),
          crisisId,
          Map.of("user_id", caller.userId()));
    }
  }

  /** Administrator removes another user's membership. */
  @Transactional
  public void remove(CallerContext caller, UUID crisisId, UUID userId) {
    var crisis = crisisAccessService.requireActiveCrisis(crisisId);
    crisisAccessService.requireAdministrator(caller, crisis);
    var participant =
        participantRepository
            .findByCrisisIdAndUserId(crisisId, userId)
            .orElseThrow(
                () ->
                    ResourceNotFoundException.withDetail(
                        "Not a participant",
                        "User " + userId + " does not participate in crisis " + crisisId));

    participantRepository.delete(participant);
    log.info("User {} removed from crisis {} by {}", userId, crisisId, caller.userId());
    audit(
        caller, "participant.removed", participant.getId(), crisisId, Map.of("user_id", userId));
  }

  @Transactional(readOnly = true)
  public Page<CrisisParticipant> listParticipants(UUID crisisId, Pageable pageable) {
    crisisAccessService.requireCrisis(crisisId);
    return participantRepository.findByCrisisId(crisisId, pageable);
  }

  @Transactional(readOnly = true)
  public Page<ParticipationRequest> listRequests(
      CallerContext caller,
      UUID crisisId,
      ParticipationRequestStatus status,
      Pageable pageable) {
    var crisis = crisisAccessService.requireCrisis(crisisId);
    crisisAccessService.requireAdministrator(caller, crisis);
    return participationRequestRepository.findByCrisis(crisisId, status, pageable);
  }

  @Transactional(readOnly = true)
  public List<CrisisParticipant> listMemberships(CallerContext caller) {
    return participantRepository.findByUserId(caller.userId());
  }

  /** Inserts a participant record. Callers have already checked the crisis and the caller. */
  @Transactional
  public CrisisParticipant addParticipant(UUID crisisId, UUID userId, String roleLabel) {
    return participantRepository.save(
        new CrisisParticipant(crisisId, userId, labelOrDefault(roleLabel), Instant.now(clock)));
  }

  private ParticipationRequest requireRequest(UUID requestId) {
    return participationRequestRepository
        .findById(requestId)
        .orElseThrow(() -> new ResourceNotFoundException("ParticipationRequest", requestId));
  }

  private void publishDecision(
      CallerContext caller, Crisis crisis, ParticipationRequest request, boolean approved) {
    eventPublisher.publishEvent(
        new ParticipationDecidedEvent(
            approved ? "participation_request.approved" : "participation_request.rejected",
            "participation_request",
            request.getId(),
            crisis.getId(),
            caller.userId(),
            Instant.now(clock),
            Map.of("crisis_title", crisis.getTitle()),
            request.getUserId(),
            approved));
  }

  private void audit(
      CallerContext caller,
      String eventType,
      UUID entityId,
      UUID crisisId,
      Map<String, Object> extra) {
    var details = new LinkedHashMap<String, Object>(extra);
    details.put("crisis_id", crisisId.toString());
    auditService.log(
        AuditEventBuilder.builder()
            .eventType(eventType)
            .entityType(eventType.substring(0, eventType.indexOf('.')))
            .entityId(entityId)
            .actor(caller)
            .details(details)
            .build());
  }

  private static String labelOrDefault(String roleLabel) {
    return roleLabel == null || roleLabel.isBlank() ? DEFAULT_ROLE_LABEL : roleLabel.trim();
  }

  private static ResourceConflictException alreadyParticipating(UUID crisisId, UUID userId) {
    return new ResourceConflictException(
        "Already participating", "User " + userId + " already participates in crisis " + crisisId);
  }

  /** Outcome of a participation filing; {@code duplicate} marks a returned pending request. */
  public record ParticipationFiling(ParticipationRequest request, boolean duplicate) {}
}
