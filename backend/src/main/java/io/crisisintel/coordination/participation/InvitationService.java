package io.crisisintel.coordination.participation;

import io.crisisintel.coordination.audit.AuditEventBuilder;
import io.crisisintel.coordination.audit.AuditService;
import io.crisisintel.coordination.directory.OrganizationDirectory;
import io.crisisintel.coordination.event.InvitationCreatedEvent;
import io.crisisintel.coordination.exception.ForbiddenException;
import io.crisisintel.coordination.exception.InvalidRequestException;
import io.crisisintel.coordination.exception.InvalidStateException;
import io.crisisintel.coordination.exception.ResourceConflictException;
import io.crisisintel.coordination.exception.ResourceNotFoundException;
import io.crisisintel.coordination.security.CallerContext;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class InvitationService {

  private static final Logger log = LoggerFactory.getLogger(InvitationService.class);

  private final CrisisAccessService crisisAccessService;
  private final CrisisInvitationRepository invitationRepository;
  private final CrisisParticipantRepository participantRepository;
  private final ParticipationService participationService;
  private final OrganizationDirectory organizationDirectory;
  private final AuditService auditService;
  private final ApplicationEventPublisher eventPublisher;
  private final Clock clock;

  public InvitationService(
      CrisisAccessService crisisAccessService,
      CrisisInvitationRepository invitationRepository,
      CrisisParticipantRepository participantRepository,
      ParticipationService participationService,
      OrganizationDirectory organizationDirectory,
      AuditService auditService,
      ApplicationEventPublisher eventPublisher,
      Clock clock) {
    this.crisisAccessService = crisisAccessService;
    this.invitationRepository = invitationRepository;
    this.participantRepository = participantRepository;
    this.participationService = participationService;
    this.organizationDirectory = organizationDirectory;
    this.auditService = auditService;
    this.eventPublisher = eventPublisher;
    this.clock = clock;
  }

  /** Administrator invites an organization account into the crisis. */
  @Transactional
  public CrisisInvitation invite(CallerContext caller, UUID crisisId, UUID orgUserId, String note) {
    var crisis = crisisAccessService.requireActiveCrisis(crisisId);
    crisisAccessService.requireAdministrator(caller, crisis);
    if (orgUserId == null) {
      throw new InvalidRequestException("Missing invitee", "orgUserId is required");
    }

    var account =
        organizationDirectory
            .findAccount(orgUserId)
            .filter(a -> a.role().isOrganization())
            .orElseThrow(
                () ->
                    new InvalidRequestException(
                        "Invalid invitee", "User " + orgUserId + " is not an organization"));
    if (participantRepository.existsByCrisisIdAndUserId(crisisId, orgUserId)) {
      throw new ResourceConflictException(
          "Already participating", "Organization already participates in crisis " + crisisId);
    }
    if (invitationRepository.findByCrisisIdAndOrgUserId(crisisId, orgUserId).isPresent()) {
      throw new ResourceConflictException(
          "Already invited", "Organization was already invited to crisis " + crisisId);
    }

    Instant now = Instant.now(clock);
    var invitation =
        invitationRepository.save(
            new CrisisInvitation(
                crisisId, orgUserId, account.role().claimValue(), note, caller.userId(), now));

    log.info("Organization {} invited to crisis {} by {}", orgUserId, crisisId, caller.userId());
    audit(
        caller,
        "invitation.created",
        invitation,
        Map.of("org_user_id", orgUserId, "org_type", invitation.getOrgType()));
    eventPublisher.publishEvent(
        new InvitationCreatedEvent(
            "invitation.created",
            "invitation",
            invitation.getId(),
            crisisId,
            caller.userId(),
            now,
            Map.of("org_type", invitation.getOrgType()),
            orgUserId,
            crisis.getTitle()));
    return invitation;
  }

  /** The invited organization accepts (joining the crisis) or declines. */
  @Transactional
  public CrisisInvitation respond(CallerContext caller, UUID invitationId, boolean accept) {
    var invitation = requireInvitation(invitationId);
    if (!caller.is(invitation.getOrgUserId())) {
      throw new ForbiddenException(
          "Not the invitee", "Only the invited organization may answer this invitation");
    }
    crisisAccessService.requireActiveCrisis(invitation.getCrisisId());

    Instant now = Instant.now(clock);
    if (accept) {
      invitation.accept(now);
    } else {
      invitation.decline(now);
    }
    invitationRepository.saveAndFlush(invitation);

    if (accept
        && !participantRepository.existsByCrisisIdAndUserId(
            invitation.getCrisisId(), invitation.getOrgUserId())) {
      participationService.addParticipant(
          invitation.getCrisisId(), invitation.getOrgUserId(), invitation.getOrgType());
    }

    String eventType = accept ? "invitation.accepted" : "invitation.declined";
    log.info(
        "Invitation {} {} by {}", invitationId, accept ? "accepted" : "declined", caller.userId());
    audit(caller, eventType, invitation, Map.of());
    return invitation;
  }

  /** Administrator withdraws an invitation that has not been answered yet. */
  @Transactional
  public void deletePending(CallerContext caller, UUID invitationId) {
    var invitation = requireInvitation(invitationId);
    var crisis = crisisAccessService.requireActiveCrisis(invitation.getCrisisId());
    crisisAccessService.requireAdministrator(caller, crisis);
    if (!invitation.isPending()) {
      throw new InvalidStateException(
          "Invitation already answered",
          "Only pending invitations can be deleted; this one is "
              + invitation.getStatus().name().toLowerCase(Locale.ROOT));
    }

    invitationRepository.delete(invitation);
    log.info("Invitation {} deleted by {}", invitationId, caller.userId());
    audit(caller, "invitation.deleted", invitation, Map.of());
  }

  @Transactional(readOnly = true)
  public Page<CrisisInvitation> listForCrisis(
      CallerContext caller, UUID crisisId, InvitationStatus status, Pageable pageable) {
    var crisis = crisisAccessService.requireCrisis(crisisId);
    crisisAccessService.requireAdministrator(caller, crisis);
    return invitationRepository.findByCrisis(crisisId, status, pageable);
  }

  @Transactional(readOnly = true)
  public Page<CrisisInvitation> listMine(
      CallerContext caller, InvitationStatus status, Pageable pageable) {
    return invitationRepository.findByInvitee(caller.userId(), status, pageable);
  }

  private CrisisInvitation requireInvitation(UUID invitationId) {
    return invitationRepository
        .findById(invitationId)
        .orElseThrow(() -> new ResourceNotFoundException("Invitation", invitationId));
  }

  private void audit(
      CallerContext caller,
      String eventType,
      CrisisInvitation invitation,
      Map<String, Object> extra) {
    var details = new LinkedHashMap<String, Object>(extra);
    details.put("crisis_id", invitation.getCrisisId().toString());
    auditService.log(
        AuditEventBuilder.builder()
            .eventType(eventType)
            .entityType("invitation")
            .entityId(invitation.getId())
            .actor(caller)
            .details(details)
            .build());
  }
}
