package io.crisisintel.coordination.participation;

import io.crisisintel.coordination.crisis.Crisis;
import io.crisisintel.coordination.crisis.CrisisRepository;
import io.crisisintel.coordination.exception.ForbiddenException;
import io.crisisintel.coordination.exception.ResourceNotFoundException;
import io.crisisintel.coordination.security.CallerContext;
import java.util.UUID;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Decides who may act inside a crisis. Administrators (the crisis creator and platform admins)
 * may do anything; organization-role callers need a participant record; every other caller is
 * unrestricted by participation.
 */
@Service
public class CrisisAccessService {

  private final CrisisRepository crisisRepository;
  private final CrisisParticipantRepository participantRepository;

  public CrisisAccessService(
      CrisisRepository crisisRepository, CrisisParticipantRepository participantRepository) {
    this.crisisRepository = crisisRepository;
    this.participantRepository = participantRepository;
  }

  @Transactional(readOnly = true)
  public Crisis requireCrisis(UUID crisisId) {
    return crisisRepository
        .findById(crisisId)
        .orElseThrow(() -> new ResourceNotFoundException("Crisis", crisisId));
  }

  /** Loads the crisis and fails with {@code immutable} when it is closed or cancelled. */
  @Transactional(readOnly = true)
  public Crisis requireActiveCrisis(UUID crisisId) {
    var crisis = requireCrisis(crisisId);
    crisis.requireActive();
    return crisis;
  }

  public boolean isAdministrator(CallerContext caller, Crisis crisis) {
    return caller.admin() || caller.is(crisis.getAdminUserId());
  }

  public void requireAdministrator(CallerContext caller, Crisis crisis) {
    if (!isAdministrator(caller, crisis)) {
      throw new ForbiddenException(
          "Not a crisis administrator",
          "Only the crisis administrator may perform this operation");
    }
  }

  @Transactional(readOnly = true)
  public boolean isParticipant(UUID crisisId, UUID userId) {
    return participantRepository.existsByCrisisIdAndUserId(crisisId, userId);
  }

  /**
   * Gate for acting inside a crisis. An organization-role caller without a participant record is
   * refused unless it administers the crisis.
   */
  @Transactional(readOnly = true)
  public void requireMayAct(CallerContext caller, Crisis crisis) {
    if (isAdministrator(caller, crisis) || !caller.isOrganization()) {
      return;
    }
    if (!isParticipant(crisis.getId(), caller.userId())) {
      throw new ForbiddenException(
          "Not a crisis participant",
          "Organizations must participate in crisis " + crisis.getId() + " to act in it");
    }
  }

  /** Gate for operations reserved to participants and administrators regardless of role. */
  @Transactional(readOnly = true)
  public void requireParticipantOrAdministrator(CallerContext caller, Crisis crisis) {
    if (isAdministrator(caller, crisis) || isParticipant(crisis.getId(), caller.userId())) {
      return;
    }
    throw new ForbiddenException(
        "Not a crisis participant",
        "Only participants and administrators of crisis " + crisis.getId() + " may do this");
  }
}
