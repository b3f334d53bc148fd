package io.crisisintel.coordination.request;

import io.crisisintel.coordination.config.CoordinationProperties;
import io.crisisintel.coordination.directory.OrganizationDirectory;
import io.crisisintel.coordination.donor.DonorProfileService;
import io.crisisintel.coordination.exception.ErrorCode;
import io.crisisintel.coordination.exception.InvalidRequestException;
import io.crisisintel.coordination.exception.InvalidStateException;
import io.crisisintel.coordination.security.CallerContext;
import java.time.Instant;
import org.springframework.stereotype.Component;

/** Donation meeting with a donor. The counterparty is the donor. */
@Component
public class MeetingRequestHandler implements RequestKindHandler {

  private final OrganizationDirectory organizationDirectory;
  private final DonorProfileService donorProfileService;
  private final CoordinationProperties properties;

  public MeetingRequestHandler(
      OrganizationDirectory organizationDirectory,
      DonorProfileService donorProfileService,
      CoordinationProperties properties) {
    this.organizationDirectory = organizationDirectory;
    this.donorProfileService = donorProfileService;
    this.properties = properties;
  }

  @Override
  public RequestKind kind() {
    return RequestKind.MEETING;
  }

  @Override
  public RequestDraft validate(CallerContext caller, RequestDraft draft) {
    CounterpartyCheck.requireTarget(draft);
    if (draft.cooldownDays() != null && draft.cooldownDays() < 0) {
      throw new InvalidRequestException("Invalid cooldown", "cooldownDays must not be negative");
    }
    CounterpartyCheck.requireRole(organizationDirectory, draft.counterpartyId(), null);
    return draft;
  }

  /** A donor still cooling down at the meeting time cannot accept it. */
  @Override
  public void beforeAccept(RequestEnvelope envelope, Instant now) {
    donorProfileService
        .find(envelope.getCounterpartyId())
        .filter(profile -> profile.isCoolingDownAt(envelope.getTargetAt()))
        .ifPresent(
            profile -> {
              throw new InvalidStateException(
                  ErrorCode.COOLDOWN_ACTIVE,
                  "Donor cooling down",
                  "Donor is in cooldown until " + profile.getCooldownUntil());
            });
  }

  /** Cooldown days: the completion call's value, else the request's, else the default. */
  @Override
  public void afterComplete(RequestEnvelope envelope, Integer cooldownDaysOverride, Instant now) {
    int days;
    if (cooldownDaysOverride != null) {
      days = cooldownDaysOverride;
    } else if (envelope.getCooldownDays() != null) {
      days = envelope.getCooldownDays();
    } else {
      days = properties.defaultCooldownDays();
    }
    donorProfileService.applyCooldown(envelope.getCounterpartyId(), days, now);
  }
}
