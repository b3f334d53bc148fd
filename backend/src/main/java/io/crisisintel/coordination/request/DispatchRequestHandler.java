package io.crisisintel.coordination.request;

import io.crisisintel.coordination.directory.OrganizationDirectory;
import io.crisisintel.coordination.exception.InvalidRequestException;
import io.crisisintel.coordination.security.ActorRole;
import io.crisisintel.coordination.security.CallerContext;
import org.springframework.stereotype.Component;

/** Emergency call-out of a fire service. Not time-bound. */
@Component
public class DispatchRequestHandler implements RequestKindHandler {

  private final OrganizationDirectory organizationDirectory;

  public DispatchRequestHandler(OrganizationDirectory organizationDirectory) {
    this.organizationDirectory = organizationDirectory;
  }

  @Override
  public RequestKind kind() {
    return RequestKind.DISPATCH;
  }

  @Override
  public RequestDraft validate(CallerContext caller, RequestDraft draft) {
    if (draft.description() == null || draft.description().isBlank()) {
      throw new InvalidRequestException(
          "Missing description", "dispatch requests need a description");
    }
    if ((draft.lat() == null) != (draft.lng() == null)) {
      throw new InvalidRequestException(
          "Incomplete location", "lat and lng must be given together");
    }
    CounterpartyCheck.requireRole(
        organizationDirectory, draft.counterpartyId(), ActorRole.FIRE_SERVICE);
    return draft;
  }
}
