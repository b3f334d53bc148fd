package io.crisisintel.coordination.request;

import io.crisisintel.coordination.directory.OrganizationDirectory;
import io.crisisintel.coordination.exception.InvalidRequestException;
import io.crisisintel.coordination.security.ActorRole;
import io.crisisintel.coordination.security.CallerContext;
import org.springframework.stereotype.Component;

/** Appointment for one of a hospital's services. */
@Component
public class BookingRequestHandler implements RequestKindHandler {

  private final OrganizationDirectory organizationDirectory;

  public BookingRequestHandler(OrganizationDirectory organizationDirectory) {
    this.organizationDirectory = organizationDirectory;
  }

  @Override
  public RequestKind kind() {
    return RequestKind.BOOKING;
  }

  @Override
  public RequestDraft validate(CallerContext caller, RequestDraft draft) {
    CounterpartyCheck.requireTarget(draft);
    if (draft.serviceId() == null) {
      throw new InvalidRequestException("Missing service", "booking requests need a serviceId");
    }
    CounterpartyCheck.requireRole(
        organizationDirectory, draft.counterpartyId(), ActorRole.HOSPITAL);
    if (!organizationDirectory.isActiveHospitalService(draft.serviceId(), draft.counterpartyId())) {
      throw new InvalidRequestException(
          "Invalid service",
          "Service " + draft.serviceId() + " is not an active service of the hospital");
    }
    return draft;
  }
}
