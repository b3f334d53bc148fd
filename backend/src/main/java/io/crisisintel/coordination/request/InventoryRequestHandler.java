package io.crisisintel.coordination.request;

import io.crisisintel.coordination.directory.OrganizationDirectory;
import io.crisisintel.coordination.exception.InvalidRequestException;
import io.crisisintel.coordination.inventory.BloodType;
import io.crisisintel.coordination.security.ActorRole;
import io.crisisintel.coordination.security.CallerContext;
import org.springframework.stereotype.Component;

/**
 * Blood units asked of a blood bank. Completing the request records the hand-over only; stock is
 * moved through crisis allocations, not here.
 */
@Component
public class InventoryRequestHandler implements RequestKindHandler {

  private final OrganizationDirectory organizationDirectory;

  public InventoryRequestHandler(OrganizationDirectory organizationDirectory) {
    this.organizationDirectory = organizationDirectory;
  }

  @Override
  public RequestKind kind() {
    return RequestKind.INVENTORY;
  }

  @Override
  public RequestDraft validate(CallerContext caller, RequestDraft draft) {
    CounterpartyCheck.requireTarget(draft);
    var bloodType =
        BloodType.fromLabel(draft.resourceType())
            .orElseThrow(
                () ->
                    new InvalidRequestException(
                        "Invalid resource type",
                        "Unknown blood type '" + draft.resourceType() + "'"));
    if (draft.quantity() == null || draft.quantity() <= 0) {
      throw new InvalidRequestException("Invalid quantity", "quantity must be greater than 0");
    }
    CounterpartyCheck.requireRole(
        organizationDirectory, draft.counterpartyId(), ActorRole.BLOOD_BANK);
    return draft.withResourceType(bloodType.label());
  }
}
