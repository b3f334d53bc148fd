package io.crisisintel.coordination.request;

import io.crisisintel.coordination.directory.OrganizationDirectory;
import io.crisisintel.coordination.exception.InvalidRequestException;
import io.crisisintel.coordination.security.ActorRole;
import java.util.UUID;

/** Counterparty lookups shared by the kind handlers. */
final class CounterpartyCheck {

  static void requireRole(OrganizationDirectory directory, UUID counterpartyId, ActorRole role) {
    var account =
        directory
            .findAccount(counterpartyId)
            .orElseThrow(
                () ->
                    new InvalidRequestException(
                        "Unknown counterparty", "No account with id " + counterpartyId));
    if (role != null && account.role() != role) {
      throw new InvalidRequestException(
          "Invalid counterparty",
          "Counterparty must be a "
              + role.claimValue()
              + " account, not "
              + account.role().claimValue());
    }
  }

  static void requireTarget(RequestDraft draft) {
    if (draft.kind().isTimeBound() && draft.targetAt() == null) {
      throw new InvalidRequestException(
          "Missing target time", draft.kind().value() + " requests need a targetAt");
    }
  }

  private CounterpartyCheck() {}
}
