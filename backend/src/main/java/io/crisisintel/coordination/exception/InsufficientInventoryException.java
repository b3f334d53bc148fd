package io.crisisintel.coordination.exception;

import java.util.UUID;

public class InsufficientInventoryException extends CoordinationException {

  public InsufficientInventoryException(UUID providerId, String resourceType, int requested) {
    super(
        ErrorCode.INSUFFICIENT_INVENTORY,
        "Insufficient inventory",
        "Provider "
            + providerId
            + " does not hold "
            + requested
            + " unit(s) of "
            + resourceType);
  }
}
