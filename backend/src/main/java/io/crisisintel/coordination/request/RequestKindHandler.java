package io.crisisintel.coordination.request;

import io.crisisintel.coordination.security.CallerContext;
import java.time.Instant;

/**
 * Kind-specific rules plugged into the shared request lifecycle. One implementation exists per
 * {@link RequestKind}.
 */
public interface RequestKindHandler {

  RequestKind kind();

  /**
   * Validates the kind's payload and counterparty, returning the draft to store (possibly
   * normalized).
   */
  RequestDraft validate(CallerContext caller, RequestDraft draft);

  /** Extra guard run before a counterparty accepts. */
  default void beforeAccept(RequestEnvelope envelope, Instant now) {}

  /**
   * Side effect of completion.
   *
   * @param cooldownDaysOverride value supplied with the completion call, or null
   */
  default void afterComplete(
      RequestEnvelope envelope, Integer cooldownDaysOverride, Instant now) {}
}
