package io.crisisintel.coordination.request;

import java.time.Instant;
import java.util.UUID;

/**
 * Input for a new request. Only the fields of the draft's kind are read: {@code resourceType} and
 * {@code quantity} for inventory, {@code cooldownDays} for meetings, {@code serviceId} for
 * bookings, {@code description} and the location fields for dispatches.
 */
public record RequestDraft(
    RequestKind kind,
    UUID counterpartyId,
    Instant targetAt,
    UUID crisisId,
    String resourceType,
    Integer quantity,
    UUID serviceId,
    String description,
    String locationText,
    Double lat,
    Double lng,
    Integer cooldownDays) {

  public RequestDraft withResourceType(String normalized) {
    return new RequestDraft(
        kind,
        counterpartyId,
        targetAt,
        crisisId,
        normalized,
        quantity,
        serviceId,
        description,
        locationText,
        lat,
        lng,
        cooldownDays);
  }
}
