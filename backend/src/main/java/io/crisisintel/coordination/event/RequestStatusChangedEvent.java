package io.crisisintel.coordination.event;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

public record RequestStatusChangedEvent(
    String eventType,
    String entityType,
    UUID entityId,
    UUID crisisId,
    UUID actorId,
    Instant occurredAt,
    Map<String, Object> details,
    String kind,
    UUID requesterId,
    UUID counterpartyId,
    String oldStatus,
    String newStatus)
    implements DomainEvent {}
