package io.crisisintel.coordination.event;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

public record InvitationCreatedEvent(
    String eventType,
    String entityType,
    UUID entityId,
    UUID crisisId,
    UUID actorId,
    Instant occurredAt,
    Map<String, Object> details,
    UUID invitedUserId,
    String crisisTitle)
    implements DomainEvent {}
