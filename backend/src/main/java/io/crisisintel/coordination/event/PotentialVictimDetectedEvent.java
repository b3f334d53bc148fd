package io.crisisintel.coordination.event;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/** A user was found inside a crisis radius. {@code entityId} is the user. */
public record PotentialVictimDetectedEvent(
    String eventType,
    String entityType,
    UUID entityId,
    UUID crisisId,
    UUID actorId,
    Instant occurredAt,
    Map<String, Object> details,
    String crisisTitle,
    double distanceKm)
    implements DomainEvent {}
