package io.crisisintel.coordination.event;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Base interface for domain events published via Spring {@code ApplicationEventPublisher}. All
 * implementations are records with primitive/UUID fields only -- no JPA entity references, no lazy
 * proxies -- so they stay valid after the publishing transaction commits.
 *
 * <p>{@code crisisId} is null for events outside any crisis (for example a request filed without
 * crisis scope).
 */
public sealed interface DomainEvent
    permits InvitationCreatedEvent,
        ParticipationDecidedEvent,
        PotentialVictimDetectedEvent,
        RequestStatusChangedEvent {

  String eventType();

  String entityType();

  UUID entityId();

  UUID crisisId();

  UUID actorId();

  Instant occurredAt();

  Map<String, Object> details();
}
