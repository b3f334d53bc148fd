package io.crisisintel.coordination.request;

import io.crisisintel.coordination.audit.AuditEventBuilder;
import io.crisisintel.coordination.audit.AuditService;
import io.crisisintel.coordination.config.CoordinationProperties;
import io.crisisintel.coordination.event.RequestStatusChangedEvent;
import io.crisisintel.coordination.exception.ForbiddenException;
import io.crisisintel.coordination.exception.InvalidRequestException;
import io.crisisintel.coordination.exception.ResourceNotFoundException;
import io.crisisintel.coordination.participation.CrisisAccessService;
import io.crisisintel.coordination.security.CallerContext;
import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * The lifecycle shared by inventory, meeting, booking and dispatch requests:
 *
 * <pre>
 * pending  -> accepted | rejected | cancelled
 * accepted -> completed | cancelled
 * </pre>
 *
 * Accept, reject and complete belong to the counterparty; cancel belongs to the requester;
 * administrators may do all four. Every transition is a compare-and-set on the row version, so of
 * two racing callers exactly one wins.
 */
@Service
public class RequestLifecycleService {

  private static final Logger log = LoggerFactory.getLogger(RequestLifecycleService.class);

  private final RequestEnvelopeRepository requestRepository;
  private final Map<RequestKind, RequestKindHandler> handlers;
  private final CrisisAccessService crisisAccessService;
  private final AuditService auditService;
  private final ApplicationEventPublisher eventPublisher;
  private final CoordinationProperties properties;
  private final Clock clock;

  public RequestLifecycleService(
      RequestEnvelopeRepository requestRepository,
      List<RequestKindHandler> handlers,
      CrisisAccessService crisisAccessService,
      AuditService auditService,
      ApplicationEventPublisher eventPublisher,
      CoordinationProperties properties,
      Clock clock) {
    this.requestRepository = requestRepository;
    this.handlers = new EnumMap<>(RequestKind.class);
    for (var handler : handlers) {
      if (this.handlers.put(handler.kind(), handler) != null) {
        throw new IllegalStateException("Duplicate handler for request kind " + handler.kind());
      }
    }
    this.crisisAccessService = crisisAccessService;
    this.auditService = auditService;
    this.eventPublisher = eventPublisher;
    this.properties = properties;
    this.clock = clock;
  }

  /**
   * Files a new request. An identical pending request (same kind, requester, counterparty and
   * target) created within the duplicate window is returned instead, flagged as duplicate.
   */
  @Transactional
  public CreateResult create(CallerContext caller, RequestDraft draft) {
    if (draft.kind() == null) {
      throw new InvalidRequestException("Missing kind", "kind is required");
    }
    if (draft.counterpartyId() == null) {
      throw new InvalidRequestException("Missing counterparty", "counterpartyId is required");
    }
    if (caller.is(draft.counterpartyId())) {
      throw new InvalidRequestException(
          "Invalid counterparty", "A request cannot be addressed to its own requester");
    }
    if (draft.crisisId() != null) {
      var crisis = crisisAccessService.requireActiveCrisis(draft.crisisId());
      crisisAccessService.requireMayAct(caller, crisis);
    }
    var validated = handlerFor(draft.kind()).validate(caller, draft);

    Instant now = Instant.now(clock);
    var duplicate = findDuplicate(caller.userId(), validated, now);
    if (duplicate != null) {
      log.info(
          "Duplicate {} request by {} to {}; returning {}",
          validated.kind().value(),
          caller.userId(),
          validated.counterpartyId(),
          duplicate.getId());
      return new CreateResult(duplicate, true);
    }

    var envelope = requestRepository.save(new RequestEnvelope(caller.userId(), validated, now));
    log.info(
        "Created {} request {} from {} to {}",
        envelope.getKind().value(),
        envelope.getId(),
        envelope.getRequesterId(),
        envelope.getCounterpartyId());
    audit(caller, "request.created", envelope, null);
    publish(caller, envelope, null, now);
    return new CreateResult(envelope, false);
  }

  @Transactional
  public RequestEnvelope accept(CallerContext caller, UUID requestId) {
    var envelope = requireEnvelope(requestId);
    requireCounterpartyOrAdmin(caller, envelope, "accept");
    requireCrisisOpen(envelope);

    Instant now = Instant.now(clock);
    var previous = envelope.getStatus();
    handlerFor(envelope.getKind()).beforeAccept(envelope, now);
    envelope.accept(now);
    return commit(caller, envelope, previous, "request.accepted", now);
  }

  @Transactional
  public RequestEnvelope reject(CallerContext caller, UUID requestId, String reason) {
    var envelope = requireEnvelope(requestId);
    requireCounterpartyOrAdmin(caller, envelope, "reject");
    requireCrisisOpen(envelope);

    Instant now = Instant.now(clock);
    var previous = envelope.getStatus();
    envelope.reject(reason, now);
    return commit(caller, envelope, previous, "request.rejected", now);
  }

  @Transactional
  public RequestEnvelope cancel(CallerContext caller, UUID requestId) {
    var envelope = requireEnvelope(requestId);
    if (!caller.is(envelope.getRequesterId()) && !isAdministrator(caller, envelope)) {
      throw new ForbiddenException(
          "Not the requester", "Only the requester or an administrator may cancel a request");
    }
    requireCrisisOpen(envelope);

    Instant now = Instant.now(clock);
    var previous = envelope.getStatus();
    envelope.cancel(now, properties.cancellationWindow(), properties.enforceWindowOnPending());
    return commit(caller, envelope, previous, "request.cancelled", now);
  }

  /**
   * Completes an accepted request and runs the kind's completion effect.
   *
   * @param cooldownDays meeting requests only: overrides the donor cooldown; may be null
   */
  @Transactional
  public RequestEnvelope complete(CallerContext caller, UUID requestId, Integer cooldownDays) {
    var envelope = requireEnvelope(requestId);
    requireCounterpartyOrAdmin(caller, envelope, "complete");
    requireCrisisOpen(envelope);
    if (cooldownDays != null && cooldownDays < 0) {
      throw new InvalidRequestException("Invalid cooldown", "cooldownDays must not be negative");
    }

    Instant now = Instant.now(clock);
    var previous = envelope.getStatus();
    envelope.complete(now);
    var saved = commit(caller, envelope, previous, "request.completed", now);
    handlerFor(saved.getKind()).afterComplete(saved, cooldownDays, now);
    return saved;
  }

  /** Hides a finished request from the caller's own listings. */
  @Transactional
  public RequestEnvelope hide(CallerContext caller, UUID requestId) {
    var envelope = requireEnvelope(requestId);
    if (!envelope.isParty(caller.userId())) {
      throw new ForbiddenException(
          "Not a party", "Only the requester or counterparty may hide a request");
    }
    envelope.hideFor(caller.userId());
    var saved = requestRepository.saveAndFlush(envelope);
    log.info("Request {} hidden for {}", requestId, caller.userId());
    audit(caller, "request.hidden", saved, null);
    return saved;
  }

  @Transactional(readOnly = true)
  public RequestEnvelope get(CallerContext caller, UUID requestId) {
    var envelope = requireEnvelope(requestId);
    if (!envelope.isParty(caller.userId()) && !isAdministrator(caller, envelope)) {
      throw new ForbiddenException(
          "Not a party", "Only the parties and administrators may read this request");
    }
    return envelope;
  }

  /**
   * Lists requests. With a crisis the caller administers, every request of that crisis is listed;
   * otherwise only requests the caller is a party to and has not hidden.
   */
  @Transactional(readOnly = true)
  public Page<RequestEnvelope> list(CallerContext caller, RequestFilter filter, Pageable pageable) {
    if (filter.crisisId() != null) {
      var crisis = crisisAccessService.requireCrisis(filter.crisisId());
      if (crisisAccessService.isAdministrator(caller, crisis) && filter.side() == null) {
        return requestRepository.findByCrisis(
            filter.crisisId(), filter.kind(), filter.status(), filter.counterpartyId(), pageable);
      }
    }
    return requestRepository.findVisibleTo(
        caller.userId(),
        filter.side(),
        filter.kind(),
        filter.status(),
        filter.crisisId(),
        filter.counterpartyId(),
        pageable);
  }

  private RequestEnvelope findDuplicate(UUID requesterId, RequestDraft draft, Instant now) {
    Instant since = now.minus(properties.duplicateWindow());
    var matches =
        draft.targetAt() != null
            ? requestRepository.findRecentDuplicates(
                draft.kind(),
                requesterId,
                draft.counterpartyId(),
                draft.targetAt(),
                RequestStatus.PENDING,
                since)
            : requestRepository.findRecentUntimedDuplicates(
                draft.kind(), requesterId, draft.counterpartyId(), RequestStatus.PENDING, since);
    return matches.isEmpty() ? null : matches.get(0);
  }

  private RequestEnvelope commit(
      CallerContext caller,
      RequestEnvelope envelope,
      RequestStatus previous,
      String eventType,
      Instant now) {
    var saved = requestRepository.saveAndFlush(envelope);
    log.info(
        "Request {} ({}) moved {} -> {} by {}",
        saved.getId(),
        saved.getKind().value(),
        previous,
        saved.getStatus(),
        caller.userId());
    audit(caller, eventType, saved, previous);
    publish(caller, saved, previous, now);
    return saved;
  }

  private void requireCounterpartyOrAdmin(
      CallerContext caller, RequestEnvelope envelope, String action) {
    if (!caller.is(envelope.getCounterpartyId()) && !isAdministrator(caller, envelope)) {
      throw new ForbiddenException(
          "Not the counterparty",
          "Only the counterparty or an administrator may " + action + " this request");
    }
  }

  private boolean isAdministrator(CallerContext caller, RequestEnvelope envelope) {
    if (caller.admin()) {
      return true;
    }
    return envelope.getCrisisId() != null
        && crisisAccessService.isAdministrator(
            caller, crisisAccessService.requireCrisis(envelope.getCrisisId()));
  }

  private void requireCrisisOpen(RequestEnvelope envelope) {
    if (envelope.getCrisisId() != null) {
      crisisAccessService.requireActiveCrisis(envelope.getCrisisId());
    }
  }

  private RequestKindHandler handlerFor(RequestKind kind) {
    var handler = handlers.get(kind);
    if (handler == null) {
      throw new IllegalStateException("No handler registered for request kind " + kind);
    }
    return handler;
  }

  private RequestEnvelope requireEnvelope(UUID requestId) {
    return requestRepository
        .findById(requestId)
        .orElseThrow(() -> new ResourceNotFoundException("Request", requestId));
  }

  private void audit(
      CallerContext caller, String eventType, RequestEnvelope envelope, RequestStatus previous) {
    var details = new LinkedHashMap<String, Object>();
    details.put("kind", envelope.getKind().value());
    details.put("status", envelope.getStatus().name());
    if (previous != null) {
      details.put("previous_status", previous.name());
    }
    if (envelope.getCrisisId() != null) {
      details.put("crisis_id", envelope.getCrisisId().toString());
    }
    auditService.log(
        AuditEventBuilder.builder()
            .eventType(eventType)
            .entityType("request")
            .entityId(envelope.getId())
            .actor(caller)
            .details(details)
            .build());
  }

  private void publish(
      CallerContext caller, RequestEnvelope envelope, RequestStatus previous, Instant now) {
    eventPublisher.publishEvent(
        new RequestStatusChangedEvent(
            "request.status_changed",
            "request",
            envelope.getId(),
            envelope.getCrisisId(),
            caller.userId(),
            now,
            Map.of("kind", envelope.getKind().value()),
            envelope.getKind().value(),
            envelope.getRequesterId(),
            envelope.getCounterpartyId(),
            previous != null ? previous.name() : null,
            envelope.getStatus().name()));
  }

  /** Listing filter; every field is optional. {@code side} is "requester" or "counterparty". */
  public record RequestFilter(
      RequestKind kind,
      RequestStatus status,
      UUID crisisId,
      UUID counterpartyId,
      String side) {}

  /** Outcome of {@link #create}; {@code duplicate} marks a returned existing request. */
  public record CreateResult(RequestEnvelope request, boolean duplicate) {}
}
