package io.crisisintel.coordination.request;

import io.crisisintel.coordination.exception.ErrorCode;
import io.crisisintel.coordination.exception.InvalidStateException;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * One request between a requester and a counterparty. All four kinds share this row shape and its
 * state machine; kind-specific payload columns stay null for the other kinds.
 */
@Entity
@Table(name = "coordination_requests")
public class RequestEnvelope {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Enumerated(EnumType.STRING)
  @Column(name = "kind", nullable = false, updatable = false, length = 20)
  private RequestKind kind;

  @Column(name = "requester_id", nullable = false, updatable = false)
  private UUID requesterId;

  @Column(name = "counterparty_id", nullable = false, updatable = false)
  private UUID counterpartyId;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private RequestStatus status;

  @Column(name = "target_at")
  private Instant targetAt;

  @Column(name = "crisis_id", updatable = false)
  private UUID crisisId;

  @Column(name = "resource_type", length = 10)
  private String resourceType;

  @Column(name = "quantity")
  private Integer quantity;

  @Column(name = "service_id")
  private UUID serviceId;

  @Column(name = "description", columnDefinition = "TEXT")
  private String description;

  @Column(name = "location_text", length = 500)
  private String locationText;

  @Column(name = "lat")
  private Double lat;

  @Column(name = "lng")
  private Double lng;

  @Column(name = "cooldown_days")
  private Integer cooldownDays;

  @Column(name = "reject_reason", length = 500)
  private String rejectReason;

  @Column(name = "hidden_by_requester", nullable = false)
  private boolean hiddenByRequester;

  @Column(name = "hidden_by_counterparty", nullable = false)
  private boolean hiddenByCounterparty;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  @Column(name = "responded_at")
  private Instant respondedAt;

  @Column(name = "closed_at")
  private Instant closedAt;

  @Version
  @Column(name = "version", nullable = false)
  private long version;

  protected RequestEnvelope() {}

  public RequestEnvelope(UUID requesterId, RequestDraft draft, Instant createdAt) {
    this.kind = draft.kind();
    this.requesterId = requesterId;
    this.counterpartyId = draft.counterpartyId();
    this.targetAt = draft.targetAt();
    this.crisisId = draft.crisisId();
    this.resourceType = draft.resourceType();
    this.quantity = draft.quantity();
    this.serviceId = draft.serviceId();
    this.description = draft.description();
    this.locationText = draft.locationText();
    this.lat = draft.lat();
    this.lng = draft.lng();
    this.cooldownDays = draft.cooldownDays();
    this.status = RequestStatus.PENDING;
    this.createdAt = createdAt;
    this.updatedAt = createdAt;
  }

  public void accept(Instant at) {
    requireTransition(RequestStatus.ACCEPTED, "accept");
    this.status = RequestStatus.ACCEPTED;
    this.respondedAt = at;
    this.updatedAt = at;
  }

  public void reject(String reason, Instant at) {
    requireTransition(RequestStatus.REJECTED, "reject");
    this.status = RequestStatus.REJECTED;
    this.rejectReason = reason;
    this.respondedAt = at;
    this.closedAt = at;
    this.updatedAt = at;
  }

  /**
   * Cancels the request. An accepted request with a target time can no longer be cancelled once
   * {@code now} reaches {@code targetAt - window}; pending requests are exempt unless {@code
   * enforceOnPending} is set.
   */
  public void cancel(Instant now, Duration window, boolean enforceOnPending) {
    requireTransition(RequestStatus.CANCELLED, "cancel");
    boolean windowApplies = status == RequestStatus.ACCEPTED || enforceOnPending;
    if (windowApplies && targetAt != null && !now.isBefore(targetAt.minus(window))) {
      throw new InvalidStateException(
          ErrorCode.TOO_LATE_TO_CANCEL,
          "Too late to cancel",
          "Requests can only be cancelled until "
              + window.toMinutes()
              + " minutes before the target time "
              + targetAt);
    }
    this.status = RequestStatus.CANCELLED;
    this.closedAt = now;
    this.updatedAt = now;
  }

  public void complete(Instant at) {
    requireTransition(RequestStatus.COMPLETED, "complete");
    this.status = RequestStatus.COMPLETED;
    this.closedAt = at;
    this.updatedAt = at;
  }

  /**
   * Hides a completed or cancelled request from one party's own listings. Shared state is
   * unchanged.
   */
  public void hideFor(UUID userId) {
    if (status != RequestStatus.COMPLETED && status != RequestStatus.CANCELLED) {
      throw new InvalidStateException(
          "Request not hideable",
          "Only completed or cancelled requests can be hidden; this one is " + status);
    }
    if (userId.equals(requesterId)) {
      this.hiddenByRequester = true;
    }
    if (userId.equals(counterpartyId)) {
      this.hiddenByCounterparty = true;
    }
  }

  public boolean isParty(UUID userId) {
    return requesterId.equals(userId) || counterpartyId.equals(userId);
  }

  public boolean isHiddenFor(UUID userId) {
    return (requesterId.equals(userId) && hiddenByRequester)
        || (counterpartyId.equals(userId) && hiddenByCounterparty);
  }

  private void requireTransition(RequestStatus target, String action) {
    if (status.isTerminal()) {
      throw InvalidStateException.immutable("Request", status);
    }
    if (!status.canTransitionTo(target)) {
      throw new InvalidStateException(
          "Invalid request state", "Cannot " + action + " request in status " + status);
    }
  }

  public UUID getId() {
    return id;
  }

  public RequestKind getKind() {
    return kind;
  }

  public UUID getRequesterId() {
    return requesterId;
  }

  public UUID getCounterpartyId() {
    return counterpartyId;
  }

  public RequestStatus getStatus() {
    return status;
  }

  public Instant getTargetAt() {
    return targetAt;
  }

  public UUID getCrisisId() {
    return crisisId;
  }

  public String getResourceType() {
    return resourceType;
  }

  public Integer getQuantity() {
    return quantity;
  }

  public UUID getServiceId() {
    return serviceId;
  }

  public String getDescription() {
    return description;
  }

  public String getLocationText() {
    return locationText;
  }

  public Double getLat() {
    return lat;
  }

  public Double getLng() {
    return lng;
  }

  public Integer getCooldownDays() {
    return cooldownDays;
  }

  public String getRejectReason() {
    return rejectReason;
  }

  public boolean isHiddenByRequester() {
    return hiddenByRequester;
  }

  public boolean isHiddenByCounterparty() {
    return hiddenByCounterparty;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public Instant getRespondedAt() {
    return respondedAt;
  }

  public Instant getClosedAt() {
    return closedAt;
  }
}
