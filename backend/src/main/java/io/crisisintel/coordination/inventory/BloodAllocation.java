package io.crisisintel.coordination.inventory;

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
import java.time.Instant;
import java.util.UUID;

/** A committed draw of blood units from a provider's stock for a crisis. */
@Entity
@Table(name = "crisis_blood_allocations")
public class BloodAllocation {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "crisis_id", nullable = false, updatable = false)
  private UUID crisisId;

  @Column(name = "provider_id", nullable = false, updatable = false)
  private UUID providerId;

  @Column(name = "resource_type", nullable = false, updatable = false, length = 10)
  private String resourceType;

  @Column(name = "quantity", nullable = false, updatable = false)
  private int quantity;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private AllocationStatus status;

  @Column(name = "purpose", length = 500)
  private String purpose;

  @Column(name = "allocated_by", nullable = false, updatable = false)
  private UUID allocatedBy;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "reverted_at")
  private Instant revertedAt;

  @Version
  @Column(name = "version", nullable = false)
  private long version;

  protected BloodAllocation() {}

  public BloodAllocation(
      UUID crisisId,
      UUID providerId,
      String resourceType,
      int quantity,
      String purpose,
      UUID allocatedBy,
      Instant createdAt) {
    this.crisisId = crisisId;
    this.providerId = providerId;
    this.resourceType = resourceType;
    this.quantity = quantity;
    this.purpose = purpose;
    this.allocatedBy = allocatedBy;
    this.status = AllocationStatus.ALLOCATED;
    this.createdAt = createdAt;
  }

  /** Marks the allocation reverted. Only an allocation still in effect can be reverted. */
  public void revert(Instant at) {
    if (status != AllocationStatus.ALLOCATED) {
      throw new InvalidStateException(
          "Allocation already reverted", "Allocation " + id + " is no longer in effect");
    }
    this.status = AllocationStatus.REVERTED;
    this.revertedAt = at;
  }

  public boolean isInEffect() {
    return status == AllocationStatus.ALLOCATED;
  }

  public UUID getId() {
    return id;
  }

  public UUID getCrisisId() {
    return crisisId;
  }

  public UUID getProviderId() {
    return providerId;
  }

  public String getResourceType() {
    return resourceType;
  }

  public int getQuantity() {
    return quantity;
  }

  public AllocationStatus getStatus() {
    return status;
  }

  public String getPurpose() {
    return purpose;
  }

  public UUID getAllocatedBy() {
    return allocatedBy;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getRevertedAt() {
    return revertedAt;
  }
}
