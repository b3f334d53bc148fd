package io.crisisintel.coordination.inventory;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/**
 * Stock held by one provider for one resource type. Quantity never drops below zero; the schema
 * enforces it with a CHECK constraint and allocation uses a guarded UPDATE.
 */
@Entity
@Table(name = "blood_inventory")
public class InventoryEntry {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "provider_id", nullable = false, updatable = false)
  private UUID providerId;

  @Column(name = "resource_type", nullable = false, updatable = false, length = 10)
  private String resourceType;

  @Column(name = "quantity", nullable = false)
  private int quantity;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected InventoryEntry() {}

  public InventoryEntry(UUID providerId, String resourceType, int quantity, Instant updatedAt) {
    this.providerId = providerId;
    this.resourceType = resourceType;
    this.quantity = quantity;
    this.updatedAt = updatedAt;
  }

  public void setQuantity(int quantity, Instant at) {
    this.quantity = quantity;
    this.updatedAt = at;
  }

  public UUID getId() {
    return id;
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

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
