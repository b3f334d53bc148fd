package io.crisisintel.coordination.crisis;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "crisis_donations")
public class CrisisDonation {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "crisis_id", nullable = false, updatable = false)
  private UUID crisisId;

  @Column(name = "user_id", nullable = false, updatable = false)
  private UUID userId;

  @Column(name = "amount", nullable = false, precision = 14, scale = 2)
  private BigDecimal amount;

  @Column(name = "note", length = 500)
  private String note;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected CrisisDonation() {}

  public CrisisDonation(
      UUID crisisId, UUID userId, BigDecimal amount, String note, Instant createdAt) {
    this.crisisId = crisisId;
    this.userId = userId;
    this.amount = amount;
    this.note = note;
    this.createdAt = createdAt;
  }

  public UUID getId() {
    return id;
  }

  public UUID getCrisisId() {
    return crisisId;
  }

  public UUID getUserId() {
    return userId;
  }

  public BigDecimal getAmount() {
    return amount;
  }

  public String getNote() {
    return note;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
