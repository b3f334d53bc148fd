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
@Table(name = "crisis_expenses")
public class CrisisExpense {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "crisis_id", nullable = false, updatable = false)
  private UUID crisisId;

  @Column(name = "user_id", nullable = false, updatable = false)
  private UUID userId;

  @Column(name = "amount", nullable = false, precision = 14, scale = 2)
  private BigDecimal amount;

  @Column(name = "purpose", nullable = false, length = 500)
  private String purpose;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected CrisisExpense() {}

  public CrisisExpense(
      UUID crisisId, UUID userId, BigDecimal amount, String purpose, Instant createdAt) {
    this.crisisId = crisisId;
    this.userId = userId;
    this.amount = amount;
    this.purpose = purpose;
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

  public String getPurpose() {
    return purpose;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
