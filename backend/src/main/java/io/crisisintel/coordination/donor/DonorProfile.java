package io.crisisintel.coordination.donor;

import io.crisisintel.coordination.exception.InvalidRequestException;
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

/** Blood donor availability. One profile per user. */
@Entity
@Table(name = "donor_profiles")
public class DonorProfile {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "user_id", nullable = false, unique = true, updatable = false)
  private UUID userId;

  @Column(name = "blood_type", length = 10)
  private String bloodType;

  @Enumerated(EnumType.STRING)
  @Column(name = "availability", nullable = false, length = 20)
  private DonorAvailability availability;

  @Column(name = "cooldown_until")
  private Instant cooldownUntil;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  @Version
  @Column(name = "version", nullable = false)
  private long version;

  protected DonorProfile() {}

  public DonorProfile(UUID userId, String bloodType, Instant createdAt) {
    this.userId = userId;
    this.bloodType = bloodType;
    this.availability = DonorAvailability.AVAILABLE;
    this.updatedAt = createdAt;
  }

  public void changeBloodType(String bloodType, Instant at) {
    this.bloodType = bloodType;
    this.updatedAt = at;
  }

  /**
   * Sets availability explicitly. {@code COOLDOWN} needs a positive number of days and starts the
   * cooldown now; the other states clear any running cooldown.
   */
  public void setAvailability(DonorAvailability target, Integer days, Instant now) {
    if (target == DonorAvailability.COOLDOWN) {
      if (days == null || days <= 0) {
        throw new InvalidRequestException(
            "Invalid cooldown", "A cooldown needs a positive number of days");
      }
      this.cooldownUntil = now.plus(Duration.ofDays(days));
    } else {
      this.cooldownUntil = null;
    }
    this.availability = target;
    this.updatedAt = now;
  }

  /** Starts a cooldown after a donation. An already longer cooldown is kept. */
  public void applyCooldown(int days, Instant now) {
    if (days <= 0) {
      return;
    }
    Instant until = now.plus(Duration.ofDays(days));
    if (cooldownUntil == null || until.isAfter(cooldownUntil)) {
      this.cooldownUntil = until;
    }
    this.availability = DonorAvailability.COOLDOWN;
    this.updatedAt = now;
  }

  /** True when the donor is still cooling down at the given instant. */
  public boolean isCoolingDownAt(Instant instant) {
    return cooldownUntil != null && cooldownUntil.isAfter(instant);
  }

  /** Availability as seen at {@code now}; an expired cooldown reads as available. */
  public DonorAvailability effectiveAvailability(Instant now) {
    if (availability == DonorAvailability.COOLDOWN && !isCoolingDownAt(now)) {
      return DonorAvailability.AVAILABLE;
    }
    return availability;
  }

  public UUID getId() {
    return id;
  }

  public UUID getUserId() {
    return userId;
  }

  public String getBloodType() {
    return bloodType;
  }

  public DonorAvailability getAvailability() {
    return availability;
  }

  public Instant getCooldownUntil() {
    return cooldownUntil;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
