package io.crisisintel.coordination.location;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/** One reported position. The newest row per user is that user's last-known location. */
@Entity
@Table(name = "user_locations")
public class UserLocation {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "user_id", nullable = false, updatable = false)
  private UUID userId;

  @Column(name = "lat", nullable = false)
  private double lat;

  @Column(name = "lng", nullable = false)
  private double lng;

  @Column(name = "source", nullable = false, length = 30)
  private String source;

  @Column(name = "captured_at", nullable = false, updatable = false)
  private Instant capturedAt;

  protected UserLocation() {}

  public UserLocation(UUID userId, double lat, double lng, String source, Instant capturedAt) {
    this.userId = userId;
    this.lat = lat;
    this.lng = lng;
    this.source = source;
    this.capturedAt = capturedAt;
  }

  public LocationSnapshot toSnapshot() {
    return new LocationSnapshot(userId, lat, lng, capturedAt);
  }

  public UUID getId() {
    return id;
  }

  public UUID getUserId() {
    return userId;
  }

  public double getLat() {
    return lat;
  }

  public double getLng() {
    return lng;
  }

  public String getSource() {
    return source;
  }

  public Instant getCapturedAt() {
    return capturedAt;
  }
}
