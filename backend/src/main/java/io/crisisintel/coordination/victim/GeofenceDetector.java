package io.crisisintel.coordination.victim;

import io.crisisintel.coordination.location.LocationProvider;
import io.crisisintel.coordination.location.LocationProvider.BoundingBox;
import io.crisisintel.coordination.location.LocationSnapshot;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Finds users whose last-known location lies within a radius of a centre point. Candidates are
 * pre-filtered by a bounding box in the database and then tested exactly with the haversine
 * distance.
 */
@Component
public class GeofenceDetector {

  /** Widens the pre-filter box so rounding never drops a point that is exactly on the radius. */
  private static final double BOX_MARGIN = 1.01;

  private final LocationProvider locationProvider;

  public GeofenceDetector(LocationProvider locationProvider) {
    this.locationProvider = locationProvider;
  }

  /** All users inside the circle, nearest first. */
  public List<PotentialVictim> detect(double centerLat, double centerLng, double radiusKm) {
    return locationProvider.latestWithin(boxAround(centerLat, centerLng, radiusKm)).stream()
        .map(snapshot -> evaluate(snapshot, centerLat, centerLng, radiusKm))
        .flatMap(Optional::stream)
        .sorted(Comparator.comparingDouble(PotentialVictim::distanceKm))
        .toList();
  }

  /** Tests a single location against the circle. */
  public Optional<PotentialVictim> evaluate(
      LocationSnapshot snapshot, double centerLat, double centerLng, double radiusKm) {
    double distance =
        GeoDistance.haversineKm(centerLat, centerLng, snapshot.lat(), snapshot.lng());
    if (!GeoDistance.withinRadius(distance, radiusKm)) {
      return Optional.empty();
    }
    return Optional.of(
        new PotentialVictim(
            snapshot.userId(), snapshot.lat(), snapshot.lng(), snapshot.capturedAt(), distance));
  }

  /**
   * Smallest lat/lng rectangle containing the circle, or {@code null} when the circle reaches a
   * pole or crosses the antimeridian and no simple rectangle bounds it.
   */
  static BoundingBox boxAround(double lat, double lng, double radiusKm) {
    double angular = radiusKm / GeoDistance.EARTH_RADIUS_KM;
    double dLat = Math.toDegrees(angular) * BOX_MARGIN;
    if (lat - dLat < -90.0 || lat + dLat > 90.0) {
      return null;
    }
    double sinRatio = Math.sin(angular) / Math.cos(Math.toRadians(lat));
    if (sinRatio >= 1.0) {
      return null;
    }
    double dLng = Math.toDegrees(Math.asin(sinRatio)) * BOX_MARGIN;
    if (lng - dLng < -180.0 || lng + dLng > 180.0) {
      return null;
    }
    return new BoundingBox(lat - dLat, lat + dLat, lng - dLng, lng + dLng);
  }
}
