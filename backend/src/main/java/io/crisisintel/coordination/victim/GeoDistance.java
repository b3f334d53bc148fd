package io.crisisintel.coordination.victim;

/** Great-circle distances on a spherical earth. */
public final class GeoDistance {

  public static final double EARTH_RADIUS_KM = 6371.0;

  /** Absorbs floating-point noise so a point exactly on the radius counts as inside. */
  static final double BOUNDARY_TOLERANCE_KM = 1e-6;

  /** Haversine distance in kilometres between two coordinates given in degrees. */
  public static double haversineKm(double lat1, double lng1, double lat2, double lng2) {
    double phi1 = Math.toRadians(lat1);
    double phi2 = Math.toRadians(lat2);
    double dPhi = Math.toRadians(lat2 - lat1);
    double dLambda = Math.toRadians(lng2 - lng1);

    double a =
        Math.sin(dPhi / 2) * Math.sin(dPhi / 2)
            + Math.cos(phi1) * Math.cos(phi2) * Math.sin(dLambda / 2) * Math.sin(dLambda / 2);
    double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
    return EARTH_RADIUS_KM * c;
  }

  /** Inclusive radius test: {@code distance <= radius}. */
  public static boolean withinRadius(double distanceKm, double radiusKm) {
    return distanceKm <= radiusKm + BOUNDARY_TOLERANCE_KM;
  }

  private GeoDistance() {}
}
