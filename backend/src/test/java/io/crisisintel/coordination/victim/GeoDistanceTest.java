package io.crisisintel.coordination.victim;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

class GeoDistanceTest {

  private static final double CENTER_LAT = 23.8103;
  private static final double CENTER_LNG = 90.4125;

  /** Latitude offset that puts a point {@code km} due north of the centre. */
  private static double latitudeNorthBy(double km) {
    return CENTER_LAT + Math.toDegrees(km / GeoDistance.EARTH_RADIUS_KM);
  }

  @Test
  void samePoint_isZeroDistance() {
    assertThat(GeoDistance.haversineKm(CENTER_LAT, CENTER_LNG, CENTER_LAT, CENTER_LNG))
        .isEqualTo(0.0);
  }

  @Test
  void oneDegreeOfLatitude_isAbout111Km() {
    assertThat(GeoDistance.haversineKm(0.0, 0.0, 1.0, 0.0)).isCloseTo(111.19, within(0.01));
  }

  @Test
  void pointTenKmAway_isInsideRadiusTen() {
    double distance =
        GeoDistance.haversineKm(CENTER_LAT, CENTER_LNG, latitudeNorthBy(10.0), CENTER_LNG);

    assertThat(distance).isCloseTo(10.0, within(1e-9));
    assertThat(GeoDistance.withinRadius(distance, 10.0)).isTrue();
  }

  @Test
  void pointTenKmAway_isOutsideRadiusNinePointNine() {
    double distance =
        GeoDistance.haversineKm(CENTER_LAT, CENTER_LNG, latitudeNorthBy(10.0), CENTER_LNG);

    assertThat(GeoDistance.withinRadius(distance, 9.9)).isFalse();
  }

  @Test
  void distance_isSymmetric() {
    double there = GeoDistance.haversineKm(23.81, 90.41, 22.35, 91.78);
    double back = GeoDistance.haversineKm(22.35, 91.78, 23.81, 90.41);

    assertThat(there).isCloseTo(back, within(1e-9));
  }
}
