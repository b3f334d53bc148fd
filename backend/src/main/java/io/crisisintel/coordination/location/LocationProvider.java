package io.crisisintel.coordination.location;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Source of last-known user locations. Users without any location on file are simply absent from
 * every result.
 */
public interface LocationProvider {

  Optional<LocationSnapshot> latestFor(UUID userId);

  /**
   * Latest location of every user whose latest fix lies inside the given box.
   *
   * @param box coarse pre-filter; {@code null} returns every user's latest location
   */
  List<LocationSnapshot> latestWithin(BoundingBox box);

  /** Latitude/longitude rectangle in degrees. */
  record BoundingBox(double minLat, double maxLat, double minLng, double maxLng) {}
}
