package io.crisisintel.coordination.location;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/** {@link LocationProvider} backed by the {@code user_locations} table. */
@Component
@Transactional(readOnly = true)
public class JpaLocationProvider implements LocationProvider {

  private final UserLocationRepository userLocationRepository;

  public JpaLocationProvider(UserLocationRepository userLocationRepository) {
    this.userLocationRepository = userLocationRepository;
  }

  @Override
  public Optional<LocationSnapshot> latestFor(UUID userId) {
    return userLocationRepository
        .findFirstByUserIdOrderByCapturedAtDesc(userId)
        .map(UserLocation::toSnapshot);
  }

  @Override
  public List<LocationSnapshot> latestWithin(BoundingBox box) {
    var rows =
        box == null
            ? userLocationRepository.findLatestPerUser()
            : userLocationRepository.findLatestPerUserWithin(
                box.minLat(), box.maxLat(), box.minLng(), box.maxLng());
    // two rows sharing a user's max captured_at collapse to one
    Map<UUID, LocationSnapshot> byUser = new LinkedHashMap<>();
    for (var row : rows) {
      byUser.putIfAbsent(row.getUserId(), row.toSnapshot());
    }
    return new ArrayList<>(byUser.values());
  }
}
