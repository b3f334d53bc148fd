package io.crisisintel.coordination.location;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface UserLocationRepository extends JpaRepository<UserLocation, UUID> {

  Optional<UserLocation> findFirstByUserIdOrderByCapturedAtDesc(UUID userId);

  /** Newest row per user. Ties on captured_at are broken arbitrarily but consistently. */
  @Query(
      """
      SELECT l FROM UserLocation l
      WHERE l.capturedAt = (
          SELECT MAX(l2.capturedAt) FROM UserLocation l2 WHERE l2.userId = l.userId)
      """)
  List<UserLocation> findLatestPerUser();

  @Query(
      """
      SELECT l FROM UserLocation l
      WHERE l.capturedAt = (
          SELECT MAX(l2.capturedAt) FROM UserLocation l2 WHERE l2.userId = l.userId)
        AND l.lat BETWEEN :minLat AND :maxLat
        AND l.lng BETWEEN :minLng AND :maxLng
      """)
  List<UserLocation> findLatestPerUserWithin(
      @Param("minLat") double minLat,
      @Param("maxLat") double maxLat,
      @Param("minLng") double minLng,
      @Param("maxLng") double maxLng);
}
