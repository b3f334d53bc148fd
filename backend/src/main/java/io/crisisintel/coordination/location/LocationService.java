package io.crisisintel.coordination.location;

import io.crisisintel.coordination.audit.AuditEventBuilder;
import io.crisisintel.coordination.audit.AuditService;
import io.crisisintel.coordination.exception.InvalidRequestException;
import io.crisisintel.coordination.security.CallerContext;
import io.crisisintel.coordination.victim.VictimDetectionService;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class LocationService {

  private static final Logger log = LoggerFactory.getLogger(LocationService.class);

  static final String DEFAULT_SOURCE = "device";

  private final UserLocationRepository userLocationRepository;
  private final VictimDetectionService victimDetectionService;
  private final AuditService auditService;
  private final Clock clock;

  public LocationService(
      UserLocationRepository userLocationRepository,
      VictimDetectionService victimDetectionService,
      AuditService auditService,
      Clock clock) {
    this.userLocationRepository = userLocationRepository;
    this.victimDetectionService = victimDetectionService;
    this.auditService = auditService;
    this.clock = clock;
  }

  /**
   * Stores the caller's current position and checks it against every active crisis. Users found
   * inside a crisis radius are notified once the transaction commits.
   */
  @Transactional
  public RecordedLocation record(CallerContext caller, double lat, double lng, String source) {
    if (lat < -90.0 || lat > 90.0 || lng < -180.0 || lng > 180.0) {
      throw new InvalidRequestException(
          "Invalid coordinates", "Latitude must be within [-90, 90] and longitude [-180, 180]");
    }
    var location =
        userLocationRepository.save(
            new UserLocation(
                caller.userId(),
                lat,
                lng,
                source == null || source.isBlank() ? DEFAULT_SOURCE : source,
                Instant.now(clock)));

    int crisesMatched = victimDetectionService.announceForLocation(location.toSnapshot());
    log.info(
        "Location recorded for user {} (inside {} active crisis area(s))",
        caller.userId(),
        crisesMatched);
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("location.recorded")
            .entityType("user_location")
            .entityId(location.getId())
            .actor(caller)
            .details(Map.of("source", location.getSource()))
            .build());
    return new RecordedLocation(location.toSnapshot(), crisesMatched);
  }

  @Transactional(readOnly = true)
  public Optional<LocationSnapshot> latest(CallerContext caller) {
    return userLocationRepository
        .findFirstByUserIdOrderByCapturedAtDesc(caller.userId())
        .map(UserLocation::toSnapshot);
  }

  public record RecordedLocation(LocationSnapshot location, int activeCrisesInRange) {}
}
