package io.crisisintel.coordination.victim;

import io.crisisintel.coordination.crisis.Crisis;
import io.crisisintel.coordination.crisis.CrisisRepository;
import io.crisisintel.coordination.crisis.CrisisStatus;
import io.crisisintel.coordination.event.PotentialVictimDetectedEvent;
import io.crisisintel.coordination.location.LocationSnapshot;
import io.crisisintel.coordination.participation.CrisisAccessService;
import io.crisisintel.coordination.security.CallerContext;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Runs geofence detection for crises and announces users found inside a crisis radius who are
 * not yet registered as its victims.
 */
@Service
public class VictimDetectionService {

  private static final Logger log = LoggerFactory.getLogger(VictimDetectionService.class);

  private final GeofenceDetector geofenceDetector;
  private final CrisisAccessService crisisAccessService;
  private final CrisisRepository crisisRepository;
  private final CrisisVictimRepository victimRepository;
  private final ApplicationEventPublisher eventPublisher;
  private final Clock clock;

  public VictimDetectionService(
      GeofenceDetector geofenceDetector,
      CrisisAccessService crisisAccessService,
      CrisisRepository crisisRepository,
      CrisisVictimRepository victimRepository,
      ApplicationEventPublisher eventPublisher,
      Clock clock) {
    this.geofenceDetector = geofenceDetector;
    this.crisisAccessService = crisisAccessService;
    this.crisisRepository = crisisRepository;
    this.victimRepository = victimRepository;
    this.eventPublisher = eventPublisher;
    this.clock = clock;
  }

  /** Who is inside the crisis radius right now. */
  public List<PotentialVictim> detect(Crisis crisis) {
    return geofenceDetector.detect(
        crisis.getCenterLat(), crisis.getCenterLng(), crisis.getRadiusKm());
  }

  /**
   * Candidates inside the crisis radius who are not registered victims yet, nearest first. For
   * participants and administrators of the crisis.
   */
  @Transactional(readOnly = true)
  public List<PotentialVictim> listUnregistered(CallerContext caller, UUID crisisId) {
    var crisis = crisisAccessService.requireCrisis(crisisId);
    crisisAccessService.requireParticipantOrAdministrator(caller, crisis);
    var registered = victimRepository.findUserIdsByCrisisId(crisisId);
    return detect(crisis).stream().filter(c -> !registered.contains(c.userId())).toList();
  }

  /** Announces every unregistered candidate of a newly created crisis. */
  @Transactional(readOnly = true)
  public int announceForCrisis(Crisis crisis, UUID actorId) {
    var registered = victimRepository.findUserIdsByCrisisId(crisis.getId());
    int announced = 0;
    for (var candidate : detect(crisis)) {
      if (!registered.contains(candidate.userId())) {
        publish(crisis, candidate, actorId);
        announced++;
      }
    }
    log.info(
        "Geofence detection for crisis {} announced {} candidate(s)", crisis.getId(), announced);
    return announced;
  }

  /** Tests one fresh location against every active crisis. */
  @Transactional(readOnly = true)
  public int announceForLocation(LocationSnapshot snapshot) {
    int announced = 0;
    for (var crisis : crisisRepository.findByStatus(CrisisStatus.ACTIVE)) {
      var hit =
          geofenceDetector.evaluate(
              snapshot, crisis.getCenterLat(), crisis.getCenterLng(), crisis.getRadiusKm());
      if (hit.isPresent()
          && !victimRepository.existsByCrisisIdAndUserId(crisis.getId(), snapshot.userId())) {
        publish(crisis, hit.get(), snapshot.userId());
        announced++;
      }
    }
    return announced;
  }

  private void publish(Crisis crisis, PotentialVictim candidate, UUID actorId) {
    eventPublisher.publishEvent(
        new PotentialVictimDetectedEvent(
            "victim.detected",
            "user",
            candidate.userId(),
            crisis.getId(),
            actorId,
            Instant.now(clock),
            Map.of("distance_km", candidate.distanceKm()),
            crisis.getTitle(),
            candidate.distanceKm()));
  }
}
