package io.crisisintel.coordination.donor;

import io.crisisintel.coordination.audit.AuditEventBuilder;
import io.crisisintel.coordination.audit.AuditService;
import io.crisisintel.coordination.exception.InvalidRequestException;
import io.crisisintel.coordination.exception.ResourceNotFoundException;
import io.crisisintel.coordination.inventory.BloodType;
import io.crisisintel.coordination.security.CallerContext;
import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class DonorProfileService {

  private static final Logger log = LoggerFactory.getLogger(DonorProfileService.class);

  private final DonorProfileRepository donorProfileRepository;
  private final AuditService auditService;
  private final Clock clock;

  public DonorProfileService(
      DonorProfileRepository donorProfileRepository, AuditService auditService, Clock clock) {
    this.donorProfileRepository = donorProfileRepository;
    this.auditService = auditService;
    this.clock = clock;
  }

  /** Creates or updates the caller's donor profile. */
  @Transactional
  public DonorProfile upsert(CallerContext caller, String bloodType) {
    String type =
        BloodType.fromLabel(bloodType)
            .map(BloodType::label)
            .orElseThrow(
                () ->
                    new InvalidRequestException(
                        "Invalid blood type", "Unknown blood type '" + bloodType + "'"));
    Instant now = Instant.now(clock);
    var profile =
        donorProfileRepository
            .findByUserId(caller.userId())
            .orElseGet(() -> new DonorProfile(caller.userId(), type, now));
    profile.changeBloodType(type, now);
    profile = donorProfileRepository.save(profile);

    log.info("Donor profile of {} set to blood type {}", caller.userId(), type);
    audit(caller, "donor.profile_updated", profile, Map.of("blood_type", type));
    return profile;
  }

  @Transactional
  public DonorProfile setAvailability(
      CallerContext caller, DonorAvailability availability, Integer days) {
    if (availability == null) {
      throw new InvalidRequestException("Missing availability", "availability is required");
    }
    var profile = requireProfile(caller.userId());
    profile.setAvailability(availability, days, Instant.now(clock));
    profile = donorProfileRepository.saveAndFlush(profile);

    log.info("Donor {} availability set to {}", caller.userId(), availability);
    var details = new HashMap<String, Object>();
    details.put("availability", availability.name());
    if (profile.getCooldownUntil() != null) {
      details.put("cooldown_until", profile.getCooldownUntil().toString());
    }
    audit(caller, "donor.availability_changed", profile, details);
    return profile;
  }

  @Transactional(readOnly = true)
  public Optional<DonorProfile> find(UUID userId) {
    return donorProfileRepository.findByUserId(userId);
  }

  @Transactional(readOnly = true)
  public DonorProfile requireProfile(UUID userId) {
    return donorProfileRepository
        .findByUserId(userId)
        .orElseThrow(
            () ->
                ResourceNotFoundException.withDetail(
                    "Donor profile not found", "User " + userId + " has no donor profile"));
  }

  /** Starts a post-donation cooldown, creating a bare profile for first-time donors. */
  @Transactional
  public DonorProfile applyCooldown(UUID donorId, int days, Instant now) {
    var profile =
        donorProfileRepository
            .findByUserId(donorId)
            .orElseGet(() -> new DonorProfile(donorId, null, now));
    profile.applyCooldown(days, now);
    profile = donorProfileRepository.save(profile);
    log.info("Donor {} cooling down until {}", donorId, profile.getCooldownUntil());
    return profile;
  }

  private void audit(
      CallerContext caller, String eventType, DonorProfile profile, Map<String, Object> details) {
    auditService.log(
        AuditEventBuilder.builder()
            .eventType(eventType)
            .entityType("donor_profile")
            .entityId(profile.getId())
            .actor(caller)
            .details(details)
            .build());
  }
}
