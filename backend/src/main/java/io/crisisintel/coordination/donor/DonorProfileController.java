package io.crisisintel.coordination.donor;

import io.crisisintel.coordination.security.CallerContext;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/donors")
public class DonorProfileController {

  private final DonorProfileService donorProfileService;
  private final Clock clock;

  public DonorProfileController(DonorProfileService donorProfileService, Clock clock) {
    this.donorProfileService = donorProfileService;
    this.clock = clock;
  }

  @PutMapping("/me")
  public ResponseEntity<DonorProfileResponse> upsertProfile(
      CallerContext caller, @Valid @RequestBody UpsertDonorProfileRequest request) {
    var profile = donorProfileService.upsert(caller, request.bloodType());
    return ResponseEntity.ok(DonorProfileResponse.from(profile, Instant.now(clock)));
  }

  @PutMapping("/me/availability")
  public ResponseEntity<DonorProfileResponse> setAvailability(
      CallerContext caller, @Valid @RequestBody SetAvailabilityRequest request) {
    var profile =
        donorProfileService.setAvailability(caller, request.availability(), request.days());
    return ResponseEntity.ok(DonorProfileResponse.from(profile, Instant.now(clock)));
  }

  @GetMapping("/{userId}")
  public ResponseEntity<DonorProfileResponse> getProfile(@PathVariable UUID userId) {
    var profile = donorProfileService.requireProfile(userId);
    return ResponseEntity.ok(DonorProfileResponse.from(profile, Instant.now(clock)));
  }

  // --- DTOs ---

  public record UpsertDonorProfileRequest(
      @NotBlank(message = "bloodType is required") String bloodType) {}

  public record SetAvailabilityRequest(
      @NotNull(message = "availability is required") DonorAvailability availability,
      @Positive(message = "days must be positive") Integer days) {}

  public record DonorProfileResponse(
      UUID userId,
      String bloodType,
      DonorAvailability availability,
      Instant cooldownUntil,
      Instant updatedAt) {

    public static DonorProfileResponse from(DonorProfile profile, Instant now) {
      return new DonorProfileResponse(
          profile.getUserId(),
          profile.getBloodType(),
          profile.effectiveAvailability(now),
          profile.getCooldownUntil(),
          profile.getUpdatedAt());
    }
  }
}
