package io.crisisintel.coordination.location;

import io.crisisintel.coordination.security.CallerContext;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/locations")
public class LocationController {

  private final LocationService locationService;

  public LocationController(LocationService locationService) {
    this.locationService = locationService;
  }

  @PostMapping
  public ResponseEntity<RecordLocationResponse> recordLocation(
      CallerContext caller, @Valid @RequestBody RecordLocationRequest request) {
    var recorded =
        locationService.record(caller, request.lat(), request.lng(), request.source());
    return ResponseEntity.status(201)
        .body(
            new RecordLocationResponse(
                LocationResponse.from(recorded.location()), recorded.activeCrisesInRange()));
  }

  @GetMapping("/me")
  public ResponseEntity<LocationResponse> getMyLocation(CallerContext caller) {
    return locationService
        .latest(caller)
        .map(LocationResponse::from)
        .map(ResponseEntity::ok)
        .orElseGet(() -> ResponseEntity.noContent().build());
  }

  // --- DTOs ---

  public record RecordLocationRequest(
      @NotNull(message = "lat is required") Double lat,
      @NotNull(message = "lng is required") Double lng,
      @Size(max = 30, message = "source must be at most 30 characters") String source) {}

  public record LocationResponse(UUID userId, double lat, double lng, Instant capturedAt) {

    public static LocationResponse from(LocationSnapshot snapshot) {
      return new LocationResponse(
          snapshot.userId(), snapshot.lat(), snapshot.lng(), snapshot.capturedAt());
    }
  }

  public record RecordLocationResponse(LocationResponse location, int activeCrisesInRange) {}
}
