package io.crisisintel.coordination.victim;

import io.crisisintel.coordination.common.EnumParams;
import io.crisisintel.coordination.common.PageRequests;
import io.crisisintel.coordination.common.PagedResponse;
import io.crisisintel.coordination.security.CallerContext;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class VictimController {

  private final VictimService victimService;
  private final VictimDetectionService victimDetectionService;
  private final PageRequests pageRequests;

  public VictimController(
      VictimService victimService,
      VictimDetectionService victimDetectionService,
      PageRequests pageRequests) {
    this.victimService = victimService;
    this.victimDetectionService = victimDetectionService;
    this.pageRequests = pageRequests;
  }

  @PostMapping("/api/crises/{crisisId}/victims/me")
  public ResponseEntity<VictimResponse> enroll(
      CallerContext caller,
      @PathVariable UUID crisisId,
      @Valid @RequestBody(required = false) EnrollRequest request) {
    var victim = victimService.enroll(caller, crisisId, request != null ? request.note() : null);
    return ResponseEntity.status(201).body(VictimResponse.from(victim));
  }

  @DeleteMapping("/api/crises/{crisisId}/victims/me")
  public ResponseEntity<Void> unenroll(CallerContext caller, @PathVariable UUID crisisId) {
    victimService.unenroll(caller, crisisId);
    return ResponseEntity.noContent().build();
  }

  @PostMapping("/api/crises/{crisisId}/victims")
  public ResponseEntity<VictimResponse> registerVictim(
      CallerContext caller,
      @PathVariable UUID crisisId,
      @Valid @RequestBody RegisterVictimRequest request) {
    var victim =
        victimService.adminCreate(
            caller, crisisId, request.userId(), request.email(), request.note());
    return ResponseEntity.status(201).body(VictimResponse.from(victim));
  }

  @GetMapping("/api/crises/{crisisId}/victims")
  public ResponseEntity<PagedResponse<VictimResponse>> listVictims(
      CallerContext caller,
      @PathVariable UUID crisisId,
      @RequestParam(required = false) String status,
      @RequestParam(required = false) Integer page,
      @RequestParam(name = "page_size", required = false) Integer pageSize) {
    var victims =
        victimService.list(
            caller,
            crisisId,
            EnumParams.parse(VictimStatus.class, "status", status),
            pageRequests.newestFirst(page, pageSize));
    return ResponseEntity.ok(PagedResponse.from(victims, VictimResponse::from));
  }

  @GetMapping("/api/crises/{crisisId}/potential-victims")
  public ResponseEntity<List<PotentialVictim>> listPotentialVictims(
      CallerContext caller, @PathVariable UUID crisisId) {
    return ResponseEntity.ok(victimDetectionService.listUnregistered(caller, crisisId));
  }

  @PatchMapping("/api/victims/{id}/status")
  public ResponseEntity<VictimResponse> updateStatus(
      CallerContext caller,
      @PathVariable UUID id,
      @Valid @RequestBody UpdateStatusRequest request) {
    var target = EnumParams.parse(VictimStatus.class, "status", request.status());
    return ResponseEntity.ok(VictimResponse.from(victimService.triage(caller, id, target)));
  }

  @PutMapping("/api/victims/{id}")
  public ResponseEntity<VictimResponse> editVictim(
      CallerContext caller, @PathVariable UUID id, @Valid @RequestBody EditVictimRequest request) {
    var victim =
        victimService.edit(caller, id, request.note(), request.lastLat(), request.lastLng());
    return ResponseEntity.ok(VictimResponse.from(victim));
  }

  @DeleteMapping("/api/victims/{id}")
  public ResponseEntity<Void> deleteVictim(CallerContext caller, @PathVariable UUID id) {
    victimService.delete(caller, id);
    return ResponseEntity.noContent().build();
  }

  // --- DTOs ---

  public record EnrollRequest(
      @Size(max = 1000, message = "note must be at most 1000 characters") String note) {}

  public record RegisterVictimRequest(
      UUID userId,
      @Size(max = 255, message = "email must be at most 255 characters") String email,
      @Size(max = 1000, message = "note must be at most 1000 characters") String note) {}

  public record UpdateStatusRequest(@NotBlank(message = "status is required") String status) {}

  public record EditVictimRequest(
      @Size(max = 1000, message = "note must be at most 1000 characters") String note,
      Double lastLat,
      Double lastLng) {}

  public record VictimResponse(
      UUID id,
      UUID crisisId,
      UUID userId,
      String status,
      String note,
      Double lastLat,
      Double lastLng,
      UUID createdBy,
      Instant createdAt,
      Instant updatedAt) {

    public static VictimResponse from(CrisisVictim victim) {
      return new VictimResponse(
          victim.getId(),
          victim.getCrisisId(),
          victim.getUserId(),
          victim.getStatus().name(),
          victim.getNote(),
          victim.getLastLat(),
          victim.getLastLng(),
          victim.getCreatedBy(),
          victim.getCreatedAt(),
          victim.getUpdatedAt());
    }
  }
}
