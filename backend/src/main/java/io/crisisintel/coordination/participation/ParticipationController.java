package io.crisisintel.coordination.participation;

import io.crisisintel.coordination.common.EnumParams;
import io.crisisintel.coordination.common.PageRequests;
import io.crisisintel.coordination.common.PagedResponse;
import io.crisisintel.coordination.security.CallerContext;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ParticipationController {

  private final ParticipationService participationService;
  private final PageRequests pageRequests;

  public ParticipationController(
      ParticipationService participationService, PageRequests pageRequests) {
    this.participationService = participationService;
    this.pageRequests = pageRequests;
  }

  @GetMapping("/api/crises/{crisisId}/participants")
  public ResponseEntity<PagedResponse<ParticipantResponse>> listParticipants(
      @PathVariable UUID crisisId,
      @RequestParam(required = false) Integer page,
      @RequestParam(name = "page_size", required = false) Integer pageSize) {
    var participants =
        participationService.listParticipants(
            crisisId, pageRequests.of(page, pageSize, Sort.by("joinedAt")));
    return ResponseEntity.ok(PagedResponse.from(participants, ParticipantResponse::from));
  }

  @PostMapping("/api/crises/{crisisId}/participants")
  public ResponseEntity<ParticipantResponse> joinParticipant(
      CallerContext caller,
      @PathVariable UUID crisisId,
      @Valid @RequestBody JoinRequest request) {
    var participant =
        participationService.join(caller, crisisId, request.userId(), request.roleLabel());
    return ResponseEntity.status(201).body(ParticipantResponse.from(participant));
  }

  @DeleteMapping("/api/crises/{crisisId}/participants/{userId}")
  public ResponseEntity<Void> removeParticipant(
      CallerContext caller, @PathVariable UUID crisisId, @PathVariable UUID userId) {
    participationService.remove(caller, crisisId, userId);
    return ResponseEntity.noContent().build();
  }

  @PostMapping("/api/crises/{crisisId}/leave")
  public ResponseEntity<Void> leaveCrisis(CallerContext caller, @PathVariable UUID crisisId) {
    participationService.leave(caller, crisisId);
    return ResponseEntity.noContent().build();
  }

  @PostMapping("/api/crises/{crisisId}/participation-requests")
  public ResponseEntity<ParticipationRequestResponse> requestToParticipate(
      CallerContext caller,
      @PathVariable UUID crisisId,
      @Valid @RequestBody(required = false) FileRequest request) {
    String roleLabel = request != null ? request.roleLabel() : null;
    String note = request != null ? request.note() : null;
    var filing = participationService.requestToParticipate(caller, crisisId, roleLabel, note);
    var status = filing.duplicate() ? HttpStatus.OK : HttpStatus.CREATED;
    return ResponseEntity.status(status)
        .body(ParticipationRequestResponse.from(filing.request(), filing.duplicate()));
  }

  @GetMapping("/api/crises/{crisisId}/participation-requests")
  public ResponseEntity<PagedResponse<ParticipationRequestResponse>> listRequests(
      CallerContext caller,
      @PathVariable UUID crisisId,
      @RequestParam(required = false) String status,
      @RequestParam(required = false) Integer page,
      @RequestParam(name = "page_size", required = false) Integer pageSize) {
    var requests =
        participationService.listRequests(
            caller,
            crisisId,
            EnumParams.parse(ParticipationRequestStatus.class, "status", status),
            pageRequests.newestFirst(page, pageSize));
    return ResponseEntity.ok(
        PagedResponse.from(requests, r -> ParticipationRequestResponse.from(r, false)));
  }

  @PostMapping("/api/participation-requests/{id}/approve")
  public ResponseEntity<ParticipationRequestResponse> approveRequest(
      CallerContext caller, @PathVariable UUID id) {
    return ResponseEntity.ok(
        ParticipationRequestResponse.from(participationService.approve(caller, id), false));
  }

  @PostMapping("/api/participation-requests/{id}/reject")
  public ResponseEntity<ParticipationRequestResponse> rejectRequest(
      CallerContext caller, @PathVariable UUID id) {
    return ResponseEntity.ok(
        ParticipationRequestResponse.from(participationService.reject(caller, id), false));
  }

  @GetMapping("/api/me/participations")
  public ResponseEntity<List<ParticipantResponse>> listMyParticipations(CallerContext caller) {
    return ResponseEntity.ok(
        participationService.listMemberships(caller).stream()
            .map(ParticipantResponse::from)
            .toList());
  }

  // --- DTOs ---

  public record JoinRequest(
      @NotNull(message = "userId is required") UUID userId,
      @Size(max = 50, message = "roleLabel must be at most 50 characters") String roleLabel) {}

  public record FileRequest(
      @Size(max = 50, message = "roleLabel must be at most 50 characters") String roleLabel,
      @Size(max = 500, message = "note must be at most 500 characters") String note) {}

  public record ParticipantResponse(
      UUID id, UUID crisisId, UUID userId, String roleLabel, Instant joinedAt) {

    public static ParticipantResponse from(CrisisParticipant participant) {
      return new ParticipantResponse(
          participant.getId(),
          participant.getCrisisId(),
          participant.getUserId(),
          participant.getRoleLabel(),
          participant.getJoinedAt());
    }
  }

  public record ParticipationRequestResponse(
      UUID id,
      UUID crisisId,
      UUID userId,
      String roleLabel,
      String note,
      String status,
      UUID decidedBy,
      Instant createdAt,
      Instant decidedAt,
      boolean duplicate) {

    public static ParticipationRequestResponse from(
        ParticipationRequest request, boolean duplicate) {
      return new ParticipationRequestResponse(
          request.getId(),
          request.getCrisisId(),
          request.getUserId(),
          request.getRoleLabel(),
          request.getNote(),
          request.getStatus().name(),
          request.getDecidedBy(),
          request.getCreatedAt(),
          request.getDecidedAt(),
          duplicate);
    }
  }
}
