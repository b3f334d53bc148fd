package io.crisisintel.coordination.participation;

import io.crisisintel.coordination.common.EnumParams;
import io.crisisintel.coordination.common.PageRequests;
import io.crisisintel.coordination.common.PagedResponse;
import io.crisisintel.coordination.security.CallerContext;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class InvitationController {

  private final InvitationService invitationService;
  private final PageRequests pageRequests;

  public InvitationController(InvitationService invitationService, PageRequests pageRequests) {
    this.invitationService = invitationService;
    this.pageRequests = pageRequests;
  }

  @PostMapping("/api/crises/{crisisId}/invitations")
  public ResponseEntity<InvitationResponse> invite(
      CallerContext caller,
      @PathVariable UUID crisisId,
      @Valid @RequestBody InviteRequest request) {
    var invitation =
        invitationService.invite(caller, crisisId, request.orgUserId(), request.note());
    return ResponseEntity.status(201).body(InvitationResponse.from(invitation));
  }

  @GetMapping("/api/crises/{crisisId}/invitations")
  public ResponseEntity<PagedResponse<InvitationResponse>> listCrisisInvitations(
      CallerContext caller,
      @PathVariable UUID crisisId,
      @RequestParam(required = false) String status,
      @RequestParam(required = false) Integer page,
      @RequestParam(name = "page_size", required = false) Integer pageSize) {
    var invitations =
        invitationService.listForCrisis(
            caller,
            crisisId,
            EnumParams.parse(InvitationStatus.class, "status", status),
            pageRequests.newestFirst(page, pageSize));
    return ResponseEntity.ok(PagedResponse.from(invitations, InvitationResponse::from));
  }

  @GetMapping("/api/invitations")
  public ResponseEntity<PagedResponse<InvitationResponse>> listMyInvitations(
      CallerContext caller,
      @RequestParam(required = false) String status,
      @RequestParam(required = false) Integer page,
      @RequestParam(name = "page_size", required = false) Integer pageSize) {
    var invitations =
        invitationService.listMine(
            caller,
            EnumParams.parse(InvitationStatus.class, "status", status),
            pageRequests.newestFirst(page, pageSize));
    return ResponseEntity.ok(PagedResponse.from(invitations, InvitationResponse::from));
  }

  @PostMapping("/api/invitations/{id}/accept")
  public ResponseEntity<InvitationResponse> acceptInvitation(
      CallerContext caller, @PathVariable UUID id) {
    return ResponseEntity.ok(InvitationResponse.from(invitationService.respond(caller, id, true)));
  }

  @PostMapping("/api/invitations/{id}/decline")
  public ResponseEntity<InvitationResponse> declineInvitation(
      CallerContext caller, @PathVariable UUID id) {
    return ResponseEntity.ok(
        InvitationResponse.from(invitationService.respond(caller, id, false)));
  }

  @DeleteMapping("/api/invitations/{id}")
  public ResponseEntity<Void> deleteInvitation(CallerContext caller, @PathVariable UUID id) {
    invitationService.deletePending(caller, id);
    return ResponseEntity.noContent().build();
  }

  // --- DTOs ---

  public record InviteRequest(
      @NotNull(message = "orgUserId is required") UUID orgUserId,
      @Size(max = 500, message = "note must be at most 500 characters") String note) {}

  public record InvitationResponse(
      UUID id,
      UUID crisisId,
      UUID orgUserId,
      String orgType,
      String note,
      String status,
      UUID invitedBy,
      Instant createdAt,
      Instant respondedAt) {

    public static InvitationResponse from(CrisisInvitation invitation) {
      return new InvitationResponse(
          invitation.getId(),
          invitation.getCrisisId(),
          invitation.getOrgUserId(),
          invitation.getOrgType(),
          invitation.getNote(),
          invitation.getStatus().name(),
          invitation.getInvitedBy(),
          invitation.getCreatedAt(),
          invitation.getRespondedAt());
    }
  }
}
