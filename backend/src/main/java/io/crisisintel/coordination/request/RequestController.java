package io.crisisintel.coordination.request;

import io.crisisintel.coordination.common.EnumParams;
import io.crisisintel.coordination.common.PageRequests;
import io.crisisintel.coordination.common.PagedResponse;
import io.crisisintel.coordination.exception.InvalidRequestException;
import io.crisisintel.coordination.request.RequestLifecycleService.RequestFilter;
import io.crisisintel.coordination.security.CallerContext;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import java.util.Locale;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/requests")
public class RequestController {

  private final RequestLifecycleService requestLifecycleService;
  private final PageRequests pageRequests;

  public RequestController(
      RequestLifecycleService requestLifecycleService, PageRequests pageRequests) {
    this.requestLifecycleService = requestLifecycleService;
    this.pageRequests = pageRequests;
  }

  @PostMapping
  public ResponseEntity<RequestResponse> createRequest(
      CallerContext caller, @Valid @RequestBody CreateRequestRequest request) {
    var result = requestLifecycleService.create(caller, request.toDraft());
    var status = result.duplicate() ? HttpStatus.OK : HttpStatus.CREATED;
    return ResponseEntity.status(status)
        .body(RequestResponse.from(result.request(), result.duplicate()));
  }

  @GetMapping
  public ResponseEntity<PagedResponse<RequestResponse>> listRequests(
      CallerContext caller,
      @RequestParam(required = false) String kind,
      @RequestParam(required = false) String status,
      @RequestParam(name = "crisis_id", required = false) UUID crisisId,
      @RequestParam(name = "counterparty_id", required = false) UUID counterpartyId,
      @RequestParam(required = false) String side,
      @RequestParam(required = false) Integer page,
      @RequestParam(name = "page_size", required = false) Integer pageSize) {
    var filter =
        new RequestFilter(
            kind != null ? parseKind(kind) : null,
            EnumParams.parse(RequestStatus.class, "status", status),
            crisisId,
            counterpartyId,
            parseSide(side));
    var requests =
        requestLifecycleService.list(caller, filter, pageRequests.newestFirst(page, pageSize));
    return ResponseEntity.ok(PagedResponse.from(requests, r -> RequestResponse.from(r, false)));
  }

  @GetMapping("/{id}")
  public ResponseEntity<RequestResponse> getRequest(CallerContext caller, @PathVariable UUID id) {
    return ResponseEntity.ok(RequestResponse.from(requestLifecycleService.get(caller, id), false));
  }

  @PostMapping("/{id}/accept")
  public ResponseEntity<RequestResponse> acceptRequest(
      CallerContext caller, @PathVariable UUID id) {
    return ResponseEntity.ok(
        RequestResponse.from(requestLifecycleService.accept(caller, id), false));
  }

  @PostMapping("/{id}/reject")
  public ResponseEntity<RequestResponse> rejectRequest(
      CallerContext caller,
      @PathVariable UUID id,
      @Valid @RequestBody(required = false) RejectRequest request) {
    String reason = request != null ? request.reason() : null;
    return ResponseEntity.ok(
        RequestResponse.from(requestLifecycleService.reject(caller, id, reason), false));
  }

  @PostMapping("/{id}/cancel")
  public ResponseEntity<RequestResponse> cancelRequest(
      CallerContext caller, @PathVariable UUID id) {
    return ResponseEntity.ok(
        RequestResponse.from(requestLifecycleService.cancel(caller, id), false));
  }

  @PostMapping("/{id}/complete")
  public ResponseEntity<RequestResponse> completeRequest(
      CallerContext caller,
      @PathVariable UUID id,
      @RequestBody(required = false) CompleteRequest request) {
    Integer cooldownDays = request != null ? request.cooldownDays() : null;
    return ResponseEntity.ok(
        RequestResponse.from(
            requestLifecycleService.complete(caller, id, cooldownDays), false));
  }

  @PostMapping("/{id}/hide")
  public ResponseEntity<Void> hideRequest(CallerContext caller, @PathVariable UUID id) {
    requestLifecycleService.hide(caller, id);
    return ResponseEntity.noContent().build();
  }

  static RequestKind parseKind(String value) {
    return RequestKind.fromValue(value)
        .orElseThrow(
            () ->
                new InvalidRequestException(
                    "Invalid kind",
                    "kind must be one of inventory, meeting, booking, dispatch; got: " + value));
  }

  static String parseSide(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    var side = value.trim().toLowerCase(Locale.ROOT);
    if (!side.equals("requester") && !side.equals("counterparty")) {
      throw new InvalidRequestException(
          "Invalid side", "side must be requester or counterparty; got: " + value);
    }
    return side;
  }

  // --- DTOs ---

  public record CreateRequestRequest(
      @NotBlank(message = "kind is required") String kind,
      @NotNull(message = "counterpartyId is required") UUID counterpartyId,
      Instant targetAt,
      UUID crisisId,
      @Size(max = 10, message = "resourceType must be at most 10 characters") String resourceType,
      Integer quantity,
      UUID serviceId,
      @Size(max = 2000, message = "description must be at most 2000 characters")
          String description,
      @Size(max = 500, message = "locationText must be at most 500 characters")
          String locationText,
      Double lat,
      Double lng,
      Integer cooldownDays) {

    RequestDraft toDraft() {
      return new RequestDraft(
          parseKind(kind),
          counterpartyId,
          targetAt,
          crisisId,
          resourceType,
          quantity,
          serviceId,
          description,
          locationText,
          lat,
          lng,
          cooldownDays);
    }
  }

  public record RejectRequest(
      @Size(max = 500, message = "reason must be at most 500 characters") String reason) {}

  public record CompleteRequest(Integer cooldownDays) {}

  public record RequestResponse(
      UUID id,
      String kind,
      String status,
      UUID requesterId,
      UUID counterpartyId,
      Instant targetAt,
      UUID crisisId,
      String resourceType,
      Integer quantity,
      UUID serviceId,
      String description,
      String locationText,
      Double lat,
      Double lng,
      Integer cooldownDays,
      String rejectReason,
      Instant createdAt,
      Instant updatedAt,
      Instant respondedAt,
      Instant closedAt,
      boolean duplicate) {

    public static RequestResponse from(RequestEnvelope envelope, boolean duplicate) {
      return new RequestResponse(
          envelope.getId(),
          envelope.getKind().value(),
          envelope.getStatus().name(),
          envelope.getRequesterId(),
          envelope.getCounterpartyId(),
          envelope.getTargetAt(),
          envelope.getCrisisId(),
          envelope.getResourceType(),
          envelope.getQuantity(),
          envelope.getServiceId(),
          envelope.getDescription(),
          envelope.getLocationText(),
          envelope.getLat(),
          envelope.getLng(),
          envelope.getCooldownDays(),
          envelope.getRejectReason(),
          envelope.getCreatedAt(),
          envelope.getUpdatedAt(),
          envelope.getRespondedAt(),
          envelope.getClosedAt(),
          duplicate);
    }
  }
}
