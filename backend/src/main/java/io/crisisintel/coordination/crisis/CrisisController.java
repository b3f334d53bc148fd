package io.crisisintel.coordination.crisis;

import io.crisisintel.coordination.audit.AuditEvent;
import io.crisisintel.coordination.common.EnumParams;
import io.crisisintel.coordination.common.PageRequests;
import io.crisisintel.coordination.common.PagedResponse;
import io.crisisintel.coordination.crisis.CrisisService.CreateCrisisCommand;
import io.crisisintel.coordination.crisis.CrisisService.CrisisDetail;
import io.crisisintel.coordination.crisis.CrisisService.IncidentNote;
import io.crisisintel.coordination.crisis.CrisisSummaryService.CompletedSummary;
import io.crisisintel.coordination.security.CallerContext;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import org.springframework.data.domain.Sort;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/crises")
public class CrisisController {

  private final CrisisService crisisService;
  private final CrisisSummaryService crisisSummaryService;
  private final PageRequests pageRequests;

  public CrisisController(
      CrisisService crisisService,
      CrisisSummaryService crisisSummaryService,
      PageRequests pageRequests) {
    this.crisisService = crisisService;
    this.crisisSummaryService = crisisSummaryService;
    this.pageRequests = pageRequests;
  }

  @PostMapping
  public ResponseEntity<CrisisResponse> createCrisis(
      CallerContext caller, @Valid @RequestBody CreateCrisisRequest request) {
    var crisis =
        crisisService.createCrisis(
            caller,
            new CreateCrisisCommand(
                request.title(),
                request.description(),
                request.incidentType(),
                request.severity(),
                request.lat(),
                request.lng(),
                request.radiusKm()));
    return ResponseEntity.status(201).body(CrisisResponse.from(crisis));
  }

  @GetMapping
  public ResponseEntity<PagedResponse<CrisisResponse>> listCrises(
      @RequestParam(required = false) String status,
      @RequestParam(required = false) Integer page,
      @RequestParam(name = "page_size", required = false) Integer pageSize) {
    var crises =
        crisisService.listCrises(
            EnumParams.parse(CrisisStatus.class, "status", status),
            pageRequests.newestFirst(page, pageSize));
    return ResponseEntity.ok(PagedResponse.from(crises, CrisisResponse::from));
  }

  @GetMapping("/{id}")
  public ResponseEntity<CrisisDetailResponse> getCrisis(@PathVariable UUID id) {
    return ResponseEntity.ok(CrisisDetailResponse.from(crisisService.getCrisis(id)));
  }

  @PostMapping("/{id}/close")
  public ResponseEntity<CrisisResponse> closeCrisis(CallerContext caller, @PathVariable UUID id) {
    return ResponseEntity.ok(CrisisResponse.from(crisisService.closeCrisis(caller, id)));
  }

  @PostMapping("/{id}/cancel")
  public ResponseEntity<CrisisResponse> cancelCrisis(CallerContext caller, @PathVariable UUID id) {
    return ResponseEntity.ok(CrisisResponse.from(crisisService.cancelCrisis(caller, id)));
  }

  @PostMapping("/{id}/notes")
  public ResponseEntity<IncidentNote> addIncidentNote(
      CallerContext caller, @PathVariable UUID id, @Valid @RequestBody AddNoteRequest request) {
    return ResponseEntity.status(201)
        .body(crisisService.addIncidentNote(caller, id, request.note()));
  }

  @GetMapping("/{id}/timeline")
  public ResponseEntity<PagedResponse<TimelineEntryResponse>> getTimeline(
      CallerContext caller,
      @PathVariable UUID id,
      @RequestParam(required = false) Integer page,
      @RequestParam(name = "page_size", required = false) Integer pageSize) {
    var events =
        crisisService.timeline(caller, id, pageRequests.of(page, pageSize, Sort.unsorted()));
    return ResponseEntity.ok(PagedResponse.from(events, TimelineEntryResponse::from));
  }

  @GetMapping("/{id}/summary")
  public ResponseEntity<CompletedSummary> getCompletedSummary(
      CallerContext caller, @PathVariable UUID id) {
    return ResponseEntity.ok(crisisSummaryService.completedSummary(caller, id));
  }

  // --- DTOs ---

  public record CreateCrisisRequest(
      @NotBlank(message = "title is required")
          @Size(max = 255, message = "title must be at most 255 characters")
          String title,
      String description,
      @Size(max = 50, message = "incidentType must be at most 50 characters") String incidentType,
      @Size(max = 20, message = "severity must be at most 20 characters") String severity,
      @NotNull(message = "lat is required") Double lat,
      @NotNull(message = "lng is required") Double lng,
      Double radiusKm) {}

  public record AddNoteRequest(
      @NotBlank(message = "note is required")
          @Size(max = 4000, message = "note must be at most 4000 characters")
          String note) {}

  public record CrisisResponse(
      UUID id,
      UUID incidentId,
      String title,
      String description,
      String status,
      double centerLat,
      double centerLng,
      double radiusKm,
      UUID adminUserId,
      Instant createdAt,
      Instant endedAt) {

    public static CrisisResponse from(Crisis crisis) {
      return new CrisisResponse(
          crisis.getId(),
          crisis.getIncidentId(),
          crisis.getTitle(),
          crisis.getDescription(),
          crisis.getStatus().name(),
          crisis.getCenterLat(),
          crisis.getCenterLng(),
          crisis.getRadiusKm(),
          crisis.getAdminUserId(),
          crisis.getCreatedAt(),
          crisis.getEndedAt());
    }
  }

  public record IncidentResponse(
      UUID id,
      String title,
      String incidentType,
      String severity,
      double latitude,
      double longitude,
      String status,
      Instant openedAt,
      Instant closedAt) {

    public static IncidentResponse from(Incident incident) {
      return new IncidentResponse(
          incident.getId(),
          incident.getTitle(),
          incident.getIncidentType(),
          incident.getSeverity(),
          incident.getLatitude(),
          incident.getLongitude(),
          incident.getStatus().name(),
          incident.getOpenedAt(),
          incident.getClosedAt());
    }
  }

  public record CrisisDetailResponse(
      CrisisResponse crisis,
      IncidentResponse incident,
      long participantCount,
      long victimCount,
      BigDecimal donationsTotal,
      BigDecimal expensesTotal,
      BigDecimal balance) {

    public static CrisisDetailResponse from(CrisisDetail detail) {
      return new CrisisDetailResponse(
          CrisisResponse.from(detail.crisis()),
          IncidentResponse.from(detail.incident()),
          detail.participantCount(),
          detail.victimCount(),
          detail.donationsTotal(),
          detail.expensesTotal(),
          detail.balance());
    }
  }

  public record TimelineEntryResponse(
      UUID id,
      String eventType,
      String entityType,
      UUID entityId,
      UUID actorId,
      Map<String, Object> details,
      Instant occurredAt) {

    public static TimelineEntryResponse from(AuditEvent event) {
      return new TimelineEntryResponse(
          event.getId(),
          event.getEventType(),
          event.getEntityType(),
          event.getEntityId(),
          event.getActorId(),
          event.getDetails(),
          event.getOccurredAt());
    }
  }
}
