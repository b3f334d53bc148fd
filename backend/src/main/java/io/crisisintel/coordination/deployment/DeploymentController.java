package io.crisisintel.coordination.deployment;

import io.crisisintel.coordination.common.EnumParams;
import io.crisisintel.coordination.common.PageRequests;
import io.crisisintel.coordination.common.PagedResponse;
import io.crisisintel.coordination.deployment.DeploymentService.DeployCommand;
import io.crisisintel.coordination.exception.InvalidRequestException;
import io.crisisintel.coordination.security.CallerContext;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class DeploymentController {

  private final DeploymentService deploymentService;
  private final PageRequests pageRequests;

  public DeploymentController(DeploymentService deploymentService, PageRequests pageRequests) {
    this.deploymentService = deploymentService;
    this.pageRequests = pageRequests;
  }

  @PostMapping("/api/incidents/{incidentId}/deployments")
  public ResponseEntity<DeploymentResponse> deploy(
      CallerContext caller,
      @PathVariable UUID incidentId,
      @Valid @RequestBody DeployRequest request) {
    var command =
        new DeployCommand(
            parseUnitType(request.unitType()),
            request.unitId(),
            request.headcount(),
            request.members(),
            request.capabilities(),
            request.note());
    var deployment = deploymentService.deploy(caller, incidentId, command);
    return ResponseEntity.status(201).body(DeploymentResponse.from(deployment));
  }

  @GetMapping("/api/incidents/{incidentId}/deployments")
  public ResponseEntity<PagedResponse<DeploymentResponse>> listDeployments(
      @PathVariable UUID incidentId,
      @RequestParam(required = false) String status,
      @RequestParam(name = "unit_type", required = false) String unitType,
      @RequestParam(required = false) Integer page,
      @RequestParam(name = "page_size", required = false) Integer pageSize) {
    var deployments =
        deploymentService.list(
            incidentId,
            EnumParams.parse(DeploymentStatus.class, "status", status),
            unitType != null ? parseUnitType(unitType) : null,
            pageRequests.newestFirst(page, pageSize));
    return ResponseEntity.ok(PagedResponse.from(deployments, DeploymentResponse::from));
  }

  @GetMapping("/api/deployments/{id}")
  public ResponseEntity<DeploymentResponse> getDeployment(@PathVariable UUID id) {
    return ResponseEntity.ok(DeploymentResponse.from(deploymentService.get(id)));
  }

  @PatchMapping("/api/deployments/{id}/status")
  public ResponseEntity<DeploymentResponse> updateStatus(
      CallerContext caller,
      @PathVariable UUID id,
      @Valid @RequestBody UpdateStatusRequest request) {
    var target = EnumParams.parse(DeploymentStatus.class, "status", request.status());
    var deployment = deploymentService.transition(caller, id, target);
    return ResponseEntity.ok(DeploymentResponse.from(deployment));
  }

  private static UnitType parseUnitType(String value) {
    return UnitType.fromValue(value)
        .orElseThrow(
            () ->
                new InvalidRequestException(
                    "Invalid unit type",
                    "unitType must be fire_team or volunteer_group; got: " + value));
  }

  // --- DTOs ---

  public record DeployRequest(
      @NotBlank(message = "unitType is required") String unitType,
      @NotNull(message = "unitId is required") UUID unitId,
      Integer headcount,
      List<UUID> members,
      @Size(max = 500, message = "capabilities must be at most 500 characters")
          String capabilities,
      String note) {}

  public record UpdateStatusRequest(@NotBlank(message = "status is required") String status) {}

  public record DeploymentResponse(
      UUID id,
      UUID incidentId,
      String unitType,
      UUID unitId,
      UUID ownerUserId,
      int headcount,
      List<UUID> members,
      String capabilities,
      String note,
      String status,
      UUID deployedBy,
      Instant createdAt,
      Instant endedAt) {

    public static DeploymentResponse from(Deployment deployment) {
      return new DeploymentResponse(
          deployment.getId(),
          deployment.getIncidentId(),
          deployment.getUnitType().value(),
          deployment.getUnitId(),
          deployment.getOwnerUserId(),
          deployment.getHeadcount(),
          deployment.getMembers(),
          deployment.getCapabilities(),
          deployment.getNote(),
          deployment.getStatus().name(),
          deployment.getDeployedBy(),
          deployment.getCreatedAt(),
          deployment.getEndedAt());
    }
  }
}
