package io.crisisintel.coordination.inventory;

import io.crisisintel.coordination.common.EnumParams;
import io.crisisintel.coordination.common.PageRequests;
import io.crisisintel.coordination.common.PagedResponse;
import io.crisisintel.coordination.security.CallerContext;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class InventoryController {

  private final InventoryLedgerService ledgerService;
  private final PageRequests pageRequests;

  public InventoryController(InventoryLedgerService ledgerService, PageRequests pageRequests) {
    this.ledgerService = ledgerService;
    this.pageRequests = pageRequests;
  }

  @PutMapping("/api/inventory/{providerId}")
  public ResponseEntity<StockResponse> setStock(
      CallerContext caller,
      @PathVariable UUID providerId,
      @Valid @RequestBody SetStockRequest request) {
    var entry =
        ledgerService.setStock(caller, providerId, request.resourceType(), request.quantity());
    return ResponseEntity.ok(StockResponse.from(entry));
  }

  @GetMapping("/api/inventory/{providerId}")
  public ResponseEntity<List<StockResponse>> listStock(@PathVariable UUID providerId) {
    return ResponseEntity.ok(
        ledgerService.listStock(providerId).stream().map(StockResponse::from).toList());
  }

  @PostMapping("/api/crises/{crisisId}/allocations")
  public ResponseEntity<AllocationResponse> allocate(
      CallerContext caller,
      @PathVariable UUID crisisId,
      @Valid @RequestBody AllocateRequest request) {
    var allocation =
        ledgerService.allocate(
            caller,
            crisisId,
            request.providerId(),
            request.resourceType(),
            request.quantity(),
            request.purpose());
    return ResponseEntity.status(201).body(AllocationResponse.from(allocation));
  }

  @GetMapping("/api/crises/{crisisId}/allocations")
  public ResponseEntity<PagedResponse<AllocationResponse>> listAllocations(
      @PathVariable UUID crisisId,
      @RequestParam(required = false) String status,
      @RequestParam(required = false) Integer page,
      @RequestParam(name = "page_size", required = false) Integer pageSize) {
    var allocations =
        ledgerService.listAllocations(
            crisisId,
            EnumParams.parse(AllocationStatus.class, "status", status),
            pageRequests.newestFirst(page, pageSize));
    return ResponseEntity.ok(PagedResponse.from(allocations, AllocationResponse::from));
  }

  @GetMapping("/api/allocations/{id}")
  public ResponseEntity<AllocationResponse> getAllocation(@PathVariable UUID id) {
    return ResponseEntity.ok(AllocationResponse.from(ledgerService.getAllocation(id)));
  }

  @PostMapping("/api/allocations/{id}/revert")
  public ResponseEntity<AllocationResponse> revertAllocation(
      CallerContext caller, @PathVariable UUID id) {
    return ResponseEntity.ok(AllocationResponse.from(ledgerService.revert(caller, id)));
  }

  @DeleteMapping("/api/allocations/{id}")
  public ResponseEntity<Void> deleteAllocation(CallerContext caller, @PathVariable UUID id) {
    ledgerService.delete(caller, id);
    return ResponseEntity.noContent().build();
  }

  // --- DTOs ---

  public record SetStockRequest(
      @NotBlank(message = "resourceType is required") String resourceType,
      @NotNull(message = "quantity is required") Integer quantity) {}

  public record AllocateRequest(
      @NotNull(message = "providerId is required") UUID providerId,
      @NotBlank(message = "resourceType is required") String resourceType,
      @NotNull(message = "quantity is required") Integer quantity,
      @Size(max = 500, message = "purpose must be at most 500 characters") String purpose) {}

  public record StockResponse(
      UUID providerId, String resourceType, int quantity, Instant updatedAt) {

    public static StockResponse from(InventoryEntry entry) {
      return new StockResponse(
          entry.getProviderId(),
          entry.getResourceType(),
          entry.getQuantity(),
          entry.getUpdatedAt());
    }
  }

  public record AllocationResponse(
      UUID id,
      UUID crisisId,
      UUID providerId,
      String resourceType,
      int quantity,
      String status,
      String purpose,
      UUID allocatedBy,
      Instant createdAt,
      Instant revertedAt) {

    public static AllocationResponse from(BloodAllocation allocation) {
      return new AllocationResponse(
          allocation.getId(),
          allocation.getCrisisId(),
          allocation.getProviderId(),
          allocation.getResourceType(),
          allocation.getQuantity(),
          allocation.getStatus().name(),
          allocation.getPurpose(),
          allocation.getAllocatedBy(),
          allocation.getCreatedAt(),
          allocation.getRevertedAt());
    }
  }
}
