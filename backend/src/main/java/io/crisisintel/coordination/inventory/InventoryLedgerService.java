package io.crisisintel.coordination.inventory;

import io.crisisintel.coordination.audit.AuditEventBuilder;
import io.crisisintel.coordination.audit.AuditService;
import io.crisisintel.coordination.crisis.Crisis;
import io.crisisintel.coordination.exception.ForbiddenException;
import io.crisisintel.coordination.exception.InsufficientInventoryException;
import io.crisisintel.coordination.exception.InvalidRequestException;
import io.crisisintel.coordination.exception.ResourceNotFoundException;
import io.crisisintel.coordination.participation.CrisisAccessService;
import io.crisisintel.coordination.security.ActorRole;
import io.crisisintel.coordination.security.CallerContext;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Blood stock ledger. Allocation draws down a provider's stock with one guarded UPDATE, so two
 * concurrent allocations can never take the quantity below zero; revert is its exact inverse.
 */
@Service
public class InventoryLedgerService {

  private static final Logger log = LoggerFactory.getLogger(InventoryLedgerService.class);

  private final InventoryEntryRepository inventoryEntryRepository;
  private final BloodAllocationRepository allocationRepository;
  private final CrisisAccessService crisisAccessService;
  private final AuditService auditService;
  private final Clock clock;

  public InventoryLedgerService(
      InventoryEntryRepository inventoryEntryRepository,
      BloodAllocationRepository allocationRepository,
      CrisisAccessService crisisAccessService,
      AuditService auditService,
      Clock clock) {
    this.inventoryEntryRepository = inventoryEntryRepository;
    this.allocationRepository = allocationRepository;
    this.crisisAccessService = crisisAccessService;
    this.auditService = auditService;
    this.clock = clock;
  }

  /** Sets a provider's stock of one type to an absolute value. */
  @Transactional
  public InventoryEntry setStock(
      CallerContext caller, UUID providerId, String resourceType, int quantity) {
    if (!caller.admin()
        && !(caller.role() == ActorRole.BLOOD_BANK && caller.is(providerId))) {
      throw new ForbiddenException(
          "Not the stock owner", "Only the blood bank itself may set its stock");
    }
    String type = requireBloodType(resourceType);
    if (quantity < 0) {
      throw new InvalidRequestException("Invalid quantity", "quantity must be 0 or greater");
    }

    Instant now = Instant.now(clock);
    var entry =
        inventoryEntryRepository
            .findByProviderIdAndResourceType(providerId, type)
            .orElseGet(() -> new InventoryEntry(providerId, type, quantity, now));
    entry.setQuantity(quantity, now);
    entry = inventoryEntryRepository.save(entry);

    log.info("Stock of {} for provider {} set to {}", type, providerId, quantity);
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("inventory.stock_set")
            .entityType("inventory")
            .entityId(entry.getId())
            .actor(caller)
            .details(
                Map.of("provider_id", providerId, "resource_type", type, "quantity", quantity))
            .build());
    return entry;
  }

  @Transactional(readOnly = true)
  public List<InventoryEntry> listStock(UUID providerId) {
    return inventoryEntryRepository.findByProviderIdOrderByResourceTypeAsc(providerId);
  }

  /**
   * Draws {@code quantity} units from the provider's stock for the crisis. Fails with {@code
   * insufficient_inventory} and leaves the stock untouched when it does not cover the draw.
   */
  @Transactional
  public BloodAllocation allocate(
      CallerContext caller,
      UUID crisisId,
      UUID providerId,
      String resourceType,
      int quantity,
      String purpose) {
    var crisis = crisisAccessService.requireActiveCrisis(crisisId);
    requireMayDrawFor(caller, crisis, providerId);
    String type = requireBloodType(resourceType);
    if (quantity <= 0) {
      throw new InvalidRequestException("Invalid quantity", "quantity must be greater than 0");
    }

    Instant now = Instant.now(clock);
    int updated = inventoryEntryRepository.decrementIfAvailable(providerId, type, quantity, now);
    if (updated == 0) {
      throw new InsufficientInventoryException(providerId, type, quantity);
    }

    var allocation =
        allocationRepository.save(
            new BloodAllocation(
                crisisId, providerId, type, quantity, purpose, caller.userId(), now));

    log.info(
        "Allocated {} unit(s) of {} from provider {} to crisis {}",
        quantity,
        type,
        providerId,
        crisisId);
    audit(caller, "allocation.created", allocation);
    return allocation;
  }

  /** Returns the allocated units to the provider's stock. A second revert is rejected. */
  @Transactional
  public BloodAllocation revert(CallerContext caller, UUID allocationId) {
    var allocation = requireAllocation(allocationId);
    var crisis = crisisAccessService.requireActiveCrisis(allocation.getCrisisId());
    requireMayDrawFor(caller, crisis, allocation.getProviderId());

    Instant now = Instant.now(clock);
    allocation.revert(now);
    allocation = allocationRepository.saveAndFlush(allocation);
    restock(allocation, now);

    log.info(
        "Reverted allocation {} ({} unit(s) returned)", allocationId, allocation.getQuantity());
    audit(caller, "allocation.reverted", allocation);
    return allocation;
  }

  /**
   * Removes an allocation record. An allocation still in effect is reverted first, so the ledger
   * ends where it was before the allocation.
   */
  @Transactional
  public void delete(CallerContext caller, UUID allocationId) {
    var allocation = requireAllocation(allocationId);
    var crisis = crisisAccessService.requireActiveCrisis(allocation.getCrisisId());
    requireMayDrawFor(caller, crisis, allocation.getProviderId());

    Instant now = Instant.now(clock);
    boolean wasInEffect = allocation.isInEffect();
    if (wasInEffect) {
      allocation.revert(now);
      allocation = allocationRepository.saveAndFlush(allocation);
    }
    allocationRepository.delete(allocation);
    allocationRepository.flush();
    if (wasInEffect) {
      restock(allocation, now);
    }

    log.info("Deleted allocation {} (reverted first: {})", allocationId, wasInEffect);
    audit(caller, "allocation.deleted", allocation);
  }

  @Transactional(readOnly = true)
  public BloodAllocation getAllocation(UUID allocationId) {
    return requireAllocation(allocationId);
  }

  @Transactional(readOnly = true)
  public Page<BloodAllocation> listAllocations(
      UUID crisisId, AllocationStatus status, Pageable pageable) {
    crisisAccessService.requireCrisis(crisisId);
    return allocationRepository.findByCrisis(crisisId, status, pageable);
  }

  private void restock(BloodAllocation allocation, Instant now) {
    int updated =
        inventoryEntryRepository.increment(
            allocation.getProviderId(),
            allocation.getResourceType(),
            allocation.getQuantity(),
            now);
    if (updated == 0) {
      inventoryEntryRepository.save(
          new InventoryEntry(
              allocation.getProviderId(),
              allocation.getResourceType(),
              allocation.getQuantity(),
              now));
    }
  }

  /**
   * Crisis administrators may draw from any provider. Otherwise the caller must be the blood bank
   * that owns the stock and must be allowed to act in the crisis.
   */
  private void requireMayDrawFor(CallerContext caller, Crisis crisis, UUID providerId) {
    if (crisisAccessService.isAdministrator(caller, crisis)) {
      return;
    }
    if (caller.role() != ActorRole.BLOOD_BANK || !caller.is(providerId)) {
      throw new ForbiddenException(
          "Not the stock owner", "Only the providing blood bank or an administrator may do this");
    }
    crisisAccessService.requireMayAct(caller, crisis);
  }

  private BloodAllocation requireAllocation(UUID allocationId) {
    return allocationRepository
        .findById(allocationId)
        .orElseThrow(() -> new ResourceNotFoundException("Allocation", allocationId));
  }

  static String requireBloodType(String resourceType) {
    return BloodType.fromLabel(resourceType)
        .map(BloodType::label)
        .orElseThrow(
            () ->
                new InvalidRequestException(
                    "Invalid resource type", "Unknown blood type '" + resourceType + "'"));
  }

  private void audit(CallerContext caller, String eventType, BloodAllocation allocation) {
    var details = new LinkedHashMap<String, Object>();
    details.put("crisis_id", allocation.getCrisisId().toString());
    details.put("provider_id", allocation.getProviderId().toString());
    details.put("resource_type", allocation.getResourceType());
    details.put("quantity", allocation.getQuantity());
    details.put("status", allocation.getStatus().name());
    auditService.log(
        AuditEventBuilder.builder()
            .eventType(eventType)
            .entityType("allocation")
            .entityId(allocation.getId())
            .actor(caller)
            .details(details)
            .build());
  }
}
