package io.crisisintel.coordination.inventory;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface InventoryEntryRepository extends JpaRepository<InventoryEntry, UUID> {

  Optional<InventoryEntry> findByProviderIdAndResourceType(UUID providerId, String resourceType);

  List<InventoryEntry> findByProviderIdOrderByResourceTypeAsc(UUID providerId);

  /**
   * Atomic check-and-decrement. Returns 1 when the stock covered {@code quantity} and was reduced,
   * 0 when it did not (nothing changes in that case).
   */
  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query(
      """
      UPDATE InventoryEntry e
      SET e.quantity = e.quantity - :quantity, e.updatedAt = :now
      WHERE e.providerId = :providerId
        AND e.resourceType = :resourceType
        AND e.quantity >= :quantity
      """)
  int decrementIfAvailable(
      @Param("providerId") UUID providerId,
      @Param("resourceType") String resourceType,
      @Param("quantity") int quantity,
      @Param("now") Instant now);

  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query(
      """
      UPDATE InventoryEntry e
      SET e.quantity = e.quantity + :quantity, e.updatedAt = :now
      WHERE e.providerId = :providerId
        AND e.resourceType = :resourceType
      """)
  int increment(
      @Param("providerId") UUID providerId,
      @Param("resourceType") String resourceType,
      @Param("quantity") int quantity,
      @Param("now") Instant now);
}
