package io.crisisintel.coordination.inventory;

import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface BloodAllocationRepository extends JpaRepository<BloodAllocation, UUID> {

  /** Typed projection for per-type allocation totals. */
  interface ResourceTotal {
    String getResourceType();

    long getQuantity();
  }

  @Query(
      """
      SELECT a FROM BloodAllocation a
      WHERE a.crisisId = :crisisId
        AND (:status IS NULL OR a.status = :status)
      """)
  Page<BloodAllocation> findByCrisis(
      @Param("crisisId") UUID crisisId,
      @Param("status") AllocationStatus status,
      Pageable pageable);

  @Query(
      """
      SELECT a.resourceType AS resourceType, SUM(a.quantity) AS quantity
      FROM BloodAllocation a
      WHERE a.crisisId = :crisisId AND a.status = :status
      GROUP BY a.resourceType
      ORDER BY a.resourceType
      """)
  List<ResourceTotal> sumByResourceType(
      @Param("crisisId") UUID crisisId, @Param("status") AllocationStatus status);
}
