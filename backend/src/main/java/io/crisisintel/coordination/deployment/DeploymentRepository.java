package io.crisisintel.coordination.deployment;

import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface DeploymentRepository extends JpaRepository<Deployment, UUID> {

  interface StatusCount {
    DeploymentStatus getStatus();

    long getCount();
  }

  @Query(
      """
      SELECT d FROM Deployment d
      WHERE d.incidentId = :incidentId
        AND (:status IS NULL OR d.status = :status)
        AND (:unitType IS NULL OR d.unitType = :unitType)
      """)
  Page<Deployment> findByIncident(
      @Param("incidentId") UUID incidentId,
      @Param("status") DeploymentStatus status,
      @Param("unitType") UnitType unitType,
      Pageable pageable);

  boolean existsByUnitTypeAndUnitIdAndStatus(
      UnitType unitType, UUID unitId, DeploymentStatus status);

  @Query(
      "SELECT d.status AS status, COUNT(d) AS count FROM Deployment d"
          + " WHERE d.incidentId = :incidentId GROUP BY d.status")
  List<StatusCount> countByStatus(@Param("incidentId") UUID incidentId);
}
