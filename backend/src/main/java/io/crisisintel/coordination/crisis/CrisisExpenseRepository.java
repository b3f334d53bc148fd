package io.crisisintel.coordination.crisis;

import java.math.BigDecimal;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface CrisisExpenseRepository extends JpaRepository<CrisisExpense, UUID> {

  Page<CrisisExpense> findByCrisisId(UUID crisisId, Pageable pageable);

  @Query("SELECT COALESCE(SUM(e.amount), 0) FROM CrisisExpense e WHERE e.crisisId = :crisisId")
  BigDecimal sumByCrisisId(@Param("crisisId") UUID crisisId);
}
