package io.crisisintel.coordination.crisis;

import io.crisisintel.coordination.crisis.CrisisFinanceService.FinanceSummary;
import io.crisisintel.coordination.deployment.DeploymentRepository;
import io.crisisintel.coordination.deployment.DeploymentStatus;
import io.crisisintel.coordination.exception.InvalidStateException;
import io.crisisintel.coordination.inventory.AllocationStatus;
import io.crisisintel.coordination.inventory.BloodAllocationRepository;
import io.crisisintel.coordination.participation.CrisisAccessService;
import io.crisisintel.coordination.participation.CrisisParticipantRepository;
import io.crisisintel.coordination.security.CallerContext;
import io.crisisintel.coordination.victim.CrisisVictimRepository;
import io.crisisintel.coordination.victim.VictimStatus;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Read-only wrap-up of a closed or cancelled crisis. */
@Service
public class CrisisSummaryService {

  private final CrisisAccessService crisisAccessService;
  private final CrisisParticipantRepository participantRepository;
  private final CrisisVictimRepository victimRepository;
  private final BloodAllocationRepository allocationRepository;
  private final DeploymentRepository deploymentRepository;
  private final CrisisDonationRepository donationRepository;
  private final CrisisExpenseRepository expenseRepository;

  public CrisisSummaryService(
      CrisisAccessService crisisAccessService,
      CrisisParticipantRepository participantRepository,
      CrisisVictimRepository victimRepository,
      BloodAllocationRepository allocationRepository,
      DeploymentRepository deploymentRepository,
      CrisisDonationRepository donationRepository,
      CrisisExpenseRepository expenseRepository) {
    this.crisisAccessService = crisisAccessService;
    this.participantRepository = participantRepository;
    this.victimRepository = victimRepository;
    this.allocationRepository = allocationRepository;
    this.deploymentRepository = deploymentRepository;
    this.donationRepository = donationRepository;
    this.expenseRepository = expenseRepository;
  }

  @Transactional(readOnly = true)
  public CompletedSummary completedSummary(CallerContext caller, UUID crisisId) {
    var crisis = crisisAccessService.requireCrisis(crisisId);
    crisisAccessService.requireParticipantOrAdministrator(caller, crisis);
    if (!crisis.getStatus().isTerminal()) {
      throw new InvalidStateException(
          "Crisis still active", "A summary is available once the crisis is closed or cancelled");
    }

    var victims = new EnumMap<VictimStatus, Long>(VictimStatus.class);
    for (var status : VictimStatus.values()) {
      victims.put(status, 0L);
    }
    victimRepository.countByStatus(crisisId).forEach(c -> victims.put(c.getStatus(), c.getCount()));

    var allocations = new TreeMap<String, Long>();
    allocationRepository
        .sumByResourceType(crisisId, AllocationStatus.ALLOCATED)
        .forEach(t -> allocations.put(t.getResourceType(), t.getQuantity()));

    var deployments = new EnumMap<DeploymentStatus, Long>(DeploymentStatus.class);
    for (var status : DeploymentStatus.values()) {
      deployments.put(status, 0L);
    }
    deploymentRepository
        .countByStatus(crisis.getIncidentId())
        .forEach(c -> deployments.put(c.getStatus(), c.getCount()));

    return new CompletedSummary(
        crisis.getId(),
        crisis.getTitle(),
        crisis.getStatus(),
        crisis.getCreatedAt(),
        crisis.getEndedAt(),
        participantRepository.countByCrisisId(crisisId),
        victims,
        allocations,
        deployments,
        FinanceSummary.of(
            donationRepository.sumByCrisisId(crisisId),
            expenseRepository.sumByCrisisId(crisisId)));
  }

  public record CompletedSummary(
      UUID crisisId,
      String title,
      CrisisStatus status,
      Instant createdAt,
      Instant endedAt,
      long participants,
      Map<VictimStatus, Long> victimsByStatus,
      Map<String, Long> unitsAllocatedByResourceType,
      Map<DeploymentStatus, Long> deploymentsByStatus,
      FinanceSummary finance) {}
}
