package io.crisisintel.coordination.crisis;

import io.crisisintel.coordination.audit.AuditEventBuilder;
import io.crisisintel.coordination.audit.AuditService;
import io.crisisintel.coordination.exception.InvalidRequestException;
import io.crisisintel.coordination.participation.CrisisAccessService;
import io.crisisintel.coordination.security.CallerContext;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Donations and expenses recorded against a crisis, and the resulting balance. */
@Service
public class CrisisFinanceService {

  private static final Logger log = LoggerFactory.getLogger(CrisisFinanceService.class);

  private final CrisisAccessService crisisAccessService;
  private final CrisisDonationRepository donationRepository;
  private final CrisisExpenseRepository expenseRepository;
  private final AuditService auditService;
  private final Clock clock;

  public CrisisFinanceService(
      CrisisAccessService crisisAccessService,
      CrisisDonationRepository donationRepository,
      CrisisExpenseRepository expenseRepository,
      AuditService auditService,
      Clock clock) {
    this.crisisAccessService = crisisAccessService;
    this.donationRepository = donationRepository;
    this.expenseRepository = expenseRepository;
    this.auditService = auditService;
    this.clock = clock;
  }

  /** Any authenticated user may donate to an active crisis. */
  @Transactional
  public CrisisDonation addDonation(
      CallerContext caller, UUID crisisId, BigDecimal amount, String note) {
    crisisAccessService.requireActiveCrisis(crisisId);
    var normalized = requirePositiveAmount(amount);

    var donation =
        donationRepository.save(
            new CrisisDonation(crisisId, caller.userId(), normalized, note, Instant.now(clock)));
    log.info("Donation of {} to crisis {} by {}", normalized, crisisId, caller.userId());
    audit(caller, "finance.donation_added", donation.getId(), crisisId, normalized);
    return donation;
  }

  @Transactional
  public CrisisExpense addExpense(
      CallerContext caller, UUID crisisId, BigDecimal amount, String purpose) {
    var crisis = crisisAccessService.requireActiveCrisis(crisisId);
    crisisAccessService.requireAdministrator(caller, crisis);
    var normalized = requirePositiveAmount(amount);
    if (purpose == null || purpose.isBlank()) {
      throw new InvalidRequestException("Missing purpose", "purpose is required");
    }

    var expense =
        expenseRepository.save(
            new CrisisExpense(
                crisisId, caller.userId(), normalized, purpose.trim(), Instant.now(clock)));
    log.info("Expense of {} on crisis {} by {}", normalized, crisisId, caller.userId());
    audit(caller, "finance.expense_added", expense.getId(), crisisId, normalized);
    return expense;
  }

  @Transactional(readOnly = true)
  public FinanceSummary summary(UUID crisisId) {
    crisisAccessService.requireCrisis(crisisId);
    return FinanceSummary.of(
        donationRepository.sumByCrisisId(crisisId), expenseRepository.sumByCrisisId(crisisId));
  }

  @Transactional(readOnly = true)
  public Page<CrisisDonation> listDonations(UUID crisisId, Pageable pageable) {
    crisisAccessService.requireCrisis(crisisId);
    return donationRepository.findByCrisisId(crisisId, pageable);
  }

  @Transactional(readOnly = true)
  public Page<CrisisExpense> listExpenses(CallerContext caller, UUID crisisId, Pageable pageable) {
    var crisis = crisisAccessService.requireCrisis(crisisId);
    crisisAccessService.requireParticipantOrAdministrator(caller, crisis);
    return expenseRepository.findByCrisisId(crisisId, pageable);
  }

  static BigDecimal requirePositiveAmount(BigDecimal amount) {
    if (amount == null || amount.signum() <= 0) {
      throw new InvalidRequestException("Invalid amount", "amount must be greater than 0");
    }
    var stripped = amount.stripTrailingZeros();
    if (stripped.scale() > 2) {
      throw new InvalidRequestException(
          "Invalid amount", "amount must have at most two decimal places");
    }
    return amount.setScale(2);
  }

  private void audit(
      CallerContext caller, String eventType, UUID entityId, UUID crisisId, BigDecimal amount) {
    auditService.log(
        AuditEventBuilder.builder()
            .eventType(eventType)
            .entityType(eventType.substring(eventType.indexOf('.') + 1, eventType.indexOf('_')))
            .entityId(entityId)
            .actor(caller)
            .details(Map.of("crisis_id", crisisId.toString(), "amount", amount.toPlainString()))
            .build());
  }

  /** Totals of a crisis; {@code balance} is donations minus expenses. */
  public record FinanceSummary(BigDecimal donations, BigDecimal expenses, BigDecimal balance) {

    public static FinanceSummary of(BigDecimal donations, BigDecimal expenses) {
      var d = donations != null ? donations : BigDecimal.ZERO;
      var e = expenses != null ? expenses : BigDecimal.ZERO;
      return new FinanceSummary(d, e, d.subtract(e));
    }
  }
}
