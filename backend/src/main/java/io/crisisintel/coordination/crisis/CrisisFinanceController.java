package io.crisisintel.coordination.crisis;

import io.crisisintel.coordination.common.PageRequests;
import io.crisisintel.coordination.common.PagedResponse;
import io.crisisintel.coordination.crisis.CrisisFinanceService.FinanceSummary;
import io.crisisintel.coordination.security.CallerContext;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/crises/{crisisId}")
public class CrisisFinanceController {

  private final CrisisFinanceService financeService;
  private final PageRequests pageRequests;

  public CrisisFinanceController(CrisisFinanceService financeService, PageRequests pageRequests) {
    this.financeService = financeService;
    this.pageRequests = pageRequests;
  }

  @PostMapping("/donations")
  public ResponseEntity<DonationResponse> addDonation(
      CallerContext caller,
      @PathVariable UUID crisisId,
      @Valid @RequestBody DonationRequest request) {
    var donation =
        financeService.addDonation(caller, crisisId, request.amount(), request.note());
    return ResponseEntity.status(201).body(DonationResponse.from(donation));
  }

  @GetMapping("/donations")
  public ResponseEntity<PagedResponse<DonationResponse>> listDonations(
      @PathVariable UUID crisisId,
      @RequestParam(required = false) Integer page,
      @RequestParam(name = "page_size", required = false) Integer pageSize) {
    var donations =
        financeService.listDonations(crisisId, pageRequests.newestFirst(page, pageSize));
    return ResponseEntity.ok(PagedResponse.from(donations, DonationResponse::from));
  }

  @PostMapping("/expenses")
  public ResponseEntity<ExpenseResponse> addExpense(
      CallerContext caller,
      @PathVariable UUID crisisId,
      @Valid @RequestBody ExpenseRequest request) {
    var expense =
        financeService.addExpense(caller, crisisId, request.amount(), request.purpose());
    return ResponseEntity.status(201).body(ExpenseResponse.from(expense));
  }

  @GetMapping("/expenses")
  public ResponseEntity<PagedResponse<ExpenseResponse>> listExpenses(
      CallerContext caller,
      @PathVariable UUID crisisId,
      @RequestParam(required = false) Integer page,
      @RequestParam(name = "page_size", required = false) Integer pageSize) {
    var expenses =
        financeService.listExpenses(caller, crisisId, pageRequests.newestFirst(page, pageSize));
    return ResponseEntity.ok(PagedResponse.from(expenses, ExpenseResponse::from));
  }

  @GetMapping("/finance")
  public ResponseEntity<FinanceSummary> getFinanceSummary(@PathVariable UUID crisisId) {
    return ResponseEntity.ok(financeService.summary(crisisId));
  }

  // --- DTOs ---

  public record DonationRequest(
      @NotNull(message = "amount is required") BigDecimal amount,
      @Size(max = 500, message = "note must be at most 500 characters") String note) {}

  public record ExpenseRequest(
      @NotNull(message = "amount is required") BigDecimal amount,
      @NotBlank(message = "purpose is required")
          @Size(max = 500, message = "purpose must be at most 500 characters")
          String purpose) {}

  public record DonationResponse(
      UUID id, UUID crisisId, UUID userId, BigDecimal amount, String note, Instant createdAt) {

    public static DonationResponse from(CrisisDonation donation) {
      return new DonationResponse(
          donation.getId(),
          donation.getCrisisId(),
          donation.getUserId(),
          donation.getAmount(),
          donation.getNote(),
          donation.getCreatedAt());
    }
  }

  public record ExpenseResponse(
      UUID id, UUID crisisId, UUID userId, BigDecimal amount, String purpose, Instant createdAt) {

    public static ExpenseResponse from(CrisisExpense expense) {
      return new ExpenseResponse(
          expense.getId(),
          expense.getCrisisId(),
          expense.getUserId(),
          expense.getAmount(),
          expense.getPurpose(),
          expense.getCreatedAt());
    }
  }
}
