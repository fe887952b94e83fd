package io.shiftmate.backend.report;

import io.shiftmate.backend.billing.BillingMode;
import java.time.LocalDate;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/billing")
public class ReportController {

  private final BillingReportService billingReportService;

  public ReportController(BillingReportService billingReportService) {
    this.billingReportService = billingReportService;
  }

  @GetMapping("/employee-report")
  public ResponseEntity<PeriodReport> employeeReport(
      @RequestParam Long employeeId,
      @RequestParam(required = false) Long companyId,
      @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
      @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
      @RequestParam(defaultValue = "EMPLOYEE_RATE") BillingMode mode) {
    return ResponseEntity.ok(
        billingReportService.employeeReport(employeeId, companyId, startDate, endDate, mode));
  }

  @GetMapping("/earnings")
  public ResponseEntity<EarningsStatement> earnings(
      @RequestParam Long userId,
      @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
      @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {
    return ResponseEntity.ok(billingReportService.earnings(userId, startDate, endDate));
  }
}
