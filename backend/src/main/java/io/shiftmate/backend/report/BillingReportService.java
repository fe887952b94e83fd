package io.shiftmate.backend.report;

import io.shiftmate.backend.billing.BillingMode;
import io.shiftmate.backend.billing.RateProvider;
import io.shiftmate.backend.billing.RateProviders;
import io.shiftmate.backend.billing.ShiftBilling;
import io.shiftmate.backend.billing.ShiftBillingService;
import io.shiftmate.backend.calendar.PublicHolidayService;
import io.shiftmate.backend.exception.InvalidStateException;
import io.shiftmate.backend.shift.BillableShift;
import io.shiftmate.backend.shift.ShiftRepository;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.ErrorResponseException;

/** Bills every shift of an employee over a date range and aggregates the results. */
@Service
public class BillingReportService {

  private static final Logger log = LoggerFactory.getLogger(BillingReportService.class);

  private final ShiftRepository shiftRepository;
  private final PublicHolidayService publicHolidayService;
  private final ShiftBillingService shiftBillingService;
  private final RateProviders rateProviders;
  private final Executor billingExecutor;

  public BillingReportService(
      ShiftRepository shiftRepository,
      PublicHolidayService publicHolidayService,
      ShiftBillingService shiftBillingService,
      RateProviders rateProviders,
      @Qualifier("billingExecutor") Executor billingExecutor) {
    this.shiftRepository = shiftRepository;
    this.publicHolidayService = publicHolidayService;
    this.shiftBillingService = shiftBillingService;
    this.rateProviders = rateProviders;
    this.billingExecutor = billingExecutor;
  }

  /**
   * Bills the user's shifts dated {@code from..to} inclusive. When {@code companyId} is given only
   * that company's shifts are included. A shift that fails to bill is listed in the report's
   * failures and left out of the totals; the other shifts are still billed.
   */
  public PeriodReport employeeReport(
      Long userId, Long companyId, LocalDate from, LocalDate to, BillingMode mode) {
    validateRange(from, to);
    return buildReport(userId, companyId, from, to, rateProviders.forMode(mode, userId));
  }

  /** Earnings at the user's flat employee rates, across all companies. */
  public EarningsStatement earnings(Long userId, LocalDate from, LocalDate to) {
    validateRange(from, to);
    var provider = rateProviders.forEmployee(userId);
    var report = buildReport(userId, null, from, to, provider);
    return EarningsStatement.from(report, provider.rates());
  }

  private PeriodReport buildReport(
      Long userId, Long companyId, LocalDate from, LocalDate to, RateProvider provider) {
    var shifts =
        shiftRepository
            .findByUserIdAndDateBetweenOrderByDateAscStartTimeAsc(userId, from, to)
            .stream()
            .filter(s -> companyId == null || companyId.equals(s.getCompanyId()))
            .map(BillableShift::from)
            .toList();
    var holidays = publicHolidayService.holidayDates();

    var outcomes = billAll(shifts, provider, holidays);
    var billings = new ArrayList<ShiftBilling>();
    var failures = new ArrayList<ShiftBillingFailure>();
    for (Outcome outcome : outcomes) {
      if (outcome.billing() != null) {
        billings.add(outcome.billing());
      } else {
        failures.add(outcome.failure());
      }
    }

    var summary = PeriodSummary.of(billings);
    log.info(
        "Billed {} of {} shifts for user {} from {} to {} ({}): total {}",
        billings.size(),
        shifts.size(),
        userId,
        from,
        to,
        provider.mode(),
        summary.totalAmount());
    return new PeriodReport(
        userId,
        companyId,
        provider.mode(),
        from,
        to,
        List.copyOf(billings),
        List.copyOf(failures),
        summary,
        DailySummary.byDate(billings));
  }

  /** Fans one billing task per shift out to the billing executor and joins them in input order. */
  List<Outcome> billAll(
      List<BillableShift> shifts, RateProvider provider, Set<LocalDate> holidays) {
    var futures =
        shifts.stream()
            .map(
                shift ->
                    CompletableFuture.supplyAsync(
                            () -> shiftBillingService.bill(shift, provider, holidays),
                            billingExecutor)
                        .handle((billing, ex) -> toOutcome(shift, billing, ex)))
            .toList();
    CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
    return futures.stream().map(CompletableFuture::join).toList();
  }

  private Outcome toOutcome(BillableShift shift, ShiftBilling billing, Throwable ex) {
    if (ex == null) {
      return new Outcome(billing, null);
    }
    var cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
    var reason = reasonOf(cause);
    log.warn("Failed to bill shift {} on {}: {}", shift.shiftId(), shift.date(), reason);
    return new Outcome(null, new ShiftBillingFailure(shift.shiftId(), shift.date(), reason));
  }

  private static String reasonOf(Throwable cause) {
    if (cause instanceof ErrorResponseException problem
        && problem.getBody().getDetail() != null) {
      return problem.getBody().getDetail();
    }
    return Objects.requireNonNullElse(cause.getMessage(), cause.getClass().getSimpleName());
  }

  private static void validateRange(LocalDate from, LocalDate to) {
    if (from.isAfter(to)) {
      throw new InvalidStateException(
          "Invalid date range", "startDate " + from + " is after endDate " + to);
    }
  }

  record Outcome(ShiftBilling billing, ShiftBillingFailure failure) {}
}
