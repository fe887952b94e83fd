package io.shiftmate.backend.report;

import io.shiftmate.backend.calendar.DayCategory;
import io.shiftmate.backend.employeerate.EmployeeRates;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/** An employee's own view of what they earned over a period at their flat rates. */
public record EarningsStatement(
    Long userId,
    LocalDate periodStart,
    LocalDate periodEnd,
    String currency,
    BigDecimal totalHours,
    long totalEarnings,
    List<EarningsLine> breakdown,
    int failedShifts) {

  public record EarningsLine(DayCategory category, BigDecimal hours, long rate, long earnings) {}

  /** Lists only the categories with worked hours, in {@link DayCategory} order. */
  public static EarningsStatement from(PeriodReport report, EmployeeRates rates) {
    var summary = report.summary();
    var breakdown = new ArrayList<EarningsLine>();
    for (DayCategory category : DayCategory.values()) {
      var totals = summary.totalsFor(category);
      if (totals.hours().signum() > 0) {
        breakdown.add(
            new EarningsLine(category, totals.hours(), rates.rateFor(category), totals.amount()));
      }
    }
    return new EarningsStatement(
        report.userId(),
        report.periodStart(),
        report.periodEnd(),
        rates.currency(),
        summary.totalHours(),
        summary.totalAmount(),
        List.copyOf(breakdown),
        report.failures().size());
  }
}
