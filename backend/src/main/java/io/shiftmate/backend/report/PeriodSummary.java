package io.shiftmate.backend.report;

import io.shiftmate.backend.billing.BillingTier;
import io.shiftmate.backend.billing.ShiftBilling;
import io.shiftmate.backend.calendar.DayCategory;
import java.math.BigDecimal;
import java.util.Collection;

/**
 * Per-category totals over a set of billed shifts. Every line is bucketed by its own category tag,
 * so a split weekday shift contributes to both the weekday and weeknight buckets.
 *
 * <p>{@link #add} and {@link #merge} are associative and commutative: the summary of a set of
 * shifts does not depend on the order they were billed in.
 */
public record PeriodSummary(
    CategoryTotals weekday,
    CategoryTotals weeknight,
    CategoryTotals saturday,
    CategoryTotals sunday,
    CategoryTotals publicHoliday,
    BigDecimal totalHours,
    BigDecimal unbilledHours,
    long totalAmount,
    int shiftCount) {

  public static PeriodSummary empty() {
    return new PeriodSummary(
        CategoryTotals.ZERO,
        CategoryTotals.ZERO,
        CategoryTotals.ZERO,
        CategoryTotals.ZERO,
        CategoryTotals.ZERO,
        BigDecimal.ZERO,
        BigDecimal.ZERO,
        0,
        0);
  }

  public static PeriodSummary of(Collection<ShiftBilling> billings) {
    var summary = empty();
    for (ShiftBilling billing : billings) {
      summary = summary.add(billing);
    }
    return summary;
  }

  public PeriodSummary add(ShiftBilling billing) {
    var weekdayTotals = weekday;
    var weeknightTotals = weeknight;
    var saturdayTotals = saturday;
    var sundayTotals = sunday;
    var holidayTotals = publicHoliday;
    for (BillingTier line : billing.billing()) {
      var hours = BigDecimal.valueOf(line.hours());
      switch (line.category()) {
        case WEEKDAY -> weekdayTotals = weekdayTotals.plus(hours, line.subtotal());
        case WEEKNIGHT -> weeknightTotals = weeknightTotals.plus(hours, line.subtotal());
        case SATURDAY -> saturdayTotals = saturdayTotals.plus(hours, line.subtotal());
        case SUNDAY -> sundayTotals = sundayTotals.plus(hours, line.subtotal());
        case HOLIDAY -> holidayTotals = holidayTotals.plus(hours, line.subtotal());
      }
    }
    return new PeriodSummary(
        weekdayTotals,
        weeknightTotals,
        saturdayTotals,
        sundayTotals,
        holidayTotals,
        totalHours.add(BigDecimal.valueOf(billing.totalHours())),
        unbilledHours.add(BigDecimal.valueOf(billing.unbilledHours())),
        Math.addExact(totalAmount, billing.totalAmount()),
        shiftCount + 1);
  }

  public PeriodSummary merge(PeriodSummary other) {
    return new PeriodSummary(
        weekday.plus(other.weekday),
        weeknight.plus(other.weeknight),
        saturday.plus(other.saturday),
        sunday.plus(other.sunday),
        publicHoliday.plus(other.publicHoliday),
        totalHours.add(other.totalHours),
        unbilledHours.add(other.unbilledHours),
        Math.addExact(totalAmount, other.totalAmount),
        shiftCount + other.shiftCount);
  }

  public CategoryTotals totalsFor(DayCategory category) {
    return switch (category) {
      case WEEKDAY -> weekday;
      case WEEKNIGHT -> weeknight;
      case SATURDAY -> saturday;
      case SUNDAY -> sunday;
      case HOLIDAY -> publicHoliday;
    };
  }
}
