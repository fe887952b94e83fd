package io.shiftmate.backend.employeerate;

import io.shiftmate.backend.calendar.DayCategory;

/** Immutable snapshot of an employee's flat rates, safe to share across billing threads. */
public record EmployeeRates(
    long weekdayRate,
    long weeknightRate,
    long saturdayRate,
    long sundayRate,
    long publicHolidayRate,
    String currency) {

  /** Rates of an employee with no configured row: every category pays zero. */
  public static EmployeeRates none(String currency) {
    return new EmployeeRates(0, 0, 0, 0, 0, currency);
  }

  public long rateFor(DayCategory category) {
    return switch (category) {
      case WEEKDAY -> weekdayRate;
      case WEEKNIGHT -> weeknightRate;
      case SATURDAY -> saturdayRate;
      case SUNDAY -> sundayRate;
      case HOLIDAY -> publicHolidayRate;
    };
  }
}
