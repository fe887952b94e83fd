package io.shiftmate.backend.calendar;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Classifies a calendar date for billing. Public holidays take precedence over the day of week, so
 * a holiday falling on a Saturday bills as {@link DayCategory#HOLIDAY}. Time of day is not
 * considered; {@link DayCategory#WEEKNIGHT} is never returned here.
 */
@Component
public class DayTypeClassifier {

  public DayCategory classify(LocalDate date, Set<LocalDate> holidays) {
    if (holidays.contains(date)) {
      return DayCategory.HOLIDAY;
    }
    DayOfWeek dayOfWeek = date.getDayOfWeek();
    if (dayOfWeek == DayOfWeek.SUNDAY) {
      return DayCategory.SUNDAY;
    }
    if (dayOfWeek == DayOfWeek.SATURDAY) {
      return DayCategory.SATURDAY;
    }
    return DayCategory.WEEKDAY;
  }
}
