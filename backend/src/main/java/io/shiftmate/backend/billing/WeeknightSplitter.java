package io.shiftmate.backend.billing;

import io.shiftmate.backend.calendar.DayCategory;
import io.shiftmate.backend.shift.ShiftDurationCalculator;
import io.shiftmate.backend.shift.ShiftTimes;
import java.time.LocalTime;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Splits a weekday shift into weekday and weeknight hours around a clock threshold. Hours are
 * measured on the shift's own timeline, so the part of a midnight-crossing shift that runs past
 * midnight counts as weeknight when the shift was already past the threshold.
 */
@Component
public class WeeknightSplitter {

  private final ShiftDurationCalculator durationCalculator;

  public WeeknightSplitter(ShiftDurationCalculator durationCalculator) {
    this.durationCalculator = durationCalculator;
  }

  public double weeknightHours(LocalTime start, LocalTime end, LocalTime threshold) {
    return weeknightMinutes(start, end, threshold) / 60.0;
  }

  private int weeknightMinutes(LocalTime start, LocalTime end, LocalTime threshold) {
    int endMinutes = durationCalculator.endOnTimeline(start, end);
    int from = Math.max(ShiftTimes.minutesOfDay(start), ShiftTimes.minutesOfDay(threshold));
    return Math.max(0, endMinutes - from);
  }

  /**
   * Returns one allocation when the shift lies entirely on one side of the threshold, otherwise a
   * weekday allocation followed by a weeknight allocation. Both parts are whole minutes.
   */
  public List<HourAllocation> split(LocalTime start, LocalTime end, LocalTime threshold) {
    int totalMinutes = durationCalculator.minutes(start, end);
    double totalHours = totalMinutes / 60.0;
    int weeknightMinutes = weeknightMinutes(start, end, threshold);
    if (weeknightMinutes <= 0) {
      return List.of(new HourAllocation(DayCategory.WEEKDAY, totalHours));
    }
    if (weeknightMinutes >= totalMinutes) {
      return List.of(new HourAllocation(DayCategory.WEEKNIGHT, totalHours));
    }
    return List.of(
        new HourAllocation(DayCategory.WEEKDAY, (totalMinutes - weeknightMinutes) / 60.0),
        new HourAllocation(DayCategory.WEEKNIGHT, weeknightMinutes / 60.0));
  }
}
