package io.shiftmate.backend.shift;

import io.shiftmate.backend.exception.ValidationException;
import java.time.LocalTime;
import org.springframework.stereotype.Component;

/**
 * Elapsed time of a shift given its wall-clock start and end. An end at or before the start means
 * the shift runs past midnight into the next day.
 */
@Component
public class ShiftDurationCalculator {

  public static final int MINUTES_PER_DAY = 24 * 60;

  public double hours(String startTime, String endTime) {
    return hours(ShiftTimes.parse("startTime", startTime), ShiftTimes.parse("endTime", endTime));
  }

  public double hours(LocalTime start, LocalTime end) {
    return minutes(start, end) / 60.0;
  }

  public int minutes(LocalTime start, LocalTime end) {
    return endOnTimeline(start, end) - ShiftTimes.minutesOfDay(start);
  }

  /**
   * Minute offset of the shift end from the start day's midnight, so that it always lies after the
   * start. Zero-length shifts are rejected rather than read as a full 24 hours.
   */
  public int endOnTimeline(LocalTime start, LocalTime end) {
    int startMinutes = ShiftTimes.minutesOfDay(start);
    int endMinutes = ShiftTimes.minutesOfDay(end);
    if (startMinutes == endMinutes) {
      throw new ValidationException(
          "endTime",
          "Shift starts and ends at "
              + ShiftTimes.format(start)
              + "; zero-length shifts cannot be billed");
    }
    if (endMinutes < startMinutes) {
      endMinutes += MINUTES_PER_DAY;
    }
    return endMinutes;
  }
}
