package io.shiftmate.backend.shift;

import io.shiftmate.backend.exception.ValidationException;
import java.time.LocalTime;
import java.util.regex.Pattern;

/** Parses wall-clock {@code HH:MM} values. A trailing {@code :SS} part is accepted and dropped. */
public final class ShiftTimes {

  private static final Pattern CLOCK_TIME =
      Pattern.compile("^([01]\\d|2[0-3]):([0-5]\\d)(?::[0-5]\\d)?$");

  private ShiftTimes() {}

  public static LocalTime parse(String field, String value) {
    if (value == null || value.isBlank()) {
      throw new ValidationException(field, field + " is required");
    }
    var matcher = CLOCK_TIME.matcher(value.trim());
    if (!matcher.matches()) {
      throw new ValidationException(
          field, "'" + value + "' is not a valid 24-hour HH:MM time");
    }
    return LocalTime.of(Integer.parseInt(matcher.group(1)), Integer.parseInt(matcher.group(2)));
  }

  public static int minutesOfDay(LocalTime time) {
    return time.getHour() * 60 + time.getMinute();
  }

  public static String format(LocalTime time) {
    return String.format("%02d:%02d", time.getHour(), time.getMinute());
  }
}
