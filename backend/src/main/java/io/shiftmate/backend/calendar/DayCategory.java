package io.shiftmate.backend.calendar;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.Optional;

/**
 * Rate category of billed hours. {@link #label()} is the value stored in {@code
 * rate_tiers.day_type} and written to billing output. {@link #summaryKey()} names the matching
 * period-summary bucket.
 */
public enum DayCategory {
  WEEKDAY("weekday", "weekday"),
  WEEKNIGHT("weeknight", "weeknight"),
  SATURDAY("saturday", "saturday"),
  SUNDAY("sunday", "sunday"),
  HOLIDAY("holiday", "publicHoliday");

  private final String label;
  private final String summaryKey;

  DayCategory(String label, String summaryKey) {
    this.label = label;
    this.summaryKey = summaryKey;
  }

  @JsonValue
  public String label() {
    return label;
  }

  public String summaryKey() {
    return summaryKey;
  }

  public static Optional<DayCategory> fromLabel(String label) {
    return Arrays.stream(values()).filter(c -> c.label.equalsIgnoreCase(label)).findFirst();
  }
}
