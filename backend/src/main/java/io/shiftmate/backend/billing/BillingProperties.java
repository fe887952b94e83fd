package io.shiftmate.backend.billing;

import io.shiftmate.backend.shift.ShiftTimes;
import java.time.LocalTime;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Configuration properties for the shift-billing engine.
 *
 * @param fallbackRate rate in cents per hour applied when no rate tiers match a shift
 * @param weeknightThreshold clock time ({@code HH:MM}) from which weekday hours bill as weeknight
 * @param defaultCurrency ISO 4217 code reported when an employee has no configured rate
 * @param executor sizing of the pool that bills shifts of a report in parallel
 */
@ConfigurationProperties(prefix = "shiftmate.billing")
public record BillingProperties(
    @DefaultValue("2500") long fallbackRate,
    @DefaultValue("19:00") String weeknightThreshold,
    @DefaultValue("AUD") String defaultCurrency,
    @DefaultValue Executor executor) {

  public LocalTime weeknightThresholdTime() {
    return ShiftTimes.parse("weeknightThreshold", weeknightThreshold);
  }

  public record Executor(
      @DefaultValue("4") int corePoolSize,
      @DefaultValue("8") int maxPoolSize,
      @DefaultValue("500") int queueCapacity) {}
}
