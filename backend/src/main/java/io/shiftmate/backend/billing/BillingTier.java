package io.shiftmate.backend.billing;

import io.shiftmate.backend.calendar.DayCategory;
import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * One priced line of a shift's billing. {@code category} records which rate category the hours were
 * priced under, so aggregation never has to infer it from the rate.
 *
 * @param tier 1-based position of the line within the shift
 * @param category rate category of the hours
 * @param rate cents per hour
 * @param hours hours priced on this line
 * @param subtotal {@code hours * rate} rounded half away from zero to whole cents
 */
public record BillingTier(int tier, DayCategory category, long rate, double hours, long subtotal) {

  public static BillingTier of(int tier, DayCategory category, long rate, double hours) {
    return new BillingTier(tier, category, rate, hours, subtotal(hours, rate));
  }

  public static long subtotal(double hours, long rate) {
    return BigDecimal.valueOf(hours)
        .multiply(BigDecimal.valueOf(rate))
        .setScale(0, RoundingMode.HALF_UP)
        .longValueExact();
  }

  public BillingTier renumbered(int newTier) {
    return new BillingTier(newTier, category, rate, hours, subtotal);
  }
}
