package io.shiftmate.backend.billing;

import io.shiftmate.backend.calendar.DayCategory;
import io.shiftmate.backend.ratetier.RateTier;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Consumes a shift's hours against an ordered rate card. Each tier takes up to its hour limit, an
 * unlimited tier takes everything left and ends the card. When the bounded tiers run out before the
 * hours do, the remainder is left unbilled. An empty card bills every hour at the fallback rate.
 */
@Component
public class TieredBillingCalculator {

  private final BillingProperties billingProperties;

  public TieredBillingCalculator(BillingProperties billingProperties) {
    this.billingProperties = billingProperties;
  }

  public List<BillingTier> calculate(
      double totalHours, List<RateTier> tiers, DayCategory category) {
    if (tiers.isEmpty()) {
      return List.of(BillingTier.of(1, category, billingProperties.fallbackRate(), totalHours));
    }

    var lines = new ArrayList<BillingTier>();
    double remainingHours = totalHours;
    for (RateTier tier : tiers) {
      if (remainingHours <= 0) {
        break;
      }
      double tierHours =
          tier.isUnlimited()
              ? remainingHours
              : Math.min(remainingHours, tier.getHoursInTier().doubleValue());
      lines.add(BillingTier.of(tier.getTierOrder(), category, tier.getRatePerHour(), tierHours));
      remainingHours -= tierHours;

      if (tier.isUnlimited()) {
        break;
      }
    }
    return List.copyOf(lines);
  }
}
