package io.shiftmate.backend.billing;

import io.shiftmate.backend.calendar.DayCategory;
import io.shiftmate.backend.ratetier.RateTierResolver;
import io.shiftmate.backend.shift.BillableShift;
import java.util.List;

/** Prices hours against the company's rate card for the shift's type, day type and date. */
public class TieredRateProvider implements RateProvider {

  private final RateTierResolver rateTierResolver;
  private final TieredBillingCalculator calculator;

  public TieredRateProvider(RateTierResolver rateTierResolver, TieredBillingCalculator calculator) {
    this.rateTierResolver = rateTierResolver;
    this.calculator = calculator;
  }

  @Override
  public BillingMode mode() {
    return BillingMode.TIERED;
  }

  @Override
  public boolean splitsWeeknights() {
    return false;
  }

  @Override
  public List<BillingTier> allocate(BillableShift shift, DayCategory category, double hours) {
    var tiers =
        rateTierResolver.resolve(shift.companyId(), shift.shiftType(), category, shift.date());
    return calculator.calculate(hours, tiers, category);
  }
}
