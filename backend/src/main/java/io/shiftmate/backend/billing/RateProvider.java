package io.shiftmate.backend.billing;

import io.shiftmate.backend.calendar.DayCategory;
import io.shiftmate.backend.shift.BillableShift;
import java.util.List;

/**
 * Prices hours of a shift that fall in one rate category. Implementations must be safe to call from
 * several billing threads at once.
 */
public interface RateProvider {

  BillingMode mode();

  /** Whether weekday shifts are split into weekday and weeknight hours before pricing. */
  boolean splitsWeeknights();

  List<BillingTier> allocate(BillableShift shift, DayCategory category, double hours);
}
