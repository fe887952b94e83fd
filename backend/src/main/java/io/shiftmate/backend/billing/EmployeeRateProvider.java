package io.shiftmate.backend.billing;

import io.shiftmate.backend.calendar.DayCategory;
import io.shiftmate.backend.employeerate.EmployeeRates;
import io.shiftmate.backend.shift.BillableShift;
import java.util.List;

/** Prices every hour of a category at the employee's flat rate for that category. */
public class EmployeeRateProvider implements RateProvider {

  private final EmployeeRates rates;

  public EmployeeRateProvider(EmployeeRates rates) {
    this.rates = rates;
  }

  @Override
  public BillingMode mode() {
    return BillingMode.EMPLOYEE_RATE;
  }

  @Override
  public boolean splitsWeeknights() {
    return true;
  }

  @Override
  public List<BillingTier> allocate(BillableShift shift, DayCategory category, double hours) {
    return List.of(BillingTier.of(1, category, rates.rateFor(category), hours));
  }

  public EmployeeRates rates() {
    return rates;
  }
}
