package io.shiftmate.backend.billing;

import io.shiftmate.backend.employeerate.EmployeeRateService;
import io.shiftmate.backend.ratetier.RateTierResolver;
import org.springframework.stereotype.Component;

/** Builds the {@link RateProvider} for a billing mode. */
@Component
public class RateProviders {

  private final RateTierResolver rateTierResolver;
  private final TieredBillingCalculator tieredBillingCalculator;
  private final EmployeeRateService employeeRateService;

  public RateProviders(
      RateTierResolver rateTierResolver,
      TieredBillingCalculator tieredBillingCalculator,
      EmployeeRateService employeeRateService) {
    this.rateTierResolver = rateTierResolver;
    this.tieredBillingCalculator = tieredBillingCalculator;
    this.employeeRateService = employeeRateService;
  }

  public RateProvider tiered() {
    return new TieredRateProvider(rateTierResolver, tieredBillingCalculator);
  }

  /** Snapshots the user's rates once; the provider never goes back to the store. */
  public EmployeeRateProvider forEmployee(Long userId) {
    return new EmployeeRateProvider(employeeRateService.ratesFor(userId));
  }

  public RateProvider forMode(BillingMode mode, Long userId) {
    return switch (mode) {
      case TIERED -> tiered();
      case EMPLOYEE_RATE -> forEmployee(userId);
    };
  }
}
