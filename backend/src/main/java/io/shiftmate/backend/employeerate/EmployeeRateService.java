package io.shiftmate.backend.employeerate;

import io.shiftmate.backend.billing.BillingProperties;
import io.shiftmate.backend.exception.InvalidStateException;
import io.shiftmate.backend.exception.ResourceNotFoundException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class EmployeeRateService {

  private static final Logger log = LoggerFactory.getLogger(EmployeeRateService.class);

  private final EmployeeRateRepository employeeRateRepository;
  private final BillingProperties billingProperties;

  public EmployeeRateService(
      EmployeeRateRepository employeeRateRepository, BillingProperties billingProperties) {
    this.employeeRateRepository = employeeRateRepository;
    this.billingProperties = billingProperties;
  }

  @Transactional(readOnly = true)
  public Optional<EmployeeRate> findRate(Long userId) {
    return employeeRateRepository.findFirstByUserIdOrderByIdDesc(userId);
  }

  /**
   * Returns the rates used to bill a user's shifts. A user without a rate row is billed at zero in
   * every category, in the default currency.
   */
  @Transactional(readOnly = true)
  public EmployeeRates ratesFor(Long userId) {
    return findRate(userId)
        .map(EmployeeRate::toRates)
        .orElseGet(
            () -> {
              log.debug("No employee rate for user {}; billing at zero", userId);
              return EmployeeRates.none(billingProperties.defaultCurrency());
            });
  }

  @Transactional
  public EmployeeRate upsertRate(Long userId, Long companyId, EmployeeRates rates) {
    validateRates(rates);
    var existing = employeeRateRepository.findFirstByUserIdOrderByIdDesc(userId);
    EmployeeRate saved;
    if (existing.isPresent()) {
      var rate = existing.get();
      rate.update(companyId, rates);
      saved = employeeRateRepository.save(rate);
      log.info("Updated employee rate {} for user {}", saved.getId(), userId);
    } else {
      saved = employeeRateRepository.save(new EmployeeRate(userId, companyId, rates));
      log.info("Created employee rate {} for user {}", saved.getId(), userId);
    }
    return saved;
  }

  @Transactional
  public void deleteRate(Long userId) {
    var rate =
        employeeRateRepository
            .findFirstByUserIdOrderByIdDesc(userId)
            .orElseThrow(() -> new ResourceNotFoundException("EmployeeRate", userId));
    employeeRateRepository.delete(rate);
    log.info("Deleted employee rate {} for user {}", rate.getId(), userId);
  }

  private void validateRates(EmployeeRates rates) {
    if (rates.weekdayRate() < 0
        || rates.weeknightRate() < 0
        || rates.saturdayRate() < 0
        || rates.sundayRate() < 0
        || rates.publicHolidayRate() < 0) {
      throw new InvalidStateException("Invalid employee rate", "Rates must not be negative");
    }
  }
}
