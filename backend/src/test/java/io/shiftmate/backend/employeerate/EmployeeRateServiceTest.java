package io.shiftmate.backend.employeerate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.shiftmate.backend.billing.BillingProperties;
import io.shiftmate.backend.calendar.DayCategory;
import io.shiftmate.backend.exception.InvalidStateException;
import io.shiftmate.backend.exception.ResourceNotFoundException;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class EmployeeRateServiceTest {

  private static final EmployeeRates RATES = new EmployeeRates(3000, 4000, 4500, 5000, 6000, "AUD");

  @Mock private EmployeeRateRepository employeeRateRepository;

  private EmployeeRateService service;

  @BeforeEach
  void setUp() {
    service =
        new EmployeeRateService(
            employeeRateRepository,
            new BillingProperties(2500, "19:00", "NZD", new BillingProperties.Executor(1, 1, 10)));
  }

  @Test
  void ratesForReturnsStoredRates() {
    when(employeeRateRepository.findFirstByUserIdOrderByIdDesc(7L))
        .thenReturn(Optional.of(new EmployeeRate(7L, 1L, RATES)));

    var rates = service.ratesFor(7L);

    assertThat(rates).isEqualTo(RATES);
    assertThat(rates.rateFor(DayCategory.WEEKNIGHT)).isEqualTo(4000);
    assertThat(rates.rateFor(DayCategory.HOLIDAY)).isEqualTo(6000);
  }

  @Test
  void ratesForUnconfiguredUserAreZeroInDefaultCurrency() {
    when(employeeRateRepository.findFirstByUserIdOrderByIdDesc(8L)).thenReturn(Optional.empty());

    var rates = service.ratesFor(8L);

    assertThat(rates).isEqualTo(EmployeeRates.none("NZD"));
    for (DayCategory category : DayCategory.values()) {
      assertThat(rates.rateFor(category)).isZero();
    }
  }

  @Test
  void upsertCreatesRateWhenNoneExists() {
    when(employeeRateRepository.findFirstByUserIdOrderByIdDesc(7L)).thenReturn(Optional.empty());
    when(employeeRateRepository.save(any(EmployeeRate.class)))
        .thenAnswer(invocation -> invocation.getArgument(0));

    var saved = service.upsertRate(7L, 1L, RATES);

    assertThat(saved.getUserId()).isEqualTo(7L);
    assertThat(saved.toRates()).isEqualTo(RATES);
  }

  @Test
  void upsertUpdatesExistingRate() {
    var existing = new EmployeeRate(7L, 1L, EmployeeRates.none("AUD"));
    when(employeeRateRepository.findFirstByUserIdOrderByIdDesc(7L))
        .thenReturn(Optional.of(existing));
    when(employeeRateRepository.save(existing)).thenReturn(existing);

    var saved = service.upsertRate(7L, 2L, RATES);

    assertThat(saved.getCompanyId()).isEqualTo(2L);
    assertThat(existing.getSaturdayRate()).isEqualTo(4500);
    assertThat(existing.getPublicHolidayRate()).isEqualTo(6000);
  }

  @Test
  void upsertRejectsNegativeRates() {
    var negative = new EmployeeRates(3000, -1, 4500, 5000, 6000, "AUD");

    assertThatThrownBy(() -> service.upsertRate(7L, 1L, negative))
        .isInstanceOf(InvalidStateException.class);
    verify(employeeRateRepository, never()).save(any());
  }

  @Test
  void deleteThrowsWhenUserHasNoRate() {
    when(employeeRateRepository.findFirstByUserIdOrderByIdDesc(9L)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.deleteRate(9L))
        .isInstanceOf(ResourceNotFoundException.class);
  }
}
