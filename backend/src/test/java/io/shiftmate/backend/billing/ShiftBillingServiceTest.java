package io.shiftmate.backend.billing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.shiftmate.backend.calendar.DayCategory;
import io.shiftmate.backend.calendar.DayTypeClassifier;
import io.shiftmate.backend.calendar.PublicHolidayService;
import io.shiftmate.backend.employeerate.EmployeeRates;
import io.shiftmate.backend.exception.ResourceNotFoundException;
import io.shiftmate.backend.exception.ValidationException;
import io.shiftmate.backend.ratetier.RateTier;
import io.shiftmate.backend.ratetier.RateTierResolver;
import io.shiftmate.backend.report.PeriodSummary;
import io.shiftmate.backend.shift.BillableShift;
import io.shiftmate.backend.shift.Shift;
import io.shiftmate.backend.shift.ShiftDurationCalculator;
import io.shiftmate.backend.shift.ShiftRepository;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ShiftBillingServiceTest {

  private static final LocalDate MONDAY = LocalDate.of(2025, 10, 6);
  private static final LocalDate FRIDAY = LocalDate.of(2025, 10, 10);
  private static final LocalDate SATURDAY = LocalDate.of(2025, 10, 11);
  private static final EmployeeRates RATES = new EmployeeRates(3000, 4000, 4500, 5000, 6000, "AUD");

  @Mock private RateTierResolver rateTierResolver;
  @Mock private ShiftRepository shiftRepository;
  @Mock private PublicHolidayService publicHolidayService;
  @Mock private RateProviders rateProviders;

  private ShiftBillingService service;
  private RateProvider tiered;
  private RateProvider employee;

  @BeforeEach
  void setUp() {
    var properties =
        new BillingProperties(2500, "19:00", "AUD", new BillingProperties.Executor(1, 1, 10));
    var durationCalculator = new ShiftDurationCalculator();
    service =
        new ShiftBillingService(
            durationCalculator,
            new DayTypeClassifier(),
            new WeeknightSplitter(durationCalculator),
            properties,
            shiftRepository,
            publicHolidayService,
            rateProviders);
    tiered = new TieredRateProvider(rateTierResolver, new TieredBillingCalculator(properties));
    employee = new EmployeeRateProvider(RATES);
  }

  @Test
  void standardWeekdayShiftWithoutTiersBillsAtFallbackRate() {
    when(rateTierResolver.resolve(1L, "standard", DayCategory.WEEKDAY, MONDAY))
        .thenReturn(List.of());

    var billing = service.bill(shift(MONDAY, "09:00", "17:00"), tiered, Set.of());

    assertThat(billing.totalHours()).isEqualTo(8.0);
    assertThat(billing.totalAmount()).isEqualTo(20000);
    assertThat(billing.dayType()).isEqualTo("weekday");
    assertThat(billing.unbilledHours()).isZero();
    assertThat(billing.billing())
        .containsExactly(new BillingTier(1, DayCategory.WEEKDAY, 2500, 8.0, 20000));
  }

  @Test
  void standardWeekdayShiftFillingSingleTier() {
    when(rateTierResolver.resolve(1L, "standard", DayCategory.WEEKDAY, MONDAY))
        .thenReturn(List.of(tier(1, "8", 2500)));

    var billing = service.bill(shift(MONDAY, "09:00", "17:00"), tiered, Set.of());

    assertThat(billing.totalAmount()).isEqualTo(20000);
    assertThat(billing.billing())
        .containsExactly(new BillingTier(1, DayCategory.WEEKDAY, 2500, 8.0, 20000));
  }

  @Test
  void tieredShiftFlowsAcrossTiers() {
    when(rateTierResolver.resolve(1L, "standard", DayCategory.SATURDAY, SATURDAY))
        .thenReturn(List.of(tier(1, "4", 2500), tier(2, null, 3000)));

    var billing = service.bill(shift(SATURDAY, "08:00", "18:00"), tiered, Set.of());

    assertThat(billing.totalHours()).isEqualTo(10.0);
    assertThat(billing.totalAmount()).isEqualTo(28000);
    assertThat(billing.dayType()).isEqualTo("saturday");
    assertThat(billing.billing()).extracting(BillingTier::tier).containsExactly(1, 2);
  }

  @Test
  void tieredModeNeverSplitsWeeknights() {
    when(rateTierResolver.resolve(1L, "standard", DayCategory.WEEKDAY, MONDAY))
        .thenReturn(List.of());

    var billing = service.bill(shift(MONDAY, "17:00", "21:00"), tiered, Set.of());

    assertThat(billing.dayType()).isEqualTo("weekday");
    assertThat(billing.billing()).hasSize(1);
    verify(rateTierResolver, never())
        .resolve(any(), anyString(), eq(DayCategory.WEEKNIGHT), any());
  }

  @Test
  void underCoveredTierCardReportsUnbilledHours() {
    when(rateTierResolver.resolve(1L, "standard", DayCategory.WEEKDAY, MONDAY))
        .thenReturn(List.of(tier(1, "4", 2500), tier(2, "2", 3000)));

    var billing = service.bill(shift(MONDAY, "09:00", "17:00"), tiered, Set.of());

    assertThat(billing.totalHours()).isEqualTo(8.0);
    assertThat(billing.unbilledHours()).isEqualTo(2.0);
    assertThat(billing.totalAmount()).isEqualTo(16000);
  }

  @Test
  void employeeRateSplitsWeekdayShiftAtThreshold() {
    var billing = service.bill(shift(MONDAY, "17:00", "21:00"), employee, Set.of());

    assertThat(billing.dayType()).isEqualTo("weekday/weeknight");
    assertThat(billing.billing())
        .containsExactly(
            new BillingTier(1, DayCategory.WEEKDAY, 3000, 2.0, 6000),
            new BillingTier(2, DayCategory.WEEKNIGHT, 4000, 2.0, 8000));
    assertThat(billing.totalAmount()).isEqualTo(14000);
  }

  @Test
  void splitShiftOffMinuteGridIsFullyBilled() {
    var billing = service.bill(shift(MONDAY, "17:00", "19:19"), employee, Set.of());

    assertThat(billing.totalHours()).isEqualTo(139 / 60.0);
    assertThat(billing.unbilledHours()).isZero();
    assertThat(billing.billing())
        .extracting(BillingTier::category)
        .containsExactly(DayCategory.WEEKDAY, DayCategory.WEEKNIGHT);
    assertThat(PeriodSummary.of(List.of(billing)).unbilledHours())
        .isEqualByComparingTo(BigDecimal.ZERO);
  }

  @Test
  void fractionalTierHoursLeaveNoUnbilledResidue() {
    when(rateTierResolver.resolve(1L, "standard", DayCategory.WEEKDAY, MONDAY))
        .thenReturn(List.of(tier(1, "0.1", 2500), tier(2, null, 3000)));

    var billing = service.bill(shift(MONDAY, "09:00", "09:22"), tiered, Set.of());

    assertThat(billing.billing()).hasSize(2);
    assertThat(billing.unbilledHours()).isZero();
  }

  @Test
  void employeeRateOvernightWeekdayShiftIsAllWeeknight() {
    var billing = service.bill(shift(FRIDAY, "22:00", "02:00"), employee, Set.of());

    assertThat(billing.dayType()).isEqualTo("weeknight");
    assertThat(billing.billing())
        .containsExactly(new BillingTier(1, DayCategory.WEEKNIGHT, 4000, 4.0, 16000));
  }

  @Test
  void employeeRateDoesNotSplitWeekendShifts() {
    var billing = service.bill(shift(SATURDAY, "17:00", "23:00"), employee, Set.of());

    assertThat(billing.dayType()).isEqualTo("saturday");
    assertThat(billing.totalAmount()).isEqualTo(6 * 4500);
  }

  @Test
  void publicHolidayUsesHolidayRateRegardlessOfWeekday() {
    var billing = service.bill(shift(MONDAY, "17:00", "21:00"), employee, Set.of(MONDAY));

    assertThat(billing.dayType()).isEqualTo("holiday");
    assertThat(billing.billing())
        .containsExactly(new BillingTier(1, DayCategory.HOLIDAY, 6000, 4.0, 24000));
  }

  @Test
  void missingEmployeeRateBillsZero() {
    var unrated = new EmployeeRateProvider(EmployeeRates.none("AUD"));

    var billing = service.bill(shift(MONDAY, "09:00", "17:00"), unrated, Set.of());

    assertThat(billing.totalHours()).isEqualTo(8.0);
    assertThat(billing.totalAmount()).isZero();
  }

  @Test
  void zeroLengthShiftIsRejected() {
    assertThatThrownBy(() -> service.bill(shift(MONDAY, "09:00", "09:00"), employee, Set.of()))
        .isInstanceOf(ValidationException.class);
  }

  @Test
  void billStoredShiftLoadsShiftHolidaysAndRates() {
    var stored =
        new Shift(7L, 1L, MONDAY, LocalTime.of(9, 0), LocalTime.of(17, 0), "standard");
    when(shiftRepository.findById(42L)).thenReturn(Optional.of(stored));
    when(rateProviders.forMode(BillingMode.EMPLOYEE_RATE, 7L)).thenReturn(employee);
    when(publicHolidayService.holidayDates()).thenReturn(Set.of());

    var billing = service.billStoredShift(42L, BillingMode.EMPLOYEE_RATE);

    assertThat(billing.totalAmount()).isEqualTo(8 * 3000);
    assertThat(billing.shiftType()).isEqualTo("standard");
  }

  @Test
  void billStoredShiftThrowsWhenShiftMissing() {
    when(shiftRepository.findById(99L)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.billStoredShift(99L, BillingMode.TIERED))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  private static BillableShift shift(LocalDate date, String start, String end) {
    return BillableShift.of(1L, 7L, 1L, date, start, end, "standard");
  }

  private static RateTier tier(int order, String hours, long rate) {
    return new RateTier(
        1L,
        "standard",
        "weekday",
        order,
        hours == null ? null : new BigDecimal(hours),
        rate,
        "AUD",
        null,
        null);
  }
}
