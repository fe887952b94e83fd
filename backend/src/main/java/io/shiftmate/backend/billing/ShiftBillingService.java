package io.shiftmate.backend.billing;

import io.shiftmate.backend.calendar.DayCategory;
import io.shiftmate.backend.calendar.DayTypeClassifier;
import io.shiftmate.backend.calendar.PublicHolidayService;
import io.shiftmate.backend.exception.ResourceNotFoundException;
import io.shiftmate.backend.shift.BillableShift;
import io.shiftmate.backend.shift.ShiftDurationCalculator;
import io.shiftmate.backend.shift.ShiftRepository;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class ShiftBillingService {

  private static final Logger log = LoggerFactory.getLogger(ShiftBillingService.class);

  private final ShiftDurationCalculator durationCalculator;
  private final DayTypeClassifier dayTypeClassifier;
  private final WeeknightSplitter weeknightSplitter;
  private final BillingProperties billingProperties;
  private final ShiftRepository shiftRepository;
  private final PublicHolidayService publicHolidayService;
  private final RateProviders rateProviders;

  public ShiftBillingService(
      ShiftDurationCalculator durationCalculator,
      DayTypeClassifier dayTypeClassifier,
      WeeknightSplitter weeknightSplitter,
      BillingProperties billingProperties,
      ShiftRepository shiftRepository,
      PublicHolidayService publicHolidayService,
      RateProviders rateProviders) {
    this.durationCalculator = durationCalculator;
    this.dayTypeClassifier = dayTypeClassifier;
    this.weeknightSplitter = weeknightSplitter;
    this.billingProperties = billingProperties;
    this.shiftRepository = shiftRepository;
    this.publicHolidayService = publicHolidayService;
    this.rateProviders = rateProviders;
  }

  /**
   * Bills one shift. Pure with respect to its arguments apart from the provider's reference-data
   * reads, so it may run concurrently for many shifts sharing the same holiday set and provider.
   *
   * <ol>
   *   <li>duration, midnight-crossing aware
   *   <li>day type from the calendar date and holiday set
   *   <li>weekday hours split at the weeknight threshold when the provider asks for it
   *   <li>each allocation priced by the provider, lines tagged with their category
   * </ol>
   */
  public ShiftBilling bill(BillableShift shift, RateProvider provider, Set<LocalDate> holidays) {
    double totalHours = durationCalculator.hours(shift.startTime(), shift.endTime());
    DayCategory dayType = dayTypeClassifier.classify(shift.date(), holidays);

    List<HourAllocation> allocations =
        provider.splitsWeeknights() && dayType == DayCategory.WEEKDAY
            ? weeknightSplitter.split(
                shift.startTime(), shift.endTime(), billingProperties.weeknightThresholdTime())
            : List.of(new HourAllocation(dayType, totalHours));

    var lines = new ArrayList<BillingTier>();
    for (HourAllocation allocation : allocations) {
      var priced = provider.allocate(shift, allocation.category(), allocation.hours());
      if (allocations.size() == 1) {
        lines.addAll(priced);
      } else {
        for (BillingTier line : priced) {
          lines.add(line.renumbered(lines.size() + 1));
        }
      }
    }

    double billedHours = lines.stream().mapToDouble(BillingTier::hours).sum();
    long totalAmount = lines.stream().mapToLong(BillingTier::subtotal).sum();
    String dayTypeLabel =
        allocations.stream()
            .map(a -> a.category().label())
            .distinct()
            .collect(Collectors.joining("/"));

    var billing =
        new ShiftBilling(
            shift.shiftId(),
            totalHours,
            unbilledHours(totalHours, billedHours),
            totalAmount,
            shift.date(),
            dayTypeLabel,
            shift.shiftType(),
            List.copyOf(lines));
    log.debug(
        "Billed shift {} on {} as {} ({}): {}h -> {}",
        shift.shiftId(),
        shift.date(),
        dayTypeLabel,
        provider.mode(),
        totalHours,
        totalAmount);
    return billing;
  }

  /** Hours left unpriced, to the nearest minute so that rounding residue never shows up. */
  static double unbilledHours(double totalHours, double billedHours) {
    return Math.max(0, Math.round((totalHours - billedHours) * 60)) / 60.0;
  }

  /** Bills a stored shift, loading the holiday calendar and the mode's rates for it. */
  public ShiftBilling billStoredShift(Long shiftId, BillingMode mode) {
    var shift =
        shiftRepository
            .findById(shiftId)
            .map(BillableShift::from)
            .orElseThrow(() -> new ResourceNotFoundException("Shift", shiftId));
    return billAdHoc(shift, mode);
  }

  public ShiftBilling billAdHoc(BillableShift shift, BillingMode mode) {
    var provider = rateProviders.forMode(mode, shift.userId());
    return bill(shift, provider, publicHolidayService.holidayDates());
  }
}
