package io.shiftmate.backend.report;

import static org.assertj.core.api.Assertions.assertThat;

import io.shiftmate.backend.billing.BillingTier;
import io.shiftmate.backend.billing.ShiftBilling;
import io.shiftmate.backend.calendar.DayCategory;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;

class PeriodSummaryTest {

  private static final LocalDate MONDAY = LocalDate.of(2025, 10, 6);
  private static final LocalDate SATURDAY = LocalDate.of(2025, 10, 11);

  @Test
  void splitShiftContributesToBothBuckets() {
    var split =
        billing(
            1L,
            MONDAY,
            "weekday/weeknight",
            BillingTier.of(1, DayCategory.WEEKDAY, 3000, 2.0),
            BillingTier.of(2, DayCategory.WEEKNIGHT, 4000, 2.0));

    var summary = PeriodSummary.empty().add(split);

    assertThat(summary.weekday().hours()).isEqualByComparingTo("2");
    assertThat(summary.weekday().amount()).isEqualTo(6000);
    assertThat(summary.weeknight().hours()).isEqualByComparingTo("2");
    assertThat(summary.weeknight().amount()).isEqualTo(8000);
    assertThat(summary.totalHours()).isEqualByComparingTo("4");
    assertThat(summary.totalAmount()).isEqualTo(14000);
    assertThat(summary.shiftCount()).isEqualTo(1);
  }

  @Test
  void linesAreBucketedByTheirCategoryNotTheirRate() {
    // same rate on two categories must still land in two buckets
    var weekday = billing(1L, MONDAY, "weekday", BillingTier.of(1, DayCategory.WEEKDAY, 3000, 1.0));
    var saturday =
        billing(2L, SATURDAY, "saturday", BillingTier.of(1, DayCategory.SATURDAY, 3000, 1.0));

    var summary = PeriodSummary.of(List.of(weekday, saturday));

    assertThat(summary.totalsFor(DayCategory.WEEKDAY).amount()).isEqualTo(3000);
    assertThat(summary.totalsFor(DayCategory.SATURDAY).amount()).isEqualTo(3000);
    assertThat(summary.totalsFor(DayCategory.SUNDAY)).isEqualTo(CategoryTotals.ZERO);
  }

  @Test
  void summaryDoesNotDependOnBillingOrder() {
    var billings = new ArrayList<ShiftBilling>();
    double[] hours = {0.1, 0.2, 0.3, 7.75, 1.0 / 3.0, 2.5, 0.7};
    DayCategory[] categories = DayCategory.values();
    for (int i = 0; i < hours.length; i++) {
      var category = categories[i % categories.length];
      var line = BillingTier.of(1, category, 2700, hours[i]);
      billings.add(billing((long) i, MONDAY.plusDays(i), category.label(), line));
    }
    var expected = PeriodSummary.of(billings);

    var random = new Random(42);
    for (int round = 0; round < 20; round++) {
      var shuffled = new ArrayList<>(billings);
      Collections.shuffle(shuffled, random);
      assertThat(PeriodSummary.of(shuffled)).isEqualTo(expected);
    }
  }

  @Test
  void mergeMatchesSingleFold() {
    var a = billing(1L, MONDAY, "weekday", BillingTier.of(1, DayCategory.WEEKDAY, 2500, 8.0));
    var b = billing(2L, SATURDAY, "saturday", BillingTier.of(1, DayCategory.SATURDAY, 3500, 5.5));
    var c = billing(3L, MONDAY, "holiday", BillingTier.of(1, DayCategory.HOLIDAY, 6000, 0.1));

    var merged = PeriodSummary.of(List.of(a, b)).merge(PeriodSummary.of(List.of(c)));

    assertThat(merged).isEqualTo(PeriodSummary.of(List.of(c, a, b)));
  }

  @Test
  void unbilledHoursAreCarriedThrough() {
    var underCovered =
        new ShiftBilling(
            1L,
            8.0,
            2.0,
            16000,
            MONDAY,
            "weekday",
            "standard",
            List.of(
                BillingTier.of(1, DayCategory.WEEKDAY, 2500, 4.0),
                BillingTier.of(2, DayCategory.WEEKDAY, 3000, 2.0)));

    var summary = PeriodSummary.of(List.of(underCovered));

    assertThat(summary.totalHours()).isEqualByComparingTo("8");
    assertThat(summary.unbilledHours()).isEqualByComparingTo("2");
    assertThat(summary.weekday().hours()).isEqualByComparingTo("6");
  }

  @Test
  void dailySummaryGroupsByDate() {
    var morning = billing(1L, MONDAY, "weekday", BillingTier.of(1, DayCategory.WEEKDAY, 2500, 4.0));
    var evening =
        billing(2L, MONDAY, "weeknight", BillingTier.of(1, DayCategory.WEEKNIGHT, 3000, 3.0));
    var weekend =
        billing(3L, SATURDAY, "saturday", BillingTier.of(1, DayCategory.SATURDAY, 3500, 5.0));

    var daily = DailySummary.byDate(List.of(weekend, evening, morning));

    assertThat(daily).extracting(DailySummary::date).containsExactly(MONDAY, SATURDAY);
    assertThat(daily.get(0).shiftCount()).isEqualTo(2);
    assertThat(daily.get(0).totalHours()).isEqualByComparingTo("7");
    assertThat(daily.get(0).totalAmount()).isEqualTo(19000);
    assertThat(daily.get(0).dayTypes()).containsExactly("weekday", "weeknight");
  }

  private static ShiftBilling billing(
      Long shiftId, LocalDate date, String dayType, BillingTier... lines) {
    double hours = 0;
    long amount = 0;
    for (BillingTier line : lines) {
      hours += line.hours();
      amount += line.subtotal();
    }
    return new ShiftBilling(shiftId, hours, 0, amount, date, dayType, "standard", List.of(lines));
  }
}
