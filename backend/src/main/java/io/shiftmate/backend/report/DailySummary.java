package io.shiftmate.backend.report;

import io.shiftmate.backend.billing.ShiftBilling;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/** Roll-up of all billed shifts on one date. */
public record DailySummary(
    LocalDate date,
    BigDecimal totalHours,
    long totalAmount,
    List<String> dayTypes,
    int shiftCount) {

  /** Groups billings by date, earliest first. Day type labels are listed alphabetically. */
  public static List<DailySummary> byDate(Collection<ShiftBilling> billings) {
    Map<LocalDate, List<ShiftBilling>> grouped = new TreeMap<>();
    for (ShiftBilling billing : billings) {
      grouped.computeIfAbsent(billing.date(), d -> new ArrayList<>()).add(billing);
    }
    var result = new ArrayList<DailySummary>(grouped.size());
    grouped.forEach((date, shifts) -> result.add(summarize(date, shifts)));
    return List.copyOf(result);
  }

  private static DailySummary summarize(LocalDate date, List<ShiftBilling> shifts) {
    var hours = BigDecimal.ZERO;
    long amount = 0;
    var dayTypes = new TreeSet<String>();
    for (ShiftBilling shift : shifts) {
      hours = hours.add(BigDecimal.valueOf(shift.totalHours()));
      amount = Math.addExact(amount, shift.totalAmount());
      dayTypes.add(shift.dayType());
    }
    return new DailySummary(date, hours, amount, List.copyOf(dayTypes), shifts.size());
  }
}
