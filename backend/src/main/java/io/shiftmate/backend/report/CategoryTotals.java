package io.shiftmate.backend.report;

import java.math.BigDecimal;

/** Hours and amount billed under one rate category. Hours are exact decimals so sums commute. */
public record CategoryTotals(BigDecimal hours, long amount) {

  public static final CategoryTotals ZERO = new CategoryTotals(BigDecimal.ZERO, 0);

  public CategoryTotals plus(BigDecimal moreHours, long moreAmount) {
    return new CategoryTotals(hours.add(moreHours), Math.addExact(amount, moreAmount));
  }

  public CategoryTotals plus(CategoryTotals other) {
    return plus(other.hours, other.amount);
  }
}
