package io.shiftmate.backend.billing;

import java.time.LocalDate;
import java.util.List;

/**
 * Billing result of a single shift.
 *
 * <p>{@code totalHours} is the worked duration. It equals the sum of the line hours unless the rate
 * card ran out of bounded tiers, in which case the remainder is reported as {@code unbilledHours}.
 * {@code dayType} is a category label, or {@code "weekday/weeknight"} for a shift split across the
 * weeknight threshold.
 */
public record ShiftBilling(
    Long shiftId,
    double totalHours,
    double unbilledHours,
    long totalAmount,
    LocalDate date,
    String dayType,
    String shiftType,
    List<BillingTier> billing) {}
