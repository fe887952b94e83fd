package io.shiftmate.backend.report;

import io.shiftmate.backend.billing.BillingMode;
import io.shiftmate.backend.billing.ShiftBilling;
import java.time.LocalDate;
import java.util.List;

/**
 * Billing of one employee's shifts over a date range. {@code shifts} keeps the order the shifts
 * were loaded in; {@code summary} and {@code daily} cover successfully billed shifts only.
 */
public record PeriodReport(
    Long userId,
    Long companyId,
    BillingMode mode,
    LocalDate periodStart,
    LocalDate periodEnd,
    List<ShiftBilling> shifts,
    List<ShiftBillingFailure> failures,
    PeriodSummary summary,
    List<DailySummary> daily) {}
