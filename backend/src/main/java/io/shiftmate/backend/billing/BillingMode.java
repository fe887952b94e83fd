package io.shiftmate.backend.billing;

/** Which rate system prices a shift. */
public enum BillingMode {
  /** Company-wide tiered rate cards, no weeknight split. */
  TIERED,
  /** The employee's flat per-category rates. Weekday hours are split at the weeknight threshold. */
  EMPLOYEE_RATE
}
