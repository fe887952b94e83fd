package io.shiftmate.backend.report;

import java.time.LocalDate;

/** A shift that could not be billed within a batch, with the reason it failed. */
public record ShiftBillingFailure(Long shiftId, LocalDate date, String reason) {}
