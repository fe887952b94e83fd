package io.shiftmate.backend.shift;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * The slice of a shift the billing engine needs. Built from a stored {@link Shift} or from an
 * ad-hoc request; {@code shiftId} is null for shifts that were never persisted.
 */
public record BillableShift(
    Long shiftId,
    Long userId,
    Long companyId,
    LocalDate date,
    LocalTime startTime,
    LocalTime endTime,
    String shiftType) {

  public static BillableShift from(Shift shift) {
    return new BillableShift(
        shift.getId(),
        shift.getUserId(),
        shift.getCompanyId(),
        shift.getDate(),
        shift.getStartTime(),
        shift.getEndTime(),
        shift.getShiftType());
  }

  /** Parses {@code HH:MM} clock values, failing with a validation error on malformed input. */
  public static BillableShift of(
      Long shiftId,
      Long userId,
      Long companyId,
      LocalDate date,
      String startTime,
      String endTime,
      String shiftType) {
    return new BillableShift(
        shiftId,
        userId,
        companyId,
        date,
        ShiftTimes.parse("startTime", startTime),
        ShiftTimes.parse("endTime", endTime),
        shiftType);
  }
}
