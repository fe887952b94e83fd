package io.shiftmate.backend.billing;

import io.shiftmate.backend.calendar.DayCategory;

/** Hours of a shift assigned to one rate category before pricing. */
public record HourAllocation(DayCategory category, double hours) {}
