package com.orderdesk.querysupport.aggregation;

import java.time.LocalDate;
import java.util.Locale;

/** Calendar bucket used to group timestamps for revenue reports. */
public enum PeriodUnit {
  DAY,
  WEEK,
  MONTH;

  /** Case-insensitive lookup; a null or blank value means {@link #DAY}. */
  public static PeriodUnit parse(String value) {
    if (value == null || value.isBlank()) {
      return DAY;
    }
    String normalised = value.trim().toUpperCase(Locale.ROOT);
    for (PeriodUnit unit : values()) {
      if (unit.name().equals(normalised)) {
        return unit;
      }
    }
    throw new IllegalArgumentException(
        "Unknown period unit '" + value + "', expected one of day, week, month");
  }

  public PeriodKey keyOf(LocalDate date) {
    switch (this) {
      case DAY:
        return new PeriodKey(this, date.getYear(), date.getDayOfYear());
      case WEEK:
        // Week 1 covers day-of-year 1..7, so the 53rd week is at most two days long.
        return new PeriodKey(this, date.getYear(), (date.getDayOfYear() - 1) / 7 + 1);
      case MONTH:
        return new PeriodKey(this, date.getYear(), date.getMonthValue());
      default:
        throw new IllegalStateException("Unhandled period unit " + this);
    }
  }

  public String lowerCaseName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
