package com.orderdesk.querysupport.aggregation;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.time.LocalDate;

/**
 * A single calendar bucket, ordered by year and then by its index within the year (day of year,
 * week number or month).
 */
@Getter
@EqualsAndHashCode
public final class PeriodKey implements Comparable<PeriodKey> {
  private final PeriodUnit unit;
  private final int year;
  private final int index;

  PeriodKey(PeriodUnit unit, int year, int index) {
    this.unit = unit;
    this.year = year;
    this.index = index;
  }

  public String label() {
    switch (unit) {
      case DAY:
        return LocalDate.ofYearDay(year, index).toString();
      case WEEK:
        return String.format("%d-W%02d", year, index);
      case MONTH:
        return String.format("%d-%02d", year, index);
      default:
        throw new IllegalStateException("Unhandled period unit " + unit);
    }
  }

  @Override
  public int compareTo(PeriodKey other) {
    if (unit != other.unit) {
      throw new IllegalArgumentException("Cannot compare " + unit + " with " + other.unit);
    }
    int byYear = Integer.compare(year, other.year);
    return byYear != 0 ? byYear : Integer.compare(index, other.index);
  }

  @Override
  public String toString() {
    return label();
  }
}
