package com.orderdesk.querysupport.aggregation;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.Function;

/** Groups timestamped records into calendar buckets of one {@link PeriodUnit}. */
public final class PeriodBucketer {

  private PeriodBucketer() {}

  /**
   * Buckets are computed from the UTC calendar date of each timestamp and returned in ascending
   * order; periods without records are absent.
   */
  public static <T> SortedMap<PeriodKey, List<T>> group(
      Collection<T> items, Function<? super T, Instant> timestampOf, PeriodUnit unit) {
    SortedMap<PeriodKey, List<T>> buckets = new TreeMap<>();
    for (T item : items) {
      Instant timestamp = timestampOf.apply(item);
      if (timestamp == null) {
        continue;
      }
      PeriodKey key = unit.keyOf(timestamp.atOffset(ZoneOffset.UTC).toLocalDate());
      buckets.computeIfAbsent(key, k -> new ArrayList<>()).add(item);
    }
    return buckets;
  }
}
