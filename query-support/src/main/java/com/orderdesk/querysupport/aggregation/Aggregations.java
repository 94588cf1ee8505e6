package com.orderdesk.querysupport.aggregation;

import org.jetbrains.annotations.NotNull;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.function.ToIntFunction;
import java.util.function.ToLongFunction;

/**
 * Reductions used by the statistics endpoints. Every reduction over an empty input yields zero
 * rather than null, and every ranking is deterministic.
 */
public final class Aggregations {

  public static final int MONEY_SCALE = 2;

  private Aggregations() {}

  /**
   * Groups items by a category, skipping blank categories, and returns the largest groups first.
   * Groups with the same size are ordered by category name.
   */
  public static <T> List<CountByCategory> countByCategory(
      Collection<T> items, Function<? super T, String> categoryOf, int limit) {
    requireLimit(limit);
    Map<String, Long> counts = new TreeMap<>();
    for (T item : items) {
      String category = categoryOf.apply(item);
      if (category == null || category.isBlank()) {
        continue;
      }
      counts.merge(category, 1L, Long::sum);
    }
    return counts.entrySet().stream()
        .map(e -> new CountByCategory(e.getKey(), e.getValue()))
        .sorted(
            Comparator.comparingLong(CountByCategory::getCount)
                .reversed()
                .thenComparing(CountByCategory::getCategory))
        .limit(limit)
        .toList();
  }

  public static <T> BigDecimal sum(Collection<T> items, Function<? super T, BigDecimal> valueOf) {
    BigDecimal total = BigDecimal.ZERO;
    for (T item : items) {
      BigDecimal value = valueOf.apply(item);
      if (value != null) {
        total = total.add(value);
      }
    }
    return total;
  }

  public static <T> long sumLong(Collection<T> items, ToLongFunction<? super T> valueOf) {
    long total = 0;
    for (T item : items) {
      total += valueOf.applyAsLong(item);
    }
    return total;
  }

  /** Arithmetic mean rounded half-up to cents; zero for an empty collection. */
  public static <T> BigDecimal average(
      Collection<T> items, Function<? super T, BigDecimal> valueOf) {
    if (items.isEmpty()) {
      return BigDecimal.ZERO;
    }
    return ratio(sum(items, valueOf), items.size());
  }

  /** {@code total / count} rounded half-up to cents; zero when count is zero. */
  public static BigDecimal ratio(BigDecimal total, long count) {
    if (count <= 0) {
      return BigDecimal.ZERO;
    }
    return total.divide(BigDecimal.valueOf(count), MONEY_SCALE, RoundingMode.HALF_UP);
  }

  /** Mean of an integer attribute rounded to two decimals; 0.0 for an empty collection. */
  public static <T> double averageOf(Collection<T> items, ToIntFunction<? super T> valueOf) {
    if (items.isEmpty()) {
      return 0.0;
    }
    long total = 0;
    for (T item : items) {
      total += valueOf.applyAsInt(item);
    }
    return ratio(total, items.size());
  }

  public static double ratio(long total, long count) {
    if (count <= 0) {
      return 0.0;
    }
    return BigDecimal.valueOf(total)
        .divide(BigDecimal.valueOf(count), MONEY_SCALE, RoundingMode.HALF_UP)
        .doubleValue();
  }

  /**
   * Top {@code n} items by a metric, highest first. Equal metrics fall back to the id in ascending
   * order so repeated calls over the same data return the same ranking.
   */
  public static <T, M extends Comparable<? super M>> List<T> topN(
      Collection<T> items, Function<? super T, M> metric, ToLongFunction<? super T> idOf, int n) {
    requireLimit(n);
    return items.stream().sorted(rankingOrder(metric, idOf)).limit(n).toList();
  }

  @NotNull
  private static <T, M extends Comparable<? super M>> Comparator<T> rankingOrder(
      Function<? super T, M> metric, ToLongFunction<? super T> idOf) {
    Comparator<T> byMetricDesc =
        Comparator.<T, M>comparing(metric, Comparator.nullsFirst(Comparator.<M>naturalOrder()))
            .reversed();
    return byMetricDesc.thenComparingLong(idOf);
  }

  private static void requireLimit(int limit) {
    if (limit < 0) {
      throw new IllegalArgumentException("limit must not be negative: " + limit);
    }
  }
}
