package com.orderdesk.querysupport.aggregation;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class AggregationsTests {

    private static final class Sale {
        final long id;
        final String country;
        final BigDecimal amount;
        final int quantity;

        Sale(long id, String country, String amount, int quantity) {
            this.id = id;
            this.country = country;
            this.amount = new BigDecimal(amount);
            this.quantity = quantity;
        }
    }

    private final List<Sale> sales = List.of(
            new Sale(4, "Germany", "10.00", 1),
            new Sale(2, "France", "25.50", 3),
            new Sale(3, "Germany", "25.50", 2),
            new Sale(1, "France", "5.00", 4),
            new Sale(5, "Brazil", "1.00", 1),
            new Sale(6, " ", "2.00", 1),
            new Sale(7, null, "3.00", 1));

    @Test
    void shouldCountByCategory_withTiesOrderedByName() {
        List<CountByCategory> counts = Aggregations.countByCategory(sales, s -> s.country, 5);

        assertThat(counts).containsExactly(
                new CountByCategory("France", 2),
                new CountByCategory("Germany", 2),
                new CountByCategory("Brazil", 1));
    }

    @Test
    void shouldLimitCategories() {
        assertThat(Aggregations.countByCategory(sales, s -> s.country, 1))
                .containsExactly(new CountByCategory("France", 2));
    }

    @Test
    void shouldReturnZero_whenAggregatingNothing() {
        List<Sale> none = List.of();

        assertThat(Aggregations.sum(none, s -> s.amount)).isEqualByComparingTo("0");
        assertThat(Aggregations.average(none, s -> s.amount)).isEqualByComparingTo("0");
        assertThat(Aggregations.averageOf(none, s -> s.quantity)).isEqualTo(0.0);
        assertThat(Aggregations.ratio(BigDecimal.TEN, 0)).isEqualByComparingTo("0");
        assertThat(Aggregations.countByCategory(none, s -> s.country, 5)).isEmpty();
    }

    @Test
    void shouldAverageAmountsToCents() {
        List<Sale> three = sales.subList(0, 3);

        assertThat(Aggregations.sum(three, s -> s.amount)).isEqualByComparingTo("61.00");
        assertThat(Aggregations.average(three, s -> s.amount)).isEqualByComparingTo("20.33");
        assertThat(Aggregations.averageOf(three, s -> s.quantity)).isEqualTo(2.0);
    }

    @Test
    void shouldRankByMetric_withTiesBrokenByLowestId() {
        List<Sale> top = Aggregations.topN(sales, s -> s.amount, s -> s.id, 3);

        assertThat(top).extracting(s -> s.id).containsExactly(2L, 3L, 4L);
    }

    @Test
    void shouldReturnSameRanking_regardlessOfInputOrder() {
        List<Sale> reversed = new ArrayList<>(sales);
        Collections.reverse(reversed);

        assertThat(Aggregations.topN(reversed, s -> s.amount, s -> s.id, 5))
                .extracting(s -> s.id)
                .containsExactlyElementsOf(
                        Aggregations.topN(sales, s -> s.amount, s -> s.id, 5).stream()
                                .map(s -> s.id)
                                .toList());
    }
}
