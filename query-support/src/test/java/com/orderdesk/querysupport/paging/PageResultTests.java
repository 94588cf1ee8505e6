package com.orderdesk.querysupport.paging;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class PageResultTests {

    private final List<Integer> numbers = IntStream.rangeClosed(1, 23).boxed().toList();

    @Test
    void shouldRoundTotalPagesUp() {
        PageResult<Integer> result = PageResult.slice(numbers, PageSpec.of(1, 10));

        assertThat(result.getTotalCount()).isEqualTo(23);
        assertThat(result.getTotalPages()).isEqualTo(3);
        assertThat(result.getContent()).containsExactly(1, 2, 3, 4, 5, 6, 7, 8, 9, 10);
    }

    @Test
    void shouldReturnPartialLastPage() {
        PageResult<Integer> result = PageResult.slice(numbers, PageSpec.of(3, 10));

        assertThat(result.getContent()).containsExactly(21, 22, 23);
        assertThat(result.getPage()).isEqualTo(3);
    }

    @Test
    void shouldReturnEmptyPageWithTotals_whenPageIsBeyondTheEnd() {
        PageResult<Integer> result = PageResult.slice(numbers, PageSpec.of(7, 10));

        assertThat(result.isEmpty()).isTrue();
        assertThat(result.getTotalCount()).isEqualTo(23);
        assertThat(result.getTotalPages()).isEqualTo(3);
        assertThat(result.getPage()).isEqualTo(7);
    }

    @Test
    void shouldReportZeroPages_whenNothingMatches() {
        PageResult<Integer> result = PageResult.slice(List.of(), PageSpec.of(1, 10));

        assertThat(result.getTotalPages()).isZero();
        assertThat(result.getContent()).isEmpty();
    }

    @Test
    void shouldKeepMetadata_whenMappingContent() {
        PageResult<String> mapped = PageResult.slice(numbers, PageSpec.of(2, 5)).map(n -> "#" + n);

        assertThat(mapped.getContent()).containsExactly("#6", "#7", "#8", "#9", "#10");
        assertThat(mapped.getTotalCount()).isEqualTo(23);
        assertThat(mapped.getTotalPages()).isEqualTo(5);
    }

    @Test
    void shouldRejectNegativeTotal() {
        assertThatThrownBy(() -> PageResult.of(List.of(), -1, PageSpec.of(1, 10)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
