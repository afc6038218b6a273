package com.givehub.backend.global.web;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;

class PageQueryTest {

    @Test
    void defaultsToFirstPageOfTen() {
        PageQuery query = PageQuery.of(null, null);

        assertThat(query.page()).isEqualTo(1);
        assertThat(query.limit()).isEqualTo(10);
    }

    @Test
    void clampsOutOfRangeValues() {
        assertThat(PageQuery.of(0, 0)).isEqualTo(new PageQuery(1, 1));
        assertThat(PageQuery.of(-3, 1000)).isEqualTo(new PageQuery(1, PageQuery.MAX_LIMIT));
    }

    @Test
    void newestFirstIsZeroBasedAndSortedByCreation() {
        Pageable pageable = PageQuery.of(3, 20).newestFirst();

        assertThat(pageable.getPageNumber()).isEqualTo(2);
        assertThat(pageable.getPageSize()).isEqualTo(20);
        assertThat(pageable.getSort().getOrderFor("createdAt").getDirection()).isEqualTo(Sort.Direction.DESC);
    }

    @Test
    void hugePageKeepsOffsetWithinIntRange() {
        Pageable pageable = PageQuery.of(42_949_674, 100).newestFirst();

        assertThat(pageable.getOffset()).isLessThanOrEqualTo(Integer.MAX_VALUE);
        assertThat(pageable.getOffset()).isGreaterThan(Integer.MAX_VALUE - 100L);
    }

    @Test
    void maximumPageWithLimitOneDoesNotOverflow() {
        PageQuery query = PageQuery.of(Integer.MAX_VALUE, 1);

        assertThat(query.page()).isEqualTo(Integer.MAX_VALUE);
        assertThat(query.newestFirst().getOffset()).isEqualTo(Integer.MAX_VALUE - 1L);
    }
}
