package com.givehub.backend.global.web;

import java.util.List;
import java.util.function.Function;

import org.springframework.data.domain.Page;

/**
 * Paged listing envelope: {@code {items, pagination{page, limit, total, pages}}}.
 */
public record PageResponse<T>(List<T> items, Pagination pagination) {

    public static <E, T> PageResponse<T> of(Page<E> page, Function<E, T> mapper) {
        List<T> items = page.getContent().stream().map(mapper).toList();
        return new PageResponse<>(items, new Pagination(
                page.getNumber() + 1,
                page.getSize(),
                page.getTotalElements(),
                page.getTotalPages()
        ));
    }

    public record Pagination(int page, int limit, long total, int pages) {
    }
}
