package com.givehub.backend.global.web;

import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;

/**
 * 1-based page and limit as received on the wire. Limit is clamped to {@code [1, MAX_LIMIT]}.
 * Page is raised to at least 1 and capped so that the row offset stays within {@code int} range.
 */
public record PageQuery(int page, int limit) {

    public static final int DEFAULT_LIMIT = 10;
    public static final int MAX_LIMIT = 100;

    public PageQuery {
        limit = Math.min(Math.max(limit, 1), MAX_LIMIT);
        page = Math.min(Math.max(page, 1), maxPage(limit));
    }

    public static PageQuery of(Integer page, Integer limit) {
        return new PageQuery(page == null ? 1 : page, limit == null ? DEFAULT_LIMIT : limit);
    }

    static int maxPage(int limit) {
        return (int) Math.min((long) Integer.MAX_VALUE / limit + 1, Integer.MAX_VALUE);
    }

    public Pageable newestFirst() {
        return PageRequest.of(page - 1, limit, Sort.by(Sort.Direction.DESC, "createdAt"));
    }
}
