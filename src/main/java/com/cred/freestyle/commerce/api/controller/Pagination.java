package com.cred.freestyle.commerce.api.controller;

import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;

/**
 * Page request bounds shared by list endpoints.
 *
 * @author Commerce Platform Team
 */
final class Pagination {

    static final int MAX_PAGE_SIZE = 100;

    private Pagination() {
    }

    /**
     * @throws IllegalArgumentException for a negative page or a size below 1
     */
    static Pageable of(int page, int size) {
        return PageRequest.of(page, Math.min(size, MAX_PAGE_SIZE));
    }
}
