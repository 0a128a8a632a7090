package com.cred.freestyle.commerce.api.dto;

import org.springframework.data.domain.Page;

import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Paginated list envelope. {@code page} is zero-based.
 *
 * @param <T> element type
 * @author Commerce Platform Team
 */
public class PageResponse<T> {

    private List<T> content;
    private int page;
    private int size;
    private long totalElements;
    private int totalPages;

    public PageResponse() {
    }

    /**
     * Map a Spring Data page into a response page.
     *
     * @param source Page of entities or service values
     * @param mapper Element converter
     */
    public static <E, T> PageResponse<T> from(Page<E> source, Function<E, T> mapper) {
        PageResponse<T> response = new PageResponse<>();
        response.setContent(source.getContent().stream().map(mapper).collect(Collectors.toList()));
        response.setPage(source.getNumber());
        response.setSize(source.getSize());
        response.setTotalElements(source.getTotalElements());
        response.setTotalPages(source.getTotalPages());
        return response;
    }

    public List<T> getContent() {
        return content;
    }

    public void setContent(List<T> content) {
        this.content = content;
    }

    public int getPage() {
        return page;
    }

    public void setPage(int page) {
        this.page = page;
    }

    public int getSize() {
        return size;
    }

    public void setSize(int size) {
        this.size = size;
    }

    public long getTotalElements() {
        return totalElements;
    }

    public void setTotalElements(long totalElements) {
        this.totalElements = totalElements;
    }

    public int getTotalPages() {
        return totalPages;
    }

    public void setTotalPages(int totalPages) {
        this.totalPages = totalPages;
    }
}
