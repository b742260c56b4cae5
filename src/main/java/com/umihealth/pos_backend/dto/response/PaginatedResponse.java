package com.umihealth.pos_backend.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.domain.Page;

import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaginatedResponse<T> {
    private List<T> data;
    private PaginationInfo pagination;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PaginationInfo {
        private int page;
        private int limit;
        private long total;
        private int pages;
        private boolean hasNext;
        private boolean hasPrev;
    }

    /**
     * Wraps a Spring Data page, mapping each entity to its response type.
     * {@code page} is the 1-based page number the client asked for.
     */
    public static <E, T> PaginatedResponse<T> from(Page<E> source, Function<E, T> mapper, int page, int limit) {
        List<T> data = source.getContent().stream()
                .map(mapper)
                .collect(Collectors.toList());
        return of(data, page, limit, source.getTotalElements());
    }

    public static <T> PaginatedResponse<T> of(List<T> data, int page, int limit, long total) {
        int pages = limit > 0 ? (int) ((total + limit - 1) / limit) : 0;
        PaginationInfo pagination = new PaginationInfo(page, limit, total, pages, page < pages, page > 1);
        return new PaginatedResponse<>(data, pagination);
    }
}
