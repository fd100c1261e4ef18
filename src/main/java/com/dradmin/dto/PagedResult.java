package com.dradmin.dto;

import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.springframework.data.domain.Page;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One page of a listing. {@code page} is 1-based.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PagedResult<T> {
    private List<T> items;
    private long totalCount;
    private int page;
    private int pageSize;
    private int totalPages;

    public static <E, T> PagedResult<T> of(Page<E> page, Function<E, T> mapper) {
        List<T> items = page.getContent().stream().map(mapper).collect(Collectors.toList());
        return new PagedResult<>(items, page.getTotalElements(), page.getNumber() + 1, page.getSize(), page.getTotalPages());
    }
}
