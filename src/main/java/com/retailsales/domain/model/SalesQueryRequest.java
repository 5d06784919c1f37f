package com.retailsales.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request model for sales queries.
 *
 * Supports search, filtering, sorting, and offset pagination.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SalesQueryRequest {

    public static final int DEFAULT_PAGE_SIZE = 10;
    public static final int MAX_PAGE_SIZE = 1000;

    private Integer page;
    private Integer pageSize;

    private String search;
    private SalesFilter filter;

    private String sortBy;
    private String sortOrder;

    // Defaults
    public Integer getPage() {
        if (page == null || page < 1) {
            return 1;
        }
        return page;
    }

    public Integer getPageSize() {
        if (pageSize == null || pageSize <= 0) {
            return DEFAULT_PAGE_SIZE;
        }
        return Math.min(pageSize, MAX_PAGE_SIZE);
    }

    public String getSearch() {
        return search == null ? "" : search.trim();
    }

    public SalesFilter getFilter() {
        return filter == null ? SalesFilter.none() : filter;
    }

    public SortSpec getSort() {
        return SortSpec.of(sortBy, sortOrder);
    }

    public PageSpec getPageSpec() {
        return PageSpec.of(getPage(), getPageSize());
    }
}
