package com.retailsales.domain.model;

import lombok.Value;

/**
 * 1-based page number and page size.
 */
@Value(staticConstructor = "of")
public class PageSpec {
    int page;
    int pageSize;

    public int getOffset() {
        return (int) Math.min(Integer.MAX_VALUE, (long) (page - 1) * pageSize);
    }

    public int getLimit() {
        return pageSize;
    }

    public boolean isFirstPage() {
        return page == 1;
    }
}
