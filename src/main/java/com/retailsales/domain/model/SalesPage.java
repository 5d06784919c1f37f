package com.retailsales.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Response model for sales queries: one page of records plus pagination metadata.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SalesPage {

    private List<SalesRecordView> records;
    private Pagination pagination;
    private long queryTimeMs;

    public static SalesPage of(List<SalesRecordView> records, PageSpec pageSpec, long totalCount) {
        return SalesPage.builder()
                .records(records)
                .pagination(Pagination.of(pageSpec, totalCount))
                .build();
    }

    /**
     * Degraded result: well-formed empty page with zero total.
     */
    public static SalesPage empty(PageSpec pageSpec) {
        return of(List.of(), pageSpec, 0);
    }

    @Data
    @AllArgsConstructor
    @NoArgsConstructor
    public static class Pagination {
        private int page;
        private int pageSize;
        private long totalCount;
        private long totalPages;

        public static Pagination of(PageSpec pageSpec, long totalCount) {
            long totalPages = (totalCount + pageSpec.getPageSize() - 1) / pageSpec.getPageSize();
            return new Pagination(pageSpec.getPage(), pageSpec.getPageSize(), totalCount, totalPages);
        }
    }
}
