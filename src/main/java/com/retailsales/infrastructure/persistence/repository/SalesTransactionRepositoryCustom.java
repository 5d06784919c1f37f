package com.retailsales.infrastructure.persistence.repository;

import com.retailsales.infrastructure.persistence.entity.SalesTransactionEntity;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;

import java.util.List;

public interface SalesTransactionRepositoryCustom {

    /**
     * Fetch one page of matching rows. Unlike {@code findAll(spec, pageable)}
     * this never issues a count query.
     */
    List<SalesTransactionEntity> findSlice(Specification<SalesTransactionEntity> spec, Sort sort,
                                           int offset, int limit);

    /**
     * Sum quantity, total amount and final amount over matching rows in one query.
     */
    SalesTotals sumTotals(Specification<SalesTransactionEntity> spec);
}
