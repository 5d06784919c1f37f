package com.retailsales.infrastructure.persistence.repository;

import com.retailsales.infrastructure.persistence.entity.SalesTransactionEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

/**
 * Repository for sales transaction queries.
 *
 * Filtered reads go through {@link org.springframework.data.jpa.domain.Specification}s
 * built by the predicate builder; the custom fragment adds a page fetch without
 * the implicit count query and the single-pass stats aggregate.
 */
@Repository
public interface SalesTransactionRepository extends JpaRepository<SalesTransactionEntity, UUID>,
        JpaSpecificationExecutor<SalesTransactionEntity>, SalesTransactionRepositoryCustom {

    @Query("SELECT DISTINCT t.customerRegion FROM SalesTransactionEntity t " +
           "WHERE t.customerRegion IS NOT NULL ORDER BY t.customerRegion")
    List<String> findDistinctRegions();

    @Query("SELECT DISTINCT t.gender FROM SalesTransactionEntity t " +
           "WHERE t.gender IS NOT NULL ORDER BY t.gender")
    List<String> findDistinctGenders();

    @Query("SELECT DISTINCT t.productCategory FROM SalesTransactionEntity t " +
           "WHERE t.productCategory IS NOT NULL ORDER BY t.productCategory")
    List<String> findDistinctCategories();

    @Query("SELECT DISTINCT t.paymentMethod FROM SalesTransactionEntity t " +
           "WHERE t.paymentMethod IS NOT NULL ORDER BY t.paymentMethod")
    List<String> findDistinctPaymentMethods();

    /**
     * Distinct raw tag strings; each is a comma-separated list.
     */
    @Query("SELECT DISTINCT t.tags FROM SalesTransactionEntity t WHERE t.tags IS NOT NULL")
    List<String> findDistinctTagLists();

    @Query("SELECT MIN(t.age) AS minAge, MAX(t.age) AS maxAge FROM SalesTransactionEntity t")
    AgeBounds findAgeBounds();

    interface AgeBounds {
        Integer getMinAge();

        Integer getMaxAge();
    }
}
