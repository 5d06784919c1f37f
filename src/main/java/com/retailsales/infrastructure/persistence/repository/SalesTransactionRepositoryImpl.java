package com.retailsales.infrastructure.persistence.repository;

import com.retailsales.infrastructure.persistence.entity.SalesTransactionEntity;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.Tuple;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.data.jpa.repository.query.QueryUtils;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;

@Transactional(readOnly = true)
public class SalesTransactionRepositoryImpl implements SalesTransactionRepositoryCustom {

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    public List<SalesTransactionEntity> findSlice(Specification<SalesTransactionEntity> spec, Sort sort,
                                                  int offset, int limit) {
        CriteriaBuilder cb = entityManager.getCriteriaBuilder();
        CriteriaQuery<SalesTransactionEntity> query = cb.createQuery(SalesTransactionEntity.class);
        Root<SalesTransactionEntity> root = query.from(SalesTransactionEntity.class);

        Predicate predicate = spec.toPredicate(root, query, cb);
        if (predicate != null) {
            query.where(predicate);
        }
        query.select(root).orderBy(QueryUtils.toOrders(sort, root, cb));

        return entityManager.createQuery(query)
                .setFirstResult(offset)
                .setMaxResults(limit)
                .getResultList();
    }

    @Override
    public SalesTotals sumTotals(Specification<SalesTransactionEntity> spec) {
        CriteriaBuilder cb = entityManager.getCriteriaBuilder();
        CriteriaQuery<Tuple> query = cb.createTupleQuery();
        Root<SalesTransactionEntity> root = query.from(SalesTransactionEntity.class);

        Predicate predicate = spec.toPredicate(root, query, cb);
        if (predicate != null) {
            query.where(predicate);
        }
        query.multiselect(
                cb.sumAsLong(root.<Integer>get("quantity")),
                cb.sum(root.<BigDecimal>get("totalAmount")),
                cb.sum(root.<BigDecimal>get("finalAmount")));

        Tuple row = entityManager.createQuery(query).getSingleResult();
        Number quantity = (Number) row.get(0);
        return SalesTotals.of(
                quantity == null ? null : quantity.longValue(),
                toBigDecimal(row.get(1)),
                toBigDecimal(row.get(2)));
    }

    private static BigDecimal toBigDecimal(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        return new BigDecimal(value.toString());
    }
}
