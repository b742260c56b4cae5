package com.umihealth.pos_backend.repository.impl;

import com.umihealth.pos_backend.model.Sale;
import com.umihealth.pos_backend.repository.SaleRepositoryCustom;
import com.umihealth.pos_backend.repository.SaleSearchCriteria;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.TypedQuery;
import jakarta.persistence.criteria.*;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

@Repository
public class SaleRepositoryImpl implements SaleRepositoryCustom {

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    public Page<Sale> findSalesByCriteria(SaleSearchCriteria criteria, Pageable pageable) {
        CriteriaBuilder cb = entityManager.getCriteriaBuilder();
        CriteriaQuery<Sale> query = cb.createQuery(Sale.class);
        Root<Sale> sale = query.from(Sale.class);

        query.where(buildPredicates(cb, sale, criteria));

        // Newest first
        query.orderBy(cb.desc(sale.get("saleDate")));

        TypedQuery<Sale> typedQuery = entityManager.createQuery(query);
        typedQuery.setFirstResult((int) pageable.getOffset());
        typedQuery.setMaxResults(pageable.getPageSize());

        List<Sale> resultList = typedQuery.getResultList();
        long total = countSalesByCriteria(criteria);

        return new PageImpl<>(resultList, pageable, total);
    }

    @Override
    public long countSalesByCriteria(SaleSearchCriteria criteria) {
        CriteriaBuilder cb = entityManager.getCriteriaBuilder();
        CriteriaQuery<Long> query = cb.createQuery(Long.class);
        Root<Sale> sale = query.from(Sale.class);

        query.select(cb.count(sale));
        query.where(buildPredicates(cb, sale, criteria));

        return entityManager.createQuery(query).getSingleResult();
    }

    @Override
    public BigDecimal sumTotalAmountByCriteria(SaleSearchCriteria criteria) {
        CriteriaBuilder cb = entityManager.getCriteriaBuilder();
        CriteriaQuery<BigDecimal> query = cb.createQuery(BigDecimal.class);
        Root<Sale> sale = query.from(Sale.class);

        query.select(cb.coalesce(cb.sum(sale.<BigDecimal>get("totalAmount")), BigDecimal.ZERO));
        query.where(buildPredicates(cb, sale, criteria));

        BigDecimal result = entityManager.createQuery(query).getSingleResult();
        return result != null ? result : BigDecimal.ZERO;
    }

    private Predicate[] buildPredicates(CriteriaBuilder cb, Root<Sale> sale, SaleSearchCriteria criteria) {
        List<Predicate> predicates = new ArrayList<>();

        // Tenant scoping and soft delete always apply
        predicates.add(cb.equal(sale.get("tenantId"), criteria.getTenantId()));
        predicates.add(cb.equal(sale.get("branchId"), criteria.getBranchId()));
        predicates.add(cb.isNull(sale.get("deletedAt")));

        if (criteria.getSearch() != null && !criteria.getSearch().isBlank()) {
            String pattern = "%" + criteria.getSearch().trim().toUpperCase() + "%";
            predicates.add(cb.like(cb.upper(sale.get("saleNumber")), pattern));
        }
        if (criteria.getStartDate() != null) {
            predicates.add(cb.greaterThanOrEqualTo(sale.get("saleDate"), criteria.getStartDate()));
        }
        if (criteria.getEndDate() != null) {
            predicates.add(cb.lessThanOrEqualTo(sale.get("saleDate"), criteria.getEndDate()));
        }
        if (criteria.getStatus() != null) {
            predicates.add(cb.equal(sale.get("status"), criteria.getStatus()));
        }

        return predicates.toArray(new Predicate[0]);
    }
}
