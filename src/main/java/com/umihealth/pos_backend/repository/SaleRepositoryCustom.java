package com.umihealth.pos_backend.repository;

import com.umihealth.pos_backend.model.Sale;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

import java.math.BigDecimal;

public interface SaleRepositoryCustom {

    Page<Sale> findSalesByCriteria(SaleSearchCriteria criteria, Pageable pageable);

    long countSalesByCriteria(SaleSearchCriteria criteria);

    BigDecimal sumTotalAmountByCriteria(SaleSearchCriteria criteria);
}
