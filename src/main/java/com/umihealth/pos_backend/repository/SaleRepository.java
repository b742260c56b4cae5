package com.umihealth.pos_backend.repository;

import com.umihealth.pos_backend.model.Sale;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface SaleRepository extends JpaRepository<Sale, UUID>, SaleRepositoryCustom {

    boolean existsBySaleNumber(String saleNumber);

    Optional<Sale> findByIdAndTenantIdAndBranchIdAndDeletedAtIsNull(UUID id, UUID tenantId, UUID branchId);
}
