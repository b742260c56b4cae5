package com.umihealth.pos_backend.repository;

import com.umihealth.pos_backend.model.InventoryRecord;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface InventoryRecordRepository extends JpaRepository<InventoryRecord, UUID> {

    /**
     * Live inventory record for a product at a branch, the row a sale deducts from.
     */
    Optional<InventoryRecord> findByTenantIdAndBranchIdAndProductIdAndDeletedAtIsNull(
            UUID tenantId, UUID branchId, UUID productId);

    /**
     * Same lookup including soft-deleted rows, so a restock can revive a record
     * instead of colliding with the (tenant, branch, product) unique key.
     */
    Optional<InventoryRecord> findByTenantIdAndBranchIdAndProductId(UUID tenantId, UUID branchId, UUID productId);

    Page<InventoryRecord> findByTenantIdAndBranchIdAndDeletedAtIsNull(UUID tenantId, UUID branchId, Pageable pageable);

    @Query("SELECT i FROM InventoryRecord i WHERE i.tenantId = :tenantId AND i.branchId = :branchId " +
            "AND i.deletedAt IS NULL AND i.quantityOnHand <= i.reorderLevel")
    Page<InventoryRecord> findLowStock(@Param("tenantId") UUID tenantId,
                                       @Param("branchId") UUID branchId,
                                       Pageable pageable);
}
