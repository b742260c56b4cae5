package com.umihealth.pos_backend.service;

import com.umihealth.pos_backend.dto.request.RestockRequest;
import com.umihealth.pos_backend.dto.response.InventoryResponse;
import com.umihealth.pos_backend.dto.response.PaginatedResponse;
import com.umihealth.pos_backend.exception.ResourceNotFoundException;
import com.umihealth.pos_backend.model.InventoryRecord;
import com.umihealth.pos_backend.repository.InventoryRecordRepository;
import com.umihealth.pos_backend.security.TenantContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.modelmapper.ModelMapper;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class InventoryService {

    private final InventoryRecordRepository inventoryRecordRepository;
    private final ModelMapper modelMapper;

    @Transactional(readOnly = true)
    public PaginatedResponse<InventoryResponse> getInventory(TenantContext context, int page, int limit, boolean lowStockOnly) {
        Pageable pageable = PageRequest.of(page - 1, limit, Sort.by("quantityOnHand").ascending());

        Page<InventoryRecord> inventoryPage = lowStockOnly
                ? inventoryRecordRepository.findLowStock(context.getTenantId(), context.getBranchId(), pageable)
                : inventoryRecordRepository.findByTenantIdAndBranchIdAndDeletedAtIsNull(
                        context.getTenantId(), context.getBranchId(), pageable);

        return PaginatedResponse.from(inventoryPage, this::mapToInventoryResponse, page, limit);
    }

    @Transactional(readOnly = true)
    public InventoryResponse getInventoryForProduct(TenantContext context, UUID productId) {
        InventoryRecord inventory = inventoryRecordRepository
                .findByTenantIdAndBranchIdAndProductIdAndDeletedAtIsNull(
                        context.getTenantId(), context.getBranchId(), productId)
                .orElseThrow(() -> new ResourceNotFoundException("Inventory", "productId", productId));
        return mapToInventoryResponse(inventory);
    }

    /**
     * Adds stock for a product at the caller's branch, creating the record on first delivery.
     * A soft-deleted record is brought back rather than duplicated.
     */
    @Transactional
    public InventoryResponse restock(TenantContext context, RestockRequest request) {
        InventoryRecord inventory = inventoryRecordRepository
                .findByTenantIdAndBranchIdAndProductId(context.getTenantId(), context.getBranchId(), request.getProductId())
                .orElseGet(() -> InventoryRecord.builder()
                        .tenantId(context.getTenantId())
                        .branchId(context.getBranchId())
                        .productId(request.getProductId())
                        .build());

        int previousQuantity = inventory.getDeletedAt() != null ? 0 : inventory.getQuantityOnHand();
        if (inventory.getDeletedAt() != null) {
            inventory.setDeletedAt(null);
            inventory.setQuantityOnHand(0);
        }

        inventory.restock(request.getQuantity());
        if (request.getReorderLevel() != null) {
            inventory.setReorderLevel(request.getReorderLevel());
        }

        InventoryRecord saved = inventoryRecordRepository.save(inventory);
        log.info("Restocked product {} at branch {}: {} -> {}",
                saved.getProductId(), saved.getBranchId(), previousQuantity, saved.getQuantityOnHand());

        return mapToInventoryResponse(saved);
    }

    private InventoryResponse mapToInventoryResponse(InventoryRecord inventory) {
        return modelMapper.map(inventory, InventoryResponse.class);
    }
}
