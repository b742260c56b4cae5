package com.umihealth.pos_backend.service;

import com.umihealth.pos_backend.config.ModelMapperConfig;
import com.umihealth.pos_backend.dto.request.RestockRequest;
import com.umihealth.pos_backend.dto.response.InventoryResponse;
import com.umihealth.pos_backend.dto.response.PaginatedResponse;
import com.umihealth.pos_backend.exception.ResourceNotFoundException;
import com.umihealth.pos_backend.model.InventoryRecord;
import com.umihealth.pos_backend.repository.InventoryRecordRepository;
import com.umihealth.pos_backend.security.TenantContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static com.umihealth.pos_backend.testutil.TestDataBuilder.*;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("InventoryService Unit Tests")
class InventoryServiceTest {

    @Mock
    private InventoryRecordRepository inventoryRecordRepository;

    private InventoryService inventoryService;

    private TenantContext context;
    private UUID productId;

    @BeforeEach
    void setUp() {
        inventoryService = new InventoryService(inventoryRecordRepository, new ModelMapperConfig().modelMapper());
        context = tenantContext();
        productId = UUID.randomUUID();
    }

    @Test
    @DisplayName("getInventoryForProduct - Maps quantity and low-stock flag")
    void getInventoryForProduct_Found() {
        InventoryRecord record = inventory(productId, 4);
        when(inventoryRecordRepository.findByTenantIdAndBranchIdAndProductIdAndDeletedAtIsNull(
                TENANT_ID, BRANCH_ID, productId)).thenReturn(Optional.of(record));

        InventoryResponse response = inventoryService.getInventoryForProduct(context, productId);

        assertThat(response.getProductId()).isEqualTo(productId);
        assertThat(response.getBranchId()).isEqualTo(BRANCH_ID);
        assertThat(response.getQuantityOnHand()).isEqualTo(4);
        assertThat(response.getReorderLevel()).isEqualTo(10);
        assertThat(response.isLowStock()).isTrue();
    }

    @Test
    @DisplayName("getInventoryForProduct - Unknown product is not found")
    void getInventoryForProduct_NotFound() {
        when(inventoryRecordRepository.findByTenantIdAndBranchIdAndProductIdAndDeletedAtIsNull(
                TENANT_ID, BRANCH_ID, productId)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> inventoryService.getInventoryForProduct(context, productId))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessageContaining(productId.toString());
    }

    @Test
    @DisplayName("getInventory - Low-stock filter uses the low-stock query")
    void getInventory_LowStockOnly() {
        InventoryRecord low = inventory(productId, 3);
        when(inventoryRecordRepository.findLowStock(eq(TENANT_ID), eq(BRANCH_ID), any(Pageable.class)))
                .thenReturn(new PageImpl<>(List.of(low)));

        PaginatedResponse<InventoryResponse> response = inventoryService.getInventory(context, 1, 50, true);

        assertThat(response.getData()).extracting(InventoryResponse::getProductId).containsExactly(productId);
        assertThat(response.getPagination().getTotal()).isEqualTo(1);
        verify(inventoryRecordRepository, never())
                .findByTenantIdAndBranchIdAndDeletedAtIsNull(any(), any(), any());
    }

    @Test
    @DisplayName("getInventory - Pages are requested zero-based")
    void getInventory_AllRecords() {
        when(inventoryRecordRepository.findByTenantIdAndBranchIdAndDeletedAtIsNull(
                eq(TENANT_ID), eq(BRANCH_ID), any(Pageable.class)))
                .thenReturn(new PageImpl<>(List.of(inventory(productId, 40))));

        inventoryService.getInventory(context, 2, 20, false);

        ArgumentCaptor<Pageable> captor = ArgumentCaptor.forClass(Pageable.class);
        verify(inventoryRecordRepository).findByTenantIdAndBranchIdAndDeletedAtIsNull(
                eq(TENANT_ID), eq(BRANCH_ID), captor.capture());
        assertThat(captor.getValue().getPageNumber()).isEqualTo(1);
        assertThat(captor.getValue().getPageSize()).isEqualTo(20);
    }

    @Test
    @DisplayName("restock - Adds to an existing record")
    void restock_ExistingRecord() {
        InventoryRecord record = inventory(productId, 2);
        when(inventoryRecordRepository.findByTenantIdAndBranchIdAndProductId(TENANT_ID, BRANCH_ID, productId))
                .thenReturn(Optional.of(record));
        when(inventoryRecordRepository.save(record)).thenReturn(record);

        InventoryResponse response = inventoryService.restock(context,
                RestockRequest.builder().productId(productId).quantity(8).build());

        assertThat(response.getQuantityOnHand()).isEqualTo(10);
        assertThat(response.getReorderLevel()).isEqualTo(10);
    }

    @Test
    @DisplayName("restock - Creates the record on first delivery")
    void restock_NewRecord() {
        when(inventoryRecordRepository.findByTenantIdAndBranchIdAndProductId(TENANT_ID, BRANCH_ID, productId))
                .thenReturn(Optional.empty());
        when(inventoryRecordRepository.save(any(InventoryRecord.class))).thenAnswer(invocation -> invocation.getArgument(0));

        InventoryResponse response = inventoryService.restock(context,
                RestockRequest.builder().productId(productId).quantity(5).reorderLevel(2).build());

        ArgumentCaptor<InventoryRecord> captor = ArgumentCaptor.forClass(InventoryRecord.class);
        verify(inventoryRecordRepository).save(captor.capture());
        assertThat(captor.getValue().getTenantId()).isEqualTo(TENANT_ID);
        assertThat(captor.getValue().getBranchId()).isEqualTo(BRANCH_ID);
        assertThat(response.getQuantityOnHand()).isEqualTo(5);
        assertThat(response.isLowStock()).isFalse();
    }

    @Test
    @DisplayName("restock - Revives a soft-deleted record from zero")
    void restock_RevivesDeletedRecord() {
        InventoryRecord record = inventory(productId, 7);
        record.setDeletedAt(LocalDateTime.now().minusDays(1));
        when(inventoryRecordRepository.findByTenantIdAndBranchIdAndProductId(TENANT_ID, BRANCH_ID, productId))
                .thenReturn(Optional.of(record));
        when(inventoryRecordRepository.save(record)).thenReturn(record);

        InventoryResponse response = inventoryService.restock(context,
                RestockRequest.builder().productId(productId).quantity(3).build());

        assertThat(record.getDeletedAt()).isNull();
        assertThat(response.getQuantityOnHand()).isEqualTo(3);
    }
}
