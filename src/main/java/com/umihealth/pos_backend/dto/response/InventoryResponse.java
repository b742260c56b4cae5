package com.umihealth.pos_backend.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InventoryResponse {
    private UUID id;
    private UUID branchId;
    private UUID productId;
    private int quantityOnHand;
    private int reorderLevel;
    private boolean lowStock;
    private LocalDateTime updatedAt;
}
