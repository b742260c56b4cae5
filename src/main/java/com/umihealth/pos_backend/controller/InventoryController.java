package com.umihealth.pos_backend.controller;

import com.umihealth.pos_backend.dto.request.RestockRequest;
import com.umihealth.pos_backend.dto.response.ApiResponse;
import com.umihealth.pos_backend.dto.response.InventoryResponse;
import com.umihealth.pos_backend.dto.response.PaginatedResponse;
import com.umihealth.pos_backend.security.TenantContext;
import com.umihealth.pos_backend.service.InventoryService;
import com.umihealth.pos_backend.util.Constants;
import com.umihealth.pos_backend.util.PageUtil;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping(Constants.API_BASE_PATH + "/inventory")
@RequiredArgsConstructor
public class InventoryController {

    private final InventoryService inventoryService;

    @GetMapping
    public ResponseEntity<ApiResponse<PaginatedResponse<InventoryResponse>>> getInventory(
            @AuthenticationPrincipal TenantContext context,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "50") int limit,
            @RequestParam(defaultValue = "false") boolean lowStock) {

        PaginatedResponse<InventoryResponse> inventory = inventoryService.getInventory(context,
                PageUtil.normalizePage(page), PageUtil.normalizeLimit(limit), lowStock);
        return ResponseEntity.ok(ApiResponse.success(inventory));
    }

    @GetMapping("/products/{productId}")
    public ResponseEntity<ApiResponse<InventoryResponse>> getInventoryForProduct(
            @AuthenticationPrincipal TenantContext context,
            @PathVariable UUID productId) {
        return ResponseEntity.ok(ApiResponse.success(inventoryService.getInventoryForProduct(context, productId)));
    }

    @PostMapping("/restock")
    @PreAuthorize("hasAnyRole('ADMIN', 'MANAGER', 'PHARMACIST')")
    public ResponseEntity<ApiResponse<InventoryResponse>> restock(
            @AuthenticationPrincipal TenantContext context,
            @Valid @RequestBody RestockRequest request) {

        InventoryResponse inventory = inventoryService.restock(context, request);
        return ResponseEntity.ok(ApiResponse.success(inventory, Constants.SUCCESS_RESTOCKED));
    }
}
