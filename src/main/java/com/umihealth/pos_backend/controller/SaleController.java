package com.umihealth.pos_backend.controller;

import com.umihealth.pos_backend.dto.request.SaleRequest;
import com.umihealth.pos_backend.dto.request.SaleUpdateRequest;
import com.umihealth.pos_backend.dto.response.ApiResponse;
import com.umihealth.pos_backend.dto.response.PaginatedResponse;
import com.umihealth.pos_backend.dto.response.SaleResponse;
import com.umihealth.pos_backend.dto.response.SalesStats;
import com.umihealth.pos_backend.enums.SaleStatus;
import com.umihealth.pos_backend.security.TenantContext;
import com.umihealth.pos_backend.service.SaleService;
import com.umihealth.pos_backend.util.Constants;
import com.umihealth.pos_backend.util.PageUtil;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.UUID;

@RestController
@RequestMapping(Constants.API_BASE_PATH + "/sales")
@RequiredArgsConstructor
public class SaleController {

    private final SaleService saleService;

    @GetMapping
    public ResponseEntity<ApiResponse<PaginatedResponse<SaleResponse>>> getSales(
            @AuthenticationPrincipal TenantContext context,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "50") int limit,
            @RequestParam(required = false) String search,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
            @RequestParam(required = false) SaleStatus status) {

        PaginatedResponse<SaleResponse> sales = saleService.getSales(context,
                PageUtil.normalizePage(page), PageUtil.normalizeLimit(limit), search, startDate, endDate, status);
        return ResponseEntity.ok(ApiResponse.success(sales));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<SaleResponse>> getSaleById(
            @AuthenticationPrincipal TenantContext context,
            @PathVariable UUID id) {
        SaleResponse sale = saleService.getSaleById(context, id);
        return ResponseEntity.ok(ApiResponse.success(sale));
    }

    @PostMapping
    @PreAuthorize("hasAnyRole('ADMIN', 'MANAGER', 'PHARMACIST', 'CASHIER')")
    public ResponseEntity<ApiResponse<SaleResponse>> createSale(
            @AuthenticationPrincipal TenantContext context,
            @Valid @RequestBody SaleRequest request) {

        SaleResponse sale = saleService.createSale(context, request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(sale, Constants.SUCCESS_SALE_CREATED));
    }

    @RequestMapping(path = "/{id}", method = {RequestMethod.PUT, RequestMethod.PATCH})
    @PreAuthorize("hasAnyRole('ADMIN', 'MANAGER', 'PHARMACIST', 'CASHIER')")
    public ResponseEntity<ApiResponse<SaleResponse>> updateSale(
            @AuthenticationPrincipal TenantContext context,
            @PathVariable UUID id,
            @Valid @RequestBody SaleUpdateRequest request) {

        SaleResponse sale = saleService.updateSale(context, id, request);
        return ResponseEntity.ok(ApiResponse.success(sale, Constants.SUCCESS_SALE_UPDATED));
    }

    @GetMapping("/stats")
    @PreAuthorize("hasAnyRole('ADMIN', 'MANAGER')")
    public ResponseEntity<ApiResponse<SalesStats>> getSalesStats(
            @AuthenticationPrincipal TenantContext context,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {

        SalesStats stats = saleService.getSalesStats(context, startDate, endDate);
        return ResponseEntity.ok(ApiResponse.success(stats));
    }

    @DeleteMapping("/{id}")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<ApiResponse<Void>> deleteSale(
            @AuthenticationPrincipal TenantContext context,
            @PathVariable UUID id) {
        saleService.deleteSale(context, id);
        return ResponseEntity.ok(ApiResponse.success(null, Constants.SUCCESS_SALE_DELETED));
    }
}
