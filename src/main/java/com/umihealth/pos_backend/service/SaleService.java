package com.umihealth.pos_backend.service;

import com.umihealth.pos_backend.dto.request.SaleRequest;
import com.umihealth.pos_backend.dto.request.SaleUpdateRequest;
import com.umihealth.pos_backend.dto.response.PaginatedResponse;
import com.umihealth.pos_backend.dto.response.SaleResponse;
import com.umihealth.pos_backend.dto.response.SalesStats;
import com.umihealth.pos_backend.enums.PaymentStatus;
import com.umihealth.pos_backend.enums.SaleStatus;
import com.umihealth.pos_backend.exception.InsufficientStockException;
import com.umihealth.pos_backend.exception.InventoryNotFoundException;
import com.umihealth.pos_backend.exception.ResourceNotFoundException;
import com.umihealth.pos_backend.model.InventoryRecord;
import com.umihealth.pos_backend.model.Sale;
import com.umihealth.pos_backend.model.SaleItem;
import com.umihealth.pos_backend.repository.InventoryRecordRepository;
import com.umihealth.pos_backend.repository.SaleRepository;
import com.umihealth.pos_backend.repository.SaleSearchCriteria;
import com.umihealth.pos_backend.security.TenantContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class SaleService {

    private final SaleRepository saleRepository;
    private final InventoryRecordRepository inventoryRecordRepository;
    private final SaleNumberGenerator saleNumberGenerator;

    /**
     * Creates a sale and deducts branch inventory for every line item as one unit of work.
     * <p>
     * Items are validated and deducted in request order. The first item that has no
     * inventory record, or not enough stock, aborts the sale and the transaction rolls back:
     * no sale, no line items and no inventory change are persisted.
     *
     * @throws InventoryNotFoundException  if the branch holds no inventory for a product
     * @throws InsufficientStockException  if a line item asks for more than is on hand
     * @throws com.umihealth.pos_backend.exception.SaleNumberGenerationException
     *                                     if no free sale number could be found
     */
    @Transactional(rollbackFor = Exception.class)
    public SaleResponse createSale(TenantContext context, SaleRequest request) {
        log.info("Creating sale for branch {} by user {}: {} items, total {}",
                context.getBranchId(), context.getUserId(), request.getItems().size(), request.getTotalAmount());

        String saleNumber = saleNumberGenerator.generate();

        Sale sale = Sale.builder()
                .tenantId(context.getTenantId())
                .branchId(context.getBranchId())
                .saleNumber(saleNumber)
                .patientId(request.getPatientId())
                .cashierId(context.getUserId())
                .saleDate(LocalDateTime.now())
                .subtotal(request.getSubtotal())
                .taxAmount(orZero(request.getTaxAmount()))
                .discountAmount(orZero(request.getDiscountAmount()))
                .totalAmount(request.getTotalAmount())
                .paymentMethod(request.getPaymentMethod())
                .paymentStatus(PaymentStatus.PENDING)
                .status(SaleStatus.PENDING)
                .notes(request.getNotes())
                .build();

        List<InventoryRecord> deductedRecords = new ArrayList<>();

        for (SaleRequest.SaleItemRequest itemRequest : request.getItems()) {
            UUID productId = itemRequest.getProductId();
            int quantity = itemRequest.getQuantity();

            InventoryRecord inventory = inventoryRecordRepository
                    .findByTenantIdAndBranchIdAndProductIdAndDeletedAtIsNull(
                            context.getTenantId(), context.getBranchId(), productId)
                    .orElseThrow(() -> new InventoryNotFoundException(productId));

            if (!inventory.canFulfil(quantity)) {
                throw new InsufficientStockException(productId, inventory.getQuantityOnHand(), quantity);
            }

            inventory.deduct(quantity);
            // Repeated lines for one product hit the same managed record
            if (!deductedRecords.contains(inventory)) {
                deductedRecords.add(inventory);
            }

            log.debug("Deducted {} of product {}, {} left", quantity, productId, inventory.getQuantityOnHand());

            sale.addItem(toSaleItem(itemRequest));
        }

        Sale savedSale = saleRepository.save(sale);
        inventoryRecordRepository.saveAll(deductedRecords);

        log.info("Sale {} created with ID: {}, items: {}, total: {}",
                savedSale.getSaleNumber(), savedSale.getId(), savedSale.getItems().size(), savedSale.getTotalAmount());

        return mapToSaleResponse(savedSale);
    }

    @Transactional(readOnly = true)
    public SaleResponse getSaleById(TenantContext context, UUID id) {
        return mapToSaleResponse(findScopedSale(context, id));
    }

    @Transactional(readOnly = true)
    public PaginatedResponse<SaleResponse> getSales(TenantContext context, int page, int limit, String search,
                                                    LocalDate startDate, LocalDate endDate, SaleStatus status) {
        Pageable pageable = PageRequest.of(page - 1, limit);

        SaleSearchCriteria criteria = SaleSearchCriteria.builder()
                .tenantId(context.getTenantId())
                .branchId(context.getBranchId())
                .search(search)
                .startDate(startDate != null ? startDate.atStartOfDay() : null)
                .endDate(endDate != null ? endDate.atTime(LocalTime.MAX) : null)
                .status(status)
                .build();

        Page<Sale> salesPage = saleRepository.findSalesByCriteria(criteria, pageable);
        return PaginatedResponse.from(salesPage, this::mapToSaleResponse, page, limit);
    }

    /**
     * Updates the fields of a sale that stay editable after creation.
     * Line items, totals and inventory are never touched here.
     */
    @Transactional
    public SaleResponse updateSale(TenantContext context, UUID id, SaleUpdateRequest request) {
        Sale sale = findScopedSale(context, id);

        if (request.getStatus() != null) {
            sale.setStatus(request.getStatus());
        }
        if (request.getPaymentStatus() != null) {
            sale.setPaymentStatus(request.getPaymentStatus());
        }
        if (request.getNotes() != null) {
            sale.setNotes(request.getNotes());
        }

        Sale updatedSale = saleRepository.save(sale);
        log.info("Sale {} updated: status={}, paymentStatus={}",
                updatedSale.getSaleNumber(), updatedSale.getStatus(), updatedSale.getPaymentStatus());

        return mapToSaleResponse(updatedSale);
    }

    @Transactional(readOnly = true)
    public SalesStats getSalesStats(TenantContext context, LocalDate startDate, LocalDate endDate) {
        SaleSearchCriteria range = SaleSearchCriteria.builder()
                .tenantId(context.getTenantId())
                .branchId(context.getBranchId())
                .startDate(startDate != null ? startDate.atStartOfDay() : null)
                .endDate(endDate != null ? endDate.atTime(LocalTime.MAX) : null)
                .build();

        long totalSales = saleRepository.countSalesByCriteria(range);
        BigDecimal totalRevenue = saleRepository.sumTotalAmountByCriteria(range);
        long completedSales = saleRepository.countSalesByCriteria(range.toBuilder().status(SaleStatus.COMPLETED).build());
        long pendingSales = saleRepository.countSalesByCriteria(range.toBuilder().status(SaleStatus.PENDING).build());

        // Today's figures stay inside the requested range
        LocalDate today = LocalDate.now();
        LocalDateTime todayStart = later(today.atStartOfDay(), range.getStartDate());
        LocalDateTime todayEnd = earlier(today.atTime(LocalTime.MAX), range.getEndDate());

        long todaySales = 0;
        BigDecimal todayRevenue = BigDecimal.ZERO;
        if (!todayStart.isAfter(todayEnd)) {
            SaleSearchCriteria todayRange = range.toBuilder().startDate(todayStart).endDate(todayEnd).build();
            todaySales = saleRepository.countSalesByCriteria(todayRange);
            todayRevenue = saleRepository.sumTotalAmountByCriteria(todayRange);
        }

        return SalesStats.builder()
                .totalSales(totalSales)
                .totalRevenue(totalRevenue)
                .completedSales(completedSales)
                .pendingSales(pendingSales)
                .todaySales(todaySales)
                .todayRevenue(todayRevenue)
                .build();
    }

    /**
     * Soft-deletes a sale. Inventory deducted by the sale is not restored.
     */
    @Transactional
    public void deleteSale(TenantContext context, UUID id) {
        Sale sale = findScopedSale(context, id);
        sale.setDeletedAt(LocalDateTime.now());
        saleRepository.save(sale);
        log.info("Sale {} soft-deleted by user {}", sale.getSaleNumber(), context.getUserId());
    }

    private Sale findScopedSale(TenantContext context, UUID id) {
        return saleRepository.findByIdAndTenantIdAndBranchIdAndDeletedAtIsNull(
                        id, context.getTenantId(), context.getBranchId())
                .orElseThrow(() -> new ResourceNotFoundException("Sale", "id", id));
    }

    private SaleItem toSaleItem(SaleRequest.SaleItemRequest itemRequest) {
        BigDecimal discount = orZero(itemRequest.getDiscountAmount());
        BigDecimal totalPrice = itemRequest.getTotalPrice() != null
                ? itemRequest.getTotalPrice()
                : SaleItem.computeTotalPrice(itemRequest.getQuantity(), itemRequest.getUnitPrice(), discount);

        return SaleItem.builder()
                .productId(itemRequest.getProductId())
                .quantity(itemRequest.getQuantity())
                .unitPrice(itemRequest.getUnitPrice())
                .discountAmount(discount)
                .totalPrice(totalPrice)
                .build();
    }

    private SaleResponse mapToSaleResponse(Sale sale) {
        SaleResponse response = SaleResponse.builder()
                .id(sale.getId())
                .saleNumber(sale.getSaleNumber())
                .branchId(sale.getBranchId())
                .patientId(sale.getPatientId())
                .cashierId(sale.getCashierId())
                .saleDate(sale.getSaleDate())
                .subtotal(sale.getSubtotal())
                .taxAmount(sale.getTaxAmount())
                .discountAmount(sale.getDiscountAmount())
                .totalAmount(sale.getTotalAmount())
                .paymentMethod(sale.getPaymentMethod())
                .paymentStatus(sale.getPaymentStatus())
                .status(sale.getStatus())
                .notes(sale.getNotes())
                .createdAt(sale.getCreatedAt())
                .updatedAt(sale.getUpdatedAt())
                .build();

        List<SaleResponse.SaleItemResponse> itemResponses = sale.getItems().stream()
                .map(item -> SaleResponse.SaleItemResponse.builder()
                        .id(item.getId())
                        .productId(item.getProductId())
                        .quantity(item.getQuantity())
                        .unitPrice(item.getUnitPrice())
                        .discountAmount(item.getDiscountAmount())
                        .totalPrice(item.getTotalPrice())
                        .build())
                .collect(Collectors.toList());
        response.setItems(itemResponses);

        return response;
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }

    private static LocalDateTime later(LocalDateTime a, LocalDateTime b) {
        return b != null && b.isAfter(a) ? b : a;
    }

    private static LocalDateTime earlier(LocalDateTime a, LocalDateTime b) {
        return b != null && b.isBefore(a) ? b : a;
    }
}
