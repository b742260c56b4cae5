package com.umihealth.pos_backend.repository;

import com.umihealth.pos_backend.enums.SaleStatus;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Filters for sale lookups. Tenant and branch are mandatory, the rest optional.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class SaleSearchCriteria {
    private final UUID tenantId;
    private final UUID branchId;
    private final String search;
    private final LocalDateTime startDate;
    private final LocalDateTime endDate;
    private final SaleStatus status;
}
