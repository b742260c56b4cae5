package com.umihealth.pos_backend.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SalesStats {
    private long totalSales;
    private BigDecimal totalRevenue;
    private long completedSales;
    private long pendingSales;
    private long todaySales;
    private BigDecimal todayRevenue;
}
