package com.umihealth.pos_backend.dto.request;

import com.umihealth.pos_backend.enums.PaymentStatus;
import com.umihealth.pos_backend.enums.SaleStatus;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Fields of a sale that remain editable after creation. Null leaves a field unchanged.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SaleUpdateRequest {

    private SaleStatus status;

    private PaymentStatus paymentStatus;

    @Size(max = 2000, message = "Notes cannot exceed 2000 characters")
    private String notes;
}
