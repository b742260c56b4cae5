package com.umihealth.pos_backend.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

import java.util.UUID;

@Getter
public class InsufficientStockException extends ApiException {

    private final UUID productId;

    public InsufficientStockException(UUID productId, int available, int requested) {
        super(String.format("Insufficient inventory for product %s. Available: %d, Requested: %d",
                        productId, available, requested),
                HttpStatus.BAD_REQUEST,
                "INSUFFICIENT_STOCK");
        this.productId = productId;
    }
}
