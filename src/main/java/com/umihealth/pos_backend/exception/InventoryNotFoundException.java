package com.umihealth.pos_backend.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

import java.util.UUID;

/**
 * A sale referenced a product the branch holds no inventory record for.
 * Reported as a bad request, not a 404: the sale itself is what was rejected.
 */
@Getter
public class InventoryNotFoundException extends ApiException {

    private final UUID productId;

    public InventoryNotFoundException(UUID productId) {
        super(String.format("Inventory not found for product %s", productId),
                HttpStatus.BAD_REQUEST,
                "INVENTORY_NOT_FOUND");
        this.productId = productId;
    }
}
