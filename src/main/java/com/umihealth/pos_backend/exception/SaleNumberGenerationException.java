package com.umihealth.pos_backend.exception;

import org.springframework.http.HttpStatus;

public class SaleNumberGenerationException extends ApiException {
    public SaleNumberGenerationException(int attempts) {
        super(String.format("Unable to generate unique sale number after %d attempts", attempts),
                HttpStatus.CONFLICT,
                "SALE_NUMBER_EXHAUSTED");
    }
}
