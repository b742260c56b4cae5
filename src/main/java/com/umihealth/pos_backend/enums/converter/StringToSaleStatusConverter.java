package com.umihealth.pos_backend.enums.converter;

import com.umihealth.pos_backend.enums.SaleStatus;
import org.springframework.core.convert.converter.Converter;
import org.springframework.stereotype.Component;

/**
 * Lets request parameters such as {@code ?status=completed} use the same spellings as JSON bodies.
 */
@Component
public class StringToSaleStatusConverter implements Converter<String, SaleStatus> {

    @Override
    public SaleStatus convert(String source) {
        if (source.isBlank()) {
            return null;
        }
        return SaleStatus.fromString(source);
    }
}
