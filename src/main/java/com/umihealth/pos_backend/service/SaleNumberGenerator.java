package com.umihealth.pos_backend.service;

import com.umihealth.pos_backend.config.PosProperties;
import com.umihealth.pos_backend.exception.SaleNumberGenerationException;
import com.umihealth.pos_backend.repository.SaleRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Year;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

/**
 * Produces human-readable sale numbers of the form {@code SALE20261234}:
 * prefix, current year, random four-digit suffix.
 * <p>
 * Uniqueness is checked against the store; the unique key on {@code sales.sale_number}
 * catches the rare race between that check and commit.
 */
@Component
@Slf4j
public class SaleNumberGenerator {

    static final int SUFFIX_MIN = 1000;
    static final int SUFFIX_MAX_EXCLUSIVE = 9999;

    private final SaleRepository saleRepository;
    private final PosProperties.Sales settings;
    private final Supplier<Random> randomSource;
    private final Clock clock;

    @Autowired
    public SaleNumberGenerator(SaleRepository saleRepository, PosProperties posProperties) {
        this(saleRepository, posProperties, ThreadLocalRandom::current, Clock.systemUTC());
    }

    SaleNumberGenerator(SaleRepository saleRepository, PosProperties posProperties,
                        Supplier<Random> randomSource, Clock clock) {
        this.saleRepository = saleRepository;
        this.settings = posProperties.getSales();
        this.randomSource = randomSource;
        this.clock = clock;
    }

    /**
     * @throws SaleNumberGenerationException if every attempt collides with an existing sale
     */
    public String generate() {
        String prefix = settings.getNumberPrefix() + Year.now(clock).getValue();
        int maxAttempts = settings.getNumberMaxAttempts();

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            int suffix = randomSource.get().nextInt(SUFFIX_MIN, SUFFIX_MAX_EXCLUSIVE);
            String candidate = prefix + suffix;

            if (!saleRepository.existsBySaleNumber(candidate)) {
                if (attempt > 1) {
                    log.debug("Sale number {} found after {} attempts", candidate, attempt);
                }
                return candidate;
            }
            log.debug("Sale number {} already taken (attempt {}/{})", candidate, attempt, maxAttempts);
        }

        log.error("Sale number space exhausted for prefix {} after {} attempts", prefix, maxAttempts);
        throw new SaleNumberGenerationException(maxAttempts);
    }
}
