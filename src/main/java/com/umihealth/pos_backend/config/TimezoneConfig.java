package com.umihealth.pos_backend.config;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;

import java.util.TimeZone;

@Configuration
@RequiredArgsConstructor
@Slf4j
public class TimezoneConfig {

    private final PosProperties posProperties;

    @PostConstruct
    public void init() {
        TimeZone.setDefault(TimeZone.getTimeZone(posProperties.getTimezone()));
        log.info("Application timezone set to: {}", TimeZone.getDefault().getID());
    }
}
