package com.umihealth.pos_backend.controller;

import com.umihealth.pos_backend.config.PosProperties;
import com.umihealth.pos_backend.config.SecurityConfig;
import com.umihealth.pos_backend.enums.converter.StringToSaleStatusConverter;
import com.umihealth.pos_backend.exception.GlobalExceptionHandler;
import com.umihealth.pos_backend.security.JwtAuthenticationFilter;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Import;

/**
 * Security chain, error handling and request converters shared by the controller slice tests.
 * The token provider itself is mocked in each test.
 */
@TestConfiguration
@EnableConfigurationProperties(PosProperties.class)
@Import({SecurityConfig.class, JwtAuthenticationFilter.class, GlobalExceptionHandler.class,
        StringToSaleStatusConverter.class})
public class WebMvcTestConfig {
}
