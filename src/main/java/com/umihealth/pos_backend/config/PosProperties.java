package com.umihealth.pos_backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "pos")
public class PosProperties {

    private String timezone = "UTC";

    private Sales sales = new Sales();

    private Security security = new Security();

    @Data
    public static class Sales {
        private String numberPrefix = "SALE";
        private int numberMaxAttempts = 10;
    }

    @Data
    public static class Security {
        // Base64-encoded HMAC key shared with the token issuer
        private String jwtSecret;
        private List<String> allowedOrigins = new ArrayList<>(List.of("http://localhost:3000"));
    }
}
