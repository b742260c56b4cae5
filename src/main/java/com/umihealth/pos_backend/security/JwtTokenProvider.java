package com.umihealth.pos_backend.security;

import com.umihealth.pos_backend.config.PosProperties;
import com.umihealth.pos_backend.enums.Role;
import com.umihealth.pos_backend.exception.UnauthorizedException;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.io.Decoders;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.util.UUID;

/**
 * Validates bearer tokens issued by the identity service and turns their claims
 * into a {@link TenantContext}. Tokens are never issued here.
 */
@Component
@Slf4j
public class JwtTokenProvider {

    public static final String TENANT_CLAIM = "TenantId";
    public static final String BRANCH_CLAIM = "BranchId";
    public static final String ROLE_CLAIM = "role";

    private final SecretKey signingKey;

    public JwtTokenProvider(PosProperties posProperties) {
        String secret = posProperties.getSecurity().getJwtSecret();
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("pos.security.jwt-secret must be configured");
        }
        this.signingKey = Keys.hmacShaKeyFor(Decoders.BASE64.decode(secret));
    }

    /**
     * Parses and verifies the token.
     *
     * @throws io.jsonwebtoken.JwtException when the signature is invalid or the token expired
     * @throws UnauthorizedException when a tenant, branch or user claim is missing or malformed,
     *                               or the role claim does not name a known role
     */
    public TenantContext parseToken(String token) {
        Claims claims = Jwts.parserBuilder()
                .setSigningKey(signingKey)
                .build()
                .parseClaimsJws(token)
                .getBody();

        return TenantContext.builder()
                .tenantId(requireUuid(claims.get(TENANT_CLAIM, String.class), TENANT_CLAIM))
                .branchId(requireUuid(claims.get(BRANCH_CLAIM, String.class), BRANCH_CLAIM))
                .userId(requireUuid(claims.getSubject(), "sub"))
                .role(requireRole(claims.get(ROLE_CLAIM, String.class)))
                .build();
    }

    private Role requireRole(String value) {
        Role role = Role.fromClaim(value);
        if (role == null) {
            log.warn("Unrecognised role claim: {}", value);
            throw new UnauthorizedException("Missing or unrecognised role claim in token");
        }
        return role;
    }

    private UUID requireUuid(String value, String claimName) {
        if (value == null || value.isBlank()) {
            throw new UnauthorizedException("User, tenant, or branch not found in token");
        }
        try {
            return UUID.fromString(value);
        } catch (IllegalArgumentException e) {
            log.warn("Malformed {} claim: {}", claimName, value);
            throw new UnauthorizedException("Malformed " + claimName + " claim in token");
        }
    }
}
