package com.umihealth.pos_backend.security;

import com.umihealth.pos_backend.enums.Role;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.UUID;

/**
 * Identity of the caller as established by the authentication layer.
 * Services receive it ready-made and never look at the token it came from.
 */
@Getter
@Builder
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class TenantContext {
    private final UUID tenantId;
    private final UUID branchId;
    private final UUID userId;
    private final Role role;
}
