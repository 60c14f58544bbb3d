package com.bastion.rbacservice.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Audit trail switch, bound from {@code bastion.audit.*}.
 *
 * @param enabled record mutating calls (default true)
 */
@ConfigurationProperties(prefix = "bastion.audit")
public record AuditProperties(Boolean enabled) {

    public AuditProperties {
        if (enabled == null) {
            enabled = Boolean.TRUE;
        }
    }
}
