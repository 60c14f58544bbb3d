package com.bastion.rbacservice.config;

import com.bastion.crypto.EncryptedFieldCodec;
import com.bastion.database.StoreExecutor;
import com.bastion.observability.MetricFactory;
import com.bastion.rbac.EncryptionModeGuard;
import com.bastion.rbac.PermissionResolver;
import com.bastion.rbac.audit.AuditRecorder;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the RBAC core: the field codec, the start-up encryption check, the audit recorder and the
 * resolver.
 */
@Configuration(proxyBeanMethods = false)
public class RbacConfiguration {

    private static final Logger log = LoggerFactory.getLogger(RbacConfiguration.class);

    @Bean
    public EncryptedFieldCodec encryptedFieldCodec(EncryptionProperties encryption) {
        EncryptedFieldCodec codec = EncryptedFieldCodec.fromSettings(encryption.toSettings());
        log.info(
                "Field encryption {} (key {})",
                codec.isEnabled() ? "enabled" : "disabled",
                codec.keyFingerprint().orElse("none"));
        return codec;
    }

    @Bean
    public EncryptionModeGuard encryptionModeGuard(
            StoreExecutor executor, EncryptedFieldCodec codec, EncryptionProperties encryption) {
        EncryptionModeGuard guard =
                new EncryptionModeGuard(executor, codec, encryption.allowModeChange());
        guard.verify();
        return guard;
    }

    @Bean
    public AuditRecorder auditRecorder(ObjectMapper objectMapper, AuditProperties audit) {
        return new AuditRecorder(objectMapper, Clock.systemUTC(), audit.enabled());
    }

    @Bean
    public PermissionResolver permissionResolver(
            StoreExecutor executor,
            EncryptedFieldCodec codec,
            AuditRecorder auditRecorder,
            MetricFactory metrics,
            EncryptionModeGuard guard) {
        // guard is a parameter so no call is served before the encryption mode is verified
        return new PermissionResolver(executor, codec, auditRecorder, metrics);
    }
}
