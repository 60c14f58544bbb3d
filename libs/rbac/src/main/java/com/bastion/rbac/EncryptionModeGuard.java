package com.bastion.rbac;

import com.bastion.crypto.EncryptedFieldCodec;
import com.bastion.database.StoreExecutor;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Stops a process from starting against a store written under a different encryption mode or key.
 *
 * <p>The first start records the mode ({@code enabled}/{@code disabled}) and the key fingerprint
 * in {@code rbac_store_settings}. Later starts compare the configured codec against that record.
 * On a mismatch, existing rows would no longer match their lookups, so {@link #verify()} throws
 * unless the operator explicitly allows the change; then the new mode is recorded and a warning
 * is logged. Existing rows are never re-encrypted.
 */
public final class EncryptionModeGuard {

    private static final Logger log = LoggerFactory.getLogger(EncryptionModeGuard.class);

    static final String MODE_KEY = "encryption.mode";
    static final String FINGERPRINT_KEY = "encryption.key-fingerprint";
    static final String NO_KEY = "none";

    private final StoreExecutor executor;
    private final EncryptedFieldCodec codec;
    private final boolean allowModeChange;

    public EncryptionModeGuard(
            StoreExecutor executor, EncryptedFieldCodec codec, boolean allowModeChange) {
        if (executor == null || codec == null) {
            throw new IllegalArgumentException("executor and codec must not be null");
        }
        this.executor = executor;
        this.codec = codec;
        this.allowModeChange = allowModeChange;
    }

    /**
     * Compares the configured mode with the recorded one, recording it on first start.
     *
     * @throws IllegalStateException if they differ and mode changes are not allowed
     */
    public void verify() {
        try {
            executor.inTransaction(this::verifyIn);
        } catch (DuplicateKeyException e) {
            // another process recorded the mode first; compare against what it wrote
            executor.inTransaction(this::verifyIn);
        }
    }

    private Void verifyIn(JdbcTemplate jdbc) {
        String mode = configuredMode();
        String fingerprint = configuredFingerprint();
        Map<String, String> recorded = readSettings(jdbc);

        if (recorded.isEmpty()) {
            insert(jdbc, MODE_KEY, mode);
            insert(jdbc, FINGERPRINT_KEY, fingerprint);
            log.info("Recorded store encryption mode '{}' (key {})", mode, fingerprint);
            return null;
        }

        String recordedMode = recorded.getOrDefault(MODE_KEY, NO_KEY);
        String recordedFingerprint = recorded.getOrDefault(FINGERPRINT_KEY, NO_KEY);
        if (recordedMode.equals(mode) && recordedFingerprint.equals(fingerprint)) {
            log.debug("Store encryption mode '{}' (key {}) matches configuration", mode, fingerprint);
            return null;
        }

        String mismatch =
                "Store was written with encryption mode '%s' (key %s) but is configured for '%s' (key %s)"
                        .formatted(recordedMode, recordedFingerprint, mode, fingerprint);
        if (!allowModeChange) {
            throw new IllegalStateException(
                    mismatch
                            + "; existing rows would stop matching. Set"
                            + " bastion.encryption.allow-mode-change=true to accept the change.");
        }
        log.warn("{}; mode change allowed, existing rows are NOT re-encrypted", mismatch);
        upsert(jdbc, MODE_KEY, mode);
        upsert(jdbc, FINGERPRINT_KEY, fingerprint);
        return null;
    }

    String configuredMode() {
        return codec.isEnabled() ? "enabled" : "disabled";
    }

    String configuredFingerprint() {
        return codec.keyFingerprint().orElse(NO_KEY);
    }

    private static Map<String, String> readSettings(JdbcTemplate jdbc) {
        List<Map.Entry<String, String>> rows =
                jdbc.query(
                        "SELECT setting_key, setting_value FROM rbac_store_settings"
                                + " WHERE setting_key IN (?, ?)",
                        (rs, rowNum) ->
                                Map.entry(rs.getString("setting_key"), rs.getString("setting_value")),
                        MODE_KEY,
                        FINGERPRINT_KEY);
        return rows.stream().collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue));
    }

    private static void insert(JdbcTemplate jdbc, String key, String value) {
        jdbc.update(
                "INSERT INTO rbac_store_settings (setting_key, setting_value) VALUES (?, ?)",
                key,
                value);
    }

    private static void upsert(JdbcTemplate jdbc, String key, String value) {
        int updated =
                jdbc.update(
                        "UPDATE rbac_store_settings SET setting_value = ?, updated_at = CURRENT_TIMESTAMP"
                                + " WHERE setting_key = ?",
                        value,
                        key);
        if (updated == 0) {
            insert(jdbc, key, value);
        }
    }
}
