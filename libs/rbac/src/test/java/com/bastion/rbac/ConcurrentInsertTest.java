package com.bastion.rbac;

import static org.assertj.core.api.Assertions.assertThat;

import com.bastion.crypto.EncryptedFieldCodec;
import com.bastion.rbac.audit.AuditAction;
import com.bastion.rbac.audit.AuditEntry;
import com.bastion.rbac.store.JdbcRoleGraphStore;
import com.bastion.rbac.store.RoleGraphStore;
import com.bastion.security.TenantKey;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcOperations;

/**
 * Two writers that both pass the existence check: the second insert hits the unique constraint.
 * The loser's transaction is rolled back, then the loser reports success and is audited and
 * counted as a call that changed nothing.
 */
@DisplayName("Concurrent inserts")
class ConcurrentInsertTest {

    private final TenantKey tenant = TenantKey.random();
    private TestStore store;
    private PermissionResolver racing;

    /** Association checks always miss, as if a concurrent writer had not committed yet. */
    private static final class StaleReads extends ForwardingStore {
        StaleReads(JdbcOperations jdbc) {
            super(new JdbcRoleGraphStore(jdbc));
        }

        @Override
        public boolean permissionExists(String tenant, String role, String permission) {
            return false;
        }

        @Override
        public boolean membershipExists(String tenant, String user, String role) {
            return false;
        }
    }

    @BeforeEach
    void setUp() {
        store = TestStore.migrated();
        racing = store.resolver(EncryptedFieldCodec.passthrough(), StaleReads::new);
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    @Test
    @DisplayName("losing role create reports success and is audited as unchanged")
    void roleRace() {
        RoleGraphStore.Factory missesRoles =
                jdbc ->
                        new ForwardingStore(new JdbcRoleGraphStore(jdbc)) {
                            @Override
                            public boolean roleExists(String tenant, String role) {
                                return false;
                            }
                        };
        PermissionResolver rbac = store.resolver(EncryptedFieldCodec.passthrough(), missesRoles);

        assertThat(rbac.addRole(tenant, "admin", null)).isTrue();
        assertThat(rbac.addRole(tenant, "admin", null)).isTrue();

        assertThat(store.count("rbac_role")).isEqualTo(1);
        assertThat(store.count("rbac_audit_log")).isEqualTo(2);
        assertThat(mutations("create_role")).isEqualTo(2.0);
        assertThat(store.executor.breaker().state()).isEqualTo(CircuitBreaker.State.CLOSED);

        AuditEntry loser = rbac.auditTrail(tenant, 1).get(0);
        assertThat(loser.action()).isEqualTo(AuditAction.CREATE_ROLE);
        assertThat(loser.entityId()).isEqualTo("admin");
        assertThat(loser.details()).contains("\"result\":true").contains("\"changed\":false");
    }

    @Test
    @DisplayName("losing grant and membership inserts report success and are audited")
    void associationRace() {
        store.resolver(EncryptedFieldCodec.passthrough()).addRole(tenant, "admin", null);

        assertThat(racing.addPermission(tenant, "admin", "read")).isTrue();
        assertThat(racing.addPermission(tenant, "admin", "read")).isTrue();
        assertThat(racing.addMembership(tenant, "alice", "admin")).isTrue();
        assertThat(racing.addMembership(tenant, "alice", "admin")).isTrue();

        assertThat(store.count("rbac_permission")).isEqualTo(1);
        assertThat(store.count("rbac_membership")).isEqualTo(1);
        assertThat(store.count("rbac_audit_log")).isEqualTo(5);
        assertThat(mutations("add_permission")).isEqualTo(2.0);
        assertThat(mutations("add_membership")).isEqualTo(2.0);
    }

    @Test
    @DisplayName("a grant to a role deleted after the existence check reports false and is audited")
    void vanishedRole() {
        RoleGraphStore.Factory seesGhosts =
                jdbc ->
                        new ForwardingStore(new JdbcRoleGraphStore(jdbc)) {
                            @Override
                            public boolean roleExists(String tenant, String role) {
                                return true;
                            }
                        };
        PermissionResolver rbac = store.resolver(EncryptedFieldCodec.passthrough(), seesGhosts);

        assertThat(rbac.addPermission(tenant, "ghost", "read")).isFalse();
        assertThat(rbac.addMembership(tenant, "alice", "ghost")).isFalse();
        assertThat(store.count("rbac_permission")).isZero();
        assertThat(store.count("rbac_membership")).isZero();
        assertThat(store.count("rbac_audit_log")).isEqualTo(2);
        assertThat(rbac.auditTrail(tenant, 2))
                .extracting(AuditEntry::details)
                .allSatisfy(details -> assertThat(details).contains("\"result\":false"));
    }

    private double mutations(String action) {
        return store.registry.get("bastion.rbac.mutations").tag("action", action).counter().count();
    }
}
