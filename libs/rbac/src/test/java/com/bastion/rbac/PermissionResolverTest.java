package com.bastion.rbac;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.bastion.crypto.EncryptedFieldCodec;
import com.bastion.rbac.audit.AuditAction;
import com.bastion.rbac.model.RoleAssignment;
import com.bastion.rbac.model.RoleDefinition;
import com.bastion.security.TenantKey;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("PermissionResolver")
class PermissionResolverTest {

    private final TenantKey tenant = TenantKey.random();
    private TestStore store;
    private PermissionResolver rbac;

    @BeforeEach
    void setUp() {
        store = TestStore.migrated();
        rbac = store.resolver(EncryptedFieldCodec.passthrough());
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    @Nested
    @DisplayName("roles")
    class Roles {

        @Test
        @DisplayName("creates a role with its description")
        void create() {
            assertThat(rbac.addRole(tenant, "admin", "Administrators")).isTrue();

            assertThat(rbac.getRole(tenant, "admin"))
                    .contains(new RoleDefinition("admin", "Administrators"));
            assertThat(rbac.roles(tenant)).containsExactly(new RoleDefinition("admin", "Administrators"));
        }

        @Test
        @DisplayName("creating an existing role succeeds and keeps one row")
        void idempotentCreate() {
            rbac.addRole(tenant, "admin", "first");

            assertThat(rbac.addRole(tenant, "admin", "second")).isTrue();

            assertThat(store.count("rbac_role")).isEqualTo(1);
            assertThat(rbac.getRole(tenant, "admin")).map(RoleDefinition::description).contains("first");
        }

        @Test
        @DisplayName("lists roles ordered by name")
        void ordered() {
            rbac.addRole(tenant, "viewer", null);
            rbac.addRole(tenant, "admin", null);
            rbac.addRole(tenant, "editor", null);

            assertThat(rbac.roles(tenant))
                    .extracting(RoleDefinition::name)
                    .containsExactly("admin", "editor", "viewer");
        }

        @Test
        @DisplayName("deleting a missing role succeeds")
        void idempotentDelete() {
            assertThat(rbac.delRole(tenant, "ghost")).isTrue();
            assertThat(rbac.getRole(tenant, "ghost")).isEmpty();
        }

        @Test
        @DisplayName("deleting a role cascades to its permissions and memberships")
        void cascade() {
            rbac.addRole(tenant, "admin", null);
            rbac.addRole(tenant, "viewer", null);
            rbac.addPermission(tenant, "admin", "manage_users");
            rbac.addPermission(tenant, "viewer", "read");
            rbac.addMembership(tenant, "alice", "admin");
            rbac.addMembership(tenant, "alice", "viewer");

            rbac.delRole(tenant, "admin");

            assertThat(rbac.hasPermission(tenant, "admin", "manage_users")).isFalse();
            assertThat(rbac.hasMembership(tenant, "alice", "admin")).isFalse();
            assertThat(rbac.getUserRoles(tenant, "alice")).containsExactly("viewer");
            assertThat(store.count("rbac_permission")).isEqualTo(1);
            assertThat(store.count("rbac_membership")).isEqualTo(1);
        }

        @Test
        @DisplayName("recreating a deleted role starts empty")
        void recreate() {
            rbac.addRole(tenant, "admin", null);
            rbac.addPermission(tenant, "admin", "manage_users");
            rbac.delRole(tenant, "admin");

            rbac.addRole(tenant, "admin", null);

            assertThat(rbac.getPermissions(tenant, "admin")).isEmpty();
        }
    }

    @Nested
    @DisplayName("permissions")
    class Permissions {

        @BeforeEach
        void role() {
            rbac.addRole(tenant, "admin", null);
        }

        @Test
        @DisplayName("grants to an existing role")
        void grant() {
            assertThat(rbac.addPermission(tenant, "admin", "manage_users")).isTrue();
            assertThat(rbac.hasPermission(tenant, "admin", "manage_users")).isTrue();
            assertThat(rbac.getPermissions(tenant, "admin")).containsExactly("manage_users");
        }

        @Test
        @DisplayName("granting to a missing role returns false and writes nothing")
        void missingRole() {
            assertThat(rbac.addPermission(tenant, "ghost", "read")).isFalse();
            assertThat(store.count("rbac_permission")).isZero();
        }

        @Test
        @DisplayName("granting twice keeps one row")
        void idempotentGrant() {
            rbac.addPermission(tenant, "admin", "read");
            assertThat(rbac.addPermission(tenant, "admin", "read")).isTrue();
            assertThat(store.count("rbac_permission")).isEqualTo(1);
        }

        @Test
        @DisplayName("revoking is idempotent")
        void revoke() {
            rbac.addPermission(tenant, "admin", "read");

            assertThat(rbac.delPermission(tenant, "admin", "read")).isTrue();
            assertThat(rbac.delPermission(tenant, "admin", "read")).isTrue();
            assertThat(rbac.delPermission(tenant, "ghost", "read")).isTrue();
            assertThat(rbac.hasPermission(tenant, "admin", "read")).isFalse();
        }

        @Test
        @DisplayName("permissions of a missing role are empty")
        void emptyForMissingRole() {
            assertThat(rbac.getPermissions(tenant, "ghost")).isEmpty();
            assertThat(rbac.hasPermission(tenant, "ghost", "read")).isFalse();
        }
    }

    @Nested
    @DisplayName("memberships")
    class Memberships {

        @BeforeEach
        void role() {
            rbac.addRole(tenant, "admin", null);
        }

        @Test
        @DisplayName("adds a member to an existing role")
        void add() {
            assertThat(rbac.addMembership(tenant, "alice", "admin")).isTrue();
            assertThat(rbac.hasMembership(tenant, "alice", "admin")).isTrue();
            assertThat(rbac.getRoleMembers(tenant, "admin")).containsExactly("alice");
            assertThat(rbac.getUserRoles(tenant, "alice")).containsExactly("admin");
        }

        @Test
        @DisplayName("adding to a missing role returns false")
        void missingRole() {
            assertThat(rbac.addMembership(tenant, "alice", "ghost")).isFalse();
            assertThat(rbac.getUserRoles(tenant, "alice")).isEmpty();
        }

        @Test
        @DisplayName("adding and removing are idempotent")
        void idempotent() {
            rbac.addMembership(tenant, "alice", "admin");
            assertThat(rbac.addMembership(tenant, "alice", "admin")).isTrue();
            assertThat(store.count("rbac_membership")).isEqualTo(1);

            assertThat(rbac.delMembership(tenant, "alice", "admin")).isTrue();
            assertThat(rbac.delMembership(tenant, "alice", "admin")).isTrue();
            assertThat(rbac.hasMembership(tenant, "alice", "admin")).isFalse();
        }
    }

    @Nested
    @DisplayName("resolution")
    class Resolution {

        @Test
        @DisplayName("admin/alice lifecycle")
        void adminAliceScenario() {
            rbac.addRole(tenant, "admin", null);
            rbac.addPermission(tenant, "admin", "manage_users");
            rbac.addMembership(tenant, "alice", "admin");

            assertThat(rbac.userHasPermission(tenant, "alice", "manage_users")).isTrue();
            assertThat(rbac.whichUsersCan(tenant, "manage_users"))
                    .containsExactly(new RoleAssignment("alice", "admin"));

            rbac.delRole(tenant, "admin");

            assertThat(rbac.userHasPermission(tenant, "alice", "manage_users")).isFalse();
            assertThat(rbac.whichUsersCan(tenant, "manage_users")).isEmpty();
        }

        @Test
        @DisplayName("user permissions are the union over roles")
        void union() {
            rbac.addRole(tenant, "editor", null);
            rbac.addRole(tenant, "viewer", null);
            rbac.addPermission(tenant, "editor", "write");
            rbac.addPermission(tenant, "editor", "read");
            rbac.addPermission(tenant, "viewer", "read");
            rbac.addMembership(tenant, "bob", "editor");
            rbac.addMembership(tenant, "bob", "viewer");

            assertThat(rbac.getUserPermissions(tenant, "bob")).containsExactly("read", "write");
            assertThat(rbac.whichRolesCan(tenant, "read")).containsExactly("editor", "viewer");
        }

        @Test
        @DisplayName("reverse lookup lists a user once per qualifying role")
        void perRolePairs() {
            rbac.addRole(tenant, "editor", null);
            rbac.addRole(tenant, "viewer", null);
            rbac.addPermission(tenant, "editor", "read");
            rbac.addPermission(tenant, "viewer", "read");
            rbac.addMembership(tenant, "bob", "editor");
            rbac.addMembership(tenant, "bob", "viewer");
            rbac.addMembership(tenant, "carol", "viewer");

            assertThat(rbac.whichUsersCan(tenant, "read"))
                    .containsExactlyInAnyOrder(
                            new RoleAssignment("bob", "editor"),
                            new RoleAssignment("bob", "viewer"),
                            new RoleAssignment("carol", "viewer"));
        }

        @Test
        @DisplayName("an unknown tenant sees empty results")
        void emptyTenant() {
            TenantKey empty = TenantKey.random();

            assertThat(rbac.roles(empty)).isEmpty();
            assertThat(rbac.getUserPermissions(empty, "alice")).isEmpty();
            assertThat(rbac.whichRolesCan(empty, "read")).isEmpty();
            assertThat(rbac.whichUsersCan(empty, "read")).isEmpty();
            assertThat(rbac.userHasPermission(empty, "alice", "read")).isFalse();
        }

        @Test
        @DisplayName("counts granted and denied checks")
        void checkMetrics() {
            rbac.addRole(tenant, "admin", null);
            rbac.addPermission(tenant, "admin", "manage_users");
            rbac.addMembership(tenant, "alice", "admin");

            rbac.userHasPermission(tenant, "alice", "manage_users");
            rbac.userHasPermission(tenant, "alice", "delete_everything");
            rbac.userHasPermission(tenant, "bob", "manage_users");

            assertThat(store.registry.get("bastion.rbac.checks").tag("outcome", "granted").counter().count())
                    .isEqualTo(1.0);
            assertThat(store.registry.get("bastion.rbac.checks").tag("outcome", "denied").counter().count())
                    .isEqualTo(2.0);
        }
    }

    @Nested
    @DisplayName("tenant isolation")
    class TenantIsolation {

        private final TenantKey other = TenantKey.random();

        @Test
        @DisplayName("identically named entities in two tenants never mix")
        void noCrossTenantReads() {
            rbac.addRole(tenant, "admin", "tenant A");
            rbac.addPermission(tenant, "admin", "manage_users");
            rbac.addMembership(tenant, "alice", "admin");

            rbac.addRole(other, "admin", "tenant B");

            assertThat(rbac.userHasPermission(other, "alice", "manage_users")).isFalse();
            assertThat(rbac.getPermissions(other, "admin")).isEmpty();
            assertThat(rbac.getRoleMembers(other, "admin")).isEmpty();
            assertThat(rbac.getRole(other, "admin")).map(RoleDefinition::description).contains("tenant B");
        }

        @Test
        @DisplayName("a membership cannot point at another tenant's role")
        void noCrossTenantWrites() {
            rbac.addRole(tenant, "admin", null);

            assertThat(rbac.addMembership(other, "mallory", "admin")).isFalse();
            assertThat(rbac.addPermission(other, "admin", "manage_users")).isFalse();
            assertThat(rbac.getRoleMembers(tenant, "admin")).isEmpty();
        }

        @Test
        @DisplayName("deleting a role in one tenant leaves the other intact")
        void scopedDelete() {
            rbac.addRole(tenant, "admin", null);
            rbac.addRole(other, "admin", null);
            rbac.addMembership(other, "bob", "admin");

            rbac.delRole(tenant, "admin");

            assertThat(rbac.hasMembership(other, "bob", "admin")).isTrue();
        }
    }

    @Nested
    @DisplayName("audit")
    class Audit {

        @Test
        @DisplayName("every mutating call leaves one entry, no-ops included")
        void onePerMutation() {
            rbac.addRole(tenant, "admin", null);
            rbac.addRole(tenant, "admin", null);
            rbac.addPermission(tenant, "admin", "read");
            rbac.addPermission(tenant, "ghost", "read");
            rbac.addMembership(tenant, "alice", "admin");
            rbac.delMembership(tenant, "alice", "admin");
            rbac.delPermission(tenant, "admin", "read");
            rbac.delRole(tenant, "admin");

            assertThat(rbac.auditTrail(tenant, 100))
                    .extracting(e -> e.action())
                    .containsExactly(
                            AuditAction.DELETE_ROLE,
                            AuditAction.REMOVE_PERMISSION,
                            AuditAction.REMOVE_MEMBERSHIP,
                            AuditAction.ADD_MEMBERSHIP,
                            AuditAction.ADD_PERMISSION,
                            AuditAction.ADD_PERMISSION,
                            AuditAction.CREATE_ROLE,
                            AuditAction.CREATE_ROLE);
        }

        @Test
        @DisplayName("queries are not audited")
        void queriesNotAudited() {
            rbac.addRole(tenant, "admin", null);
            rbac.roles(tenant);
            rbac.userHasPermission(tenant, "alice", "read");
            rbac.whichUsersCan(tenant, "read");

            assertThat(store.count("rbac_audit_log")).isEqualTo(1);
        }

        @Test
        @DisplayName("details record the outcome")
        void details() {
            rbac.addPermission(tenant, "ghost", "read");

            var entry = rbac.auditTrail(tenant, 1).get(0);
            assertThat(entry.entityType()).isEqualTo("permission");
            assertThat(entry.entityId()).isEqualTo("ghost:read");
            assertThat(entry.details()).contains("\"result\":false").contains("\"changed\":false");
        }

        @Test
        @DisplayName("counts mutations per action")
        void mutationMetrics() {
            rbac.addRole(tenant, "admin", null);
            rbac.addRole(tenant, "viewer", null);

            assertThat(store.registry.get("bastion.rbac.mutations").tag("action", "create_role").counter().count())
                    .isEqualTo(2.0);
        }

        @Test
        @DisplayName("rejects limits outside 1..1000")
        void limits() {
            assertThatThrownBy(() -> rbac.auditTrail(tenant, 0)).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> rbac.auditTrail(tenant, 1001)).isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("validation")
    class Validation {

        @Test
        @DisplayName("malformed identifiers are caller errors and touch nothing")
        void malformed() {
            assertThatThrownBy(() -> rbac.addRole(tenant, "bad role", null))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> rbac.addPermission(tenant, "admin", "drop table;"))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> rbac.addMembership(tenant, "", "admin"))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> rbac.userHasPermission(tenant, "alice", "x".repeat(129)))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> rbac.addRole(tenant, "admin", "d".repeat(257)))
                    .isInstanceOf(IllegalArgumentException.class);

            assertThat(store.count("rbac_audit_log")).isZero();
        }

        @Test
        @DisplayName("a null tenant is rejected")
        void nullTenant() {
            assertThatThrownBy(() -> rbac.roles(null)).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> rbac.addRole(null, "admin", null))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
