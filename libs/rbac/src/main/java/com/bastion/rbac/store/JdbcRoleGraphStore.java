package com.bastion.rbac.store;

import com.bastion.rbac.model.RoleAssignment;
import com.bastion.rbac.model.RoleDefinition;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.springframework.jdbc.core.JdbcOperations;
import org.springframework.jdbc.core.RowMapper;

/** {@link RoleGraphStore} over plain SQL. Every statement filters on {@code tenant}. */
public final class JdbcRoleGraphStore implements RoleGraphStore {

    private static final RowMapper<RoleDefinition> ROLE_MAPPER =
            (rs, rowNum) -> new RoleDefinition(rs.getString("name"), rs.getString("description"));

    private final JdbcOperations jdbc;

    public JdbcRoleGraphStore(JdbcOperations jdbc) {
        if (jdbc == null) {
            throw new IllegalArgumentException("jdbc must not be null");
        }
        this.jdbc = jdbc;
    }

    @Override
    public boolean roleExists(String tenant, String role) {
        return exists("SELECT 1 FROM rbac_role WHERE tenant = ? AND name = ?", tenant, role);
    }

    @Override
    public Optional<RoleDefinition> findRole(String tenant, String role) {
        return jdbc
                .query(
                        "SELECT name, description FROM rbac_role WHERE tenant = ? AND name = ?",
                        ROLE_MAPPER,
                        tenant,
                        role)
                .stream()
                .findFirst();
    }

    @Override
    public List<RoleDefinition> listRoles(String tenant) {
        return jdbc.query(
                "SELECT name, description FROM rbac_role WHERE tenant = ? ORDER BY name",
                ROLE_MAPPER,
                tenant);
    }

    @Override
    public void insertRole(String tenant, String role, String description) {
        jdbc.update(
                "INSERT INTO rbac_role (tenant, name, description) VALUES (?, ?, ?)",
                tenant,
                role,
                description);
    }

    @Override
    public int deleteRole(String tenant, String role) {
        // also covered by ON DELETE CASCADE
        jdbc.update("DELETE FROM rbac_permission WHERE tenant = ? AND role = ?", tenant, role);
        jdbc.update("DELETE FROM rbac_membership WHERE tenant = ? AND role = ?", tenant, role);
        return jdbc.update("DELETE FROM rbac_role WHERE tenant = ? AND name = ?", tenant, role);
    }

    @Override
    public boolean permissionExists(String tenant, String role, String permission) {
        return exists(
                "SELECT 1 FROM rbac_permission WHERE tenant = ? AND role = ? AND name = ?",
                tenant,
                role,
                permission);
    }

    @Override
    public void insertPermission(String tenant, String role, String permission) {
        jdbc.update(
                "INSERT INTO rbac_permission (tenant, role, name) VALUES (?, ?, ?)",
                tenant,
                role,
                permission);
    }

    @Override
    public int deletePermission(String tenant, String role, String permission) {
        return jdbc.update(
                "DELETE FROM rbac_permission WHERE tenant = ? AND role = ? AND name = ?",
                tenant,
                role,
                permission);
    }

    @Override
    public Set<String> permissionsOfRole(String tenant, String role) {
        return strings(
                "SELECT name FROM rbac_permission WHERE tenant = ? AND role = ? ORDER BY name",
                tenant,
                role);
    }

    @Override
    public boolean membershipExists(String tenant, String user, String role) {
        return exists(
                "SELECT 1 FROM rbac_membership WHERE tenant = ? AND username = ? AND role = ?",
                tenant,
                user,
                role);
    }

    @Override
    public void insertMembership(String tenant, String user, String role) {
        jdbc.update(
                "INSERT INTO rbac_membership (tenant, username, role) VALUES (?, ?, ?)",
                tenant,
                user,
                role);
    }

    @Override
    public int deleteMembership(String tenant, String user, String role) {
        return jdbc.update(
                "DELETE FROM rbac_membership WHERE tenant = ? AND username = ? AND role = ?",
                tenant,
                user,
                role);
    }

    @Override
    public Set<String> rolesOfUser(String tenant, String user) {
        return strings(
                "SELECT role FROM rbac_membership WHERE tenant = ? AND username = ? ORDER BY role",
                tenant,
                user);
    }

    @Override
    public Set<String> membersOfRole(String tenant, String role) {
        return strings(
                "SELECT username FROM rbac_membership WHERE tenant = ? AND role = ? ORDER BY username",
                tenant,
                role);
    }

    @Override
    public boolean userHasPermission(String tenant, String user, String permission) {
        return exists(
                "SELECT 1 FROM rbac_membership m"
                        + " JOIN rbac_permission p ON p.tenant = m.tenant AND p.role = m.role"
                        + " WHERE m.tenant = ? AND m.username = ? AND p.name = ?",
                tenant,
                user,
                permission);
    }

    @Override
    public Set<String> permissionsOfUser(String tenant, String user) {
        return strings(
                "SELECT DISTINCT p.name FROM rbac_membership m"
                        + " JOIN rbac_permission p ON p.tenant = m.tenant AND p.role = m.role"
                        + " WHERE m.tenant = ? AND m.username = ? ORDER BY p.name",
                tenant,
                user);
    }

    @Override
    public Set<String> rolesWithPermission(String tenant, String permission) {
        return strings(
                "SELECT role FROM rbac_permission WHERE tenant = ? AND name = ? ORDER BY role",
                tenant,
                permission);
    }

    @Override
    public List<RoleAssignment> assignmentsWithPermission(String tenant, String permission) {
        return jdbc.query(
                "SELECT DISTINCT m.username, m.role FROM rbac_permission p"
                        + " JOIN rbac_membership m ON m.tenant = p.tenant AND m.role = p.role"
                        + " WHERE p.tenant = ? AND p.name = ? ORDER BY m.role, m.username",
                (rs, rowNum) -> new RoleAssignment(rs.getString("username"), rs.getString("role")),
                tenant,
                permission);
    }

    private boolean exists(String sql, Object... args) {
        return !jdbc.queryForList(sql + " FETCH FIRST 1 ROWS ONLY", Integer.class, args).isEmpty();
    }

    private Set<String> strings(String sql, Object... args) {
        return new LinkedHashSet<>(jdbc.queryForList(sql, String.class, args));
    }
}
