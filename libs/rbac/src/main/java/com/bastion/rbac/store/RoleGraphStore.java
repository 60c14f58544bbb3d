package com.bastion.rbac.store;

import com.bastion.rbac.model.RoleAssignment;
import com.bastion.rbac.model.RoleDefinition;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.springframework.jdbc.core.JdbcOperations;

/**
 * Tenant-scoped access to roles, permissions and memberships.
 *
 * <p>All values in and out are in <em>stored</em> form: user identifiers, permission names and
 * descriptions arrive already encoded and are returned undecoded. Encoding is the caller's job.
 *
 * <p>Inserts of an existing row throw {@link org.springframework.dao.DuplicateKeyException};
 * inserts referencing a missing role throw {@link
 * org.springframework.dao.DataIntegrityViolationException}.
 */
public interface RoleGraphStore {

    /** Opens a store view over the operations of one unit of work. */
    @FunctionalInterface
    interface Factory {
        RoleGraphStore open(JdbcOperations jdbc);
    }

    boolean roleExists(String tenant, String role);

    Optional<RoleDefinition> findRole(String tenant, String role);

    /** Roles of the tenant ordered by name. */
    List<RoleDefinition> listRoles(String tenant);

    void insertRole(String tenant, String role, String description);

    /** Deletes the role and every permission and membership referencing it. */
    int deleteRole(String tenant, String role);

    boolean permissionExists(String tenant, String role, String permission);

    void insertPermission(String tenant, String role, String permission);

    int deletePermission(String tenant, String role, String permission);

    Set<String> permissionsOfRole(String tenant, String role);

    boolean membershipExists(String tenant, String user, String role);

    void insertMembership(String tenant, String user, String role);

    int deleteMembership(String tenant, String user, String role);

    Set<String> rolesOfUser(String tenant, String user);

    Set<String> membersOfRole(String tenant, String role);

    /** Whether any role of {@code user} holds {@code permission}. */
    boolean userHasPermission(String tenant, String user, String permission);

    /** Union of the permissions of every role of {@code user}. */
    Set<String> permissionsOfUser(String tenant, String user);

    Set<String> rolesWithPermission(String tenant, String permission);

    /** Distinct (user, role) pairs where the role holds {@code permission}. */
    List<RoleAssignment> assignmentsWithPermission(String tenant, String permission);
}
