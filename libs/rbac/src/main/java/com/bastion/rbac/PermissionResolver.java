package com.bastion.rbac;

import com.bastion.crypto.EncryptedField;
import com.bastion.crypto.EncryptedFieldCodec;
import com.bastion.database.StoreExecutor;
import com.bastion.observability.MetricFactory;
import com.bastion.rbac.audit.AuditAction;
import com.bastion.rbac.audit.AuditEntry;
import com.bastion.rbac.audit.AuditRecorder;
import com.bastion.rbac.model.RoleAssignment;
import com.bastion.rbac.model.RoleDefinition;
import com.bastion.rbac.store.JdbcRoleGraphStore;
import com.bastion.rbac.store.RoleGraphStore;
import com.bastion.security.IdentifierRules;
import com.bastion.security.TenantKey;
import io.micrometer.core.instrument.Counter;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;

/**
 * Tenant-scoped role graph: roles, their permissions, their members, and the questions asked of
 * them.
 *
 * <p>Every call takes the tenant first and never reads or writes another tenant's rows. User
 * identifiers, permission names and role descriptions are encoded through the {@link
 * EncryptedFieldCodec} before they reach the store and decoded on the way out.
 *
 * <p>Outcomes:
 *
 * <ul>
 *   <li>creating something that exists, or deleting something absent, returns {@code true}
 *   <li>granting to, or adding a member to, a missing role returns {@code false}
 *   <li>malformed identifiers throw {@link IllegalArgumentException}
 *   <li>an unavailable store throws {@link com.bastion.database.StoreUnavailableException}
 * </ul>
 *
 * <p>Each mutating call writes exactly one audit entry in the same transaction as its change,
 * including calls that turn out to be no-ops. A write that loses an insert race is rolled back
 * and then audited on its own as unchanged. Queries are not audited.
 *
 * <p>Thread-safe; holds no per-call state.
 */
public final class PermissionResolver {

    private static final Logger log = LoggerFactory.getLogger(PermissionResolver.class);

    /** Largest page {@link #auditTrail} will return. */
    public static final int MAX_AUDIT_LIMIT = 1000;

    private static final Comparator<RoleAssignment> BY_ROLE_THEN_USER =
            Comparator.comparing(RoleAssignment::role).thenComparing(RoleAssignment::user);

    private final StoreExecutor executor;
    private final EncryptedFieldCodec codec;
    private final AuditRecorder audit;
    private final RoleGraphStore.Factory stores;
    private final Map<AuditAction, Counter> mutations = new EnumMap<>(AuditAction.class);
    private final Counter granted;
    private final Counter denied;

    public PermissionResolver(
            StoreExecutor executor,
            EncryptedFieldCodec codec,
            AuditRecorder audit,
            MetricFactory metrics) {
        this(executor, codec, audit, metrics, JdbcRoleGraphStore::new);
    }

    public PermissionResolver(
            StoreExecutor executor,
            EncryptedFieldCodec codec,
            AuditRecorder audit,
            MetricFactory metrics,
            RoleGraphStore.Factory stores) {
        if (executor == null || codec == null || audit == null || metrics == null || stores == null) {
            throw new IllegalArgumentException("collaborators must not be null");
        }
        this.executor = executor;
        this.codec = codec;
        this.audit = audit;
        this.stores = stores;
        for (AuditAction action : AuditAction.values()) {
            mutations.put(
                    action,
                    metrics.counter(
                            "bastion.rbac.mutations",
                            "Role-graph mutations",
                            "action",
                            action.name().toLowerCase()));
        }
        this.granted =
                metrics.counter("bastion.rbac.checks", "User permission checks", "outcome", "granted");
        this.denied =
                metrics.counter("bastion.rbac.checks", "User permission checks", "outcome", "denied");
    }

    /**
     * Creates a role. A role that already exists keeps its description.
     *
     * @return always true: the role exists after the call
     */
    public boolean addRole(TenantKey tenant, String name, String description) {
        IdentifierRules.requireRole(name);
        IdentifierRules.checkDescription(description).orThrow();
        String storedDescription = encode(EncryptedField.ROLE_DESCRIPTION, description);

        try {
            return mutate(
                    tenant,
                    AuditAction.CREATE_ROLE,
                    name,
                    graph -> {
                        boolean created = false;
                        if (!graph.roleExists(tenant.value(), name)) {
                            graph.insertRole(tenant.value(), name, storedDescription);
                            created = true;
                        }
                        return Result.of(
                                true,
                                created,
                                details("role", name, "description", storedDescription));
                    });
        } catch (DuplicateKeyException e) {
            log.debug("Concurrent create of role '{}' in tenant {}; keeping the winner", name, tenant);
            return settle(
                    tenant,
                    AuditAction.CREATE_ROLE,
                    name,
                    true,
                    details("role", name, "description", storedDescription));
        }
    }

    /**
     * Deletes a role with all its permissions and memberships.
     *
     * @return always true: the role is absent after the call
     */
    public boolean delRole(TenantKey tenant, String name) {
        IdentifierRules.requireRole(name);
        return mutate(
                tenant,
                AuditAction.DELETE_ROLE,
                name,
                graph -> {
                    boolean deleted = graph.deleteRole(tenant.value(), name) > 0;
                    return Result.of(true, deleted, details("role", name));
                });
    }

    /** Roles of the tenant ordered by name. */
    public List<RoleDefinition> roles(TenantKey tenant) {
        requireTenant(tenant);
        return query(graph -> graph.listRoles(tenant.value())).stream()
                .map(this::decodeRole)
                .toList();
    }

    public Optional<RoleDefinition> getRole(TenantKey tenant, String name) {
        requireTenant(tenant);
        IdentifierRules.requireRole(name);
        return query(graph -> graph.findRole(tenant.value(), name)).map(this::decodeRole);
    }

    /**
     * Grants {@code permission} to {@code role}.
     *
     * @return false if the role does not exist, true otherwise
     */
    public boolean addPermission(TenantKey tenant, String role, String permission) {
        IdentifierRules.checkGrant(role, permission).orThrow();
        String stored = encode(EncryptedField.PERMISSION_NAME, permission);
        try {
            return mutate(
                    tenant,
                    AuditAction.ADD_PERMISSION,
                    role + ":" + stored,
                    graph -> {
                        Map<String, Object> details = details("role", role, "permission", stored);
                        if (!graph.roleExists(tenant.value(), role)) {
                            return Result.of(false, false, details);
                        }
                        if (graph.permissionExists(tenant.value(), role, stored)) {
                            return Result.of(true, false, details);
                        }
                        graph.insertPermission(tenant.value(), role, stored);
                        return Result.of(true, true, details);
                    });
        } catch (DuplicateKeyException e) {
            log.debug("Concurrent grant on role '{}' in tenant {}; keeping the winner", role, tenant);
            return settle(
                    tenant,
                    AuditAction.ADD_PERMISSION,
                    role + ":" + stored,
                    true,
                    details("role", role, "permission", stored));
        } catch (DataIntegrityViolationException e) {
            log.debug("Role '{}' in tenant {} was deleted during a grant", role, tenant);
            return settle(
                    tenant,
                    AuditAction.ADD_PERMISSION,
                    role + ":" + stored,
                    false,
                    details("role", role, "permission", stored));
        }
    }

    /**
     * Revokes {@code permission} from {@code role}.
     *
     * @return always true
     */
    public boolean delPermission(TenantKey tenant, String role, String permission) {
        IdentifierRules.checkGrant(role, permission).orThrow();
        String stored = encode(EncryptedField.PERMISSION_NAME, permission);
        return mutate(
                tenant,
                AuditAction.REMOVE_PERMISSION,
                role + ":" + stored,
                graph -> {
                    boolean deleted = graph.deletePermission(tenant.value(), role, stored) > 0;
                    return Result.of(true, deleted, details("role", role, "permission", stored));
                });
    }

    public boolean hasPermission(TenantKey tenant, String role, String permission) {
        requireTenant(tenant);
        IdentifierRules.checkGrant(role, permission).orThrow();
        String stored = encode(EncryptedField.PERMISSION_NAME, permission);
        return query(graph -> graph.permissionExists(tenant.value(), role, stored));
    }

    /** Permissions granted to {@code role}; empty if the role does not exist. */
    public Set<String> getPermissions(TenantKey tenant, String role) {
        requireTenant(tenant);
        IdentifierRules.requireRole(role);
        return decodeAll(
                EncryptedField.PERMISSION_NAME,
                query(graph -> graph.permissionsOfRole(tenant.value(), role)));
    }

    /**
     * Makes {@code user} a member of {@code role}.
     *
     * @return false if the role does not exist, true otherwise
     */
    public boolean addMembership(TenantKey tenant, String user, String role) {
        IdentifierRules.checkMembership(user, role).orThrow();
        String stored = encode(EncryptedField.USER_IDENTIFIER, user);
        try {
            return mutate(
                    tenant,
                    AuditAction.ADD_MEMBERSHIP,
                    stored + ":" + role,
                    graph -> {
                        Map<String, Object> details = details("user", stored, "role", role);
                        if (!graph.roleExists(tenant.value(), role)) {
                            return Result.of(false, false, details);
                        }
                        if (graph.membershipExists(tenant.value(), stored, role)) {
                            return Result.of(true, false, details);
                        }
                        graph.insertMembership(tenant.value(), stored, role);
                        return Result.of(true, true, details);
                    });
        } catch (DuplicateKeyException e) {
            log.debug(
                    "Concurrent membership add on role '{}' in tenant {}; keeping the winner",
                    role,
                    tenant);
            return settle(
                    tenant,
                    AuditAction.ADD_MEMBERSHIP,
                    stored + ":" + role,
                    true,
                    details("user", stored, "role", role));
        } catch (DataIntegrityViolationException e) {
            log.debug("Role '{}' in tenant {} was deleted during a membership add", role, tenant);
            return settle(
                    tenant,
                    AuditAction.ADD_MEMBERSHIP,
                    stored + ":" + role,
                    false,
                    details("user", stored, "role", role));
        }
    }

    /**
     * Removes {@code user} from {@code role}.
     *
     * @return always true
     */
    public boolean delMembership(TenantKey tenant, String user, String role) {
        IdentifierRules.checkMembership(user, role).orThrow();
        String stored = encode(EncryptedField.USER_IDENTIFIER, user);
        return mutate(
                tenant,
                AuditAction.REMOVE_MEMBERSHIP,
                stored + ":" + role,
                graph -> {
                    boolean deleted = graph.deleteMembership(tenant.value(), stored, role) > 0;
                    return Result.of(true, deleted, details("user", stored, "role", role));
                });
    }

    public boolean hasMembership(TenantKey tenant, String user, String role) {
        requireTenant(tenant);
        IdentifierRules.checkMembership(user, role).orThrow();
        String stored = encode(EncryptedField.USER_IDENTIFIER, user);
        return query(graph -> graph.membershipExists(tenant.value(), stored, role));
    }

    public Set<String> getUserRoles(TenantKey tenant, String user) {
        requireTenant(tenant);
        IdentifierRules.requireUser(user);
        String stored = encode(EncryptedField.USER_IDENTIFIER, user);
        return sorted(query(graph -> graph.rolesOfUser(tenant.value(), stored)));
    }

    /** Members of {@code role}; empty if the role does not exist. */
    public Set<String> getRoleMembers(TenantKey tenant, String role) {
        requireTenant(tenant);
        IdentifierRules.requireRole(role);
        return decodeAll(
                EncryptedField.USER_IDENTIFIER,
                query(graph -> graph.membersOfRole(tenant.value(), role)));
    }

    /** True iff some role of {@code user} holds {@code permission}. */
    public boolean userHasPermission(TenantKey tenant, String user, String permission) {
        requireTenant(tenant);
        IdentifierRules.requireUser(user);
        IdentifierRules.requirePermission(permission);
        String storedUser = encode(EncryptedField.USER_IDENTIFIER, user);
        String storedPermission = encode(EncryptedField.PERMISSION_NAME, permission);

        boolean result =
                query(graph -> graph.userHasPermission(tenant.value(), storedUser, storedPermission));
        (result ? granted : denied).increment();
        return result;
    }

    /** Union of the permissions of every role {@code user} belongs to. */
    public Set<String> getUserPermissions(TenantKey tenant, String user) {
        requireTenant(tenant);
        IdentifierRules.requireUser(user);
        String stored = encode(EncryptedField.USER_IDENTIFIER, user);
        return decodeAll(
                EncryptedField.PERMISSION_NAME,
                query(graph -> graph.permissionsOfUser(tenant.value(), stored)));
    }

    public Set<String> whichRolesCan(TenantKey tenant, String permission) {
        requireTenant(tenant);
        IdentifierRules.requirePermission(permission);
        String stored = encode(EncryptedField.PERMISSION_NAME, permission);
        return sorted(query(graph -> graph.rolesWithPermission(tenant.value(), stored)));
    }

    /**
     * Users holding {@code permission}, one entry per qualifying (user, role) pair: a user with two
     * qualifying roles appears twice. Ordered by role, then by plaintext user.
     */
    public Set<RoleAssignment> whichUsersCan(TenantKey tenant, String permission) {
        requireTenant(tenant);
        IdentifierRules.requirePermission(permission);
        String stored = encode(EncryptedField.PERMISSION_NAME, permission);
        Set<RoleAssignment> result = new TreeSet<>(BY_ROLE_THEN_USER);
        List<RoleAssignment> rows =
                query(graph -> graph.assignmentsWithPermission(tenant.value(), stored));
        for (RoleAssignment row : rows) {
            String user = codec.decode(EncryptedField.USER_IDENTIFIER, row.user());
            result.add(new RoleAssignment(user, row.role()));
        }
        return Collections.unmodifiableSet(result);
    }

    /**
     * Latest audit entries of the tenant, newest first. Identifiers inside are in stored form.
     *
     * @param limit 1 to {@value #MAX_AUDIT_LIMIT}
     */
    public List<AuditEntry> auditTrail(TenantKey tenant, int limit) {
        requireTenant(tenant);
        if (limit < 1 || limit > MAX_AUDIT_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_AUDIT_LIMIT);
        }
        return executor.readOnly(jdbc -> audit.recent(jdbc, tenant, limit));
    }

    /** Outcome of one mutation: the value returned, whether a row changed, what to audit. */
    private record Result(boolean value, boolean changed, Map<String, Object> details) {

        static Result of(boolean value, boolean changed, Map<String, Object> details) {
            details.put("result", value);
            details.put("changed", changed);
            return new Result(value, changed, details);
        }
    }

    @FunctionalInterface
    private interface Mutation {
        Result apply(RoleGraphStore graph);
    }

    @FunctionalInterface
    private interface Query<T> {
        T apply(RoleGraphStore graph);
    }

    private boolean mutate(TenantKey tenant, AuditAction action, String entityId, Mutation mutation) {
        requireTenant(tenant);
        Result result =
                executor.inTransaction(
                        jdbc -> {
                            Result r = mutation.apply(stores.open(jdbc));
                            audit.record(jdbc, tenant, action, entityId, r.details());
                            return r;
                        });
        mutations.get(action).increment();
        log.debug(
                "{} in tenant {}: result={}, changed={}",
                action,
                tenant,
                result.value(),
                result.changed());
        return result.value();
    }

    /**
     * Records a write that lost a race and was rolled back: the call is audited and counted with
     * the settled {@code value} and no change of its own.
     */
    private boolean settle(
            TenantKey tenant,
            AuditAction action,
            String entityId,
            boolean value,
            Map<String, Object> details) {
        return mutate(tenant, action, entityId, graph -> Result.of(value, false, details));
    }

    private <T> T query(Query<T> query) {
        return executor.readOnly(jdbc -> query.apply(stores.open(jdbc)));
    }

    private String encode(EncryptedField field, String value) {
        return codec.encode(field, value);
    }

    private RoleDefinition decodeRole(RoleDefinition stored) {
        return new RoleDefinition(
                stored.name(), codec.decode(EncryptedField.ROLE_DESCRIPTION, stored.description()));
    }

    private Set<String> decodeAll(EncryptedField field, Collection<String> stored) {
        Set<String> decoded = new TreeSet<>();
        for (String value : stored) {
            decoded.add(codec.decode(field, value));
        }
        return Collections.unmodifiableSet(decoded);
    }

    private static Set<String> sorted(Collection<String> values) {
        return Collections.unmodifiableSet(new TreeSet<>(values));
    }

    private static Map<String, Object> details(Object... pairs) {
        Map<String, Object> details = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            if (pairs[i + 1] != null) {
                details.put((String) pairs[i], pairs[i + 1]);
            }
        }
        return details;
    }

    private static void requireTenant(TenantKey tenant) {
        if (tenant == null) {
            throw new IllegalArgumentException("tenant must not be null");
        }
    }
}
