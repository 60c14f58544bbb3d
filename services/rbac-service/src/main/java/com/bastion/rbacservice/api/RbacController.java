package com.bastion.rbacservice.api;

import com.bastion.observability.CorrelationContextHolder;
import com.bastion.rbac.PermissionResolver;
import com.bastion.rbac.audit.AuditEntry;
import com.bastion.rbac.model.RoleAssignment;
import com.bastion.rbac.model.RoleDefinition;
import com.bastion.rbacservice.api.ApiResponses.BooleanResult;
import com.bastion.rbacservice.api.ApiResponses.Items;
import com.bastion.security.TenantKey;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Tenant-scoped RBAC endpoints. A thin adapter: every handler parses the tenant, delegates to
 * {@link PermissionResolver} and wraps the answer.
 *
 * <p>Boolean operations answer {@code {"result": bool}}, listings {@code {"items": [...]}}.
 * Referential failures (granting to a missing role) are a {@code false} result, not an error.
 */
@RestController
@RequestMapping("/api/v1/tenants/{tenant}")
public class RbacController {

    private static final int DEFAULT_AUDIT_LIMIT = 50;

    private final PermissionResolver rbac;

    public RbacController(PermissionResolver rbac) {
        this.rbac = rbac;
    }

    @GetMapping("/roles")
    public Items<RoleDefinition> roles(@PathVariable String tenant) {
        return Items.of(rbac.roles(tenant(tenant)));
    }

    @GetMapping("/roles/{role}")
    public ResponseEntity<RoleDefinition> role(
            @PathVariable String tenant, @PathVariable String role) {
        return ResponseEntity.of(rbac.getRole(tenant(tenant), role));
    }

    @PostMapping("/roles/{role}")
    public BooleanResult addRole(
            @PathVariable String tenant,
            @PathVariable String role,
            @Valid @RequestBody(required = false) RoleRequest body) {
        String description = body != null ? body.description() : null;
        return new BooleanResult(rbac.addRole(tenant(tenant), role, description));
    }

    @DeleteMapping("/roles/{role}")
    public BooleanResult delRole(@PathVariable String tenant, @PathVariable String role) {
        return new BooleanResult(rbac.delRole(tenant(tenant), role));
    }

    @GetMapping("/roles/{role}/permissions")
    public Items<String> permissions(@PathVariable String tenant, @PathVariable String role) {
        return Items.of(rbac.getPermissions(tenant(tenant), role));
    }

    @GetMapping("/roles/{role}/permissions/{permission}")
    public BooleanResult hasPermission(
            @PathVariable String tenant,
            @PathVariable String role,
            @PathVariable String permission) {
        return new BooleanResult(rbac.hasPermission(tenant(tenant), role, permission));
    }

    @PostMapping("/roles/{role}/permissions/{permission}")
    public BooleanResult addPermission(
            @PathVariable String tenant,
            @PathVariable String role,
            @PathVariable String permission) {
        return new BooleanResult(rbac.addPermission(tenant(tenant), role, permission));
    }

    @DeleteMapping("/roles/{role}/permissions/{permission}")
    public BooleanResult delPermission(
            @PathVariable String tenant,
            @PathVariable String role,
            @PathVariable String permission) {
        return new BooleanResult(rbac.delPermission(tenant(tenant), role, permission));
    }

    @GetMapping("/roles/{role}/members")
    public Items<String> members(@PathVariable String tenant, @PathVariable String role) {
        return Items.of(rbac.getRoleMembers(tenant(tenant), role));
    }

    @GetMapping("/roles/{role}/members/{user}")
    public BooleanResult hasMembership(
            @PathVariable String tenant, @PathVariable String role, @PathVariable String user) {
        return new BooleanResult(rbac.hasMembership(tenant(tenant), user, role));
    }

    @PostMapping("/roles/{role}/members/{user}")
    public BooleanResult addMembership(
            @PathVariable String tenant, @PathVariable String role, @PathVariable String user) {
        return new BooleanResult(rbac.addMembership(tenant(tenant), user, role));
    }

    @DeleteMapping("/roles/{role}/members/{user}")
    public BooleanResult delMembership(
            @PathVariable String tenant, @PathVariable String role, @PathVariable String user) {
        return new BooleanResult(rbac.delMembership(tenant(tenant), user, role));
    }

    @GetMapping("/users/{user}/roles")
    public Items<String> userRoles(@PathVariable String tenant, @PathVariable String user) {
        return Items.of(rbac.getUserRoles(tenant(tenant), user));
    }

    @GetMapping("/users/{user}/permissions")
    public Items<String> userPermissions(@PathVariable String tenant, @PathVariable String user) {
        return Items.of(rbac.getUserPermissions(tenant(tenant), user));
    }

    @GetMapping("/users/{user}/permissions/{permission}")
    public BooleanResult userHasPermission(
            @PathVariable String tenant,
            @PathVariable String user,
            @PathVariable String permission) {
        return new BooleanResult(rbac.userHasPermission(tenant(tenant), user, permission));
    }

    @GetMapping("/permissions/{permission}/roles")
    public Items<String> whichRolesCan(
            @PathVariable String tenant, @PathVariable String permission) {
        return Items.of(rbac.whichRolesCan(tenant(tenant), permission));
    }

    @GetMapping("/permissions/{permission}/users")
    public Items<RoleAssignment> whichUsersCan(
            @PathVariable String tenant, @PathVariable String permission) {
        return Items.of(rbac.whichUsersCan(tenant(tenant), permission));
    }

    @GetMapping("/audit")
    public Items<AuditEntry> audit(
            @PathVariable String tenant,
            @RequestParam(defaultValue = "" + DEFAULT_AUDIT_LIMIT) int limit) {
        return Items.of(rbac.auditTrail(tenant(tenant), limit));
    }

    /** Parses the tenant and scopes the request's log lines to it. */
    private static TenantKey tenant(String raw) {
        TenantKey tenant = TenantKey.of(raw);
        CorrelationContextHolder.get()
                .ifPresent(ctx -> CorrelationContextHolder.set(ctx.withTenant(tenant.value())));
        return tenant;
    }
}
