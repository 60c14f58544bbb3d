package com.bastion.rbacservice.api;

import com.bastion.security.IdentifierRules;
import jakarta.validation.constraints.Size;

/**
 * Optional body of {@code POST /roles/{role}}.
 *
 * @param description free-text description, at most 256 characters
 */
public record RoleRequest(@Size(max = IdentifierRules.MAX_DESCRIPTION_LENGTH) String description) {}
