/** Values returned by {@link com.bastion.rbac.PermissionResolver}, in domain (decoded) form. */
package com.bastion.rbac.model;
