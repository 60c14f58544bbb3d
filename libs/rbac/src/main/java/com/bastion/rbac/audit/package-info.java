/** Append-only audit trail written in the same transaction as each role-graph mutation. */
package com.bastion.rbac.audit;
