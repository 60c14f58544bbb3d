/**
 * Tenant scoping and identifier validation shared by the RBAC store and its adapters.
 */
package com.bastion.security;
