/**
 * Logging context, health and metrics shared by every Bastion module.
 */
package com.bastion.observability;
