/** Circuit breaker guarding calls to the backing store. */
package com.bastion.database.resilience;
