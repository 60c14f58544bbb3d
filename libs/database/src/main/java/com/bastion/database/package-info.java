/**
 * Access to the backing store.
 *
 * <p>{@link com.bastion.database.StoreExecutor} is the only entry point the domain layer uses: it
 * runs a unit of work inside a transaction on a pooled connection, behind a circuit breaker, and
 * turns infrastructure failures into {@link com.bastion.database.StoreUnavailableException}.
 */
package com.bastion.database;
