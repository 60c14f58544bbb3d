/** HikariCP-backed connection pool, created lazily on first use. */
package com.bastion.database.pool;
