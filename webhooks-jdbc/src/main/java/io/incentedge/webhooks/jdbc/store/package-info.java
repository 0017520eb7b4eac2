/**
 * JDBC implementations of the delivery and subscription store SPIs.
 *
 * <p>{@link io.incentedge.webhooks.jdbc.store.JdbcDeliveryStores} picks the delivery store
 * matching a JDBC URL; {@link io.incentedge.webhooks.jdbc.store.JdbcSubscriptionStore} uses
 * portable SQL and works on every supported database. Table definitions ship as
 * {@code schema/h2.sql}, {@code schema/mysql.sql} and {@code schema/postgresql.sql} on the
 * classpath.
 */
package io.incentedge.webhooks.jdbc.store;
