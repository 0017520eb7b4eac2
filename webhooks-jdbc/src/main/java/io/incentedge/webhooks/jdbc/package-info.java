/**
 * JDBC support shared by the store implementations: connection provider, SQL helper,
 * table name validation and the store exception type.
 *
 * @see io.incentedge.webhooks.jdbc.store.JdbcDeliveryStores
 */
package io.incentedge.webhooks.jdbc;
