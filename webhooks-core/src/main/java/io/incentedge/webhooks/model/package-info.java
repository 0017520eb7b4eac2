/**
 * Subscriptions, delivery records and the outcome types of a delivery attempt.
 */
package io.incentedge.webhooks.model;
