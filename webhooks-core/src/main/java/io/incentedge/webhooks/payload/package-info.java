/**
 * Typed data for project, application, deadline and eligibility events.
 */
package io.incentedge.webhooks.payload;
