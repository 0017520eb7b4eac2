/**
 * Periodic processing of due delivery records.
 *
 * <p>{@link io.incentedge.webhooks.poller.RetryScheduler} performs one bounded run and is
 * meant to be called by an external scheduler; {@link io.incentedge.webhooks.poller.RetryPoller}
 * calls it on an in-process timer.
 */
package io.incentedge.webhooks.poller;
