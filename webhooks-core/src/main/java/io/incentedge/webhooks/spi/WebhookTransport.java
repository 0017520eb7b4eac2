package io.incentedge.webhooks.spi;

import java.io.IOException;
import java.net.http.HttpTimeoutException;

/**
 * Sends one signed webhook request.
 *
 * <p>Implementations must enforce {@link WebhookRequest#timeout()} as a hard deadline on the
 * whole exchange and report it by throwing {@link HttpTimeoutException}. Any other
 * {@link IOException} is treated as a transport error. A response with any status code is
 * returned normally; classification is the caller's job.
 *
 * @see io.incentedge.webhooks.delivery.HttpClientWebhookTransport
 */
public interface WebhookTransport {

    /**
     * Performs the HTTP POST.
     *
     * @param request the request to send
     * @return the response
     * @throws HttpTimeoutException if the deadline elapsed
     * @throws IOException          on connection or I/O failure
     * @throws InterruptedException if the calling thread was interrupted while waiting
     */
    WebhookResponse send(WebhookRequest request) throws IOException, InterruptedException;
}
