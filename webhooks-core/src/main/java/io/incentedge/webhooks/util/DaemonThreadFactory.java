package io.incentedge.webhooks.util;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Names the delivery worker and retry poller threads ({@code webhook-delivery-1},
 * {@code webhook-retry-1}, ...). They are daemons, so an application that never closes its
 * {@code Webhooks} instance still exits; anything escaping a task is logged at SEVERE.
 */
public final class DaemonThreadFactory implements ThreadFactory {
  private static final Logger logger = Logger.getLogger(DaemonThreadFactory.class.getName());

  private final String namePrefix;
  private final AtomicInteger sequence = new AtomicInteger(1);

  public DaemonThreadFactory(String namePrefix) {
    this.namePrefix = Objects.requireNonNull(namePrefix, "namePrefix");
  }

  @Override
  public Thread newThread(Runnable task) {
    Thread worker = new Thread(task, namePrefix + sequence.getAndIncrement());
    worker.setDaemon(true);
    worker.setUncaughtExceptionHandler((thread, error) ->
        logger.log(Level.SEVERE, "Uncaught failure on " + thread.getName(), error));
    return worker;
  }
}
