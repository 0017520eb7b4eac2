package io.incentedge.webhooks.subscription;

import io.incentedge.webhooks.WebhookEventType;
import io.incentedge.webhooks.WebhookStorageException;
import io.incentedge.webhooks.model.DeliveryStats;
import io.incentedge.webhooks.model.Subscription;
import io.incentedge.webhooks.signature.WebhookSecrets;
import io.incentedge.webhooks.spi.ConnectionProvider;
import io.incentedge.webhooks.spi.DeliveryStore;
import io.incentedge.webhooks.spi.SubscriptionStore;
import io.incentedge.webhooks.util.Ids;

import java.net.URI;
import java.net.URISyntaxException;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Creates and administers subscriptions for one organization at a time.
 *
 * <p>Every operation is scoped by organization id; a subscription of another organization
 * is reported as missing. Subscriptions are never deleted, only deactivated, so their
 * delivery history stays intact.
 */
public final class SubscriptionManager {
  private static final Logger logger = Logger.getLogger(SubscriptionManager.class.getName());

  public static final int MAX_NAME_LENGTH = 255;
  public static final int MAX_RETRIES_LIMIT = 10;
  static final Duration STATS_WINDOW = Duration.ofHours(24);

  private final ConnectionProvider connectionProvider;
  private final SubscriptionStore subscriptionStore;
  private final DeliveryStore deliveryStore;
  private final Clock clock;

  public SubscriptionManager(ConnectionProvider connectionProvider, SubscriptionStore subscriptionStore,
      DeliveryStore deliveryStore, Clock clock) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.subscriptionStore = Objects.requireNonNull(subscriptionStore, "subscriptionStore");
    this.deliveryStore = Objects.requireNonNull(deliveryStore, "deliveryStore");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Validates and stores a new subscription with a freshly generated secret.
   *
   * @param organizationId owning organization
   * @param request        subscription settings
   * @return the stored subscription and its secret
   * @throws IllegalArgumentException if the request is invalid
   */
  public CreatedSubscription create(String organizationId, SubscriptionRequest request) {
    Objects.requireNonNull(organizationId, "organizationId");
    Objects.requireNonNull(request, "request");
    String name = validateName(request.name());
    String url = validateUrl(request.url());
    Set<String> events = validateEvents(request.events());
    int maxRetries = request.maxRetries() == null ? Subscription.DEFAULT_MAX_RETRIES : request.maxRetries();
    if (maxRetries < 0 || maxRetries > MAX_RETRIES_LIMIT) {
      throw new IllegalArgumentException("max_retries must be between 0 and " + MAX_RETRIES_LIMIT
          + ", got: " + maxRetries);
    }

    String secret = WebhookSecrets.generate();
    Subscription subscription = Subscription.builder()
        .id(Ids.newId())
        .organizationId(organizationId)
        .name(name)
        .description(request.description())
        .url(url)
        .secret(secret)
        .events(events)
        .filters(request.filters())
        .customHeaders(request.customHeaders())
        .active(request.active() == null || request.active())
        .maxRetries(maxRetries)
        .createdAt(clock.instant())
        .build();
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(false);
      try {
        subscriptionStore.insert(conn, subscription);
        conn.commit();
      } catch (SQLException | RuntimeException e) {
        conn.rollback();
        throw e;
      }
    } catch (SQLException e) {
      throw new WebhookStorageException("Failed to create webhook " + name, e);
    }
    logger.log(Level.INFO, "Created webhook {0} for organization {1} ({2} events)",
        new Object[] {subscription.id(), organizationId, events.size()});
    return new CreatedSubscription(subscription, secret);
  }

  public Optional<Subscription> find(String organizationId, String subscriptionId) {
    try (Connection conn = connectionProvider.getConnection()) {
      return findOwned(conn, organizationId, subscriptionId);
    } catch (SQLException e) {
      throw new WebhookStorageException("Failed to load webhook " + subscriptionId, e);
    }
  }

  /**
   * Lists the organization's subscriptions, newest first, each with its delivery counts
   * for the last 24 hours.
   */
  public List<SubscriptionSummary> list(String organizationId) {
    Instant since = clock.instant().minus(STATS_WINDOW);
    try (Connection conn = connectionProvider.getConnection()) {
      List<Subscription> subscriptions = subscriptionStore.findByOrganization(conn, organizationId);
      List<SubscriptionSummary> result = new ArrayList<>(subscriptions.size());
      for (Subscription subscription : subscriptions) {
        DeliveryStats stats = deliveryStore.statsSince(conn, subscription.id(), since);
        result.add(new SubscriptionSummary(subscription, stats));
      }
      return result;
    } catch (SQLException e) {
      throw new WebhookStorageException("Failed to list webhooks for " + organizationId, e);
    }
  }

  /**
   * Replaces a subscription's secret. Signatures made with the old secret stop verifying
   * immediately.
   *
   * @return the new secret
   * @throws NoSuchElementException if the subscription does not exist in the organization
   */
  public String regenerateSecret(String organizationId, String subscriptionId) {
    String secret = WebhookSecrets.generate();
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      requireOwned(conn, organizationId, subscriptionId);
      subscriptionStore.updateSecret(conn, subscriptionId, secret);
    } catch (SQLException e) {
      throw new WebhookStorageException("Failed to regenerate secret for " + subscriptionId, e);
    }
    logger.log(Level.INFO, "Regenerated secret for webhook {0}", subscriptionId);
    return secret;
  }

  /**
   * Resumes deliveries to a subscription.
   *
   * @throws NoSuchElementException if the subscription does not exist in the organization
   */
  public void activate(String organizationId, String subscriptionId) {
    setActive(organizationId, subscriptionId, true);
  }

  /**
   * Stops deliveries to a subscription. Records still waiting for a retry are exhausted by
   * the next scheduler run.
   *
   * @throws NoSuchElementException if the subscription does not exist in the organization
   */
  public void deactivate(String organizationId, String subscriptionId) {
    setActive(organizationId, subscriptionId, false);
  }

  private void setActive(String organizationId, String subscriptionId, boolean active) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      requireOwned(conn, organizationId, subscriptionId);
      subscriptionStore.setActive(conn, subscriptionId, active);
    } catch (SQLException e) {
      throw new WebhookStorageException("Failed to update webhook " + subscriptionId, e);
    }
    logger.log(Level.INFO, "Webhook {0} {1}", new Object[] {subscriptionId, active ? "activated" : "deactivated"});
  }

  private Optional<Subscription> findOwned(Connection conn, String organizationId, String subscriptionId) {
    return subscriptionStore.findById(conn, subscriptionId)
        .filter(s -> s.organizationId().equals(organizationId));
  }

  private Subscription requireOwned(Connection conn, String organizationId, String subscriptionId) {
    return findOwned(conn, organizationId, subscriptionId)
        .orElseThrow(() -> new NoSuchElementException("Webhook not found: " + subscriptionId));
  }

  static String validateName(String name) {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Webhook name is required");
    }
    if (name.length() > MAX_NAME_LENGTH) {
      throw new IllegalArgumentException("Webhook name must be at most " + MAX_NAME_LENGTH + " characters");
    }
    return name;
  }

  static String validateUrl(String url) {
    if (url == null) {
      throw new IllegalArgumentException("Must be a valid URL");
    }
    try {
      URI uri = new URI(url);
      String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
      if ((!scheme.equals("http") && !scheme.equals("https")) || uri.getHost() == null) {
        throw new IllegalArgumentException("Must be a valid URL: " + url);
      }
      return url;
    } catch (URISyntaxException e) {
      throw new IllegalArgumentException("Must be a valid URL: " + url, e);
    }
  }

  static Set<String> validateEvents(List<String> events) {
    if (events == null || events.isEmpty()) {
      throw new IllegalArgumentException("At least one event is required");
    }
    Set<String> result = new LinkedHashSet<>();
    for (String event : events) {
      if (!WebhookEventType.isKnown(event)) {
        throw new IllegalArgumentException("Unknown webhook event type: " + event);
      }
      result.add(event);
    }
    return result;
  }
}
