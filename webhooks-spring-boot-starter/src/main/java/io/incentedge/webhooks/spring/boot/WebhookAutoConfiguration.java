package io.incentedge.webhooks.spring.boot;

import io.incentedge.webhooks.Webhooks;
import io.incentedge.webhooks.delivery.HttpClientWebhookTransport;
import io.incentedge.webhooks.delivery.WebhookTestSender;
import io.incentedge.webhooks.dispatch.WebhookEvents;
import io.incentedge.webhooks.exhausted.ExhaustedDeliveryManager;
import io.incentedge.webhooks.jdbc.DataSourceConnectionProvider;
import io.incentedge.webhooks.jdbc.store.AbstractJdbcDeliveryStore;
import io.incentedge.webhooks.jdbc.store.JdbcDeliveryStores;
import io.incentedge.webhooks.jdbc.store.JdbcSubscriptionStore;
import io.incentedge.webhooks.retry.ExponentialBackoffRetryPolicy;
import io.incentedge.webhooks.retry.RetryPolicy;
import io.incentedge.webhooks.spi.ConnectionProvider;
import io.incentedge.webhooks.spi.DeliveryStore;
import io.incentedge.webhooks.spi.MetricsExporter;
import io.incentedge.webhooks.spi.SubscriptionStore;
import io.incentedge.webhooks.spi.WebhookTransport;
import io.incentedge.webhooks.subscription.SubscriptionManager;
import io.incentedge.webhooks.util.JsonCodec;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;

/**
 * Auto-configuration for webhook dispatch and delivery.
 *
 * <p>Wires a {@link Webhooks} composite from a {@link DataSource} and
 * {@link WebhookProperties}, detecting the delivery store dialect from the JDBC URL.
 * Every component backs off when the application defines its own bean.
 *
 * @see WebhookProperties
 * @see WebhookMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(Webhooks.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(WebhookProperties.class)
public class WebhookAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(DeliveryStore.class)
    public AbstractJdbcDeliveryStore webhookDeliveryStore(DataSource dataSource, WebhookProperties props) {
        return JdbcDeliveryStores.detect(dataSource, props.getTables().getDelivery(), JsonCodec.getDefault());
    }

    @Bean
    @ConditionalOnMissingBean(SubscriptionStore.class)
    public JdbcSubscriptionStore webhookSubscriptionStore(WebhookProperties props) {
        return new JdbcSubscriptionStore(props.getTables().getSubscription(),
                props.getTables().getSubscriptionEvent(), JsonCodec.getDefault());
    }

    @Bean
    @ConditionalOnMissingBean(ConnectionProvider.class)
    public DataSourceConnectionProvider webhookConnectionProvider(DataSource dataSource) {
        return new DataSourceConnectionProvider(dataSource);
    }

    @Bean
    @ConditionalOnMissingBean(WebhookTransport.class)
    public HttpClientWebhookTransport webhookTransport() {
        return new HttpClientWebhookTransport();
    }

    @Bean
    @ConditionalOnMissingBean(RetryPolicy.class)
    public ExponentialBackoffRetryPolicy webhookRetryPolicy(WebhookProperties props) {
        WebhookProperties.Retry retry = props.getRetry();
        return new ExponentialBackoffRetryPolicy(
                retry.getBaseDelayMs(), retry.getMaxDelayMs(), retry.getMultiplier());
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public Webhooks webhooks(WebhookProperties props,
                             ConnectionProvider connectionProvider,
                             SubscriptionStore subscriptionStore,
                             DeliveryStore deliveryStore,
                             WebhookTransport transport,
                             RetryPolicy retryPolicy,
                             ObjectProvider<MetricsExporter> metricsProvider) {
        var builder = Webhooks.builder()
                .connectionProvider(connectionProvider)
                .subscriptionStore(subscriptionStore)
                .deliveryStore(deliveryStore)
                .transport(transport)
                .retryPolicy(retryPolicy)
                .productName(props.getProductName())
                .apiVersion(props.getApiVersion())
                .deliveryTimeout(props.getDelivery().getTimeout())
                .workerCount(props.getDelivery().getWorkerCount())
                .drainTimeoutMs(props.getDelivery().getDrainTimeoutMs())
                .signatureTolerance(props.getSignature().getTolerance())
                .batchSize(props.getScheduler().getBatchSize())
                .lockTimeout(props.getScheduler().getLockTimeout());
        MetricsExporter metrics = metricsProvider.getIfAvailable();
        if (metrics != null) {
            builder.metrics(metrics);
        }
        if (props.getScheduler().isEnabled()) {
            builder.poller(props.getScheduler().getIntervalMs());
        }
        return builder.build();
    }

    @Bean
    @ConditionalOnMissingBean
    public WebhookEvents webhookEvents(Webhooks webhooks) {
        return webhooks.events();
    }

    @Bean
    @ConditionalOnMissingBean
    public SubscriptionManager webhookSubscriptionManager(Webhooks webhooks) {
        return webhooks.subscriptions();
    }

    @Bean
    @ConditionalOnMissingBean
    public ExhaustedDeliveryManager exhaustedDeliveryManager(Webhooks webhooks) {
        return webhooks.exhaustedDeliveries();
    }

    @Bean
    @ConditionalOnMissingBean
    public WebhookTestSender webhookTestSender(Webhooks webhooks) {
        return webhooks.testSender();
    }
}
