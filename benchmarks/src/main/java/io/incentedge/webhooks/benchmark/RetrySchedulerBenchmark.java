package io.incentedge.webhooks.benchmark;

import io.incentedge.webhooks.benchmark.BenchmarkDataSourceFactory.DatabaseSetup;
import org.openjdk.jmh.annotations.*;
import io.incentedge.webhooks.Webhooks;
import io.incentedge.webhooks.dispatch.DispatchOptions;
import io.incentedge.webhooks.jdbc.DataSourceConnectionProvider;
import io.incentedge.webhooks.jdbc.store.JdbcSubscriptionStore;
import io.incentedge.webhooks.poller.RetryBatchResult;
import io.incentedge.webhooks.spi.WebhookResponse;
import io.incentedge.webhooks.subscription.SubscriptionRequest;

import javax.sql.DataSource;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Measures retry scheduler throughput: claim a batch of due records, send each, persist outcomes.
 *
 * <p>Run: {@code java -jar benchmarks/target/benchmarks.jar RetrySchedulerBenchmark}
 * <p>PostgreSQL: {@code java -jar benchmarks/target/benchmarks.jar -p database=postgresql RetrySchedulerBenchmark}
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 3)
@Measurement(iterations = 5, time = 5)
@Fork(1)
public class RetrySchedulerBenchmark {

  private static final String ORG = "org_bench";
  private static final WebhookResponse OK = new WebhookResponse(200, Map.of(), "ok");

  private DataSource dataSource;
  private Webhooks webhooks;

  @Param({"h2"})
  private String database;

  @Param({"10", "50", "200"})
  private int batchSize;

  @Setup(Level.Trial)
  public void setup() {
    DatabaseSetup db = BenchmarkDataSourceFactory.create(database, "bench_retry");
    dataSource = db.dataSource();
    BenchmarkDataSourceFactory.clearAll(dataSource);

    webhooks = Webhooks.builder()
        .connectionProvider(new DataSourceConnectionProvider(dataSource))
        .subscriptionStore(new JdbcSubscriptionStore())
        .deliveryStore(db.store())
        .transport(request -> OK)
        .batchSize(batchSize)
        .workerCount(0)
        .build();
    webhooks.subscriptions().create(ORG,
        SubscriptionRequest.of("bench", "https://bench.example.com/hooks", List.of("project.created")));
  }

  @Setup(Level.Invocation)
  public void seedPending() {
    BenchmarkDataSourceFactory.clearDeliveries(dataSource);
    for (int i = 0; i < batchSize; i++) {
      webhooks.dispatch("project.created", Map.of("project_id", "p" + i), ORG, DispatchOptions.DEFAULT);
    }
  }

  @Benchmark
  public int processRetries() {
    RetryBatchResult result = webhooks.processRetries();
    return result.succeeded();
  }

  @TearDown(Level.Trial)
  public void tearDown() throws Exception {
    webhooks.close();
    if (dataSource instanceof AutoCloseable ac) ac.close();
  }
}
