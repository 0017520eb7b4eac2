package io.incentedge.webhooks.benchmark;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.TearDown;
import org.openjdk.jmh.annotations.Threads;
import org.openjdk.jmh.annotations.Warmup;
import io.incentedge.webhooks.Webhooks;
import io.incentedge.webhooks.benchmark.BenchmarkDataSourceFactory.DatabaseSetup;
import io.incentedge.webhooks.dispatch.DispatchOptions;
import io.incentedge.webhooks.dispatch.DispatchResult;
import io.incentedge.webhooks.jdbc.DataSourceConnectionProvider;
import io.incentedge.webhooks.jdbc.store.JdbcSubscriptionStore;
import io.incentedge.webhooks.spi.WebhookResponse;
import io.incentedge.webhooks.subscription.SubscriptionRequest;

import javax.sql.DataSource;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Measures dispatch latency for one event fanned out to N matching subscriptions: resolution,
 * filter evaluation, envelope formatting, record inserts and, for immediate dispatch, signed
 * sends through a transport that answers {@code 200} at once.
 *
 * <p>Run: {@code java -jar benchmarks/target/benchmarks.jar DispatchFanOutBenchmark}
 * <p>MySQL: {@code java -jar benchmarks/target/benchmarks.jar -p database=mysql DispatchFanOutBenchmark}
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 3)
@Measurement(iterations = 5, time = 5)
@Fork(1)
@Threads(1)
public class DispatchFanOutBenchmark {

    private static final String ORG = "org_bench";
    private static final WebhookResponse OK = new WebhookResponse(200, Map.of(), "ok");
    private static final DispatchOptions IMMEDIATE = DispatchOptions.builder().immediate(true).build();

    private DataSource dataSource;
    private Webhooks webhooks;

    @Param({"h2"})
    private String database;

    @Param({"1", "10", "50"})
    private int subscriptions;

    private Map<String, Object> data;

    @Setup(Level.Trial)
    public void setup() {
        DatabaseSetup db = BenchmarkDataSourceFactory.create(database, "bench_dispatch");
        dataSource = db.dataSource();
        BenchmarkDataSourceFactory.clearAll(dataSource);

        webhooks = Webhooks.builder()
                .connectionProvider(new DataSourceConnectionProvider(dataSource))
                .subscriptionStore(new JdbcSubscriptionStore())
                .deliveryStore(db.store())
                .transport(request -> OK)
                .workerCount(4)
                .build();
        for (int i = 0; i < subscriptions; i++) {
            webhooks.subscriptions().create(ORG, SubscriptionRequest.of(
                    "bench-" + i, "https://bench.example.com/hooks/" + i, List.of("project.created")));
        }
        data = Map.of("project_id", "p1", "project_name", "Solar Farm", "sector", "clean-energy");
    }

    @Setup(Level.Iteration)
    public void clear() {
        BenchmarkDataSourceFactory.clearDeliveries(dataSource);
    }

    @TearDown(Level.Trial)
    public void tearDown() throws Exception {
        webhooks.close();
        if (dataSource instanceof AutoCloseable ac) ac.close();
    }

    @Benchmark
    public DispatchResult dispatchQueued() {
        return webhooks.dispatch("project.created", data, ORG, DispatchOptions.DEFAULT);
    }

    @Benchmark
    public DispatchResult dispatchImmediate() {
        return webhooks.dispatch("project.created", data, ORG, IMMEDIATE);
    }
}
