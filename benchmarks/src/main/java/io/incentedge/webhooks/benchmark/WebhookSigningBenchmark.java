package io.incentedge.webhooks.benchmark;

import io.incentedge.webhooks.signature.SignatureVerification;
import io.incentedge.webhooks.signature.WebhookSecrets;
import io.incentedge.webhooks.signature.WebhookSigner;
import org.openjdk.jmh.annotations.*;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;

/**
 * Measures HMAC-SHA256 signing and constant-time verification across payload sizes.
 *
 * <p>Run: {@code java -jar benchmarks/target/benchmarks.jar WebhookSigningBenchmark}
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 3)
@Measurement(iterations = 5, time = 5)
@Fork(1)
public class WebhookSigningBenchmark {

  private final WebhookSigner signer = new WebhookSigner();

  @Param({"256", "4096", "65536"})
  private int payloadSize;

  private byte[] payload;
  private String secret;
  private String signatureHeader;

  @Setup(Level.Trial)
  public void setup() {
    payload = ("{\"data\":\"" + "x".repeat(Math.max(0, payloadSize - 11)) + "\"}")
        .getBytes(StandardCharsets.UTF_8);
    secret = WebhookSecrets.generate();
  }

  @Setup(Level.Iteration)
  public void signFresh() {
    signatureHeader = signer.sign(payload, secret);
  }

  @Benchmark
  public String sign() {
    return signer.sign(payload, secret);
  }

  @Benchmark
  public SignatureVerification verify() {
    return signer.verify(payload, signatureHeader, secret);
  }
}
