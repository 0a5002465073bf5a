package ca.gc.cra.lazypull.application.port;

/**
 * <strong>What:</strong> Sink for the counters and latency samples emitted while daemon configurations
 * are supplemented at mount time.
 * <p>The supplementer reports under the {@code daemonConfig.supplement} prefix:</p>
 * <ul>
 *   <li>{@code .success} and {@code .failure}, one increment per call;</li>
 *   <li>{@code .latencyNanos}, one sample per call, lock wait included.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Called concurrently by every mount request. Counters are bumped
 * while the supplement lock is held, so implementations must not block.</p>
 *
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Adds one to a counter.
   *
   * @param key dotted metric key, for example {@code daemonConfig.supplement.failure}; never {@code null}
   */
  void increment(String key);

  /**
   * Records one sample for a distribution.
   *
   * @param key dotted metric key; never {@code null}
   * @param value sample, in the unit named by the key suffix
   */
  void observe(String key, long value);

  /** Discards everything; used when no telemetry backend is wired. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
