package ca.gc.cra.lazypull.config.daemon;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Background prefetch tuning.
 *
 * <p>The filesystem-level form ({@code fs_prefetch}) carries {@code prefetch_all}; the blob-level form
 * used inside fscache configurations does not.</p>
 *
 * @param enable whether prefetch is enabled
 * @param prefetchAll whether the whole image is prefetched rather than the hinted files only
 * @param threadsCount prefetch worker count
 * @param mergingSize request merging size in bytes
 * @param bandwidthRate bandwidth cap in bytes per second; {@code 0} is unlimited
 * @since 0.1.0
 */
public record PrefetchConfig(
    boolean enable, boolean prefetchAll, int threadsCount, int mergingSize, int bandwidthRate) {

  /** Prefetch disabled with every setting at its zero value. */
  public static final PrefetchConfig DISABLED = new PrefetchConfig(false, false, 0, 0, 0);

  static PrefetchConfig fromJson(Map<String, Object> json) {
    if (json == null) {
      return DISABLED;
    }
    return new PrefetchConfig(
        JsonObjects.bool(json, "enable"),
        JsonObjects.bool(json, "prefetch_all"),
        JsonObjects.integer(json, "threads_count"),
        JsonObjects.integer(json, "merging_size"),
        JsonObjects.integer(json, "bandwidth_rate"));
  }

  /**
   * Returns the {@code fs_prefetch} view of these settings.
   *
   * @return node including {@code prefetch_all}
   */
  public ConfigNode filesystemView() {
    return () -> fields(true);
  }

  /**
   * Returns the blob-level view of these settings.
   *
   * @return node without {@code prefetch_all}
   */
  public ConfigNode blobView() {
    return () -> fields(false);
  }

  private List<ConfigField> fields(boolean includePrefetchAll) {
    List<ConfigField> fields = new ArrayList<>(5);
    fields.add(ConfigField.of("enable", enable));
    if (includePrefetchAll) {
      fields.add(ConfigField.of("prefetch_all", prefetchAll));
    }
    fields.add(ConfigField.of("threads_count", threadsCount));
    fields.add(ConfigField.of("merging_size", mergingSize));
    fields.add(ConfigField.of("bandwidth_rate", bandwidthRate));
    return List.copyOf(fields);
  }
}
