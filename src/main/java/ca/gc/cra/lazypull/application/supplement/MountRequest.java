package ca.gc.cra.lazypull.application.supplement;

import java.util.Map;

/**
 * Immutable {@link SupplementInfo} describing one mount request.
 *
 * @param imageId image identifier; {@code null} becomes empty and is rejected when parsed
 * @param snapshotId snapshot identifier
 * @param vpcRegistry whether the registry is reached through its private-network host
 * @param labels snapshot labels
 * @param params request parameters
 * @since 0.1.0
 */
public record MountRequest(
    String imageId,
    String snapshotId,
    boolean vpcRegistry,
    Map<String, String> labels,
    Map<String, String> params) implements SupplementInfo {

  public MountRequest {
    imageId = imageId == null ? "" : imageId;
    snapshotId = snapshotId == null ? "" : snapshotId;
    labels = labels == null ? Map.of() : Map.copyOf(labels);
    params = params == null ? Map.of() : Map.copyOf(params);
  }

  /**
   * Creates a request for a public registry image without labels or parameters.
   *
   * @param imageId image identifier
   * @param snapshotId snapshot identifier
   * @return request
   */
  public static MountRequest of(String imageId, String snapshotId) {
    return new MountRequest(imageId, snapshotId, false, Map.of(), Map.of());
  }

  @Override
  public boolean isVpcRegistry() {
    return vpcRegistry;
  }
}
