package ca.gc.cra.lazypull.application.supplement;

import java.util.Map;

/**
 * Mount-time facts a configuration is supplemented with. Read once per supplement call and never
 * retained.
 *
 * @since 0.1.0
 */
public interface SupplementInfo {
  /**
   * @return image identifier as requested by the container runtime
   */
  String imageId();

  /**
   * @return snapshot the mount serves
   */
  String snapshotId();

  /**
   * @return whether the image must be pulled through the registry's private-network host
   */
  boolean isVpcRegistry();

  /**
   * @return snapshot labels; never {@code null}
   */
  Map<String, String> labels();

  /**
   * @return request parameters such as the bootstrap path; never {@code null}
   */
  Map<String, String> params();
}
