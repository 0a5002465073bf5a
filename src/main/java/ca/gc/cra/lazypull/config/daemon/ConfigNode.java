package ca.gc.cra.lazypull.config.daemon;

import java.util.List;

/**
 * A daemon configuration structure that can enumerate its serialized fields.
 *
 * <p>Implementations return descriptors in declaration order and never repeat a key. Values are read
 * at call time, so the list reflects the node's current state.</p>
 *
 * @since 0.1.0
 */
public interface ConfigNode {

  /**
   * Returns the field descriptors for this node.
   *
   * @return ordered, duplicate-free field descriptors
   */
  List<ConfigField> fields();
}
