/**
 * Application layer for the daemon configuration flow.
 * <p><strong>Role:</strong> Hosts the supplementer, the redactor and the ports they depend on.</p>
 * <p><strong>Concurrency:</strong> Supplement calls are serialized by a shared lock; configurations are
 * owned by one mount request.</p>
 * <p><strong>Metrics:</strong> Emits {@code daemonConfig.supplement.*}.</p>
 */
package ca.gc.cra.lazypull.application;
