/**
 * Daemon configuration model, JSON codec and subsystem settings.
 * <p><strong>Concurrency:</strong> Configuration variants are mutable and unshared; settings are immutable.</p>
 * <p><strong>Security:</strong> Credential fields are declared secret in their field descriptors.</p>
 */
package ca.gc.cra.lazypull.config;
