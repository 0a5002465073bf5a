/**
 * Infrastructure adapters binding lazypull ports to registries, credential stores and OpenTelemetry.
 * <p><strong>Role:</strong> Adapter layer implementing parsing, host mapping, credential lookup and metrics.</p>
 * <p><strong>Security:</strong> Credential adapters never log secret material.</p>
 */
package ca.gc.cra.lazypull.infrastructure;
