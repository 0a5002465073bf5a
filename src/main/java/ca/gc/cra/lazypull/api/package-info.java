/**
 * CLI entry points for generating and inspecting daemon configurations.
 * <p><strong>Role:</strong> Adapter layer on the driving side; parses arguments, configures logging and
 * invokes the configuration flow.</p>
 * <p><strong>Security:</strong> Prints only redacted configurations; full documents go to files.</p>
 */
package ca.gc.cra.lazypull.api;
