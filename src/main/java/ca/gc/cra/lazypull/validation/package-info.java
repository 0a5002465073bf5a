/**
 * <strong>Purpose:</strong> Validation helpers used during CLI parsing and settings binding.
 * <p><strong>Concurrency:</strong> Stateless utilities safe for concurrent invocation.
 * <p><strong>Observability:</strong> No logging; failures surface via {@link IllegalArgumentException}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.lazypull.validation;
