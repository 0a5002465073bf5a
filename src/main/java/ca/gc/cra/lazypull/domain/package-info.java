/**
 * Registry domain values: image references and credentials.
 */
package ca.gc.cra.lazypull.domain;
