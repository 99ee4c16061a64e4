/**
 * Log analyzers classifying joined backend lines and extracting query samples.
 *
 * @since 0.1.0
 */
package ca.gc.cra.harvest.infrastructure.analysis;
