/**
 * Log line sources feeding the collection loop.
 *
 * @since 0.1.0
 */
package ca.gc.cra.harvest.infrastructure.source;
