/**
 * Clock adapters for the log pipeline's quiescence window.
 *
 * @since 0.1.0
 */
package ca.gc.cra.harvest.infrastructure.time;
