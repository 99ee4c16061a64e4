/**
 * Input validation helpers shared by the configuration layer.
 * <p>Utilities are stateless and raise {@link java.lang.IllegalArgumentException} on invalid input.</p>
 */
package ca.gc.cra.harvest.validation;
