/**
 * Argument validation helpers shared by the CLI and configuration layers.
 *
 * <p>Failures are reported as {@link java.lang.IllegalArgumentException} with the offending name in the message.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.aoef.validation;
