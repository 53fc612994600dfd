/**
 * Runtime logging controls for the CLI.
 *
 * @since 0.1.0
 */
package ca.gc.cra.aoef.logging;
